package com.wingz.api.ride.service.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wingz.api.ride.service.repository.RideEventRepository;
import com.wingz.api.ride.service.repository.RideRepository;
import com.wingz.api.ride.service.repository.UserRepository;
import com.wingz.api.shared.constants.RideStatus;
import com.wingz.api.shared.constants.UserRole;
import com.wingz.api.shared.entities.Ride;
import com.wingz.api.shared.entities.RideEvent;
import com.wingz.api.shared.entities.User;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Boots the full service against H2 with the clock pinned to {@link #NOW}.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Import(ApiIntegrationTestSupport.FixedClockConfig.class)
abstract class ApiIntegrationTestSupport {

    static final ZonedDateTime NOW = ZonedDateTime.of(2025, 3, 14, 12, 0, 0, 0, ZoneOffset.UTC);
    static final String CALLER_HEADER = "X-Caller-Id";

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        @Primary
        Clock fixedClock() {
            return Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        }
    }

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @Autowired
    protected UserRepository userRepository;

    @Autowired
    protected RideRepository rideRepository;

    @Autowired
    protected RideEventRepository rideEventRepository;

    protected User admin;
    protected User rider;
    protected User driver;

    @BeforeEach
    void resetStore() {
        rideEventRepository.deleteAll();
        rideRepository.deleteAll();
        userRepository.deleteAll();

        admin = saveUser("admin@wingz.com", "Ada", "Admin", UserRole.ADMIN);
        rider = saveUser("rita.rider@wingz.com", "Rita", "Rider", UserRole.RIDER);
        driver = saveUser("dan.driver@wingz.com", "Dan", "Driver", UserRole.DRIVER);
    }

    protected User saveUser(String email, String first, String last, UserRole role) {
        return userRepository.save(User.builder()
                .email(email)
                .firstName(first)
                .lastName(last)
                .phoneNumber("555-0199")
                .role(role)
                .dateJoined(NOW.minusDays(30))
                .build());
    }

    protected Ride saveRide(RideStatus status, double latitude, double longitude, ZonedDateTime pickupTime) {
        return rideRepository.save(Ride.builder()
                .status(status)
                .rider(rider)
                .driver(driver)
                .pickupLatitude(latitude)
                .pickupLongitude(longitude)
                .dropoffLatitude(37.80)
                .dropoffLongitude(-122.43)
                .pickupTime(pickupTime)
                .createdAt(NOW.minusDays(1))
                .updatedAt(NOW.minusDays(1))
                .build());
    }

    protected RideEvent saveEvent(Ride ride, String description, ZonedDateTime createdAt) {
        return rideEventRepository.save(RideEvent.builder()
                .ride(ride)
                .description(description)
                .createdAt(createdAt)
                .build());
    }

    protected MockHttpServletRequestBuilder as(User caller, MockHttpServletRequestBuilder request) {
        return request.header(CALLER_HEADER, String.valueOf(caller.getId()));
    }

    protected String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }
}
