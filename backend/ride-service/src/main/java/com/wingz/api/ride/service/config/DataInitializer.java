package com.wingz.api.ride.service.config;

import com.wingz.api.ride.service.repository.RideEventRepository;
import com.wingz.api.ride.service.repository.RideRepository;
import com.wingz.api.ride.service.repository.UserRepository;
import com.wingz.api.shared.constants.RideStatus;
import com.wingz.api.shared.constants.UserRole;
import com.wingz.api.shared.entities.Ride;
import com.wingz.api.shared.entities.RideEvent;
import com.wingz.api.shared.entities.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Seeds sample users, rides around San Francisco and their events when the store is empty.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "wingz.seed", name = "enabled", havingValue = "true")
public class DataInitializer implements CommandLineRunner {

    private static final int SAMPLE_PAIRS = 6;
    private static final int SAMPLE_RIDES = 12;

    private final UserRepository userRepository;
    private final RideRepository rideRepository;
    private final RideEventRepository rideEventRepository;
    private final Clock clock;

    @Override
    public void run(String... args) throws Exception {
        if (userRepository.count() == 0) {
            createSampleData();
        }
    }

    private void createSampleData() {
        log.info("Creating sample users, rides and events...");
        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(ZoneOffset.UTC);

        List<User> riders = new ArrayList<>();
        List<User> drivers = new ArrayList<>();
        for (int i = 1; i <= SAMPLE_PAIRS; i++) {
            riders.add(userRepository.save(sampleUser(UserRole.RIDER, i, "555-000" + i + "1", now)));
            drivers.add(userRepository.save(sampleUser(UserRole.DRIVER, i, "555-000" + i + "2", now)));
        }
        userRepository.save(User.builder()
                .email("admin@example.com").firstName("Admin").lastName("User")
                .phoneNumber("555-ADMIN").role(UserRole.ADMIN).dateJoined(now).build());
        userRepository.save(User.builder()
                .email("dispatcher@example.com").firstName("Dispatcher").lastName("User")
                .phoneNumber("555-DISPATCH").role(UserRole.DISPATCHER).dateJoined(now).build());

        // Fixed seed so every run produces the same sample
        Random random = new Random(42);
        RideStatus[] statuses = RideStatus.values();
        for (int i = 0; i < SAMPLE_RIDES; i++) {
            ZonedDateTime pickupTime = now.minusHours(random.nextInt(49));
            RideStatus status = statuses[random.nextInt(statuses.length)];
            Ride ride = rideRepository.save(Ride.builder()
                    .status(status)
                    .rider(riders.get(random.nextInt(riders.size())))
                    .driver(drivers.get(random.nextInt(drivers.size())))
                    .pickupLatitude(37.77 + jitter(random))
                    .pickupLongitude(-122.41 + jitter(random))
                    .dropoffLatitude(37.78 + jitter(random))
                    .dropoffLongitude(-122.42 + jitter(random))
                    .pickupTime(pickupTime)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());

            // At least one event inside the last 24 hours
            rideEventRepository.save(sampleEvent(ride, "Status changed to " + status.getValue(),
                    now.minusHours(random.nextInt(24)).minusMinutes(random.nextInt(60))));
            if (random.nextBoolean()) {
                rideEventRepository.save(sampleEvent(ride, "Pickup completed", pickupTime.plusMinutes(5)));
            }
            if (random.nextBoolean()) {
                rideEventRepository.save(sampleEvent(ride, "Dropoff completed", pickupTime.plusMinutes(30)));
            }
        }

        log.info("Created {} users, {} rides and {} events",
                userRepository.count(), rideRepository.count(), rideEventRepository.count());
    }

    private User sampleUser(UserRole role, int index, String phone, ZonedDateTime joined) {
        String prefix = role.getValue();
        return User.builder()
                .email(prefix + index + "@example.com")
                .firstName(Character.toUpperCase(prefix.charAt(0)) + prefix.substring(1) + index)
                .lastName("Test")
                .phoneNumber(phone)
                .role(role)
                .dateJoined(joined)
                .build();
    }

    private RideEvent sampleEvent(Ride ride, String description, ZonedDateTime createdAt) {
        return RideEvent.builder()
                .ride(ride)
                .description(description)
                .createdAt(createdAt)
                .build();
    }

    private double jitter(Random random) {
        return (random.nextDouble() * 2 - 1) * 0.01;
    }
}
