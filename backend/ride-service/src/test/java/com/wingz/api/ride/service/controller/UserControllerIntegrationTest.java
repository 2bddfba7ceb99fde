package com.wingz.api.ride.service.controller;

import com.wingz.api.ride.service.dto.UserCreateRequest;
import com.wingz.api.ride.service.dto.UserUpdateRequest;
import com.wingz.api.shared.constants.RideStatus;
import com.wingz.api.shared.constants.UserRole;
import com.wingz.api.shared.entities.User;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class UserControllerIntegrationTest extends ApiIntegrationTestSupport {

    @Test
    void createDefaultsToRiderAndRejectsDuplicateEmail() throws Exception {
        UserCreateRequest request = UserCreateRequest.builder()
                .email("New.Person@wingz.com")
                .firstName("New")
                .lastName("Person")
                .phoneNumber("555-0142")
                .build();

        mockMvc.perform(as(admin, post("/api/users").contentType(MediaType.APPLICATION_JSON).content(json(request))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.role").value("rider"))
                .andExpect(jsonPath("$.email").value("new.person@wingz.com"))
                .andExpect(jsonPath("$.full_name").value("New Person"))
                .andExpect(jsonPath("$.is_active").value(true))
                .andExpect(jsonPath("$.is_admin").value(false));

        mockMvc.perform(as(admin, post("/api/users").contentType(MediaType.APPLICATION_JSON).content(json(request))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.email").exists());
    }

    @Test
    void createReportsUnknownRoleToTheCaller() throws Exception {
        String body = "{\"email\":\"pat.pilot@wingz.com\",\"first_name\":\"Pat\",\"last_name\":\"Pilot\","
                + "\"phone_number\":\"555-0199\",\"role\":\"pilot\"}";

        mockMvc.perform(as(admin, post("/api/users").contentType(MediaType.APPLICATION_JSON).content(body)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid value for role"))
                .andExpect(jsonPath("$.details.role").value("Role must be one of: admin, driver, rider, dispatcher"));
        assertFalse(userRepository.existsByEmail("pat.pilot@wingz.com"));
    }

    @Test
    void listFiltersByRoleButIgnoresDispatcher() throws Exception {
        saveUser("desk@wingz.com", "Dee", "Desk", UserRole.DISPATCHER);

        mockMvc.perform(as(admin, get("/api/users").param("role", "driver")))
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.results[0].email").value("dan.driver@wingz.com"));
        mockMvc.perform(as(admin, get("/api/users").param("role", "dispatcher")))
                .andExpect(jsonPath("$.count").value(4));
        mockMvc.perform(as(admin, get("/api/users").param("search", "RITA").param("ordering", "email")))
                .andExpect(jsonPath("$.count").value(1));
    }

    @Test
    void deleteDeactivatesAndActivateRestores() throws Exception {
        mockMvc.perform(as(admin, delete("/api/users/" + driver.getId())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("User deactivated successfully"));

        User stored = userRepository.findById(driver.getId()).orElseThrow();
        assertFalse(stored.isActive());
        mockMvc.perform(as(admin, get("/api/users/drivers")))
                .andExpect(jsonPath("$", hasSize(0)));
        mockMvc.perform(as(admin, get("/api/users").param("is_active", "false")))
                .andExpect(jsonPath("$.count").value(1));

        mockMvc.perform(as(admin, post("/api/users/" + driver.getId() + "/activate")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.is_active").value(true));
    }

    @Test
    void deactivatedCallerIsNoLongerAuthenticated() throws Exception {
        User secondAdmin = saveUser("root@wingz.com", "Ro", "Ot", UserRole.ADMIN);
        mockMvc.perform(as(secondAdmin, get("/api/users/stats")))
                .andExpect(status().isOk());

        secondAdmin.setActive(false);
        userRepository.save(secondAdmin);

        mockMvc.perform(as(secondAdmin, get("/api/users/stats")))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void updateChangesOnlySuppliedFields() throws Exception {
        UserUpdateRequest update = UserUpdateRequest.builder().lastName("Rivera").build();

        mockMvc.perform(as(admin, patch("/api/users/" + rider.getId())
                        .contentType(MediaType.APPLICATION_JSON).content(json(update))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.last_name").value("Rivera"))
                .andExpect(jsonPath("$.first_name").value("Rita"))
                .andExpect(jsonPath("$.email").value("rita.rider@wingz.com"));
    }

    @Test
    void userRidesCoverBothRoles() throws Exception {
        saveRide(RideStatus.EN_ROUTE, 37.77, -122.41, NOW);
        saveRide(RideStatus.COMPLETED, 37.77, -122.41, NOW.minusDays(1));

        mockMvc.perform(as(admin, get("/api/users/" + rider.getId() + "/rides")))
                .andExpect(jsonPath("$", hasSize(2)));
        mockMvc.perform(as(admin, get("/api/users/" + driver.getId() + "/rides")))
                .andExpect(jsonPath("$", hasSize(2)));
        mockMvc.perform(as(admin, get("/api/users/" + admin.getId() + "/rides")))
                .andExpect(jsonPath("$", hasSize(0)));
        mockMvc.perform(as(admin, get("/api/users/999999/rides")))
                .andExpect(status().isNotFound());
    }

    @Test
    void statsCountActiveUsersByRole() throws Exception {
        User inactiveRider = saveUser("gone@wingz.com", "Gone", "Rider", UserRole.RIDER);
        inactiveRider.setActive(false);
        userRepository.save(inactiveRider);

        mockMvc.perform(as(admin, get("/api/users/stats")))
                .andExpect(jsonPath("$.total_users").value(4))
                .andExpect(jsonPath("$.active_users").value(3))
                .andExpect(jsonPath("$.inactive_users").value(1))
                .andExpect(jsonPath("$.riders").value(1))
                .andExpect(jsonPath("$.drivers").value(1))
                .andExpect(jsonPath("$.admins").value(1));
    }
}
