package com.wingz.api.ride.service.controller;

import org.junit.jupiter.api.Test;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AuthControllerIntegrationTest extends ApiIntegrationTestSupport {

    @Test
    void checkRoleReportsAnyAuthenticatedCaller() throws Exception {
        mockMvc.perform(as(rider, get("/api/auth/check-role")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.role").value("rider"))
                .andExpect(jsonPath("$.user_id").value(rider.getId()))
                .andExpect(jsonPath("$.is_admin").value(false));
        mockMvc.perform(get("/api/auth/check-role"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void testAdminAdmitsOnlyAdmins() throws Exception {
        mockMvc.perform(as(admin, get("/api/auth/test-admin")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.is_admin").value(true));
        mockMvc.perform(as(driver, get("/api/auth/test-admin")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("Forbidden"));
    }

    @Test
    void healthIsNotGated() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("Ride Service is healthy"));
    }
}
