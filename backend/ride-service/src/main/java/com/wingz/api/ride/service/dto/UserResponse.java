package com.wingz.api.ride.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wingz.api.shared.constants.UserRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {
    private Long id;
    private UserRole role;
    private String firstName;
    private String lastName;
    private String email;
    private String phoneNumber;
    private String fullName;

    @JsonProperty("is_admin")
    private boolean admin;

    @JsonProperty("is_active")
    private boolean active;

    private ZonedDateTime dateJoined;
}
