package com.wingz.api.ride.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wingz.api.shared.constants.UserRole;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update; absent fields keep their value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserUpdateRequest {

    @Email
    private String email;

    @Size(min = 1, max = 150)
    private String firstName;

    @Size(min = 1, max = 150)
    private String lastName;

    @Size(min = 1, max = 20)
    private String phoneNumber;

    private UserRole role;

    @JsonProperty("is_active")
    private Boolean active;
}
