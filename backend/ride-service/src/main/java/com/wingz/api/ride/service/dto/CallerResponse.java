package com.wingz.api.ride.service.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.wingz.api.shared.constants.UserRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CallerResponse {
    private boolean authenticated;
    private String message;
    private Long userId;
    private String email;
    private UserRole role;

    @JsonProperty("is_admin")
    private boolean admin;
}
