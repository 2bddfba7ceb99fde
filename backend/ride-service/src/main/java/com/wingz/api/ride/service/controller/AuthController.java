package com.wingz.api.ride.service.controller;

import com.wingz.api.ride.service.access.AccessGateInterceptor;
import com.wingz.api.ride.service.access.ApiOperation;
import com.wingz.api.ride.service.access.Gated;
import com.wingz.api.ride.service.dto.CallerResponse;
import com.wingz.api.shared.access.CallerIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Identity probes for clients checking what the gate sees for their caller header.
 */
@Slf4j
@RestController
@RequestMapping("/api/auth")
@CrossOrigin(origins = "*")
public class AuthController {

    @GetMapping("/check-role")
    @Gated(ApiOperation.CHECK_ROLE)
    public ResponseEntity<CallerResponse> checkRole(
            @RequestAttribute(AccessGateInterceptor.CALLER_ATTRIBUTE) CallerIdentity caller) {
        return ResponseEntity.ok(describe(caller, "Authenticated as " + caller.getRole().getValue()));
    }

    @GetMapping("/test-admin")
    @Gated(ApiOperation.TEST_ADMIN)
    public ResponseEntity<CallerResponse> testAdmin(
            @RequestAttribute(AccessGateInterceptor.CALLER_ATTRIBUTE) CallerIdentity caller) {
        log.info("Admin access confirmed for user {}", caller.getUserId());
        return ResponseEntity.ok(describe(caller, "Admin access granted"));
    }

    private CallerResponse describe(CallerIdentity caller, String message) {
        return CallerResponse.builder()
                .authenticated(true)
                .message(message)
                .userId(caller.getUserId())
                .email(caller.getEmail())
                .role(caller.getRole())
                .admin(caller.isAdmin())
                .build();
    }
}
