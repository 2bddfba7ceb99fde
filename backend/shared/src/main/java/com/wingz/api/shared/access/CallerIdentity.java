package com.wingz.api.shared.access;

import com.wingz.api.shared.constants.UserRole;
import lombok.Value;

/**
 * An already-authenticated caller as seen by the access gate.
 */
@Value
public class CallerIdentity {
    Long userId;
    String email;
    UserRole role;

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }
}
