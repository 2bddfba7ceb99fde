package com.wingz.api.shared.access;

import com.wingz.api.shared.constants.AccessMode;
import com.wingz.api.shared.constants.UserRole;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class AccessPolicyTest {

    private static CallerIdentity caller(UserRole role) {
        return new CallerIdentity(1L, role.getValue() + "@wingz.com", role);
    }

    @ParameterizedTest
    @EnumSource(AccessPolicy.class)
    void anonymousCallerIsUnauthenticated(AccessPolicy policy) {
        assertEquals(AccessDecision.UNAUTHENTICATED, policy.authorize(null, AccessMode.READ));
        assertEquals(AccessDecision.UNAUTHENTICATED, policy.authorize(null, AccessMode.WRITE));
    }

    @ParameterizedTest
    @EnumSource(AccessPolicy.class)
    void adminIsAlwaysAllowed(AccessPolicy policy) {
        assertTrue(policy.authorize(caller(UserRole.ADMIN), AccessMode.READ).isAllowed());
        assertTrue(policy.authorize(caller(UserRole.ADMIN), AccessMode.WRITE).isAllowed());
    }

    @ParameterizedTest
    @EnumSource(value = UserRole.class, names = {"DRIVER", "RIDER", "DISPATCHER"})
    void adminOnlyDeniesEveryOtherRole(UserRole role) {
        assertEquals(AccessDecision.FORBIDDEN, AccessPolicy.ADMIN_ONLY.authorize(caller(role), AccessMode.READ));
        assertEquals(AccessDecision.FORBIDDEN, AccessPolicy.ADMIN_ONLY.authorize(caller(role), AccessMode.WRITE));
    }

    @ParameterizedTest
    @EnumSource(value = UserRole.class, names = {"DRIVER", "RIDER", "DISPATCHER"})
    void adminWriteReadAnyLetsEveryoneRead(UserRole role) {
        assertEquals(AccessDecision.ALLOW,
                AccessPolicy.ADMIN_WRITE_READ_ANY.authorize(caller(role), AccessMode.READ));
        assertEquals(AccessDecision.FORBIDDEN,
                AccessPolicy.ADMIN_WRITE_READ_ANY.authorize(caller(role), AccessMode.WRITE));
    }

    @Test
    void denialIsDistinctFromMissingAuthentication() {
        assertNotEquals(AccessPolicy.ADMIN_ONLY.authorize(null, AccessMode.READ),
                AccessPolicy.ADMIN_ONLY.authorize(caller(UserRole.RIDER), AccessMode.READ));
    }
}
