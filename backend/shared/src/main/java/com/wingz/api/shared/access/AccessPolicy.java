package com.wingz.api.shared.access;

import com.wingz.api.shared.constants.AccessMode;

/**
 * Authorization policies a resource group can be bound to. Roles are compared
 * by exact match; there is no role hierarchy.
 */
public enum AccessPolicy {

    /**
     * Only admins may read or write.
     */
    ADMIN_ONLY {
        @Override
        protected boolean permits(CallerIdentity caller, AccessMode mode) {
            return caller.isAdmin();
        }
    },

    /**
     * Any authenticated caller may read, only admins may write.
     */
    ADMIN_WRITE_READ_ANY {
        @Override
        protected boolean permits(CallerIdentity caller, AccessMode mode) {
            return mode == AccessMode.READ || caller.isAdmin();
        }
    };

    /**
     * @param caller the authenticated caller, or {@code null} when nobody is authenticated
     * @param mode   whether the operation reads or writes
     */
    public AccessDecision authorize(CallerIdentity caller, AccessMode mode) {
        if (caller == null) {
            return AccessDecision.UNAUTHENTICATED;
        }
        return permits(caller, mode) ? AccessDecision.ALLOW : AccessDecision.FORBIDDEN;
    }

    protected abstract boolean permits(CallerIdentity caller, AccessMode mode);
}
