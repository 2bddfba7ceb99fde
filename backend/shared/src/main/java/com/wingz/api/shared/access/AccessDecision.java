package com.wingz.api.shared.access;

public enum AccessDecision {
    ALLOW,
    UNAUTHENTICATED,
    FORBIDDEN;

    public boolean isAllowed() {
        return this == ALLOW;
    }
}
