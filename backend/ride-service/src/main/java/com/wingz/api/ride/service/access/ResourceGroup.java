package com.wingz.api.ride.service.access;

public enum ResourceGroup {
    USERS,
    RIDES,
    RIDE_EVENTS,
    ACCOUNT,    // Caller's own identity, any authenticated user
    ADMIN       // Admin diagnostics
}
