package com.wingz.api.shared.constants;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

public enum RideStatus {
    EN_ROUTE("en-route"),   // Driver heading to pickup
    PICKUP("pickup"),       // Rider being picked up
    DROPOFF("dropoff"),     // Rider being dropped off
    COMPLETED("completed"),
    CANCELLED("cancelled");

    /**
     * Statuses of a ride that is still in progress.
     */
    public static final Set<RideStatus> ACTIVE = EnumSet.of(EN_ROUTE, PICKUP, DROPOFF);

    private final String value;

    RideStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public static Optional<RideStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(status -> status.value.equals(value))
                .findFirst();
    }

    @JsonCreator
    public static RideStatus parse(String value) {
        return fromValue(value).orElseThrow(() -> new IllegalArgumentException(
                "Status must be one of: en-route, pickup, dropoff, completed, cancelled"));
    }
}
