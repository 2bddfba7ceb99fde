package com.wingz.api.shared.constants;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum UserRole {
    ADMIN("admin"),
    DRIVER("driver"),
    RIDER("rider"),
    DISPATCHER("dispatcher");

    private final String value;

    UserRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<UserRole> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(role -> role.value.equals(value))
                .findFirst();
    }

    @JsonCreator
    public static UserRole parse(String value) {
        return fromValue(value).orElseThrow(() -> new IllegalArgumentException(
                "Role must be one of: admin, driver, rider, dispatcher"));
    }
}
