package com.fieldservice.bookingbackend.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Account role as the identity service stores it (lowercase).
 */
public enum Role {
    CUSTOMER("customer"),
    PROFESSIONAL("professional"),
    ADMIN("admin");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<Role> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(r -> r.value.equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
