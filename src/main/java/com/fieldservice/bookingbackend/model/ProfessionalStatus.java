package com.fieldservice.bookingbackend.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum ProfessionalStatus {
    AVAILABLE("available"),   // Can take new bookings
    BUSY("busy"),             // On a job
    OFFLINE("offline");       // Not working / tracking off

    private final String value;

    ProfessionalStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<ProfessionalStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
