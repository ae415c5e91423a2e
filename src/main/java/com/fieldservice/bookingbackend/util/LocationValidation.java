package com.fieldservice.bookingbackend.util;

import com.fieldservice.bookingbackend.exception.LocationException;
import com.fieldservice.bookingbackend.model.ProfessionalStatus;

public final class LocationValidation {

    private LocationValidation() {
    }

    public static void validateCoordinates(double latitude, double longitude) {
        if (Double.isNaN(latitude) || latitude < -90 || latitude > 90) {
            throw LocationException.validation("latitude", "Latitude must be between -90 and 90");
        }
        if (Double.isNaN(longitude) || longitude < -180 || longitude > 180) {
            throw LocationException.validation("longitude", "Longitude must be between -180 and 180");
        }
    }

    /** Accuracy, speed and heading are optional but never negative. */
    public static void validateNonNegative(String field, Double value) {
        if (value != null && (value.isNaN() || value < 0)) {
            throw LocationException.validation(field, field + " must not be negative");
        }
    }

    public static ProfessionalStatus parseStatus(String status) {
        return ProfessionalStatus.fromValue(status)
                .orElseThrow(() -> LocationException.validation("status",
                        "Invalid status: " + status + ". Must be one of: available, busy, offline"));
    }
}
