package com.fieldservice.bookingbackend.exception;

import lombok.Getter;

/**
 * Domain failure of the location subsystem. Callers branch on {@link #getCode()}, never on the message.
 */
@Getter
public class LocationException extends RuntimeException {

    private final LocationErrorCode code;
    private final String entity;
    private final String field;

    public LocationException(LocationErrorCode code, String message, String entity, String field) {
        super(message);
        this.code = code;
        this.entity = entity;
        this.field = field;
    }

    public static LocationException notFound(String entity, String id) {
        return new LocationException(LocationErrorCode.NOT_FOUND,
                entity + " not found with id: " + id, entity, null);
    }

    public static LocationException roleInvalid(String userId, String expectedRole) {
        return new LocationException(LocationErrorCode.ROLE_INVALID,
                "User " + userId + " is not a " + expectedRole, "User", "role");
    }

    public static LocationException validation(String field, String message) {
        return new LocationException(LocationErrorCode.VALIDATION_ERROR, message, "Location", field);
    }

    public static LocationException notInitialized(String professionalId) {
        return new LocationException(LocationErrorCode.LOCATION_NOT_INITIALIZED,
                "Location tracking has not been initialized for professional " + professionalId,
                "Location", null);
    }

    public static LocationException trackingDisabled(String professionalId) {
        return new LocationException(LocationErrorCode.TRACKING_DISABLED,
                "Location tracking is disabled for professional " + professionalId,
                "Location", "trackingEnabled");
    }

    public static LocationException subscriptionNotFound(String subscriberId, String professionalId) {
        return new LocationException(LocationErrorCode.SUBSCRIPTION_NOT_FOUND,
                "User " + subscriberId + " is not subscribed to professional " + professionalId,
                "Subscription", null);
    }

    public static LocationException historyEmpty(String professionalId) {
        return new LocationException(LocationErrorCode.LOCATION_HISTORY_EMPTY,
                "No location history recorded for professional " + professionalId,
                "Location", "history");
    }
}
