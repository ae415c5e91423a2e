package com.fieldservice.bookingbackend.exception;

import org.springframework.http.HttpStatus;

public enum LocationErrorCode {
    NOT_FOUND(HttpStatus.NOT_FOUND),
    ROLE_INVALID(HttpStatus.FORBIDDEN),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    LOCATION_NOT_INITIALIZED(HttpStatus.NOT_FOUND),
    TRACKING_DISABLED(HttpStatus.BAD_REQUEST),
    SUBSCRIPTION_NOT_FOUND(HttpStatus.NOT_FOUND),
    LOCATION_HISTORY_EMPTY(HttpStatus.NOT_FOUND);

    private final HttpStatus httpStatus;

    LocationErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
