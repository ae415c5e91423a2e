package com.fieldservice.bookingbackend.dto;

public enum PushNotificationType {
    SUBSCRIPTION_ADDED,
    SUBSCRIPTION_REMOVED,
    LOCATION_UPDATE
}
