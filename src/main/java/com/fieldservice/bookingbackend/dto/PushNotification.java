package com.fieldservice.bookingbackend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PushNotification {
    private String title;
    private String message;
    private PushNotificationType type;
    private Map<String, Object> actionParams = new HashMap<>();

    public static PushNotification subscriptionAdded(String subscriberId, String professionalId) {
        Map<String, Object> params = new HashMap<>();
        params.put("subscriberId", subscriberId);
        params.put("professionalId", professionalId);
        return new PushNotification(
                "New location subscriber",
                "A customer is now following your live location",
                PushNotificationType.SUBSCRIPTION_ADDED,
                params);
    }

    public static PushNotification subscriptionRemoved(String subscriberId, String professionalId) {
        Map<String, Object> params = new HashMap<>();
        params.put("subscriberId", subscriberId);
        params.put("professionalId", professionalId);
        return new PushNotification(
                "Location subscriber left",
                "A customer stopped following your live location",
                PushNotificationType.SUBSCRIPTION_REMOVED,
                params);
    }

    public static PushNotification locationUpdate(String professionalId, double latitude, double longitude) {
        Map<String, Object> params = new HashMap<>();
        params.put("professionalId", professionalId);
        params.put("latitude", latitude);
        params.put("longitude", longitude);
        return new PushNotification(
                "Professional location updated",
                "The professional you follow has moved",
                PushNotificationType.LOCATION_UPDATE,
                params);
    }
}
