package com.fieldservice.bookingbackend.service;

import com.fieldservice.bookingbackend.dto.PushNotification;
import com.fieldservice.bookingbackend.dto.SubscriptionResult;
import com.fieldservice.bookingbackend.exception.LocationException;
import com.fieldservice.bookingbackend.model.ProfessionalLocation;
import com.fieldservice.bookingbackend.model.User;
import com.fieldservice.bookingbackend.realtime.RealtimePaths;
import com.fieldservice.bookingbackend.realtime.RealtimeStore;
import com.fieldservice.bookingbackend.repository.ProfessionalLocationRepository;
import com.fieldservice.bookingbackend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Customer to professional live-location subscriptions. Each pair is stored twice in the
 * realtime tree: under the professional's subscribers and under the customer's subscriptions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LocationSubscriptionService {

    private final UserRepository userRepository;
    private final ProfessionalLocationRepository locationRepository;
    private final RealtimeStore realtimeStore;
    private final PushNotificationDispatcher pushDispatcher;

    public SubscriptionResult subscribe(String subscriberId, String professionalId) {
        findUser(subscriberId);
        User professional = findUser(professionalId);
        if (!professional.isProfessional()) {
            throw LocationException.roleInvalid(professionalId, "professional");
        }

        ProfessionalLocation location = locationRepository.findByProfessionalId(professionalId)
                .orElseThrow(() -> LocationException.trackingDisabled(professionalId));
        if (!location.isTrackingEnabled()) {
            throw LocationException.trackingDisabled(professionalId);
        }

        if (realtimeStore.exists(RealtimePaths.subscriber(professionalId, subscriberId))) {
            log.debug("{} already subscribed to {}", subscriberId, professionalId);
            return new SubscriptionResult(true, true, subscriberId, professionalId,
                    "Already subscribed to professional location");
        }

        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("subscriberId", subscriberId);
        entry.put("professionalId", professionalId);
        entry.put("createdAt", System.currentTimeMillis());

        Map<String, Object> batch = new HashMap<>();
        batch.put(RealtimePaths.subscriber(professionalId, subscriberId), entry);
        batch.put(RealtimePaths.subscription(subscriberId, professionalId), entry);
        realtimeStore.batchWrite(batch);

        log.info("🔔 {} subscribed to location of {}", subscriberId, professionalId);
        notifyProfessional(PushNotification.subscriptionAdded(subscriberId, professionalId), professionalId);

        return new SubscriptionResult(true, false, subscriberId, professionalId,
                "Subscribed to professional location");
    }

    public SubscriptionResult unsubscribe(String subscriberId, String professionalId) {
        findUser(subscriberId);
        findUser(professionalId);

        String subscriberPath = RealtimePaths.subscriber(professionalId, subscriberId);
        if (!realtimeStore.exists(subscriberPath)) {
            throw LocationException.subscriptionNotFound(subscriberId, professionalId);
        }

        realtimeStore.remove(subscriberPath);
        realtimeStore.remove(RealtimePaths.subscription(subscriberId, professionalId));

        log.info("🔕 {} unsubscribed from location of {}", subscriberId, professionalId);
        notifyProfessional(PushNotification.subscriptionRemoved(subscriberId, professionalId), professionalId);

        return new SubscriptionResult(true, false, subscriberId, professionalId,
                "Unsubscribed from professional location");
    }

    public List<String> getSubscriberIds(String professionalId) {
        return new ArrayList<>(realtimeStore.children(RealtimePaths.subscribers(professionalId)));
    }

    public List<String> getSubscribedProfessionals(String subscriberId) {
        findUser(subscriberId);
        return new ArrayList<>(realtimeStore.children(RealtimePaths.subscriptions(subscriberId)));
    }

    private User findUser(String userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> LocationException.notFound("User", userId));
    }

    private void notifyProfessional(PushNotification notification, String professionalId) {
        try {
            pushDispatcher.send(notification, professionalId);
        } catch (Exception e) {
            log.error("Failed to send {} to professional {}", notification.getType(), professionalId, e);
        }
    }
}
