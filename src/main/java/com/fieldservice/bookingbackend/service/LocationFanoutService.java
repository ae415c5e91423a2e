package com.fieldservice.bookingbackend.service;

import com.fieldservice.bookingbackend.dto.FanoutResult;
import com.fieldservice.bookingbackend.dto.PushNotification;
import com.fieldservice.bookingbackend.exception.LocationException;
import com.fieldservice.bookingbackend.model.LocationPoint;
import com.fieldservice.bookingbackend.model.User;
import com.fieldservice.bookingbackend.repository.UserRepository;
import com.fieldservice.bookingbackend.util.LocationValidation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Pushes a professional's position to everyone subscribed to it.
 * Best effort: nothing is retried and one failed subscriber never affects the others.
 */
@Slf4j
@Service
public class LocationFanoutService {

    private final UserRepository userRepository;
    private final LocationSubscriptionService subscriptionService;
    private final RealtimeLocationPublisher realtimePublisher;
    private final PushNotificationDispatcher pushDispatcher;
    private final Executor fanoutExecutor;

    @Autowired
    public LocationFanoutService(UserRepository userRepository,
                                 LocationSubscriptionService subscriptionService,
                                 RealtimeLocationPublisher realtimePublisher,
                                 PushNotificationDispatcher pushDispatcher,
                                 @Qualifier("fanoutExecutor") Executor fanoutExecutor) {
        this.userRepository = userRepository;
        this.subscriptionService = subscriptionService;
        this.realtimePublisher = realtimePublisher;
        this.pushDispatcher = pushDispatcher;
        this.fanoutExecutor = fanoutExecutor;
    }

    /**
     * Follow-up of an accepted position update, run after the durable save.
     */
    @Async("trackingExecutor")
    public void onLocationAccepted(String professionalId, LocationPoint position) {
        realtimePublisher.appendToPositionStream(professionalId, position);
        try {
            notifySubscribers(professionalId, position);
        } catch (Exception e) {
            log.error("Subscriber fanout failed for professional {}", professionalId, e);
        }
    }

    public FanoutResult notifySubscribers(String professionalId, LocationPoint position) {
        User professional = userRepository.findById(professionalId)
                .orElseThrow(() -> LocationException.notFound("User", professionalId));
        if (!professional.isProfessional()) {
            throw LocationException.roleInvalid(professionalId, "professional");
        }
        LocationValidation.validateCoordinates(position.getLatitude(), position.getLongitude());

        realtimePublisher.publishCurrentPosition(professionalId, position);

        List<String> subscriberIds = subscriptionService.getSubscriberIds(professionalId);
        if (subscriberIds.isEmpty()) {
            log.debug("No subscribers for {}", professionalId);
            return FanoutResult.none();
        }

        PushNotification notification = PushNotification.locationUpdate(
                professionalId, position.getLatitude(), position.getLongitude());

        if (subscriberIds.size() == 1) {
            boolean delivered = dispatch(notification, subscriberIds.get(0));
            return new FanoutResult(1, delivered ? 1 : 0);
        }

        realtimePublisher.writeNotificationRecords(subscriberIds, notification);

        List<CompletableFuture<Boolean>> dispatches = subscriberIds.stream()
                .map(subscriberId -> CompletableFuture.supplyAsync(
                        () -> dispatch(notification, subscriberId), fanoutExecutor))
                .collect(Collectors.toList());

        int notified = (int) dispatches.stream()
                .map(CompletableFuture::join)
                .filter(Boolean::booleanValue)
                .count();

        log.info("📣 Location of {} sent to {}/{} subscribers", professionalId, notified, subscriberIds.size());
        return new FanoutResult(subscriberIds.size(), notified);
    }

    private boolean dispatch(PushNotification notification, String subscriberId) {
        try {
            pushDispatcher.send(notification, subscriberId);
            return true;
        } catch (Exception e) {
            log.error("Failed to notify subscriber {}", subscriberId, e);
            return false;
        }
    }
}
