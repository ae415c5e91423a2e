package com.fieldservice.bookingbackend.service;

import com.fieldservice.bookingbackend.dto.PushNotification;
import com.fieldservice.bookingbackend.model.LocationPoint;
import com.fieldservice.bookingbackend.model.ProfessionalStatus;
import com.fieldservice.bookingbackend.realtime.RealtimePaths;
import com.fieldservice.bookingbackend.realtime.RealtimeStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mirrors durable location changes into the realtime tree and onto
 * {@code /topic/locations/{professionalId}}. Always called after the durable write;
 * failures here are logged and never reach the caller.
 */
@Slf4j
@Service
public class RealtimeLocationPublisher {

    public static final String LOCATION_TOPIC_PREFIX = "/topic/locations/";

    private final RealtimeStore realtimeStore;
    private final SimpMessagingTemplate messagingTemplate;
    private final AtomicLong streamSequence = new AtomicLong();

    @Autowired
    public RealtimeLocationPublisher(RealtimeStore realtimeStore, SimpMessagingTemplate messagingTemplate) {
        this.realtimeStore = realtimeStore;
        this.messagingTemplate = messagingTemplate;
    }

    /**
     * Publish the latest position. Only the position fields are written, so a
     * concurrent status or tracking change is never overwritten.
     */
    public void publishCurrentPosition(String professionalId, LocationPoint position) {
        try {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("latitude", position.getLatitude());
            fields.put("longitude", position.getLongitude());
            fields.put("accuracy", position.getAccuracy());
            fields.put("speed", position.getSpeed());
            fields.put("heading", position.getHeading());
            fields.put("timestamp", String.valueOf(position.getTimestamp()));
            fields.put("updatedAt", System.currentTimeMillis());

            writeCurrentFields(professionalId, fields);
            log.debug("📍 Mirrored position for {} -> ({}, {})",
                    professionalId, position.getLatitude(), position.getLongitude());
        } catch (Exception e) {
            log.error("Failed to mirror position for professional {}", professionalId, e);
        }
    }

    /**
     * Publish a status change. Skipped when no position has been mirrored yet.
     */
    public void publishStatus(String professionalId, ProfessionalStatus status) {
        try {
            if (!realtimeStore.exists(RealtimePaths.current(professionalId))) {
                log.debug("No mirrored position for {}, status {} not published", professionalId, status.getValue());
                return;
            }
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("status", status.getValue());
            fields.put("updatedAt", System.currentTimeMillis());

            writeCurrentFields(professionalId, fields);
            log.debug("Mirrored status for {} -> {}", professionalId, status.getValue());
        } catch (Exception e) {
            log.error("Failed to mirror status for professional {}", professionalId, e);
        }
    }

    public void publishTrackingEnabled(String professionalId, boolean trackingEnabled, ProfessionalStatus status) {
        try {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("trackingEnabled", trackingEnabled);
            fields.put("status", status.getValue());
            fields.put("updatedAt", System.currentTimeMillis());

            writeCurrentFields(professionalId, fields);
            log.debug("Mirrored tracking flag for {} -> {}", professionalId, trackingEnabled);
        } catch (Exception e) {
            log.error("Failed to mirror tracking flag for professional {}", professionalId, e);
        }
    }

    /**
     * Append to the professional's position stream. Keys are {@code epochMillis-sequence} so they sort by arrival.
     */
    public void appendToPositionStream(String professionalId, LocationPoint position) {
        try {
            String entryKey = System.currentTimeMillis() + "-" + streamSequence.incrementAndGet();

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("latitude", position.getLatitude());
            entry.put("longitude", position.getLongitude());
            entry.put("accuracy", position.getAccuracy());
            entry.put("speed", position.getSpeed());
            entry.put("heading", position.getHeading());
            entry.put("timestamp", String.valueOf(position.getTimestamp()));

            realtimeStore.write(RealtimePaths.historyStreamEntry(professionalId, entryKey), entry);
        } catch (Exception e) {
            log.error("Failed to append position stream for professional {}", professionalId, e);
        }
    }

    /**
     * Store one notification record per recipient in a single batch.
     */
    public void writeNotificationRecords(List<String> recipientIds, PushNotification notification) {
        try {
            long now = System.currentTimeMillis();
            Map<String, Object> batch = new HashMap<>();
            for (String recipientId : recipientIds) {
                Map<String, Object> record = new LinkedHashMap<>();
                record.put("title", notification.getTitle());
                record.put("message", notification.getMessage());
                record.put("type", notification.getType().name());
                record.put("meta", new HashMap<>(notification.getActionParams()));
                record.put("timestamp", now);
                record.put("read", false);
                batch.put(RealtimePaths.notification(recipientId, now), record);
            }
            realtimeStore.batchWrite(batch);
        } catch (Exception e) {
            log.error("Failed to write {} notification records", recipientIds.size(), e);
        }
    }

    // Each field is its own node under current/, written in one batch. Null fields are cleared.
    private void writeCurrentFields(String professionalId, Map<String, Object> fields) {
        Map<String, Object> batch = new LinkedHashMap<>();
        fields.forEach((field, value) -> {
            String path = RealtimePaths.currentField(professionalId, field);
            if (value != null) {
                batch.put(path, value);
            } else if (realtimeStore.exists(path)) {
                realtimeStore.remove(path);
            }
        });
        realtimeStore.batchWrite(batch);

        messagingTemplate.convertAndSend(LOCATION_TOPIC_PREFIX + professionalId, currentSnapshot(professionalId));
    }

    private Map<String, Object> currentSnapshot(String professionalId) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        Optional<Object> existing = realtimeStore.read(RealtimePaths.current(professionalId));
        existing.filter(Map.class::isInstance)
                .<Map<?, ?>>map(value -> (Map<?, ?>) value)
                .ifPresent(m -> m.forEach((k, v) -> snapshot.put(String.valueOf(k), v)));
        return snapshot;
    }
}
