package com.fieldservice.bookingbackend.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Durable location record, one per professional. Source of truth for
 * current position, status, tracking flag and the bounded history.
 */
@Data
@NoArgsConstructor
@Document(collection = "locations")
@CompoundIndexes({
    @CompoundIndex(name = "tracking_status_idx", def = "{'trackingEnabled': 1, 'status': 1}")
})
public class ProfessionalLocation implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    private String id;

    @Indexed(unique = true)
    private String professionalId;

    private LocationPoint current;

    private ProfessionalStatus status = ProfessionalStatus.OFFLINE;

    private boolean trackingEnabled = false;

    private List<LocationHistoryEntry> history = new ArrayList<>();

    private TrackingSettings settings = new TrackingSettings();

    private LocalDateTime lastUpdated;

    private LocalDateTime createdAt;

    public static ProfessionalLocation initialize(String professionalId, TrackingSettings settings, LocalDateTime now) {
        ProfessionalLocation location = new ProfessionalLocation();
        location.setProfessionalId(professionalId);
        location.setSettings(settings);
        location.setCreatedAt(now);
        location.setLastUpdated(now);
        return location;
    }

    /**
     * Replaces the current position and records it in the history,
     * dropping the oldest entries once {@code maxHistoryItems} is exceeded.
     */
    public void moveTo(LocationPoint position) {
        this.current = position;
        if (settings.getMaxHistoryItems() > 0) {
            history.add(LocationHistoryEntry.from(position));
        }
        trimHistory();
        this.lastUpdated = position.getTimestamp();
    }

    public void trimHistory() {
        int max = Math.max(settings.getMaxHistoryItems(), 0);
        if (history.size() > max) {
            history.subList(0, history.size() - max).clear();
        }
    }

    /**
     * Most recent {@code limit} entries, newest first.
     */
    public List<LocationHistoryEntry> recentHistory(int limit) {
        int from = Math.max(history.size() - limit, 0);
        List<LocationHistoryEntry> recent = new ArrayList<>(history.subList(from, history.size()));
        Collections.reverse(recent);
        return recent;
    }
}
