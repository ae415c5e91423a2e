package com.fieldservice.bookingbackend.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LocationHistoryEntry implements Serializable {
    private static final long serialVersionUID = 1L;

    private double latitude;
    private double longitude;
    private double accuracy;
    private double speed;
    private LocalDateTime timestamp;

    public static LocationHistoryEntry from(LocationPoint point) {
        return new LocationHistoryEntry(
                point.getLatitude(),
                point.getLongitude(),
                point.getAccuracy(),
                point.getSpeed(),
                point.getTimestamp()
        );
    }
}
