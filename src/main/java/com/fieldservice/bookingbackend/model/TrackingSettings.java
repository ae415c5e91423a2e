package com.fieldservice.bookingbackend.model;

import com.fieldservice.bookingbackend.config.TrackingProperties;
import com.fieldservice.bookingbackend.dto.TrackingSettingsRequest;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrackingSettings implements Serializable {
    private static final long serialVersionUID = 1L;

    private long updateIntervalMs = 30000;
    private double significantChangeThresholdMeters = 10;
    private boolean batteryOptimizationEnabled = true;
    private int maxHistoryItems = 100;

    public static TrackingSettings from(TrackingProperties.Defaults defaults) {
        return new TrackingSettings(
                defaults.getUpdateIntervalMs(),
                defaults.getSignificantChangeThresholdMeters(),
                defaults.isBatteryOptimizationEnabled(),
                defaults.getMaxHistoryItems()
        );
    }

    /**
     * Applies only the keys present in the request; everything else keeps its current value.
     */
    public void merge(TrackingSettingsRequest request) {
        if (request.getUpdateIntervalMs() != null) {
            updateIntervalMs = request.getUpdateIntervalMs();
        }
        if (request.getSignificantChangeThresholdMeters() != null) {
            significantChangeThresholdMeters = request.getSignificantChangeThresholdMeters();
        }
        if (request.getBatteryOptimizationEnabled() != null) {
            batteryOptimizationEnabled = request.getBatteryOptimizationEnabled();
        }
        if (request.getMaxHistoryItems() != null) {
            maxHistoryItems = request.getMaxHistoryItems();
        }
    }
}
