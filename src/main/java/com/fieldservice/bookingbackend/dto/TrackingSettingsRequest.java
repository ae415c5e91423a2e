package com.fieldservice.bookingbackend.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial settings update. Null fields are left untouched.
 * The aliases accept the short key names older app builds still send.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrackingSettingsRequest {
    @JsonAlias("updateInterval")
    private Long updateIntervalMs;

    @JsonAlias("significantChangeThreshold")
    private Double significantChangeThresholdMeters;

    @JsonAlias("batteryOptimization")
    private Boolean batteryOptimizationEnabled;

    private Integer maxHistoryItems;
}
