package com.fieldservice.bookingbackend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "tracking")
public class TrackingProperties {

    private Defaults defaults = new Defaults();
    private Cache cache = new Cache();
    private Executor executor = new Executor();
    private Executor fanoutExecutor = new Executor();
    private Nearby nearby = new Nearby();

    // Applied to a location record when it is first created
    @Data
    public static class Defaults {
        private long updateIntervalMs = 30000;
        private double significantChangeThresholdMeters = 10;
        private boolean batteryOptimizationEnabled = true;
        private int maxHistoryItems = 100;
    }

    @Data
    public static class Cache {
        private Duration nearbyTtl = Duration.ofSeconds(60);
    }

    @Data
    public static class Nearby {
        private double defaultDistanceMeters = 10000;
        private double maxDistanceMeters = 50000;
    }

    @Data
    public static class Executor {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 500;
    }
}
