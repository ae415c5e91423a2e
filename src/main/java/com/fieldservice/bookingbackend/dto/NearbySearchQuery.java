package com.fieldservice.bookingbackend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Nearby search parameters. Two queries that differ only below the fourth
 * coordinate decimal or in filter order share a cache entry.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NearbySearchQuery {

    public static final String ALL_STATUSES = "all";

    private double latitude;
    private double longitude;
    private double maxDistanceMeters;
    private String status = "available";
    private Set<String> services = new LinkedHashSet<>();
    private Set<String> specialties = new LinkedHashSet<>();

    public boolean matchesAllStatuses() {
        return ALL_STATUSES.equalsIgnoreCase(status);
    }

    public String cacheKey() {
        StringBuilder key = new StringBuilder(String.format(Locale.ROOT, "nearby:%.4f:%.4f:%s:%s",
                latitude,
                longitude,
                BigDecimal.valueOf(maxDistanceMeters).stripTrailingZeros().toPlainString(),
                status == null ? "" : status.trim().toLowerCase(Locale.ROOT)));

        StringBuilder filters = new StringBuilder();
        appendFilter(filters, "services", services);
        appendFilter(filters, "specialties", specialties);
        if (filters.length() > 0) {
            key.append(':').append(filters);
        }
        return key.toString();
    }

    private static void appendFilter(StringBuilder filters, String name, Set<String> values) {
        if (values == null || values.isEmpty()) {
            return;
        }
        if (filters.length() > 0) {
            filters.append('|');
        }
        filters.append(name).append(':').append(String.join(",", new TreeSet<>(values)));
    }
}
