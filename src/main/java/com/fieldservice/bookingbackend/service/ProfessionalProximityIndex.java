package com.fieldservice.bookingbackend.service;

import com.fieldservice.bookingbackend.dto.NearbyProfessional;
import com.fieldservice.bookingbackend.dto.NearbySearchQuery;
import com.fieldservice.bookingbackend.dto.ProfessionalSummary;
import com.fieldservice.bookingbackend.exception.LocationException;
import com.fieldservice.bookingbackend.model.ProfessionalLocation;
import com.fieldservice.bookingbackend.model.ProfessionalStatus;
import com.fieldservice.bookingbackend.model.User;
import com.fieldservice.bookingbackend.repository.ProfessionalLocationRepository;
import com.fieldservice.bookingbackend.repository.UserRepository;
import com.fieldservice.bookingbackend.util.LocationValidation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.geo.Distance;
import org.springframework.data.geo.Metrics;
import org.springframework.data.mongodb.core.geo.GeoJsonPoint;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Finds tracked professionals around a point: a $near scan on the 2dsphere index of
 * {@code current.point}, then exact haversine distances, service filters and the profile join.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfessionalProximityIndex {

    private static final double EARTH_RADIUS_KM = 6371;

    private final ProfessionalLocationRepository locationRepository;
    private final UserRepository userRepository;

    public List<NearbyProfessional> findNearby(NearbySearchQuery query) {
        LocationValidation.validateCoordinates(query.getLatitude(), query.getLongitude());
        if (Double.isNaN(query.getMaxDistanceMeters()) || query.getMaxDistanceMeters() <= 0) {
            throw LocationException.validation("maxDistance", "Max distance must be greater than 0");
        }

        GeoJsonPoint origin = new GeoJsonPoint(query.getLongitude(), query.getLatitude());
        double radiusKm = query.getMaxDistanceMeters() / 1000.0;
        Distance maxDistance = new Distance(radiusKm, Metrics.KILOMETERS);

        List<ProfessionalLocation> candidates;
        if (query.matchesAllStatuses()) {
            candidates = locationRepository.findByTrackingEnabledTrueAndCurrentPointNear(origin, maxDistance);
        } else {
            ProfessionalStatus status = LocationValidation.parseStatus(query.getStatus());
            candidates = locationRepository.findByTrackingEnabledTrueAndStatusAndCurrentPointNear(
                    status, origin, maxDistance);
        }

        if (candidates.isEmpty()) {
            return new ArrayList<>();
        }

        Map<String, User> professionals = userRepository.findAllById(
                        candidates.stream().map(ProfessionalLocation::getProfessionalId).collect(Collectors.toSet()))
                .stream()
                .collect(Collectors.toMap(User::getId, Function.identity(), (a, b) -> a));

        List<NearbyProfessional> results = new ArrayList<>();
        for (ProfessionalLocation candidate : candidates) {
            if (candidate.getCurrent() == null) {
                continue;
            }
            User professional = professionals.get(candidate.getProfessionalId());
            if (professional == null) {
                log.warn("⚠️ Location {} references missing professional {}", candidate.getId(), candidate.getProfessionalId());
                continue;
            }
            if (!intersects(query.getServices(), professional.getServiceIds())
                    || !intersects(query.getSpecialties(), professional.getSpecialization())) {
                continue;
            }

            double distanceKm = calculateDistance(
                    query.getLatitude(), query.getLongitude(),
                    candidate.getCurrent().getLatitude(), candidate.getCurrent().getLongitude());
            if (distanceKm > radiusKm) {
                continue;
            }

            results.add(new NearbyProfessional(
                    candidate.getId(),
                    candidate.getProfessionalId(),
                    candidate.getCurrent(),
                    candidate.getStatus(),
                    candidate.getLastUpdated(),
                    distanceKm,
                    ProfessionalSummary.from(professional)
            ));
        }

        results.sort(Comparator.comparingDouble(NearbyProfessional::getDistance));
        results.forEach(r -> r.setDistance(Math.round(r.getDistance() * 100.0) / 100.0));

        log.debug("Nearby search {} -> {} of {} candidates", query.cacheKey(), results.size(), candidates.size());
        return results;
    }

    // An empty filter matches everyone
    private boolean intersects(Set<String> wanted, Collection<String> offered) {
        if (wanted == null || wanted.isEmpty()) {
            return true;
        }
        return offered != null && offered.stream().anyMatch(wanted::contains);
    }

    /**
     * Haversine distance in kilometres.
     */
    static double calculateDistance(double lat1, double lon1, double lat2, double lon2) {
        double latDistance = Math.toRadians(lat2 - lat1);
        double lonDistance = Math.toRadians(lon2 - lon1);
        double a = Math.sin(latDistance / 2) * Math.sin(latDistance / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(lonDistance / 2) * Math.sin(lonDistance / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }
}
