package com.fieldservice.bookingbackend.service;

import com.fieldservice.bookingbackend.config.TrackingProperties;
import com.fieldservice.bookingbackend.dto.LocationDetails;
import com.fieldservice.bookingbackend.dto.LocationUpdateRequest;
import com.fieldservice.bookingbackend.dto.ProfessionalProfile;
import com.fieldservice.bookingbackend.dto.TrackingSettingsRequest;
import com.fieldservice.bookingbackend.exception.LocationException;
import com.fieldservice.bookingbackend.model.LocationHistoryEntry;
import com.fieldservice.bookingbackend.model.LocationPoint;
import com.fieldservice.bookingbackend.model.ProfessionalLocation;
import com.fieldservice.bookingbackend.model.ProfessionalStatus;
import com.fieldservice.bookingbackend.model.TrackingSettings;
import com.fieldservice.bookingbackend.model.User;
import com.fieldservice.bookingbackend.repository.ProfessionalLocationRepository;
import com.fieldservice.bookingbackend.repository.UserRepository;
import com.fieldservice.bookingbackend.util.LocationValidation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Durable location records of professionals. Every mutation is saved to Mongo first;
 * the realtime mirror and subscriber fanout follow.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LocationTrackingService {

    private final ProfessionalLocationRepository locationRepository;
    private final UserRepository userRepository;
    private final RealtimeLocationPublisher realtimePublisher;
    private final LocationFanoutService fanoutService;
    private final TrackingProperties trackingProperties;

    public ProfessionalLocation updateLocation(String professionalId, LocationUpdateRequest request) {
        requireProfessional(professionalId);
        validatePosition(request);

        LocalDateTime now = LocalDateTime.now();
        LocationPoint position = LocationPoint.of(
                request.getLatitude(),
                request.getLongitude(),
                request.getAccuracy(),
                request.getSpeed(),
                request.getHeading(),
                now
        );

        ProfessionalLocation location = locationRepository.findByProfessionalId(professionalId)
                .map(existing -> {
                    existing.moveTo(position);
                    return existing;
                })
                .orElseGet(() -> {
                    // First fix only sets the current position, history starts with the next one
                    ProfessionalLocation created = ProfessionalLocation.initialize(professionalId, defaultSettings(), now);
                    created.setCurrent(position);
                    return created;
                });

        ProfessionalLocation saved = locationRepository.save(location);
        log.info("📍 Location updated for {} -> ({}, {})",
                professionalId, position.getLatitude(), position.getLongitude());

        fanoutService.onLocationAccepted(professionalId, position);
        return saved;
    }

    public ProfessionalLocation updateStatus(String professionalId, String status) {
        ProfessionalStatus newStatus = LocationValidation.parseStatus(status);

        ProfessionalLocation location = locationRepository.findByProfessionalId(professionalId)
                .orElseThrow(() -> LocationException.notInitialized(professionalId));

        location.setStatus(newStatus);
        location.setLastUpdated(LocalDateTime.now());
        ProfessionalLocation saved = locationRepository.save(location);

        userRepository.updateAvailability(professionalId, newStatus != ProfessionalStatus.OFFLINE);
        log.info("🔄 Status of {} -> {}", professionalId, newStatus.getValue());

        realtimePublisher.publishStatus(professionalId, newStatus);
        return saved;
    }

    public ProfessionalLocation setTrackingEnabled(String professionalId, boolean enabled) {
        findUser(professionalId);

        LocalDateTime now = LocalDateTime.now();
        ProfessionalLocation location = locationRepository.findByProfessionalId(professionalId)
                .orElseGet(() -> ProfessionalLocation.initialize(professionalId, defaultSettings(), now));

        location.setTrackingEnabled(enabled);
        if (!enabled) {
            location.setStatus(ProfessionalStatus.OFFLINE);
        }
        location.setLastUpdated(now);
        ProfessionalLocation saved = locationRepository.save(location);

        log.info("{} Tracking {} for {}", enabled ? "▶️" : "⏹️", enabled ? "enabled" : "disabled", professionalId);
        realtimePublisher.publishTrackingEnabled(professionalId, enabled, saved.getStatus());
        return saved;
    }

    public ProfessionalLocation updateTrackingSettings(String professionalId, TrackingSettingsRequest request) {
        findUser(professionalId);

        ProfessionalLocation location = locationRepository.findByProfessionalId(professionalId)
                .orElseThrow(() -> LocationException.notInitialized(professionalId));

        validateSettings(request);
        location.getSettings().merge(request);
        location.trimHistory();
        location.setLastUpdated(LocalDateTime.now());

        ProfessionalLocation saved = locationRepository.save(location);
        log.info("⚙️ Tracking settings updated for {}: {}", professionalId, saved.getSettings());
        return saved;
    }

    public LocationDetails getLocation(String professionalId) {
        User professional = requireProfessional(professionalId);

        ProfessionalLocation location = locationRepository.findByProfessionalId(professionalId)
                .orElseThrow(() -> LocationException.notFound("Location", professionalId));

        return new LocationDetails(location, ProfessionalProfile.from(professional));
    }

    public List<LocationHistoryEntry> getHistory(String professionalId, int limit) {
        if (limit <= 0) {
            throw LocationException.validation("limit", "Limit must be greater than 0");
        }

        ProfessionalLocation location = locationRepository.findByProfessionalId(professionalId)
                .orElseThrow(() -> LocationException.notFound("Location", professionalId));

        if (location.getHistory() == null || location.getHistory().isEmpty()) {
            throw LocationException.historyEmpty(professionalId);
        }
        return location.recentHistory(limit);
    }

    private User findUser(String userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> LocationException.notFound("User", userId));
    }

    private User requireProfessional(String userId) {
        User user = findUser(userId);
        if (!user.isProfessional()) {
            throw LocationException.roleInvalid(userId, "professional");
        }
        return user;
    }

    private TrackingSettings defaultSettings() {
        return TrackingSettings.from(trackingProperties.getDefaults());
    }

    private void validatePosition(LocationUpdateRequest request) {
        if (request.getLatitude() == null) {
            throw LocationException.validation("latitude", "Latitude is required");
        }
        if (request.getLongitude() == null) {
            throw LocationException.validation("longitude", "Longitude is required");
        }
        LocationValidation.validateCoordinates(request.getLatitude(), request.getLongitude());
        LocationValidation.validateNonNegative("accuracy", request.getAccuracy());
        LocationValidation.validateNonNegative("speed", request.getSpeed());
        LocationValidation.validateNonNegative("heading", request.getHeading());
    }

    private void validateSettings(TrackingSettingsRequest request) {
        if (request.getUpdateIntervalMs() != null && request.getUpdateIntervalMs() <= 0) {
            throw LocationException.validation("updateIntervalMs", "Update interval must be greater than 0");
        }
        if (request.getSignificantChangeThresholdMeters() != null
                && (request.getSignificantChangeThresholdMeters().isNaN()
                || request.getSignificantChangeThresholdMeters() <= 0)) {
            throw LocationException.validation("significantChangeThresholdMeters",
                    "Significant change threshold must be greater than 0");
        }
        if (request.getMaxHistoryItems() != null && request.getMaxHistoryItems() < 0) {
            throw LocationException.validation("maxHistoryItems", "Max history items must not be negative");
        }
    }
}
