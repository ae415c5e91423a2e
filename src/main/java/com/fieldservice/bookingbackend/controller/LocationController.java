package com.fieldservice.bookingbackend.controller;

import com.fieldservice.bookingbackend.config.TrackingProperties;
import com.fieldservice.bookingbackend.dto.FanoutResult;
import com.fieldservice.bookingbackend.dto.LocationDetails;
import com.fieldservice.bookingbackend.dto.LocationUpdateRequest;
import com.fieldservice.bookingbackend.dto.NearbyProfessional;
import com.fieldservice.bookingbackend.dto.NearbySearchQuery;
import com.fieldservice.bookingbackend.dto.StatusUpdateRequest;
import com.fieldservice.bookingbackend.dto.SubscriptionResult;
import com.fieldservice.bookingbackend.dto.TrackingSettingsRequest;
import com.fieldservice.bookingbackend.dto.TrackingToggleRequest;
import com.fieldservice.bookingbackend.model.LocationHistoryEntry;
import com.fieldservice.bookingbackend.model.LocationPoint;
import com.fieldservice.bookingbackend.model.ProfessionalLocation;
import com.fieldservice.bookingbackend.service.LocationFanoutService;
import com.fieldservice.bookingbackend.service.LocationSubscriptionService;
import com.fieldservice.bookingbackend.service.LocationTrackingService;
import com.fieldservice.bookingbackend.service.NearbyProfessionalsService;
import com.fieldservice.bookingbackend.util.LocationValidation;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

@Tag(name = "Location", description = "Professional location tracking, nearby search and live subscriptions")
@Slf4j
@RestController
@RequestMapping("/api/location")
public class LocationController {

    @Autowired
    private LocationTrackingService trackingService;

    @Autowired
    private NearbyProfessionalsService nearbyService;

    @Autowired
    private LocationSubscriptionService subscriptionService;

    @Autowired
    private LocationFanoutService fanoutService;

    @Autowired
    private TrackingProperties trackingProperties;

    // ========== PROFESSIONAL (SELF) ==========

    @Operation(summary = "Update own location", description = "Records the caller's current GPS position")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Location updated"),
        @ApiResponse(responseCode = "400", description = "Coordinates or motion values out of range"),
        @ApiResponse(responseCode = "403", description = "Caller is not a professional")
    })
    @PostMapping("/update")
    public ResponseEntity<ProfessionalLocation> updateLocation(Authentication authentication,
                                                               @Valid @RequestBody LocationUpdateRequest request) {
        return ResponseEntity.ok(trackingService.updateLocation(authentication.getName(), request));
    }

    @Operation(summary = "Update own status", description = "Sets availability status: available, busy or offline")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Status updated"),
        @ApiResponse(responseCode = "400", description = "Unknown status"),
        @ApiResponse(responseCode = "404", description = "Location tracking not initialized")
    })
    @PostMapping("/status")
    public ResponseEntity<ProfessionalLocation> updateStatus(Authentication authentication,
                                                             @Valid @RequestBody StatusUpdateRequest request) {
        return ResponseEntity.ok(trackingService.updateStatus(authentication.getName(), request.getStatus()));
    }

    @Operation(summary = "Toggle tracking", description = "Enables or disables location tracking; disabling sets status to offline")
    @ApiResponse(responseCode = "200", description = "Tracking flag updated")
    @PostMapping("/tracking")
    public ResponseEntity<ProfessionalLocation> setTracking(Authentication authentication,
                                                            @Valid @RequestBody TrackingToggleRequest request) {
        return ResponseEntity.ok(trackingService.setTrackingEnabled(authentication.getName(), request.getEnabled()));
    }

    @Operation(summary = "Update tracking settings", description = "Partially updates tracking settings; omitted keys keep their value")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Settings updated"),
        @ApiResponse(responseCode = "400", description = "Invalid setting value"),
        @ApiResponse(responseCode = "404", description = "Location tracking not initialized")
    })
    @PostMapping("/settings")
    public ResponseEntity<ProfessionalLocation> updateSettings(Authentication authentication,
                                                               @RequestBody TrackingSettingsRequest request) {
        return ResponseEntity.ok(trackingService.updateTrackingSettings(authentication.getName(), request));
    }

    @Operation(summary = "Notify subscribers", description = "Re-broadcasts a position to everyone following the caller")
    @ApiResponse(responseCode = "200", description = "Number of subscribers and successful notifications")
    @PostMapping("/notify")
    public ResponseEntity<FanoutResult> notifySubscribers(Authentication authentication,
                                                          @Valid @RequestBody LocationUpdateRequest request) {
        LocationValidation.validateNonNegative("accuracy", request.getAccuracy());
        LocationValidation.validateNonNegative("speed", request.getSpeed());
        LocationValidation.validateNonNegative("heading", request.getHeading());

        LocationPoint position = LocationPoint.of(
                request.getLatitude(), request.getLongitude(),
                request.getAccuracy(), request.getSpeed(), request.getHeading(),
                LocalDateTime.now());
        return ResponseEntity.ok(fanoutService.notifySubscribers(authentication.getName(), position));
    }

    // ========== LOOKUP ==========

    @Operation(summary = "Get professional location", description = "Current location record with a minimal professional profile")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Location found"),
        @ApiResponse(responseCode = "404", description = "Professional or location not found")
    })
    @GetMapping("/professional/{professionalId}")
    public ResponseEntity<LocationDetails> getLocation(
            @Parameter(description = "Professional ID") @PathVariable String professionalId) {
        return ResponseEntity.ok(trackingService.getLocation(professionalId));
    }

    @Operation(summary = "Get location history", description = "Most recent positions first")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "History entries"),
        @ApiResponse(responseCode = "404", description = "No location or empty history")
    })
    @GetMapping("/professional/{professionalId}/history")
    public ResponseEntity<List<LocationHistoryEntry>> getHistory(
            @Parameter(description = "Professional ID") @PathVariable String professionalId,
            @Parameter(description = "Maximum number of entries") @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(trackingService.getHistory(professionalId, limit));
    }

    @Operation(summary = "Find nearby professionals", description = "Tracked professionals within maxDistance metres, nearest first")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Nearby professionals, distance in km"),
        @ApiResponse(responseCode = "400", description = "Invalid coordinates, distance or status")
    })
    @GetMapping("/nearby")
    public ResponseEntity<List<NearbyProfessional>> findNearby(
            @RequestParam double latitude,
            @RequestParam double longitude,
            @Parameter(description = "Radius in metres, capped by configuration") @RequestParam(required = false) Double maxDistance,
            @Parameter(description = "available, busy, offline or all") @RequestParam(defaultValue = "available") String status,
            @RequestParam(required = false) List<String> services,
            @RequestParam(required = false) List<String> specialties) {

        TrackingProperties.Nearby limits = trackingProperties.getNearby();
        double radius = maxDistance != null ? maxDistance : limits.getDefaultDistanceMeters();
        radius = Math.min(radius, limits.getMaxDistanceMeters());

        NearbySearchQuery query = new NearbySearchQuery(
                latitude,
                longitude,
                radius,
                status,
                services != null ? new LinkedHashSet<>(services) : new LinkedHashSet<>(),
                specialties != null ? new LinkedHashSet<>(specialties) : new LinkedHashSet<>()
        );
        return ResponseEntity.ok(nearbyService.findNearby(query));
    }

    // ========== SUBSCRIPTIONS ==========

    @Operation(summary = "Subscribe to a professional", description = "Follow a professional's live location")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Subscribed, or already subscribed"),
        @ApiResponse(responseCode = "400", description = "Professional has tracking disabled"),
        @ApiResponse(responseCode = "404", description = "User not found")
    })
    @PostMapping("/subscribe/{professionalId}")
    public ResponseEntity<SubscriptionResult> subscribe(Authentication authentication,
                                                        @PathVariable String professionalId) {
        return ResponseEntity.ok(subscriptionService.subscribe(authentication.getName(), professionalId));
    }

    @Operation(summary = "Unsubscribe from a professional")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Unsubscribed"),
        @ApiResponse(responseCode = "404", description = "User or subscription not found")
    })
    @PostMapping("/unsubscribe/{professionalId}")
    public ResponseEntity<SubscriptionResult> unsubscribe(Authentication authentication,
                                                          @PathVariable String professionalId) {
        return ResponseEntity.ok(subscriptionService.unsubscribe(authentication.getName(), professionalId));
    }

    @Operation(summary = "List own subscriptions", description = "IDs of professionals the caller follows")
    @GetMapping("/subscriptions")
    public ResponseEntity<Map<String, Object>> getSubscriptions(Authentication authentication) {
        List<String> professionalIds = subscriptionService.getSubscribedProfessionals(authentication.getName());
        return ResponseEntity.ok(Map.of(
                "count", professionalIds.size(),
                "professionalIds", professionalIds
        ));
    }
}
