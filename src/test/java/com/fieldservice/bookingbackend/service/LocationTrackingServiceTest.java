package com.fieldservice.bookingbackend.service;

import com.fieldservice.bookingbackend.config.TrackingProperties;
import com.fieldservice.bookingbackend.dto.LocationDetails;
import com.fieldservice.bookingbackend.dto.LocationUpdateRequest;
import com.fieldservice.bookingbackend.dto.TrackingSettingsRequest;
import com.fieldservice.bookingbackend.exception.LocationErrorCode;
import com.fieldservice.bookingbackend.exception.LocationException;
import com.fieldservice.bookingbackend.model.LocationHistoryEntry;
import com.fieldservice.bookingbackend.model.LocationPoint;
import com.fieldservice.bookingbackend.model.ProfessionalLocation;
import com.fieldservice.bookingbackend.model.ProfessionalStatus;
import com.fieldservice.bookingbackend.model.Role;
import com.fieldservice.bookingbackend.model.TrackingSettings;
import com.fieldservice.bookingbackend.model.User;
import com.fieldservice.bookingbackend.repository.ProfessionalLocationRepository;
import com.fieldservice.bookingbackend.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LocationTrackingServiceTest {

    @Mock
    private ProfessionalLocationRepository locationRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private RealtimeLocationPublisher realtimePublisher;

    @Mock
    private LocationFanoutService fanoutService;

    private TrackingProperties trackingProperties;
    private LocationTrackingService trackingService;

    private User professional;
    private User customer;

    @BeforeEach
    void setUp() {
        trackingProperties = new TrackingProperties();
        trackingService = new LocationTrackingService(
                locationRepository, userRepository, realtimePublisher, fanoutService, trackingProperties);

        professional = new User();
        professional.setId("pro1");
        professional.setName("Sam Washer");
        professional.setPhone("+15550001");
        professional.setRole(Role.PROFESSIONAL);
        professional.setRating(4.8);

        customer = new User();
        customer.setId("cust1");
        customer.setName("Casey");
        customer.setRole(Role.CUSTOMER);
    }

    // Saves go into a map so reads see earlier writes
    private Map<String, ProfessionalLocation> backRepositoryWithMap() {
        Map<String, ProfessionalLocation> store = new HashMap<>();
        lenient().when(locationRepository.findByProfessionalId(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(store.get(inv.<String>getArgument(0))));
        lenient().when(locationRepository.save(any(ProfessionalLocation.class)))
                .thenAnswer(inv -> {
                    ProfessionalLocation location = inv.getArgument(0);
                    store.put(location.getProfessionalId(), location);
                    return location;
                });
        return store;
    }

    private ProfessionalLocation existingLocation() {
        ProfessionalLocation location = ProfessionalLocation.initialize(
                "pro1", new TrackingSettings(), LocalDateTime.now().minusHours(1));
        location.setCurrent(LocationPoint.of(37.7749, -122.4194, 5.0, 0.0, 0.0, LocalDateTime.now().minusHours(1)));
        return location;
    }

    private LocationUpdateRequest position(double latitude, double longitude) {
        return new LocationUpdateRequest(latitude, longitude, 5.0, 1.5, 90.0);
    }

    @Test
    void testUpdateLocation_firstFixCreatesRecord() {
        when(userRepository.findById("pro1")).thenReturn(Optional.of(professional));
        when(locationRepository.findByProfessionalId("pro1")).thenReturn(Optional.empty());
        when(locationRepository.save(any(ProfessionalLocation.class))).thenAnswer(inv -> inv.getArgument(0));

        ProfessionalLocation result = trackingService.updateLocation("pro1", position(37.7749, -122.4194));

        assertEquals("pro1", result.getProfessionalId());
        assertEquals(37.7749, result.getCurrent().getLatitude());
        assertEquals(-122.4194, result.getCurrent().getLongitude());
        assertEquals(-122.4194, result.getCurrent().getPoint().getX());
        assertEquals(ProfessionalStatus.OFFLINE, result.getStatus());
        assertFalse(result.isTrackingEnabled());
        assertTrue(result.getHistory().isEmpty());
        assertEquals(100, result.getSettings().getMaxHistoryItems());
        verify(fanoutService).onLocationAccepted(eq("pro1"), any(LocationPoint.class));
    }

    @Test
    void testUpdateThenGetLocation_roundTrip() {
        backRepositoryWithMap();
        when(userRepository.findById("pro1")).thenReturn(Optional.of(professional));

        trackingService.updateLocation("pro1", position(37.7749, -122.4194));
        LocationDetails details = trackingService.getLocation("pro1");

        assertEquals(37.7749, details.getLocation().getCurrent().getLatitude());
        assertEquals(-122.4194, details.getLocation().getCurrent().getLongitude());
        assertEquals("Sam Washer", details.getProfessional().getName());
        assertEquals(4.8, details.getProfessional().getRating());
    }

    @Test
    void testHistoryKeepsOnlyMostRecentEntries() {
        trackingProperties.getDefaults().setMaxHistoryItems(3);
        Map<String, ProfessionalLocation> store = backRepositoryWithMap();
        when(userRepository.findById("pro1")).thenReturn(Optional.of(professional));

        // 1 creating fix + 5 moves, history capacity 3
        for (int i = 0; i < 6; i++) {
            trackingService.updateLocation("pro1", position(10 + i, 20));
        }

        List<LocationHistoryEntry> history = store.get("pro1").getHistory();
        assertEquals(3, history.size());
        assertEquals(13.0, history.get(0).getLatitude());
        assertEquals(15.0, history.get(2).getLatitude());

        List<LocationHistoryEntry> newestFirst = trackingService.getHistory("pro1", 50);
        assertEquals(15.0, newestFirst.get(0).getLatitude());
        assertEquals(14.0, newestFirst.get(1).getLatitude());
        assertEquals(13.0, newestFirst.get(2).getLatitude());

        assertEquals(1, trackingService.getHistory("pro1", 1).size());
    }

    @Test
    void testUpdateLocation_zeroHistoryCapacityRecordsNothing() {
        trackingProperties.getDefaults().setMaxHistoryItems(0);
        Map<String, ProfessionalLocation> store = backRepositoryWithMap();
        when(userRepository.findById("pro1")).thenReturn(Optional.of(professional));

        trackingService.updateLocation("pro1", position(10, 20));
        trackingService.updateLocation("pro1", position(11, 20));

        assertTrue(store.get("pro1").getHistory().isEmpty());
        assertEquals(11.0, store.get("pro1").getCurrent().getLatitude());
    }

    @Test
    void testUpdateLocation_latitudeOutOfRange() {
        when(userRepository.findById("pro1")).thenReturn(Optional.of(professional));

        LocationException ex = assertThrows(LocationException.class,
                () -> trackingService.updateLocation("pro1", position(91, 0)));

        assertEquals(LocationErrorCode.VALIDATION_ERROR, ex.getCode());
        assertEquals("latitude", ex.getField());
        verify(locationRepository, never()).save(any());
        verifyNoInteractions(fanoutService);
    }

    @Test
    void testUpdateLocation_negativeSpeed() {
        when(userRepository.findById("pro1")).thenReturn(Optional.of(professional));

        LocationException ex = assertThrows(LocationException.class,
                () -> trackingService.updateLocation("pro1", new LocationUpdateRequest(10.0, 10.0, 5.0, -1.0, 0.0)));

        assertEquals(LocationErrorCode.VALIDATION_ERROR, ex.getCode());
        assertEquals("speed", ex.getField());
    }

    @Test
    void testUpdateLocation_customerRejected() {
        when(userRepository.findById("cust1")).thenReturn(Optional.of(customer));

        LocationException ex = assertThrows(LocationException.class,
                () -> trackingService.updateLocation("cust1", position(10, 10)));

        assertEquals(LocationErrorCode.ROLE_INVALID, ex.getCode());
    }

    @Test
    void testUpdateLocation_unknownUser() {
        when(userRepository.findById("ghost")).thenReturn(Optional.empty());

        LocationException ex = assertThrows(LocationException.class,
                () -> trackingService.updateLocation("ghost", position(10, 10)));

        assertEquals(LocationErrorCode.NOT_FOUND, ex.getCode());
        assertEquals("User", ex.getEntity());
    }

    @Test
    void testUpdateStatus_setsAvailabilityFlag() {
        backRepositoryWithMap().put("pro1", existingLocation());

        ProfessionalLocation busy = trackingService.updateStatus("pro1", "busy");
        assertEquals(ProfessionalStatus.BUSY, busy.getStatus());
        verify(userRepository).updateAvailability("pro1", true);
        verify(realtimePublisher).publishStatus("pro1", ProfessionalStatus.BUSY);

        ProfessionalLocation offline = trackingService.updateStatus("pro1", "offline");
        assertEquals(ProfessionalStatus.OFFLINE, offline.getStatus());
        verify(userRepository).updateAvailability("pro1", false);
    }

    @Test
    void testUpdateStatus_unknownStatus() {
        LocationException ex = assertThrows(LocationException.class,
                () -> trackingService.updateStatus("pro1", "sleeping"));

        assertEquals(LocationErrorCode.VALIDATION_ERROR, ex.getCode());
        assertEquals("status", ex.getField());
        verifyNoInteractions(locationRepository);
    }

    @Test
    void testUpdateStatus_notInitialized() {
        when(locationRepository.findByProfessionalId("pro1")).thenReturn(Optional.empty());

        LocationException ex = assertThrows(LocationException.class,
                () -> trackingService.updateStatus("pro1", "available"));

        assertEquals(LocationErrorCode.LOCATION_NOT_INITIALIZED, ex.getCode());
        verify(userRepository, never()).updateAvailability(anyString(), anyBoolean());
    }

    @Test
    void testSetTrackingDisabled_forcesOffline() {
        ProfessionalLocation location = existingLocation();
        location.setTrackingEnabled(true);
        location.setStatus(ProfessionalStatus.AVAILABLE);
        backRepositoryWithMap().put("pro1", location);
        when(userRepository.findById("pro1")).thenReturn(Optional.of(professional));

        ProfessionalLocation result = trackingService.setTrackingEnabled("pro1", false);

        assertFalse(result.isTrackingEnabled());
        assertEquals(ProfessionalStatus.OFFLINE, result.getStatus());
        verify(realtimePublisher).publishTrackingEnabled("pro1", false, ProfessionalStatus.OFFLINE);
    }

    @Test
    void testSetTrackingEnabled_createsRecordAndKeepsStatus() {
        Map<String, ProfessionalLocation> store = backRepositoryWithMap();
        when(userRepository.findById("pro1")).thenReturn(Optional.of(professional));

        ProfessionalLocation result = trackingService.setTrackingEnabled("pro1", true);

        assertTrue(result.isTrackingEnabled());
        assertEquals(ProfessionalStatus.OFFLINE, result.getStatus());
        assertNull(result.getCurrent());
        assertSame(result, store.get("pro1"));

        store.get("pro1").setStatus(ProfessionalStatus.BUSY);
        assertEquals(ProfessionalStatus.BUSY, trackingService.setTrackingEnabled("pro1", true).getStatus());
    }

    @Test
    void testUpdateSettings_partialMerge() {
        backRepositoryWithMap().put("pro1", existingLocation());
        when(userRepository.findById("pro1")).thenReturn(Optional.of(professional));

        TrackingSettingsRequest request = new TrackingSettingsRequest();
        request.setUpdateIntervalMs(60000L);

        TrackingSettings settings = trackingService.updateTrackingSettings("pro1", request).getSettings();

        assertEquals(60000L, settings.getUpdateIntervalMs());
        assertEquals(10.0, settings.getSignificantChangeThresholdMeters());
        assertTrue(settings.isBatteryOptimizationEnabled());
        assertEquals(100, settings.getMaxHistoryItems());
    }

    @Test
    void testUpdateSettings_shrinkingHistoryTrimsOldest() {
        ProfessionalLocation location = existingLocation();
        for (int i = 0; i < 5; i++) {
            location.moveTo(LocationPoint.of(i, 0, null, null, null, LocalDateTime.now()));
        }
        backRepositoryWithMap().put("pro1", location);
        when(userRepository.findById("pro1")).thenReturn(Optional.of(professional));

        TrackingSettingsRequest request = new TrackingSettingsRequest();
        request.setMaxHistoryItems(2);

        ProfessionalLocation result = trackingService.updateTrackingSettings("pro1", request);

        assertEquals(2, result.getHistory().size());
        assertEquals(3.0, result.getHistory().get(0).getLatitude());
        assertEquals(4.0, result.getHistory().get(1).getLatitude());
    }

    @Test
    void testUpdateSettings_notInitialized() {
        when(userRepository.findById("pro1")).thenReturn(Optional.of(professional));
        when(locationRepository.findByProfessionalId("pro1")).thenReturn(Optional.empty());

        LocationException ex = assertThrows(LocationException.class,
                () -> trackingService.updateTrackingSettings("pro1", new TrackingSettingsRequest()));

        assertEquals(LocationErrorCode.LOCATION_NOT_INITIALIZED, ex.getCode());
    }

    @Test
    void testUpdateSettings_rejectsZeroInterval() {
        when(userRepository.findById("pro1")).thenReturn(Optional.of(professional));
        when(locationRepository.findByProfessionalId("pro1")).thenReturn(Optional.of(existingLocation()));

        TrackingSettingsRequest request = new TrackingSettingsRequest();
        request.setUpdateIntervalMs(0L);

        LocationException ex = assertThrows(LocationException.class,
                () -> trackingService.updateTrackingSettings("pro1", request));

        assertEquals(LocationErrorCode.VALIDATION_ERROR, ex.getCode());
        assertEquals("updateIntervalMs", ex.getField());
        verify(locationRepository, never()).save(any());
    }

    @Test
    void testGetLocation_noRecord() {
        when(userRepository.findById("pro1")).thenReturn(Optional.of(professional));
        when(locationRepository.findByProfessionalId("pro1")).thenReturn(Optional.empty());

        LocationException ex = assertThrows(LocationException.class, () -> trackingService.getLocation("pro1"));

        assertEquals(LocationErrorCode.NOT_FOUND, ex.getCode());
    }

    @Test
    void testGetHistory_emptyAndInvalidLimit() {
        when(locationRepository.findByProfessionalId("pro1")).thenReturn(Optional.of(existingLocation()));

        LocationException empty = assertThrows(LocationException.class,
                () -> trackingService.getHistory("pro1", 50));
        assertEquals(LocationErrorCode.LOCATION_HISTORY_EMPTY, empty.getCode());

        LocationException badLimit = assertThrows(LocationException.class,
                () -> trackingService.getHistory("pro1", 0));
        assertEquals(LocationErrorCode.VALIDATION_ERROR, badLimit.getCode());
    }
}
