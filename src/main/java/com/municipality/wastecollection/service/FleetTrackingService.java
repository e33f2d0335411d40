package com.municipality.wastecollection.service;

import com.municipality.wastecollection.config.CollectionProperties;
import com.municipality.wastecollection.config.RedisConfig;
import com.municipality.wastecollection.dto.LocationSampleRequest;
import com.municipality.wastecollection.dto.TruckPositionEvent;
import com.municipality.wastecollection.exception.PermissionDeniedException;
import com.municipality.wastecollection.geo.GeoDistance;
import com.municipality.wastecollection.geo.GeoPoint;
import com.municipality.wastecollection.model.Driver;
import com.municipality.wastecollection.model.LocationSample;
import com.municipality.wastecollection.repository.LocationSampleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Ingestion of driver GPS samples.
 * <p>
 * Samples of one driver are applied in arrival order under that driver's lock; other drivers
 * are never blocked. Nothing here touches optimizer or route state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FleetTrackingService {

    private final FleetService fleetService;
    private final LocationSampleRepository sampleRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final CollectionProperties properties;

    private final KeyedLocks driverLocks = new KeyedLocks();
    private final Map<String, Deque<LocationSample>> trails = new ConcurrentHashMap<>();
    private final Map<String, LocalDateTime> lastStoredAt = new ConcurrentHashMap<>();

    /**
     * @throws com.municipality.wastecollection.exception.ResourceNotFoundException if the driver is unknown
     * @throws PermissionDeniedException if the driver has location sharing disabled
     * @throws IllegalArgumentException  if the sample is out of range
     */
    @CacheEvict(value = RedisConfig.ACTIVE_DRIVERS, allEntries = true)
    public LocationSample ingest(String driverId, LocationSampleRequest request) {
        validate(request);
        LocalDateTime recordedAt = request.getRecordedAt() != null ? request.getRecordedAt() : LocalDateTime.now();

        return driverLocks.call(driverId, () -> {
            Driver driver = fleetService.getDriver(driverId);
            if (!driver.isLocationSharingEnabled()) {
                throw new PermissionDeniedException("Driver " + driverId + " has location sharing disabled");
            }

            String truckId = driver.getCurrentTruckId();
            LocationSample sample = new LocationSample(UUID.randomUUID().toString(), driverId, truckId,
                    request.getLatitude(), request.getLongitude(), request.getAccuracyMeters(),
                    request.getHeading(), request.getSpeedKmh(), request.getAltitude(),
                    request.getBatteryLevel(), recordedAt);

            appendToTrail(driverId, sample);

            if (shouldStore(driverId, recordedAt)) {
                sampleRepository.save(sample);
                lastStoredAt.put(driverId, recordedAt);
            }

            if (truckId != null) {
                fleetService.updateTruckPosition(truckId, sample.getLatitude(), sample.getLongitude(), recordedAt);
            }
            fleetService.touchDriver(driverId, LocalDateTime.now());

            eventPublisher.publishEvent(new TruckPositionEvent(driverId, truckId, sample.getLatitude(),
                    sample.getLongitude(), sample.getHeading(), sample.getSpeedKmh(), recordedAt));
            return sample;
        });
    }

    /**
     * Most recent in-memory samples of the driver, oldest first.
     */
    public List<LocationSample> getTrail(String driverId) {
        fleetService.getDriver(driverId);
        Deque<LocationSample> trail = trails.get(driverId);
        if (trail == null) {
            return List.of();
        }
        synchronized (trail) {
            return new ArrayList<>(trail);
        }
    }

    /**
     * Geodesic length of the stored track between two instants, or null with fewer than two samples.
     */
    public Double measuredDistanceKm(String driverId, LocalDateTime from, LocalDateTime to) {
        if (driverId == null || from == null || to == null) {
            return null;
        }
        List<LocationSample> samples = sampleRepository
                .findByDriverIdAndRecordedAtBetweenOrderByRecordedAtAsc(driverId, from, to);
        if (samples.size() < 2) {
            return null;
        }
        return GeoDistance.pathKm(samples.stream()
                .map(sample -> new GeoPoint(sample.getLatitude(), sample.getLongitude()))
                .collect(Collectors.toList()));
    }

    public long purgeSamplesOlderThan(LocalDateTime cutoff) {
        long removed = sampleRepository.deleteByRecordedAtBefore(cutoff);
        trails.values().forEach(trail -> {
            synchronized (trail) {
                trail.removeIf(sample -> sample.getRecordedAt().isBefore(cutoff));
            }
        });
        return removed;
    }

    private void appendToTrail(String driverId, LocationSample sample) {
        int limit = Math.max(1, properties.getTracking().getTrailSize());
        Deque<LocationSample> trail = trails.computeIfAbsent(driverId, id -> new ArrayDeque<>());
        synchronized (trail) {
            trail.addLast(sample);
            while (trail.size() > limit) {
                trail.removeFirst();
            }
        }
    }

    private boolean shouldStore(String driverId, LocalDateTime recordedAt) {
        LocalDateTime previous = lastStoredAt.get(driverId);
        if (previous == null) {
            return true;
        }
        long minInterval = properties.getTracking().getMinStorageIntervalMs();
        return Duration.between(previous, recordedAt).toMillis() >= minInterval;
    }

    static void validate(LocationSampleRequest request) {
        if (request == null || request.getLatitude() == null || request.getLongitude() == null) {
            throw new IllegalArgumentException("Latitude and longitude are required");
        }
        GeoPoint.of(request.getLatitude(), request.getLongitude());
        if (request.getAccuracyMeters() != null && request.getAccuracyMeters() < 0) {
            throw new IllegalArgumentException("Accuracy must not be negative: " + request.getAccuracyMeters());
        }
        if (request.getHeading() != null && (request.getHeading() < 0 || request.getHeading() > 360)) {
            throw new IllegalArgumentException("Heading must be within [0, 360]: " + request.getHeading());
        }
        if (request.getSpeedKmh() != null && request.getSpeedKmh() < 0) {
            throw new IllegalArgumentException("Speed must not be negative: " + request.getSpeedKmh());
        }
        if (request.getBatteryLevel() != null && (request.getBatteryLevel() < 0 || request.getBatteryLevel() > 100)) {
            throw new IllegalArgumentException("Battery level must be within [0, 100]: " + request.getBatteryLevel());
        }
    }
}
