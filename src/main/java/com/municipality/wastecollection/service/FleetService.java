package com.municipality.wastecollection.service;

import com.municipality.wastecollection.config.RedisConfig;
import com.municipality.wastecollection.dto.ActiveDriverStatus;
import com.municipality.wastecollection.dto.AuditEvent;
import com.municipality.wastecollection.dto.DriverRequest;
import com.municipality.wastecollection.dto.TruckRequest;
import com.municipality.wastecollection.exception.ResourceNotFoundException;
import com.municipality.wastecollection.exception.SchedulingConflictException;
import com.municipality.wastecollection.model.AuditAction;
import com.municipality.wastecollection.model.AuditedEntity;
import com.municipality.wastecollection.model.CollectionRoute;
import com.municipality.wastecollection.model.Driver;
import com.municipality.wastecollection.model.FuelType;
import com.municipality.wastecollection.model.RouteStatus;
import com.municipality.wastecollection.model.Truck;
import com.municipality.wastecollection.model.TruckStatus;
import com.municipality.wastecollection.repository.CollectionRouteRepository;
import com.municipality.wastecollection.repository.DriverRepository;
import com.municipality.wastecollection.repository.TruckRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Trucks, drivers and the exclusive binding between them.
 * <p>
 * Lock order is pairing monitor, then driver, then truck. Nothing here calls back into
 * route or bin services.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FleetService {

    private static final Set<RouteStatus> DRIVING = EnumSet.of(RouteStatus.ASSIGNED, RouteStatus.IN_PROGRESS);

    private final TruckRepository truckRepository;
    private final DriverRepository driverRepository;
    private final CollectionRouteRepository routeRepository;
    private final ApplicationEventPublisher eventPublisher;

    private final Object pairingMonitor = new Object();
    private final KeyedLocks driverLocks = new KeyedLocks();
    private final KeyedLocks truckLocks = new KeyedLocks();

    public Truck registerTruck(TruckRequest request) {
        if (request.getLicensePlate() == null || request.getLicensePlate().isBlank()) {
            throw new IllegalArgumentException("License plate is required");
        }
        if (request.getCapacityKg() <= 0) {
            throw new IllegalArgumentException("Truck capacity must be positive: " + request.getCapacityKg());
        }
        Truck truck = new Truck();
        truck.setId(UUID.randomUUID().toString());
        truck.setLicensePlate(request.getLicensePlate());
        truck.setModel(request.getModel());
        truck.setCapacityKg(request.getCapacityKg());
        truck.setFuelType(request.getFuelType() != null ? request.getFuelType() : FuelType.DIESEL);
        truck.setStatus(TruckStatus.AVAILABLE);
        truck.setStatusUpdatedAt(LocalDateTime.now());

        Truck saved = truckRepository.save(truck);
        log.info("🚛 Registered truck {} ({} kg)", saved.getLicensePlate(), saved.getCapacityKg());
        audit(AuditedEntity.TRUCK, saved.getId(), AuditAction.CREATE, null,
                AuditEvent.values("licensePlate", saved.getLicensePlate(), "capacityKg", saved.getCapacityKg(),
                        "fuelType", saved.getFuelType(), "status", saved.getStatus()));
        return saved;
    }

    public Driver registerDriver(DriverRequest request) {
        Driver driver = new Driver();
        driver.setId(UUID.randomUUID().toString());
        driver.setFullName(request.getFullName());
        driver.setLicenseNumber(request.getLicenseNumber());
        Driver saved = driverRepository.save(driver);
        audit(AuditedEntity.DRIVER, saved.getId(), AuditAction.CREATE, null,
                AuditEvent.values("fullName", saved.getFullName(), "licenseNumber", saved.getLicenseNumber()));
        return saved;
    }

    public Truck getTruck(String truckId) {
        return truckRepository.findById(truckId)
                .orElseThrow(() -> ResourceNotFoundException.of("Truck", truckId));
    }

    public Driver getDriver(String driverId) {
        return driverRepository.findById(driverId)
                .orElseThrow(() -> ResourceNotFoundException.of("Driver", driverId));
    }

    public List<Truck> getAllTrucks() {
        return truckRepository.findAll();
    }

    public List<Driver> getAllDrivers() {
        return driverRepository.findAll();
    }

    /**
     * Binds a driver and a truck to each other. Both back-references are written in one
     * step under the pairing monitor.
     *
     * @throws SchedulingConflictException if either side is already bound to someone else
     */
    @CacheEvict(value = RedisConfig.ACTIVE_DRIVERS, allEntries = true)
    public Driver assignDriverToTruck(String driverId, String truckId) {
        synchronized (pairingMonitor) {
            return driverLocks.call(driverId, () -> truckLocks.call(truckId, () -> {
                Driver driver = getDriver(driverId);
                Truck truck = getTruck(truckId);

                if (driver.getCurrentTruckId() != null && !driver.getCurrentTruckId().equals(truckId)) {
                    throw new SchedulingConflictException("Driver " + driverId + " already drives truck " + driver.getCurrentTruckId());
                }
                if (truck.getCurrentDriverId() != null && !truck.getCurrentDriverId().equals(driverId)) {
                    throw new SchedulingConflictException("Truck " + truckId + " is already driven by " + truck.getCurrentDriverId());
                }

                String previousTruckId = driver.getCurrentTruckId();
                String previousDriverId = truck.getCurrentDriverId();
                driver.setCurrentTruckId(truckId);
                truck.setCurrentDriverId(driverId);
                truckRepository.save(truck);
                Driver saved = driverRepository.save(driver);
                log.info("🔗 Driver {} paired with truck {}", driverId, truck.getLicensePlate());
                audit(AuditedEntity.DRIVER, driverId, AuditAction.PAIRED,
                        AuditEvent.values("currentTruckId", previousTruckId), AuditEvent.values("currentTruckId", truckId));
                audit(AuditedEntity.TRUCK, truckId, AuditAction.PAIRED,
                        AuditEvent.values("currentDriverId", previousDriverId), AuditEvent.values("currentDriverId", driverId));
                return saved;
            }));
        }
    }

    @CacheEvict(value = RedisConfig.ACTIVE_DRIVERS, allEntries = true)
    public Driver releaseDriver(String driverId) {
        synchronized (pairingMonitor) {
            return driverLocks.call(driverId, () -> {
                Driver driver = getDriver(driverId);
                String truckId = driver.getCurrentTruckId();
                if (truckId == null) {
                    return driver;
                }
                boolean truckCleared = truckLocks.call(truckId, () -> {
                    Truck truck = truckRepository.findById(truckId).orElse(null);
                    if (truck == null) {
                        return false;
                    }
                    if (truck.getStatus() == TruckStatus.ON_ROUTE) {
                        throw new SchedulingConflictException("Truck " + truckId + " is on a route; finish or cancel it first");
                    }
                    if (!driverId.equals(truck.getCurrentDriverId())) {
                        return false;
                    }
                    truck.setCurrentDriverId(null);
                    truckRepository.save(truck);
                    return true;
                });
                driver.setCurrentTruckId(null);
                Driver saved = driverRepository.save(driver);
                audit(AuditedEntity.DRIVER, driverId, AuditAction.UNPAIRED,
                        AuditEvent.values("currentTruckId", truckId), AuditEvent.values("currentTruckId", null));
                if (truckCleared) {
                    audit(AuditedEntity.TRUCK, truckId, AuditAction.UNPAIRED,
                            AuditEvent.values("currentDriverId", driverId), AuditEvent.values("currentDriverId", null));
                }
                return saved;
            });
        }
    }

    /**
     * Manual status changes. ON_ROUTE is owned by route assignment and cannot be set or left here.
     */
    public Truck updateTruckStatus(String truckId, TruckStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("Truck status is required");
        }
        if (status == TruckStatus.ON_ROUTE) {
            throw new IllegalArgumentException("ON_ROUTE is set by route assignment only");
        }
        return truckLocks.call(truckId, () -> {
            Truck truck = getTruck(truckId);
            if (truck.getStatus() == TruckStatus.ON_ROUTE) {
                throw new SchedulingConflictException("Truck " + truckId + " is on a route");
            }
            TruckStatus previous = truck.getStatus();
            truck.setStatus(status);
            truck.setStatusUpdatedAt(LocalDateTime.now());
            Truck saved = truckRepository.save(truck);
            auditStatus(truckId, previous, status);
            return saved;
        });
    }

    @CacheEvict(value = RedisConfig.ACTIVE_DRIVERS, allEntries = true)
    public Driver setOnDuty(String driverId, boolean onDuty) {
        return driverLocks.call(driverId, () -> {
            Driver driver = getDriver(driverId);
            boolean previous = driver.isOnDuty();
            driver.setOnDuty(onDuty);
            driver.setLastActive(LocalDateTime.now());
            Driver saved = driverRepository.save(driver);
            if (previous != onDuty) {
                audit(AuditedEntity.DRIVER, driverId, AuditAction.UPDATE,
                        AuditEvent.values("onDuty", previous), AuditEvent.values("onDuty", onDuty));
            }
            return saved;
        });
    }

    public Driver updateLocationSharing(String driverId, boolean enabled, Integer frequencySeconds) {
        if (frequencySeconds != null
                && (frequencySeconds < Driver.MIN_UPDATE_FREQUENCY_SECONDS
                || frequencySeconds > Driver.MAX_UPDATE_FREQUENCY_SECONDS)) {
            throw new IllegalArgumentException("Location update frequency must be between "
                    + Driver.MIN_UPDATE_FREQUENCY_SECONDS + " and " + Driver.MAX_UPDATE_FREQUENCY_SECONDS
                    + " seconds: " + frequencySeconds);
        }
        return driverLocks.call(driverId, () -> {
            Driver driver = getDriver(driverId);
            driver.setLocationSharingEnabled(enabled);
            if (frequencySeconds != null) {
                driver.setLocationUpdateFrequencySeconds(frequencySeconds);
            }
            return driverRepository.save(driver);
        });
    }

    void touchDriver(String driverId, LocalDateTime at) {
        driverLocks.run(driverId, () -> driverRepository.findById(driverId).ifPresent(driver -> {
            driver.setLastActive(at);
            driverRepository.save(driver);
        }));
    }

    /**
     * Trucks that can take a route now: AVAILABLE and driven by an on-duty driver.
     */
    public List<Truck> getAvailableTrucks() {
        Set<String> onDuty = driverRepository.findByOnDutyTrue().stream()
                .map(Driver::getId)
                .collect(Collectors.toSet());
        return truckRepository.findByStatus(TruckStatus.AVAILABLE).stream()
                .filter(truck -> truck.getCurrentDriverId() != null && onDuty.contains(truck.getCurrentDriverId()))
                .collect(Collectors.toList());
    }

    /**
     * Atomically moves the truck from AVAILABLE to ON_ROUTE.
     *
     * @return false when the truck was not AVAILABLE
     */
    public boolean tryReserveTruck(String truckId) {
        return truckLocks.call(truckId, () -> {
            Truck truck = getTruck(truckId);
            if (truck.getStatus() != TruckStatus.AVAILABLE) {
                return false;
            }
            truck.setStatus(TruckStatus.ON_ROUTE);
            truck.setStatusUpdatedAt(LocalDateTime.now());
            truckRepository.save(truck);
            auditStatus(truckId, TruckStatus.AVAILABLE, TruckStatus.ON_ROUTE);
            return true;
        });
    }

    public void releaseTruck(String truckId) {
        releaseTruck(truckId, 0.0);
    }

    /**
     * Returns an ON_ROUTE truck to AVAILABLE and adds the driven distance to its odometer.
     */
    public void releaseTruck(String truckId, double distanceKm) {
        truckLocks.run(truckId, () -> truckRepository.findById(truckId).ifPresent(truck -> {
            boolean wasOnRoute = truck.getStatus() == TruckStatus.ON_ROUTE;
            if (wasOnRoute) {
                truck.setStatus(TruckStatus.AVAILABLE);
                truck.setStatusUpdatedAt(LocalDateTime.now());
            }
            if (distanceKm > 0) {
                truck.setTotalDistanceKm(truck.getTotalDistanceKm() + distanceKm);
            }
            truckRepository.save(truck);
            if (wasOnRoute) {
                auditStatus(truckId, TruckStatus.ON_ROUTE, TruckStatus.AVAILABLE);
            }
        }));
    }

    /**
     * Overwrites the truck's last fix unless it already holds a newer one.
     */
    public boolean updateTruckPosition(String truckId, double latitude, double longitude, LocalDateTime at) {
        return truckLocks.call(truckId, () -> {
            Optional<Truck> found = truckRepository.findById(truckId);
            if (found.isEmpty()) {
                return false;
            }
            Truck truck = found.get();
            if (truck.getLastLocationUpdate() != null && !at.isAfter(truck.getLastLocationUpdate())) {
                return false;
            }
            truck.setLastLatitude(latitude);
            truck.setLastLongitude(longitude);
            truck.setLastLocationUpdate(at);
            truckRepository.save(truck);
            return true;
        });
    }

    private void auditStatus(String truckId, TruckStatus from, TruckStatus to) {
        audit(AuditedEntity.TRUCK, truckId, AuditAction.STATUS_CHANGED,
                AuditEvent.values("status", from), AuditEvent.values("status", to));
    }

    private void audit(AuditedEntity entityType, String entityId, AuditAction action,
                       Map<String, Object> oldValues, Map<String, Object> newValues) {
        eventPublisher.publishEvent(AuditEvent.of(entityType, entityId, action, null, oldValues, newValues));
    }

    @Cacheable(value = RedisConfig.ACTIVE_DRIVERS, key = "'all'")
    public List<ActiveDriverStatus> getActiveDriverStatus() {
        List<ActiveDriverStatus> result = new ArrayList<>();
        for (Driver driver : driverRepository.findByOnDutyTrue()) {
            Truck truck = driver.getCurrentTruckId() != null
                    ? truckRepository.findById(driver.getCurrentTruckId()).orElse(null)
                    : null;
            Optional<CollectionRoute> route = routeRepository.findFirstByDriverIdAndStatusIn(driver.getId(), DRIVING);

            result.add(new ActiveDriverStatus(
                    driver.getId(),
                    driver.getFullName(),
                    truck != null ? truck.getId() : null,
                    truck != null ? truck.getLicensePlate() : null,
                    truck != null ? truck.getLastLatitude() : null,
                    truck != null ? truck.getLastLongitude() : null,
                    truck != null ? truck.getLastLocationUpdate() : null,
                    route.map(CollectionRoute::getId).orElse(null),
                    route.map(r -> r.getStatus().name().toLowerCase()).orElse("pending")));
        }
        return result;
    }
}
