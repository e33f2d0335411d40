package com.municipality.wastecollection.routing;

import com.municipality.wastecollection.config.CollectionProperties;
import com.municipality.wastecollection.config.RedisConfig;
import com.municipality.wastecollection.dto.AuditEvent;
import com.municipality.wastecollection.dto.CreateRouteRequest;
import com.municipality.wastecollection.dto.RouteAssignedEvent;
import com.municipality.wastecollection.dto.RouteCancelledEvent;
import com.municipality.wastecollection.dto.RouteCompletedEvent;
import com.municipality.wastecollection.dto.RoutePlan;
import com.municipality.wastecollection.dto.RouteProgressEvent;
import com.municipality.wastecollection.exception.CapacityExceededException;
import com.municipality.wastecollection.exception.InvalidTransitionException;
import com.municipality.wastecollection.exception.PermissionDeniedException;
import com.municipality.wastecollection.exception.ResourceNotFoundException;
import com.municipality.wastecollection.exception.SchedulingConflictException;
import com.municipality.wastecollection.geo.GeoDistance;
import com.municipality.wastecollection.geo.GeoPoint;
import com.municipality.wastecollection.model.AuditAction;
import com.municipality.wastecollection.model.AuditedEntity;
import com.municipality.wastecollection.model.Bin;
import com.municipality.wastecollection.model.CollectionRoute;
import com.municipality.wastecollection.model.Driver;
import com.municipality.wastecollection.model.RouteStatus;
import com.municipality.wastecollection.model.RouteStop;
import com.municipality.wastecollection.model.Truck;
import com.municipality.wastecollection.repository.CollectionRouteRepository;
import com.municipality.wastecollection.service.BinService;
import com.municipality.wastecollection.service.FleetService;
import com.municipality.wastecollection.service.FleetTrackingService;
import com.municipality.wastecollection.service.KeyedLocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Execution state machine of collection routes.
 * <p>
 * PENDING → ASSIGNED → IN_PROGRESS → COMPLETED, with CANCELLED reachable from every
 * non-terminal state. Every operation on a route holds that route's lock and re-reads the
 * route under it, so a cancellation and a stop collection on the same route never interleave.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RouteLifecycleService {

    static final String OPTIMIZER = "optimizer";

    private final CollectionRouteRepository routeRepository;
    private final BinService binService;
    private final FleetService fleetService;
    private final FleetTrackingService trackingService;
    private final BinClaimRegistry claimRegistry;
    private final ApplicationEventPublisher eventPublisher;
    private final CollectionProperties properties;

    private final KeyedLocks routeLocks = new KeyedLocks();

    /**
     * Manual route in PENDING, visiting the bins in the given order.
     *
     * @throws SchedulingConflictException if any bin is already on another active route
     */
    public CollectionRoute createRoute(CreateRouteRequest request) {
        List<String> binIds = request.getBinIds() == null ? List.of() : request.getBinIds();
        if (binIds.isEmpty()) {
            throw new IllegalArgumentException("A route needs at least one bin");
        }
        if (new LinkedHashSet<>(binIds).size() != binIds.size()) {
            throw new IllegalArgumentException("A bin can appear only once in a route");
        }

        List<RouteStop> stops = new ArrayList<>();
        int sequence = 1;
        for (String binId : binIds) {
            Bin bin = binService.getBin(binId);
            stops.add(new RouteStop(bin.getId(), bin.getLatitude(), bin.getLongitude(), sequence++, estimatedMassKg(bin)));
        }

        String routeId = UUID.randomUUID().toString();
        List<String> conflicts = claimRegistry.claimAll(binIds, routeId);
        if (!conflicts.isEmpty()) {
            throw new SchedulingConflictException("Bins already scheduled on another route: " + conflicts, conflicts);
        }

        CollectionRoute route = newRoute(routeId, stops, request.getCreatedBy());
        route.setName(request.getName());
        route.setScheduledDate(request.getScheduledDate());
        route.setScheduledStartTime(request.getScheduledStartTime());
        route.setScheduledEndTime(request.getScheduledEndTime());
        route.setPlannedDistanceKm(GeoDistance.pathKm(pointsOf(stops)));
        route.setEstimatedDurationMinutes(estimateDurationMinutes(route.getPlannedDistanceKm(), stops.size()));

        try {
            CollectionRoute saved = routeRepository.save(route);
            log.info("🗺️ Created route {} with {} stops", saved.getCode(), stops.size());
            audit(saved, AuditAction.CREATE, saved.getCreatedBy(), null, created(saved));
            return saved;
        } catch (RuntimeException e) {
            claimRegistry.releaseAll(binIds, routeId);
            throw e;
        }
    }

    /**
     * Binds a pending route to a driver and the truck they drive.
     */
    @CacheEvict(value = RedisConfig.ACTIVE_DRIVERS, allEntries = true)
    public CollectionRoute assignRoute(String routeId, String driverId, String truckId) {
        return routeLocks.call(routeId, () -> {
            CollectionRoute route = load(routeId);
            requireTransition(route, RouteStatus.ASSIGNED);

            Driver driver = fleetService.getDriver(driverId);
            Truck truck = fleetService.getTruck(truckId);
            if (!truckId.equals(driver.getCurrentTruckId())) {
                throw new IllegalArgumentException("Driver " + driverId + " is not assigned to truck " + truckId);
            }
            if (route.getEstimatedMassKg() > truck.getCapacityKg()) {
                throw new CapacityExceededException(truckId, route.getEstimatedMassKg(), truck.getCapacityKg());
            }
            if (!fleetService.tryReserveTruck(truckId)) {
                throw new SchedulingConflictException("Truck " + truckId + " is not available");
            }

            RouteStatus previous = route.getStatus();
            route.setDriverId(driverId);
            route.setTruckId(truckId);
            route.setStatus(RouteStatus.ASSIGNED);
            route.setUpdatedAt(LocalDateTime.now());
            CollectionRoute saved;
            try {
                saved = routeRepository.save(route);
            } catch (RuntimeException e) {
                fleetService.releaseTruck(truckId);
                throw e;
            }
            audit(saved, AuditAction.ASSIGNED, null, AuditEvent.values("status", previous),
                    AuditEvent.values("status", saved.getStatus(), "driverId", driverId, "truckId", truckId));
            publishAssigned(saved);
            return saved;
        });
    }

    /**
     * Persists an optimizer plan directly as an ASSIGNED route. The truck reservation and the
     * bin claims either all succeed or are all rolled back.
     *
     * @throws SchedulingConflictException if the truck or any bin was taken concurrently
     */
    @CacheEvict(value = RedisConfig.ACTIVE_DRIVERS, allEntries = true)
    public CollectionRoute commitOptimizedRoute(RoutePlan plan) {
        String routeId = UUID.randomUUID().toString();
        List<String> binIds = plan.getStops().stream().map(RouteStop::getBinId).collect(Collectors.toList());

        if (!fleetService.tryReserveTruck(plan.getTruckId())) {
            throw new SchedulingConflictException("Truck " + plan.getTruckId() + " was reserved concurrently");
        }
        List<String> conflicts = claimRegistry.claimAll(binIds, routeId);
        if (!conflicts.isEmpty()) {
            fleetService.releaseTruck(plan.getTruckId());
            throw new SchedulingConflictException("Bins claimed concurrently: " + conflicts, conflicts);
        }

        CollectionRoute route = newRoute(routeId, new ArrayList<>(plan.getStops()), OPTIMIZER);
        route.setName("Optimized route " + route.getCode());
        route.setScheduledDate(LocalDate.now());
        route.setDriverId(plan.getDriverId());
        route.setTruckId(plan.getTruckId());
        route.setStatus(RouteStatus.ASSIGNED);
        route.setPlannedDistanceKm(plan.getPlannedDistanceKm());
        route.setEstimatedDurationMinutes(plan.getEstimatedDurationMinutes());

        CollectionRoute saved;
        try {
            saved = routeRepository.save(route);
        } catch (RuntimeException e) {
            claimRegistry.releaseAll(binIds, routeId);
            fleetService.releaseTruck(plan.getTruckId());
            throw e;
        }
        audit(saved, AuditAction.CREATE, OPTIMIZER, null, created(saved));
        publishAssigned(saved);
        return saved;
    }

    @CacheEvict(value = RedisConfig.ACTIVE_DRIVERS, allEntries = true)
    public CollectionRoute startRoute(String routeId, String driverId) {
        return routeLocks.call(routeId, () -> {
            CollectionRoute route = load(routeId);
            requireTransition(route, RouteStatus.IN_PROGRESS);
            if (driverId == null || !driverId.equals(route.getDriverId())) {
                throw new PermissionDeniedException("Route " + routeId + " is not assigned to driver " + driverId);
            }
            LocalDateTime now = LocalDateTime.now();
            route.setStatus(RouteStatus.IN_PROGRESS);
            route.setActualStartTime(now);
            route.setUpdatedAt(now);
            CollectionRoute saved = routeRepository.save(route);
            log.info("▶️ Route {} started by driver {}", saved.getCode(), driverId);
            audit(saved, AuditAction.STARTED, driverId, AuditEvent.values("status", RouteStatus.ASSIGNED),
                    AuditEvent.values("status", saved.getStatus(), "actualStartTime", now));
            return saved;
        });
    }

    public CollectionRoute markStopCollected(String routeId, String binId, Double weightKg) {
        return markStopCollected(routeId, binId, weightKg, null);
    }

    /**
     * Records the collection of one stop and empties the bin.
     *
     * @throws InvalidTransitionException if the route is not in progress or the stop was already collected
     * @throws ResourceNotFoundException  if the bin is not a stop of the route
     */
    @CacheEvict(value = RedisConfig.ACTIVE_DRIVERS, allEntries = true)
    public CollectionRoute markStopCollected(String routeId, String binId, Double weightKg, String notes) {
        if (weightKg != null && weightKg < 0) {
            throw new IllegalArgumentException("Collected weight must not be negative: " + weightKg);
        }
        return routeLocks.call(routeId, () -> {
            CollectionRoute route = load(routeId);
            if (route.getStatus() != RouteStatus.IN_PROGRESS) {
                throw new InvalidTransitionException("Route " + routeId + " is " + route.getStatus()
                        + "; stops can only be collected while IN_PROGRESS");
            }
            RouteStop stop = route.findStop(binId)
                    .orElseThrow(() -> new ResourceNotFoundException("Bin " + binId + " is not a stop of route " + routeId));
            if (stop.isCollected()) {
                throw new InvalidTransitionException("Stop " + binId + " of route " + routeId + " was already collected");
            }

            LocalDateTime now = LocalDateTime.now();
            stop.setCollected(true);
            stop.setCollectedAt(now);
            stop.setWeightKg(weightKg);
            stop.setNotes(notes);
            route.setBinsCollected(route.getBinsCollected() + 1);
            if (weightKg != null) {
                route.setTotalWasteKg(route.getTotalWasteKg() + weightKg);
            }
            route.setUpdatedAt(now);

            // Claim is held until the route is COMPLETED or CANCELLED
            binService.markCollected(binId);
            CollectionRoute saved = routeRepository.save(route);
            audit(saved, AuditAction.STOP_COLLECTED, saved.getDriverId(),
                    AuditEvent.values("binId", binId, "collected", false),
                    AuditEvent.values("binId", binId, "collected", true, "weightKg", weightKg,
                            "binsCollected", saved.getBinsCollected(), "totalWasteKg", saved.getTotalWasteKg()));

            eventPublisher.publishEvent(new RouteProgressEvent(routeId, binId, saved.getBinsCollected(),
                    saved.getStops().size(), saved.getTotalWasteKg(), now));

            if (properties.getRoutes().isAutoComplete() && saved.allStopsCollected()) {
                return complete(saved, null);
            }
            return saved;
        });
    }

    /**
     * @param actualDistanceKm driven distance; measured from stored location samples when null
     */
    @CacheEvict(value = RedisConfig.ACTIVE_DRIVERS, allEntries = true)
    public CollectionRoute completeRoute(String routeId, Double actualDistanceKm) {
        if (actualDistanceKm != null && actualDistanceKm < 0) {
            throw new IllegalArgumentException("Actual distance must not be negative: " + actualDistanceKm);
        }
        return routeLocks.call(routeId, () -> complete(load(routeId), actualDistanceKm));
    }

    /**
     * Cancels a non-terminal route and frees all of its bins and its truck.
     */
    @CacheEvict(value = RedisConfig.ACTIVE_DRIVERS, allEntries = true)
    public CollectionRoute cancelRoute(String routeId, String reason) {
        return routeLocks.call(routeId, () -> {
            CollectionRoute route = load(routeId);
            requireTransition(route, RouteStatus.CANCELLED);

            RouteStatus previous = route.getStatus();
            List<String> released = route.getBinIds();
            claimRegistry.releaseAll(released, routeId);
            if (previous != RouteStatus.PENDING && route.getTruckId() != null) {
                fleetService.releaseTruck(route.getTruckId());
            }

            LocalDateTime now = LocalDateTime.now();
            route.setStatus(RouteStatus.CANCELLED);
            route.setCancelledAt(now);
            route.setCancellationReason(reason);
            route.setUpdatedAt(now);
            CollectionRoute saved = routeRepository.save(route);

            log.info("❌ Route {} cancelled from {} ({} bins released): {}", saved.getCode(), previous, released.size(), reason);
            audit(saved, AuditAction.CANCELLED, null, AuditEvent.values("status", previous),
                    AuditEvent.values("status", saved.getStatus(), "cancellationReason", reason, "releasedBinIds", released));
            eventPublisher.publishEvent(new RouteCancelledEvent(routeId, saved.getDriverId(), reason, released, now));
            return saved;
        });
    }

    public CollectionRoute getRoute(String routeId) {
        return load(routeId);
    }

    public List<CollectionRoute> getRoutesByStatus(RouteStatus status) {
        return status == null ? routeRepository.findAll() : routeRepository.findByStatus(status);
    }

    public List<CollectionRoute> getActiveRoutes() {
        return routeRepository.findByStatusIn(RouteStatus.activeStatuses());
    }

    /**
     * planned / actual as a percentage, capped to [0, 100]; null when the actual distance is unknown or zero.
     */
    public static Double efficiencyScore(double plannedDistanceKm, Double actualDistanceKm) {
        if (actualDistanceKm == null || actualDistanceKm <= 0) {
            return null;
        }
        double score = plannedDistanceKm / actualDistanceKm * 100.0;
        return Math.max(0.0, Math.min(100.0, score));
    }

    double estimatedMassKg(Bin bin) {
        return bin.getCapacityLiters() * properties.getOptimizer().getDensityKgPerLiter();
    }

    int estimateDurationMinutes(double distanceKm, int stops) {
        double speed = properties.getOptimizer().getAverageSpeedKmh();
        double driving = speed > 0 ? distanceKm / speed * 60.0 : 0.0;
        return (int) Math.ceil(driving + stops * properties.getOptimizer().getServiceMinutesPerStop());
    }

    // Caller holds the route lock
    private CollectionRoute complete(CollectionRoute route, Double actualDistanceKm) {
        requireTransition(route, RouteStatus.COMPLETED);

        LocalDateTime now = LocalDateTime.now();
        Double distance = actualDistanceKm != null
                ? actualDistanceKm
                : trackingService.measuredDistanceKm(route.getDriverId(), route.getActualStartTime(), now);

        claimRegistry.releaseAll(route.getBinIds(), route.getId());

        route.setStatus(RouteStatus.COMPLETED);
        route.setActualEndTime(now);
        route.setCompletedAt(now);
        route.setUpdatedAt(now);
        route.setActualDistanceKm(distance);
        route.setEfficiencyScore(efficiencyScore(route.getPlannedDistanceKm(), distance));
        CollectionRoute saved = routeRepository.save(route);

        if (saved.getTruckId() != null) {
            fleetService.releaseTruck(saved.getTruckId(), distance != null ? distance : 0.0);
        }

        log.info("✅ Route {} completed: {}/{} bins, {} kg, efficiency {}", saved.getCode(),
                saved.getBinsCollected(), saved.getStops().size(), saved.getTotalWasteKg(), saved.getEfficiencyScore());
        audit(saved, AuditAction.COMPLETED, saved.getDriverId(), AuditEvent.values("status", RouteStatus.IN_PROGRESS),
                AuditEvent.values("status", saved.getStatus(), "actualDistanceKm", distance,
                        "efficiencyScore", saved.getEfficiencyScore(), "binsCollected", saved.getBinsCollected(),
                        "totalWasteKg", saved.getTotalWasteKg()));
        eventPublisher.publishEvent(new RouteCompletedEvent(saved.getId(), saved.getDriverId(), saved.getTruckId(),
                saved.getBinsCollected(), saved.getTotalWasteKg(), saved.getEfficiencyScore(), now));
        return saved;
    }

    private CollectionRoute newRoute(String routeId, List<RouteStop> stops, String createdBy) {
        LocalDateTime now = LocalDateTime.now();
        CollectionRoute route = new CollectionRoute();
        route.setId(routeId);
        route.setCode(routeCode(routeId, now));
        route.setStops(stops);
        route.setEstimatedMassKg(stops.stream().mapToDouble(RouteStop::getEstimatedMassKg).sum());
        route.setCreatedBy(createdBy);
        route.setCreatedAt(now);
        route.setUpdatedAt(now);
        return route;
    }

    private void audit(CollectionRoute route, AuditAction action, String actorId,
                       Map<String, Object> oldValues, Map<String, Object> newValues) {
        eventPublisher.publishEvent(AuditEvent.of(AuditedEntity.ROUTE, route.getId(), action, actorId, oldValues, newValues));
    }

    private static Map<String, Object> created(CollectionRoute route) {
        return AuditEvent.values("code", route.getCode(), "status", route.getStatus(), "binIds", route.getBinIds(),
                "driverId", route.getDriverId(), "truckId", route.getTruckId(),
                "estimatedMassKg", route.getEstimatedMassKg(), "plannedDistanceKm", route.getPlannedDistanceKm());
    }

    private void publishAssigned(CollectionRoute route) {
        log.info("🚚 Route {} assigned to driver {} / truck {} ({} stops, {} kg)", route.getCode(),
                route.getDriverId(), route.getTruckId(), route.getStops().size(), route.getEstimatedMassKg());
        eventPublisher.publishEvent(new RouteAssignedEvent(route.getId(), route.getCode(), route.getDriverId(),
                route.getTruckId(), route.getBinIds(), LocalDateTime.now()));
    }

    private CollectionRoute load(String routeId) {
        return routeRepository.findById(routeId)
                .orElseThrow(() -> ResourceNotFoundException.of("Route", routeId));
    }

    private static void requireTransition(CollectionRoute route, RouteStatus next) {
        if (!route.getStatus().canTransitionTo(next)) {
            throw new InvalidTransitionException("Route " + route.getId() + " cannot move from "
                    + route.getStatus() + " to " + next);
        }
    }

    private static List<GeoPoint> pointsOf(List<RouteStop> stops) {
        return stops.stream()
                .map(stop -> new GeoPoint(stop.getLatitude(), stop.getLongitude()))
                .collect(Collectors.toList());
    }

    private static String routeCode(String routeId, LocalDateTime now) {
        return "RT-" + now.getYear() + "-" + routeId.replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
    }
}
