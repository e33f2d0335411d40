package com.municipality.wastecollection.routing;

import com.municipality.wastecollection.config.CollectionProperties;
import com.municipality.wastecollection.dto.ClusterPlan;
import com.municipality.wastecollection.dto.NearbyBin;
import com.municipality.wastecollection.dto.OptimizationResult;
import com.municipality.wastecollection.dto.RoutePlan;
import com.municipality.wastecollection.exception.SchedulingConflictException;
import com.municipality.wastecollection.geo.BinSpatialIndex;
import com.municipality.wastecollection.geo.GeoDistance;
import com.municipality.wastecollection.geo.GeoPoint;
import com.municipality.wastecollection.model.Bin;
import com.municipality.wastecollection.model.CollectionRoute;
import com.municipality.wastecollection.model.RouteStop;
import com.municipality.wastecollection.model.Truck;
import com.municipality.wastecollection.service.FleetService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Groups bins needing collection into truck routes.
 * <p>
 * A run works on a snapshot of eligible, unclaimed bins: it clusters them by priority and
 * proximity within the largest available truck capacity, matches clusters to the nearest
 * compatible truck and orders each cluster by a nearest-neighbour walk. Commits claim bins and
 * trucks atomically; when another run got there first, the run recomputes without the lost
 * bins up to {@code optimizer.max-claim-attempts} times. No global lock is taken.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RouteOptimizationService {

    private final BinSpatialIndex spatialIndex;
    private final BinClaimRegistry claimRegistry;
    private final BinPriority binPriority;
    private final FleetService fleetService;
    private final RouteLifecycleService lifecycleService;
    private final CollectionProperties properties;

    public OptimizationResult runOptimization() {
        return runOptimization(null, null);
    }

    /**
     * @param seedPoint    limits the run to bins around this point; every eligible bin when null
     * @param radiusMeters search radius around the seed, {@code optimizer.search-radius-meters} when null
     */
    public OptimizationResult runOptimization(GeoPoint seedPoint, Double radiusMeters) {
        if (seedPoint == null && radiusMeters != null) {
            throw new IllegalArgumentException("A search radius needs a seed point");
        }
        if (radiusMeters != null && (radiusMeters.isNaN() || radiusMeters <= 0)) {
            throw new IllegalArgumentException("Search radius must be positive: " + radiusMeters);
        }

        OptimizationResult result = OptimizationResult.empty();
        int maxAttempts = Math.max(1, properties.getOptimizer().getMaxClaimAttempts());

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            result.setAttempts(attempt);
            LocalDateTime now = LocalDateTime.now();

            List<Bin> candidates = candidates(seedPoint, radiusMeters);
            if (attempt == 1) {
                result.setCandidateBins(candidates.size());
            }
            if (candidates.isEmpty()) {
                result.setUnassignedClusters(new ArrayList<>());
                result.setSchedulingConflicts(new ArrayList<>());
                break;
            }

            List<Truck> trucks = fleetService.getAvailableTrucks();
            List<List<Bin>> clusters = cluster(candidates, capacityTarget(trucks), now);

            List<ClusterPlan> unassigned = new ArrayList<>();
            Set<String> conflicts = new LinkedHashSet<>();
            boolean conflicted = false;

            for (Assignment assignment : assign(clusters, trucks, unassigned)) {
                RoutePlan plan = sequence(assignment.cluster, assignment.truck, seedPoint, now);
                try {
                    CollectionRoute route = lifecycleService.commitOptimizedRoute(plan);
                    result.getRoutes().add(route);
                } catch (SchedulingConflictException e) {
                    conflicted = true;
                    conflicts.addAll(e.getConflictingBinIds());
                    log.warn("⚠️ Attempt {}: commit for truck {} lost: {}", attempt, plan.getTruckId(), e.getMessage());
                }
            }

            result.setUnassignedClusters(unassigned);
            result.setSchedulingConflicts(new ArrayList<>(conflicts));
            if (!conflicted) {
                break;
            }
        }

        log.info("🧮 Optimization: {} candidates, {} routes, {} unassigned clusters, {} conflicts after {} attempt(s)",
                result.getCandidateBins(), result.getRoutes().size(), result.getUnassignedClusters().size(),
                result.getSchedulingConflicts().size(), result.getAttempts());
        return result;
    }

    List<Bin> candidates(GeoPoint seedPoint, Double radiusMeters) {
        List<Bin> pool;
        if (seedPoint != null) {
            double radius = radiusMeters != null ? radiusMeters : properties.getOptimizer().getSearchRadiusMeters();
            pool = spatialIndex.nearby(seedPoint, radius, true).stream()
                    .map(NearbyBin::getBin)
                    .collect(Collectors.toList());
        } else {
            pool = spatialIndex.eligibleBins();
        }
        return pool.stream()
                .filter(bin -> !claimRegistry.isClaimed(bin.getId()))
                .collect(Collectors.toList());
    }

    double capacityTarget(List<Truck> trucks) {
        return trucks.stream()
                .mapToDouble(Truck::getCapacityKg)
                .max()
                .orElse(properties.getOptimizer().getDefaultTruckCapacityKg());
    }

    /**
     * Seeds a cluster with the highest-priority remaining bin and grows it with the best
     * remaining bin within the cluster radius of the seed, preferring the higher tier, then
     * the nearer bin. Growth stops at the first bin that would exceed the capacity target.
     */
    List<List<Bin>> cluster(List<Bin> candidates, double capacityTargetKg, LocalDateTime now) {
        double clusterRadius = properties.getOptimizer().getClusterRadiusMeters();
        List<Bin> remaining = new ArrayList<>(candidates);
        remaining.sort(binPriority.ordering(now));

        List<List<Bin>> clusters = new ArrayList<>();
        while (!remaining.isEmpty()) {
            Bin seed = remaining.remove(0);
            List<Bin> cluster = new ArrayList<>();
            cluster.add(seed);
            double mass = estimatedMassKg(seed);

            Comparator<Bin> growthOrder = Comparator
                    .<Bin, BinPriority.Tier>comparing(bin -> binPriority.tierOf(bin, now))
                    .thenComparingDouble(bin -> distanceMeters(seed, bin))
                    .thenComparing(BinPriority.staleness())
                    .thenComparing(Bin::getId);

            while (true) {
                Bin next = remaining.stream()
                        .filter(bin -> distanceMeters(seed, bin) <= clusterRadius)
                        .min(growthOrder)
                        .orElse(null);
                if (next == null || mass + estimatedMassKg(next) > capacityTargetKg) {
                    break;
                }
                cluster.add(next);
                mass += estimatedMassKg(next);
                remaining.remove(next);
            }
            clusters.add(cluster);
        }
        return clusters;
    }

    /**
     * Heaviest cluster first, each to the nearest free truck that can carry it.
     */
    private List<Assignment> assign(List<List<Bin>> clusters, List<Truck> trucks, List<ClusterPlan> unassigned) {
        List<List<Bin>> byMass = new ArrayList<>(clusters);
        byMass.sort(Comparator.<List<Bin>>comparingDouble(this::massOf).reversed());

        List<Truck> free = new ArrayList<>(trucks);
        List<Assignment> assignments = new ArrayList<>();
        for (List<Bin> cluster : byMass) {
            double mass = massOf(cluster);
            GeoPoint centroid = centroidOf(cluster);
            Truck chosen = free.stream()
                    .filter(truck -> truck.getCapacityKg() >= mass)
                    .min(Comparator.<Truck>comparingDouble(truck -> truckDistance(truck, centroid))
                            .thenComparing(Truck::getId))
                    .orElse(null);
            if (chosen == null) {
                unassigned.add(new ClusterPlan(cluster.stream().map(Bin::getId).collect(Collectors.toList()),
                        mass, centroid.getLatitude(), centroid.getLongitude()));
                continue;
            }
            free.remove(chosen);
            assignments.add(new Assignment(cluster, chosen));
        }
        return assignments;
    }

    /**
     * Nearest-neighbour visit order starting at the seed point, else the truck's last fix,
     * else the cluster's seed bin. Equal distances go to the higher-priority bin.
     */
    RoutePlan sequence(List<Bin> cluster, Truck truck, GeoPoint seedPoint, LocalDateTime now) {
        GeoPoint start;
        if (seedPoint != null) {
            start = seedPoint;
        } else if (truck.hasKnownPosition()) {
            start = new GeoPoint(truck.getLastLatitude(), truck.getLastLongitude());
        } else {
            start = pointOf(cluster.get(0));
        }

        Comparator<Bin> priority = binPriority.ordering(now);
        List<Bin> remaining = new ArrayList<>(cluster);
        List<GeoPoint> path = new ArrayList<>();
        path.add(start);
        List<RouteStop> stops = new ArrayList<>();

        GeoPoint current = start;
        while (!remaining.isEmpty()) {
            GeoPoint from = current;
            Bin next = remaining.stream()
                    .min(Comparator.<Bin>comparingDouble(bin -> GeoDistance.meters(from, pointOf(bin)))
                            .thenComparing(priority))
                    .orElseThrow();
            remaining.remove(next);
            stops.add(new RouteStop(next.getId(), next.getLatitude(), next.getLongitude(),
                    stops.size() + 1, estimatedMassKg(next)));
            current = pointOf(next);
            path.add(current);
        }

        double distanceKm = GeoDistance.pathKm(path);
        return new RoutePlan(truck.getId(), truck.getCurrentDriverId(), stops, distanceKm,
                lifecycleService.estimateDurationMinutes(distanceKm, stops.size()), massOf(cluster));
    }

    private double estimatedMassKg(Bin bin) {
        return bin.getCapacityLiters() * properties.getOptimizer().getDensityKgPerLiter();
    }

    private double massOf(List<Bin> cluster) {
        return cluster.stream().mapToDouble(this::estimatedMassKg).sum();
    }

    private static GeoPoint centroidOf(List<Bin> cluster) {
        double lat = cluster.stream().mapToDouble(Bin::getLatitude).average().orElse(0);
        double lon = cluster.stream().mapToDouble(Bin::getLongitude).average().orElse(0);
        return new GeoPoint(lat, lon);
    }

    private static double truckDistance(Truck truck, GeoPoint point) {
        if (!truck.hasKnownPosition()) {
            return Double.POSITIVE_INFINITY;
        }
        return GeoDistance.meters(truck.getLastLatitude(), truck.getLastLongitude(), point.getLatitude(), point.getLongitude());
    }

    private static double distanceMeters(Bin a, Bin b) {
        return GeoDistance.meters(a.getLatitude(), a.getLongitude(), b.getLatitude(), b.getLongitude());
    }

    private static GeoPoint pointOf(Bin bin) {
        return new GeoPoint(bin.getLatitude(), bin.getLongitude());
    }

    private static final class Assignment {
        private final List<Bin> cluster;
        private final Truck truck;

        private Assignment(List<Bin> cluster, Truck truck) {
            this.cluster = cluster;
            this.truck = truck;
        }
    }
}
