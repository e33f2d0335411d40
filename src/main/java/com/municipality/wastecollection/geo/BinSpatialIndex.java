package com.municipality.wastecollection.geo;

import com.municipality.wastecollection.config.CollectionProperties;
import com.municipality.wastecollection.dto.NearbyBin;
import com.municipality.wastecollection.model.Bin;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * In-memory grid of active bins for radius queries.
 * <p>
 * Bins are bucketed into square cells of {@code collection.spatial.cell-size-degrees}.
 * A query scans only the cells overlapping the bounding box of the search circle and
 * then filters on the exact geodesic distance. Queries hold the read lock for their
 * whole scan, so each result reflects a single consistent state of the index; every
 * returned {@link Bin} is a detached copy.
 */
@Slf4j
@Component
public class BinSpatialIndex {

    // Shortest length of one degree of latitude on WGS84 (at the equator), slightly rounded down
    private static final double MIN_METERS_PER_DEGREE = 110_000.0;

    private static final Comparator<NearbyBin> BY_DISTANCE_THEN_ID = Comparator
            .comparingDouble(NearbyBin::getDistanceMeters)
            .thenComparing(nearby -> nearby.getBin().getId());

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Bin> bins = new HashMap<>();
    private final Map<Long, Set<String>> cells = new HashMap<>();

    private final double cellSize;
    private final int latCells;
    private final int lonCells;

    public BinSpatialIndex(CollectionProperties properties) {
        this.cellSize = properties.getSpatial().getCellSizeDegrees();
        if (!(cellSize > 0) || cellSize > 90) {
            throw new IllegalArgumentException("collection.spatial.cell-size-degrees must be in (0, 90]: " + cellSize);
        }
        this.latCells = (int) Math.ceil(180.0 / cellSize - 1e-9);
        this.lonCells = (int) Math.ceil(360.0 / cellSize - 1e-9);
    }

    /**
     * Bins within {@code radiusMeters} of {@code center} (boundary included), nearest first,
     * ties broken by bin id.
     */
    public List<NearbyBin> nearby(GeoPoint center, double radiusMeters, boolean eligibleOnly) {
        if (center == null) {
            throw new IllegalArgumentException("Center point is required");
        }
        if (Double.isNaN(radiusMeters) || radiusMeters < 0) {
            throw new IllegalArgumentException("Radius must be a non-negative number of meters: " + radiusMeters);
        }

        lock.readLock().lock();
        try {
            List<NearbyBin> result = new ArrayList<>();
            for (String binId : candidateIds(center, radiusMeters)) {
                Bin bin = bins.get(binId);
                if (eligibleOnly && !bin.isNeedsCollection()) {
                    continue;
                }
                double distance = GeoDistance.meters(center.getLatitude(), center.getLongitude(),
                        bin.getLatitude(), bin.getLongitude());
                if (distance <= radiusMeters) {
                    result.add(new NearbyBin(bin.snapshot(), distance));
                }
            }
            result.sort(BY_DISTANCE_THEN_ID);
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Every indexed bin currently needing collection, ordered by id.
     */
    public List<Bin> eligibleBins() {
        lock.readLock().lock();
        try {
            return bins.values().stream()
                    .filter(Bin::isNeedsCollection)
                    .sorted(Comparator.comparing(Bin::getId))
                    .map(Bin::snapshot)
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Inserts or replaces the bin's entry. Inactive bins are removed instead.
     */
    public void upsert(Bin bin) {
        lock.writeLock().lock();
        try {
            removeInternal(bin.getId());
            if (bin.isActive()) {
                Bin copy = bin.snapshot();
                bins.put(copy.getId(), copy);
                cells.computeIfAbsent(cellKey(copy.getLatitude(), copy.getLongitude()), k -> new HashSet<>())
                        .add(copy.getId());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void remove(String binId) {
        lock.writeLock().lock();
        try {
            removeInternal(binId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void rebuild(Collection<Bin> source) {
        lock.writeLock().lock();
        try {
            bins.clear();
            cells.clear();
            for (Bin bin : source) {
                if (!bin.isActive()) {
                    continue;
                }
                Bin copy = bin.snapshot();
                bins.put(copy.getId(), copy);
                cells.computeIfAbsent(cellKey(copy.getLatitude(), copy.getLongitude()), k -> new HashSet<>())
                        .add(copy.getId());
            }
            log.info("🗺️ Spatial index rebuilt with {} bins in {} cells", bins.size(), cells.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return bins.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void removeInternal(String binId) {
        Bin previous = bins.remove(binId);
        if (previous == null) {
            return;
        }
        long key = cellKey(previous.getLatitude(), previous.getLongitude());
        Set<String> cell = cells.get(key);
        if (cell != null) {
            cell.remove(binId);
            if (cell.isEmpty()) {
                cells.remove(key);
            }
        }
    }

    // Caller holds the read lock
    private List<String> candidateIds(GeoPoint center, double radiusMeters) {
        double latSpan = radiusMeters / MIN_METERS_PER_DEGREE;
        double minLat = center.getLatitude() - latSpan;
        double maxLat = center.getLatitude() + latSpan;

        // Longitude degrees shrink with latitude; use the widest latitude of the box
        double widestLat = Math.min(90.0, Math.max(Math.abs(minLat), Math.abs(maxLat)));
        double cosLat = Math.cos(Math.toRadians(widestLat));
        boolean allLongitudes = minLat <= -90 || maxLat >= 90 || cosLat < 1e-6;
        double lonSpan = allLongitudes ? 180.0 : latSpan / cosLat;

        List<double[]> lonRanges = new ArrayList<>();
        double west = center.getLongitude() - lonSpan;
        double east = center.getLongitude() + lonSpan;
        if (allLongitudes || east - west >= 360.0) {
            lonRanges.add(new double[]{-180.0, 180.0});
        } else if (west < -180.0) {
            lonRanges.add(new double[]{west + 360.0, 180.0});
            lonRanges.add(new double[]{-180.0, east});
        } else if (east > 180.0) {
            lonRanges.add(new double[]{west, 180.0});
            lonRanges.add(new double[]{-180.0, east - 360.0});
        } else {
            lonRanges.add(new double[]{west, east});
        }

        int fromLat = latIndex(Math.max(-90.0, minLat));
        int toLat = latIndex(Math.min(90.0, maxLat));

        Set<Integer> columns = new TreeSet<>();
        for (double[] range : lonRanges) {
            for (int lonIdx = lonIndex(range[0]); lonIdx <= lonIndex(range[1]); lonIdx++) {
                columns.add(lonIdx);
            }
            // A bin stored at exactly 180 sits in the last column but is also at -180
            if (range[0] <= -180.0) {
                columns.add(lonCells - 1);
            }
        }

        List<String> ids = new ArrayList<>();
        for (int latIdx = fromLat; latIdx <= toLat; latIdx++) {
            for (int lonIdx : columns) {
                Set<String> cell = cells.get(key(latIdx, lonIdx));
                if (cell != null) {
                    ids.addAll(cell);
                }
            }
        }
        return ids;
    }

    private long cellKey(double latitude, double longitude) {
        return key(latIndex(latitude), lonIndex(longitude));
    }

    private int latIndex(double latitude) {
        int idx = (int) Math.floor((latitude + 90.0) / cellSize);
        return Math.min(Math.max(idx, 0), latCells - 1);
    }

    private int lonIndex(double longitude) {
        int idx = (int) Math.floor((longitude + 180.0) / cellSize);
        return Math.min(Math.max(idx, 0), lonCells - 1);
    }

    private static long key(int latIdx, int lonIdx) {
        return ((long) latIdx << 32) | (lonIdx & 0xffffffffL);
    }
}
