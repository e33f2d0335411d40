package com.municipality.wastecollection.service;

import com.municipality.wastecollection.config.CollectionProperties;
import com.municipality.wastecollection.config.RedisConfig;
import com.municipality.wastecollection.dto.AuditEvent;
import com.municipality.wastecollection.dto.BinEligibleEvent;
import com.municipality.wastecollection.dto.BinRequest;
import com.municipality.wastecollection.dto.FillReportRequest;
import com.municipality.wastecollection.dto.NearbyBin;
import com.municipality.wastecollection.dto.UrgentBin;
import com.municipality.wastecollection.exception.DuplicateReportException;
import com.municipality.wastecollection.exception.ResourceNotFoundException;
import com.municipality.wastecollection.geo.BinSpatialIndex;
import com.municipality.wastecollection.geo.GeoPoint;
import com.municipality.wastecollection.model.AuditAction;
import com.municipality.wastecollection.model.AuditedEntity;
import com.municipality.wastecollection.model.Bin;
import com.municipality.wastecollection.model.FillLevel;
import com.municipality.wastecollection.model.WasteReport;
import com.municipality.wastecollection.model.WasteType;
import com.municipality.wastecollection.repository.BinRepository;
import com.municipality.wastecollection.repository.WasteReportRepository;
import com.municipality.wastecollection.routing.BinClaimRegistry;
import com.municipality.wastecollection.routing.BinPriority;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Bin records and the fill-level state machine.
 * <p>
 * Every write to one bin runs under that bin's lock, so concurrent reports on the same bin
 * are applied one at a time while different bins proceed in parallel.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BinService {

    private final BinRepository binRepository;
    private final WasteReportRepository wasteReportRepository;
    private final BinSpatialIndex spatialIndex;
    private final BinClaimRegistry claimRegistry;
    private final BinPriority binPriority;
    private final ApplicationEventPublisher eventPublisher;
    private final CollectionProperties properties;

    private final KeyedLocks binLocks = new KeyedLocks();

    @CacheEvict(value = RedisConfig.URGENT_BINS, allEntries = true)
    public Bin registerBin(BinRequest request) {
        validateCapacity(request.getCapacityLiters());
        GeoPoint position = positionOf(request);

        LocalDateTime now = LocalDateTime.now();
        Bin bin = new Bin();
        bin.setId(UUID.randomUUID().toString());
        bin.setOwnerId(request.getOwnerId());
        bin.setName(request.getName());
        bin.setCode(request.getCode());
        bin.setCapacityLiters(request.getCapacityLiters());
        bin.setWasteType(request.getWasteType() != null ? request.getWasteType() : WasteType.GENERAL);
        bin.setLatitude(position.getLatitude());
        bin.setLongitude(position.getLongitude());
        bin.setAddress(request.getAddress());
        bin.setCreatedAt(now);
        bin.setUpdatedAt(now);

        Bin saved = binRepository.save(bin);
        spatialIndex.upsert(saved);
        audit(saved.getId(), AuditAction.CREATE, saved.getOwnerId(), null, details(saved));
        log.info("🗑️ Registered bin {} ({} L) for owner {}", saved.getId(), saved.getCapacityLiters(), saved.getOwnerId());
        return saved;
    }

    @CacheEvict(value = RedisConfig.URGENT_BINS, allEntries = true)
    public Bin updateBin(String binId, BinRequest request) {
        validateCapacity(request.getCapacityLiters());
        GeoPoint position = positionOf(request);

        return binLocks.call(binId, () -> {
            Bin bin = loadActive(binId);
            Map<String, Object> before = details(bin);
            bin.setName(request.getName());
            bin.setCode(request.getCode());
            bin.setAddress(request.getAddress());
            bin.setCapacityLiters(request.getCapacityLiters());
            if (request.getWasteType() != null) {
                bin.setWasteType(request.getWasteType());
            }
            bin.setLatitude(position.getLatitude());
            bin.setLongitude(position.getLongitude());
            bin.setUpdatedAt(LocalDateTime.now());

            Bin saved = binRepository.save(bin);
            spatialIndex.upsert(saved);
            audit(binId, AuditAction.UPDATE, null, before, details(saved));
            return saved;
        });
    }

    /**
     * Soft delete. The bin leaves the spatial index and can never be claimed by a route again.
     */
    @CacheEvict(value = RedisConfig.URGENT_BINS, allEntries = true)
    public void deactivateBin(String binId) {
        binLocks.run(binId, () -> {
            Bin bin = loadActive(binId);
            LocalDateTime now = LocalDateTime.now();
            bin.setActive(false);
            bin.setDeletedAt(now);
            bin.setUpdatedAt(now);
            binRepository.save(bin);

            claimRegistry.retire(binId);
            spatialIndex.remove(binId);
            audit(binId, AuditAction.DELETE, null, AuditEvent.values("active", true),
                    AuditEvent.values("active", false, "deletedAt", now));
            log.info("🚫 Deactivated bin {}", binId);
        });
    }

    public Bin getBin(String binId) {
        return loadActive(binId);
    }

    public List<Bin> getAllBins() {
        return binRepository.findByActiveTrue();
    }

    public List<Bin> getBinsByOwner(String ownerId) {
        return binRepository.findByOwnerIdAndActiveTrue(ownerId);
    }

    @CacheEvict(value = RedisConfig.URGENT_BINS, allEntries = true)
    public WasteReport report(String binId, FillReportRequest request) {
        return report(binId, request.getFillLevel(), request.getReporterId(),
                request.getReportedAt(), request.getNotes(), request.getReportedVia());
    }

    @CacheEvict(value = RedisConfig.URGENT_BINS, allEntries = true)
    public WasteReport report(String binId, FillLevel level, String reporterId) {
        return report(binId, level, reporterId, null, null, null);
    }

    /**
     * Records a fill level observation and applies it to the bin.
     * <p>
     * A report lower than the current level is kept in the history but does not change the
     * bin: fill levels only go down through {@link #markCollected(String)}. The first report
     * that makes a bin need collection raises exactly one {@link BinEligibleEvent}.
     *
     * @throws ResourceNotFoundException if the bin is unknown or inactive
     * @throws DuplicateReportException  if the bin already has a report at {@code reportedAt}
     */
    @CacheEvict(value = RedisConfig.URGENT_BINS, allEntries = true)
    public WasteReport report(String binId, FillLevel level, String reporterId,
                              LocalDateTime reportedAt, String notes, String reportedVia) {
        if (level == null) {
            throw new IllegalArgumentException("Fill level is required");
        }
        LocalDateTime at = reportedAt != null ? reportedAt : LocalDateTime.now();

        return binLocks.call(binId, () -> {
            Bin bin = loadActive(binId);
            if (wasteReportRepository.existsByBinIdAndReportedAt(binId, at)) {
                throw new DuplicateReportException(binId, at);
            }

            WasteReport report = new WasteReport(UUID.randomUUID().toString(), binId, reporterId,
                    level, notes, reportedVia, at);
            try {
                report = wasteReportRepository.save(report);
            } catch (DuplicateKeyException e) {
                throw new DuplicateReportException(binId, at);
            }

            if (level.isLowerThan(bin.getCurrentFillLevel())) {
                log.debug("Ignoring lower report {} for bin {} (current {})", level, binId, bin.getCurrentFillLevel());
                return report;
            }

            boolean wasEligible = bin.isNeedsCollection();
            Map<String, Object> before = fillState(bin);
            bin.setCurrentFillLevel(level);
            if (bin.getLastReported() == null || at.isAfter(bin.getLastReported())) {
                bin.setLastReported(at);
            }
            bin.setUpdatedAt(LocalDateTime.now());
            Bin saved = binRepository.save(bin);
            spatialIndex.upsert(saved);
            audit(binId, AuditAction.FILL_REPORTED, reporterId, before, fillState(saved));

            if (!wasEligible && saved.isNeedsCollection()) {
                log.info("🔔 Bin {} now needs collection ({})", binId, level);
                eventPublisher.publishEvent(new BinEligibleEvent(binId, level,
                        saved.getLatitude(), saved.getLongitude(), LocalDateTime.now()));
            }
            return report;
        });
    }

    /**
     * Resets the bin to EMPTY after a truck emptied it. Works on deactivated bins too, so a
     * route that still holds the stop can finish it.
     */
    @CacheEvict(value = RedisConfig.URGENT_BINS, allEntries = true)
    public Bin markCollected(String binId) {
        return binLocks.call(binId, () -> {
            Bin bin = binRepository.findById(binId)
                    .orElseThrow(() -> ResourceNotFoundException.of("Bin", binId));
            Map<String, Object> before = fillState(bin);
            LocalDateTime now = LocalDateTime.now();
            bin.setCurrentFillLevel(FillLevel.EMPTY);
            bin.setLastEmptied(now);
            bin.setUpdatedAt(now);
            Bin saved = binRepository.save(bin);
            spatialIndex.upsert(saved);
            audit(binId, AuditAction.COLLECTED, null, before, fillState(saved));
            return saved;
        });
    }

    public List<WasteReport> getReportHistory(String binId) {
        if (!binRepository.existsById(binId)) {
            throw ResourceNotFoundException.of("Bin", binId);
        }
        return wasteReportRepository.findByBinIdOrderByReportedAtDesc(binId);
    }

    public List<NearbyBin> findNearby(double latitude, double longitude, Double radiusMeters, boolean eligibleOnly) {
        double radius = radiusMeters != null ? radiusMeters : properties.getOptimizer().getSearchRadiusMeters();
        return spatialIndex.nearby(GeoPoint.of(latitude, longitude), radius, eligibleOnly);
    }

    /**
     * Bins needing collection, most urgent first.
     */
    @Cacheable(value = RedisConfig.URGENT_BINS, key = "'all'")
    public List<UrgentBin> getUrgentBins() {
        LocalDateTime now = LocalDateTime.now();
        return spatialIndex.eligibleBins().stream()
                .sorted(binPriority.ordering(now))
                .map(bin -> new UrgentBin(bin.getId(), bin.getName(), bin.getAddress(),
                        bin.getLatitude(), bin.getLongitude(), bin.getCurrentFillLevel(),
                        bin.getLastReported(), binPriority.tierOf(bin, now).label()))
                .collect(Collectors.toList());
    }

    private void audit(String binId, AuditAction action, String actorId,
                       Map<String, Object> oldValues, Map<String, Object> newValues) {
        eventPublisher.publishEvent(AuditEvent.of(AuditedEntity.BIN, binId, action, actorId, oldValues, newValues));
    }

    private static Map<String, Object> details(Bin bin) {
        return AuditEvent.values("name", bin.getName(), "code", bin.getCode(), "address", bin.getAddress(),
                "capacityLiters", bin.getCapacityLiters(), "wasteType", bin.getWasteType(),
                "latitude", bin.getLatitude(), "longitude", bin.getLongitude());
    }

    private static Map<String, Object> fillState(Bin bin) {
        return AuditEvent.values("currentFillLevel", bin.getCurrentFillLevel(),
                "lastReported", bin.getLastReported(), "lastEmptied", bin.getLastEmptied());
    }

    private Bin loadActive(String binId) {
        return binRepository.findById(binId)
                .filter(Bin::isActive)
                .orElseThrow(() -> ResourceNotFoundException.of("Bin", binId));
    }

    private static GeoPoint positionOf(BinRequest request) {
        if (request.getLatitude() == null || request.getLongitude() == null) {
            throw new IllegalArgumentException("Bin latitude and longitude are required");
        }
        return GeoPoint.of(request.getLatitude(), request.getLongitude());
    }

    private static void validateCapacity(Integer capacityLiters) {
        if (capacityLiters == null
                || capacityLiters < Bin.MIN_CAPACITY_LITERS
                || capacityLiters > Bin.MAX_CAPACITY_LITERS) {
            throw new IllegalArgumentException("Capacity must be between " + Bin.MIN_CAPACITY_LITERS
                    + " and " + Bin.MAX_CAPACITY_LITERS + " liters: " + capacityLiters);
        }
    }
}
