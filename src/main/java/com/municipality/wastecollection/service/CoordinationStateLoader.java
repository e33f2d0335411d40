package com.municipality.wastecollection.service;

import com.municipality.wastecollection.geo.BinSpatialIndex;
import com.municipality.wastecollection.model.Bin;
import com.municipality.wastecollection.model.CollectionRoute;
import com.municipality.wastecollection.model.RouteStatus;
import com.municipality.wastecollection.repository.BinRepository;
import com.municipality.wastecollection.repository.CollectionRouteRepository;
import com.municipality.wastecollection.routing.BinClaimRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Rebuilds the in-memory coordination state from storage: the spatial index from active
 * bins, and bin claims from routes that are still running.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CoordinationStateLoader {

    private final BinRepository binRepository;
    private final CollectionRouteRepository routeRepository;
    private final BinSpatialIndex spatialIndex;
    private final BinClaimRegistry claimRegistry;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        reload();
    }

    public void reload() {
        List<Bin> active = binRepository.findByActiveTrue();
        spatialIndex.rebuild(active);

        claimRegistry.reset();
        int claimed = 0;
        for (CollectionRoute route : routeRepository.findByStatusIn(RouteStatus.activeStatuses())) {
            List<String> binIds = route.getBinIds();
            List<String> conflicts = claimRegistry.claimAll(binIds, route.getId());
            if (conflicts.isEmpty()) {
                claimed += binIds.size();
            } else {
                // Stored data already violates single membership; keep the first route's claims
                log.warn("⚠️ Route {} overlaps other active routes on bins {}", route.getCode(), conflicts);
            }
        }
        // Retired after the route claims so a running route keeps its deactivated stops
        List<Bin> inactive = binRepository.findByActiveFalse();
        inactive.forEach(bin -> claimRegistry.retire(bin.getId()));

        log.info("🔄 Coordination state loaded: {} active bins, {} retired, {} claimed bins", active.size(), inactive.size(), claimed);
    }
}
