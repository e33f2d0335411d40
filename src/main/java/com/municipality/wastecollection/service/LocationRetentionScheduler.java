package com.municipality.wastecollection.service;

import com.municipality.wastecollection.config.CollectionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

@Service
@Slf4j
@RequiredArgsConstructor
public class LocationRetentionScheduler {

    private final FleetTrackingService trackingService;
    private final CollectionProperties properties;

    @Scheduled(cron = "${collection.tracking.retention-cron:0 30 3 * * *}")
    public void purgeExpiredSamples() {
        LocalDateTime cutoff = LocalDateTime.now().minusDays(properties.getTracking().getRetentionDays());
        long removed = trackingService.purgeSamplesOlderThan(cutoff);
        log.info("🧹 Purged {} location samples recorded before {}", removed, cutoff);
    }
}
