package com.municipality.wastecollection.service;

import com.municipality.wastecollection.config.CollectionProperties;
import com.municipality.wastecollection.dto.BinEligibleEvent;
import com.municipality.wastecollection.dto.OptimizationResult;
import com.municipality.wastecollection.routing.RouteOptimizationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the optimizer periodically, and early when a bin becomes eligible.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RouteSchedulerService {

    private final RouteOptimizationService routeOptimizationService;
    private final CollectionProperties properties;

    private final AtomicBoolean dirty = new AtomicBoolean(false);
    private final AtomicLong lastRunMillis = new AtomicLong(0);

    @EventListener
    public void onBinEligible(BinEligibleEvent event) {
        dirty.set(true);
    }

    @Scheduled(fixedDelayString = "${collection.optimizer.schedule.tick-ms:30000}",
            initialDelayString = "${collection.optimizer.schedule.tick-ms:30000}")
    public void tick() {
        tick(System.currentTimeMillis());
    }

    boolean tick(long nowMillis) {
        CollectionProperties.Schedule schedule = properties.getOptimizer().getSchedule();
        if (!schedule.isEnabled()) {
            return false;
        }
        boolean due = nowMillis - lastRunMillis.get() >= schedule.getIntervalMs();
        if (!due && !dirty.get()) {
            return false;
        }

        dirty.set(false);
        lastRunMillis.set(nowMillis);
        log.info("⏰ Scheduled: running route optimization ({})", due ? "interval" : "new eligible bins");
        try {
            OptimizationResult result = routeOptimizationService.runOptimization();
            log.info("⏰ Scheduled optimization created {} route(s)", result.getRoutes().size());
        } catch (RuntimeException e) {
            // The next tick retries; one failed pass must not stop the schedule
            log.error("❌ Scheduled optimization failed", e);
        }
        return true;
    }

    boolean isDirty() {
        return dirty.get();
    }
}
