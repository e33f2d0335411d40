package com.municipality.wastecollection.service;

import com.municipality.wastecollection.config.CollectionProperties;
import com.municipality.wastecollection.dto.BinEligibleEvent;
import com.municipality.wastecollection.dto.OptimizationResult;
import com.municipality.wastecollection.model.FillLevel;
import com.municipality.wastecollection.routing.RouteOptimizationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RouteSchedulerServiceTest {

    private static final long INTERVAL = 300_000L;

    private RouteOptimizationService optimizationService;
    private CollectionProperties properties;
    private RouteSchedulerService scheduler;

    @BeforeEach
    void setUp() {
        optimizationService = mock(RouteOptimizationService.class);
        when(optimizationService.runOptimization()).thenReturn(OptimizationResult.empty());
        properties = new CollectionProperties();
        properties.getOptimizer().getSchedule().setIntervalMs(INTERVAL);
        scheduler = new RouteSchedulerService(optimizationService, properties);
    }

    private static BinEligibleEvent eligible() {
        return new BinEligibleEvent("bin-1", FillLevel.FULL, 36.8, 10.18, LocalDateTime.now());
    }

    @Test
    void testRunsWhenIntervalElapsed() {
        assertTrue(scheduler.tick(INTERVAL));
        assertFalse(scheduler.tick(INTERVAL + 1_000));
        assertTrue(scheduler.tick(2 * INTERVAL));

        verify(optimizationService, times(2)).runOptimization();
    }

    @Test
    void testEligibleBinTriggersEarlyRun() {
        scheduler.tick(INTERVAL);

        scheduler.onBinEligible(eligible());
        assertTrue(scheduler.isDirty());
        assertTrue(scheduler.tick(INTERVAL + 1_000));
        assertFalse(scheduler.isDirty());
        assertFalse(scheduler.tick(INTERVAL + 2_000));

        verify(optimizationService, times(2)).runOptimization();
    }

    @Test
    void testDisabledScheduleNeverRuns() {
        properties.getOptimizer().getSchedule().setEnabled(false);
        scheduler.onBinEligible(eligible());

        assertFalse(scheduler.tick(10 * INTERVAL));

        verifyNoInteractions(optimizationService);
    }

    @Test
    void testFailedRunDoesNotStopTheSchedule() {
        when(optimizationService.runOptimization())
                .thenThrow(new IllegalStateException("store unavailable"))
                .thenReturn(OptimizationResult.empty());

        assertTrue(scheduler.tick(INTERVAL));
        assertTrue(scheduler.tick(2 * INTERVAL));

        verify(optimizationService, times(2)).runOptimization();
    }
}
