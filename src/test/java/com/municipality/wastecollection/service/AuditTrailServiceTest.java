package com.municipality.wastecollection.service;

import com.municipality.wastecollection.dto.BinRequest;
import com.municipality.wastecollection.dto.CreateRouteRequest;
import com.municipality.wastecollection.exception.DuplicateReportException;
import com.municipality.wastecollection.exception.SchedulingConflictException;
import com.municipality.wastecollection.model.AuditAction;
import com.municipality.wastecollection.model.AuditEntry;
import com.municipality.wastecollection.model.AuditedEntity;
import com.municipality.wastecollection.model.Bin;
import com.municipality.wastecollection.model.CollectionRoute;
import com.municipality.wastecollection.model.FillLevel;
import com.municipality.wastecollection.model.Truck;
import com.municipality.wastecollection.support.CoordinationHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class AuditTrailServiceTest {

    private static final LocalDateTime REPORTED = LocalDateTime.now().minusHours(2).withNano(0);

    private CoordinationHarness harness;
    private AuditTrailService auditTrail;

    @BeforeEach
    void setUp() {
        harness = new CoordinationHarness();
        auditTrail = harness.auditTrailService;
    }

    private List<AuditAction> actionsOf(AuditedEntity type, String id) {
        return auditTrail.getHistory(type, id).stream().map(AuditEntry::getAction).collect(Collectors.toList());
    }

    private CollectionRoute manualRoute(String... binIds) {
        CreateRouteRequest request = new CreateRouteRequest();
        request.setName("Audit round");
        request.setBinIds(List.of(binIds));
        request.setCreatedBy("supervisor-1");
        return harness.lifecycleService.createRoute(request);
    }

    @Test
    void testBinHistoryRecordsFillChangesAndCollection() {
        Bin bin = harness.registerBin("market", 36.80, 10.18, 120);
        harness.binService.report(bin.getId(), FillLevel.HALF, "shop-1", REPORTED, null, "app");
        harness.binService.report(bin.getId(), FillLevel.QUARTER, "shop-1", REPORTED.plusMinutes(5), null, "app");
        harness.binService.report(bin.getId(), FillLevel.FULL, "shop-2", REPORTED.plusMinutes(10), null, "app");
        harness.binService.markCollected(bin.getId());

        List<AuditEntry> history = auditTrail.getHistory(AuditedEntity.BIN, bin.getId());

        assertEquals(List.of(AuditAction.CREATE, AuditAction.FILL_REPORTED, AuditAction.FILL_REPORTED, AuditAction.COLLECTED),
                history.stream().map(AuditEntry::getAction).collect(Collectors.toList()));
        assertNull(history.get(0).getOldValues());
        assertEquals(120, history.get(0).getNewValues().get("capacityLiters"));

        AuditEntry toFull = history.get(2);
        assertEquals("shop-2", toFull.getActorId());
        assertEquals("HALF", toFull.getOldValues().get("currentFillLevel"));
        assertEquals("FULL", toFull.getNewValues().get("currentFillLevel"));
        assertEquals(REPORTED.plusMinutes(10), toFull.getNewValues().get("lastReported"));

        AuditEntry collected = history.get(3);
        assertEquals("FULL", collected.getOldValues().get("currentFillLevel"));
        assertEquals("EMPTY", collected.getNewValues().get("currentFillLevel"));
        assertNotNull(collected.getNewValues().get("lastEmptied"));
    }

    @Test
    void testUpdateAndDeactivationKeepOldValues() {
        Bin bin = harness.registerBin("market", 36.80, 10.18, 120);
        BinRequest request = new BinRequest();
        request.setName("market north");
        request.setCapacityLiters(240);
        request.setLatitude(36.81);
        request.setLongitude(10.18);
        harness.binService.updateBin(bin.getId(), request);
        harness.binService.deactivateBin(bin.getId());

        List<AuditEntry> history = auditTrail.getHistory(AuditedEntity.BIN, bin.getId());

        AuditEntry update = history.get(1);
        assertEquals(AuditAction.UPDATE, update.getAction());
        assertEquals("market", update.getOldValues().get("name"));
        assertEquals(120, update.getOldValues().get("capacityLiters"));
        assertEquals(240, update.getNewValues().get("capacityLiters"));

        AuditEntry deletion = history.get(2);
        assertEquals(AuditAction.DELETE, deletion.getAction());
        assertEquals(true, deletion.getOldValues().get("active"));
        assertEquals(false, deletion.getNewValues().get("active"));
    }

    @Test
    void testRouteTransitionsAreRecordedInOrder() {
        Truck truck = harness.readyTruck("TN-1", 5000);
        String driverId = truck.getCurrentDriverId();
        Bin first = harness.filledBin("first", 36.800, 10.180, 120, FillLevel.FULL, REPORTED);
        Bin second = harness.filledBin("second", 36.805, 10.185, 120, FillLevel.FULL, REPORTED);

        CollectionRoute route = manualRoute(first.getId(), second.getId());
        harness.lifecycleService.assignRoute(route.getId(), driverId, truck.getId());
        harness.lifecycleService.startRoute(route.getId(), driverId);
        harness.lifecycleService.markStopCollected(route.getId(), first.getId(), 20.0);
        harness.lifecycleService.markStopCollected(route.getId(), second.getId(), 25.0);

        List<AuditEntry> history = auditTrail.getHistory(AuditedEntity.ROUTE, route.getId());

        assertEquals(List.of(AuditAction.CREATE, AuditAction.ASSIGNED, AuditAction.STARTED,
                        AuditAction.STOP_COLLECTED, AuditAction.STOP_COLLECTED, AuditAction.COMPLETED),
                history.stream().map(AuditEntry::getAction).collect(Collectors.toList()));
        assertEquals("supervisor-1", history.get(0).getActorId());
        assertEquals("PENDING", history.get(0).getNewValues().get("status"));
        assertEquals(List.of(first.getId(), second.getId()), history.get(0).getNewValues().get("binIds"));
        assertEquals("PENDING", history.get(1).getOldValues().get("status"));
        assertEquals(truck.getId(), history.get(1).getNewValues().get("truckId"));
        assertEquals(driverId, history.get(2).getActorId());
        assertEquals(second.getId(), history.get(4).getNewValues().get("binId"));
        assertEquals(45.0, history.get(4).getNewValues().get("totalWasteKg"));
        assertEquals("IN_PROGRESS", history.get(5).getOldValues().get("status"));
        assertEquals("COMPLETED", history.get(5).getNewValues().get("status"));

        assertEquals(List.of(AuditAction.CREATE, AuditAction.PAIRED, AuditAction.STATUS_CHANGED, AuditAction.STATUS_CHANGED),
                actionsOf(AuditedEntity.TRUCK, truck.getId()));
    }

    @Test
    void testCancellationRecordsReleasedBins() {
        Bin first = harness.filledBin("first", 36.800, 10.180, 120, FillLevel.FULL, REPORTED);
        CollectionRoute route = manualRoute(first.getId());

        harness.lifecycleService.cancelRoute(route.getId(), "street closed");

        AuditEntry cancelled = auditTrail.getHistory(AuditedEntity.ROUTE, route.getId()).get(1);
        assertEquals(AuditAction.CANCELLED, cancelled.getAction());
        assertEquals("PENDING", cancelled.getOldValues().get("status"));
        assertEquals("street closed", cancelled.getNewValues().get("cancellationReason"));
        assertEquals(List.of(first.getId()), cancelled.getNewValues().get("releasedBinIds"));
    }

    @Test
    void testOptimizedRouteIsRecordedAsOptimizerCreation() {
        harness.readyTruckAt("TN-1", 5000, 36.80, 10.18);
        harness.filledBin("first", 36.800, 10.180, 120, FillLevel.FULL, REPORTED);

        CollectionRoute route = harness.optimizationService.runOptimization().getRoutes().get(0);

        AuditEntry created = auditTrail.getHistory(AuditedEntity.ROUTE, route.getId()).get(0);
        assertEquals(AuditAction.CREATE, created.getAction());
        assertEquals("optimizer", created.getActorId());
        assertEquals("ASSIGNED", created.getNewValues().get("status"));
    }

    @Test
    void testPairingIsRecordedOnBothSides() {
        Truck truck = harness.readyTruck("TN-1", 5000);
        String driverId = truck.getCurrentDriverId();

        harness.fleetService.releaseDriver(driverId);

        List<AuditEntry> driverHistory = auditTrail.getHistory(AuditedEntity.DRIVER, driverId);
        assertEquals(List.of(AuditAction.CREATE, AuditAction.PAIRED, AuditAction.UPDATE, AuditAction.UNPAIRED),
                driverHistory.stream().map(AuditEntry::getAction).collect(Collectors.toList()));
        assertNull(driverHistory.get(1).getOldValues().get("currentTruckId"));
        assertEquals(truck.getId(), driverHistory.get(1).getNewValues().get("currentTruckId"));
        assertEquals(truck.getId(), driverHistory.get(3).getOldValues().get("currentTruckId"));
        assertNull(driverHistory.get(3).getNewValues().get("currentTruckId"));

        assertEquals(List.of(AuditAction.CREATE, AuditAction.PAIRED, AuditAction.UNPAIRED),
                actionsOf(AuditedEntity.TRUCK, truck.getId()));
    }

    @Test
    void testRejectedOperationsWriteNoEntries() {
        Truck truck = harness.readyTruck("TN-1", 5000);
        Truck other = harness.readyTruck("TN-2", 5000);
        Bin bin = harness.filledBin("first", 36.800, 10.180, 120, FillLevel.HALF, REPORTED);
        int before = harness.auditEntries.size();

        assertThrows(SchedulingConflictException.class,
                () -> harness.fleetService.assignDriverToTruck(truck.getCurrentDriverId(), other.getId()));
        assertThrows(DuplicateReportException.class,
                () -> harness.binService.report(bin.getId(), FillLevel.FULL, "shop-1", REPORTED, null, "app"));
        harness.binService.report(bin.getId(), FillLevel.EMPTY, "shop-1", REPORTED.plusMinutes(1), null, "app");

        assertEquals(before, harness.auditEntries.size());
    }

    @Test
    void testEntriesOfOneDay() {
        harness.registerBin("market", 36.80, 10.18, 120);
        harness.readyTruck("TN-1", 5000);

        List<AuditEntry> today = auditTrail.getEntriesOn(LocalDate.now());

        assertEquals(harness.auditEntries.size(), today.size());
        assertTrue(auditTrail.getEntriesOn(LocalDate.now().minusDays(1)).isEmpty());
    }
}
