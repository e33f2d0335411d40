package com.municipality.wastecollection.support;

import com.municipality.wastecollection.config.CollectionProperties;
import com.municipality.wastecollection.dto.AuditEvent;
import com.municipality.wastecollection.dto.BinRequest;
import com.municipality.wastecollection.dto.DriverRequest;
import com.municipality.wastecollection.dto.TruckRequest;
import com.municipality.wastecollection.geo.BinSpatialIndex;
import com.municipality.wastecollection.model.AuditEntry;
import com.municipality.wastecollection.model.Bin;
import com.municipality.wastecollection.model.CollectionRoute;
import com.municipality.wastecollection.model.Driver;
import com.municipality.wastecollection.model.FillLevel;
import com.municipality.wastecollection.model.LocationSample;
import com.municipality.wastecollection.model.Truck;
import com.municipality.wastecollection.model.WasteReport;
import com.municipality.wastecollection.repository.AuditEntryRepository;
import com.municipality.wastecollection.repository.BinRepository;
import com.municipality.wastecollection.repository.CollectionRouteRepository;
import com.municipality.wastecollection.repository.DriverRepository;
import com.municipality.wastecollection.repository.LocationSampleRepository;
import com.municipality.wastecollection.repository.TruckRepository;
import com.municipality.wastecollection.repository.WasteReportRepository;
import com.municipality.wastecollection.routing.BinClaimRegistry;
import com.municipality.wastecollection.routing.BinPriority;
import com.municipality.wastecollection.routing.RouteLifecycleService;
import com.municipality.wastecollection.routing.RouteOptimizationService;
import com.municipality.wastecollection.service.AuditTrailService;
import com.municipality.wastecollection.service.BinService;
import com.municipality.wastecollection.service.FleetService;
import com.municipality.wastecollection.service.FleetTrackingService;
import org.springframework.context.ApplicationEventPublisher;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * The real coordination services wired together over map-backed repositories.
 */
public class CoordinationHarness {

    public final CollectionProperties properties = new CollectionProperties();

    public final Map<String, Bin> bins = new ConcurrentHashMap<>();
    public final List<WasteReport> reports = new CopyOnWriteArrayList<>();
    public final Map<String, Truck> trucks = new ConcurrentHashMap<>();
    public final Map<String, Driver> drivers = new ConcurrentHashMap<>();
    public final List<LocationSample> samples = new CopyOnWriteArrayList<>();
    public final Map<String, CollectionRoute> routes = new ConcurrentHashMap<>();
    public final List<Object> events = new CopyOnWriteArrayList<>();
    public final List<AuditEntry> auditEntries = new CopyOnWriteArrayList<>();

    public final BinRepository binRepository = MapBackedRepositories.bins(bins);
    public final WasteReportRepository reportRepository = MapBackedRepositories.reports(reports);
    public final TruckRepository truckRepository = MapBackedRepositories.trucks(trucks);
    public final DriverRepository driverRepository = MapBackedRepositories.drivers(drivers);
    public final LocationSampleRepository sampleRepository = MapBackedRepositories.samples(samples);
    public final CollectionRouteRepository routeRepository = MapBackedRepositories.routes(routes);
    public final AuditEntryRepository auditRepository = MapBackedRepositories.auditEntries(auditEntries);

    public final AuditTrailService auditTrailService = new AuditTrailService(auditRepository);

    // Records every event and hands audit events to the audit trail, as the application context would
    public final ApplicationEventPublisher eventPublisher = event -> {
        events.add(event);
        if (event instanceof AuditEvent) {
            auditTrailService.onAuditEvent((AuditEvent) event);
        }
    };

    public final BinSpatialIndex spatialIndex;
    public final BinClaimRegistry claimRegistry = new BinClaimRegistry();
    public final BinPriority binPriority;
    public final BinService binService;
    public final FleetService fleetService;
    public final FleetTrackingService trackingService;
    public final RouteLifecycleService lifecycleService;
    public final RouteOptimizationService optimizationService;

    public CoordinationHarness() {
        this(properties -> { });
    }

    public CoordinationHarness(Consumer<CollectionProperties> customizer) {
        customizer.accept(properties);
        spatialIndex = new BinSpatialIndex(properties);
        binPriority = new BinPriority(properties);
        binService = new BinService(binRepository, reportRepository, spatialIndex, claimRegistry,
                binPriority, eventPublisher, properties);
        fleetService = new FleetService(truckRepository, driverRepository, routeRepository, eventPublisher);
        trackingService = new FleetTrackingService(fleetService, sampleRepository, eventPublisher, properties);
        lifecycleService = new RouteLifecycleService(routeRepository, binService, fleetService, trackingService,
                claimRegistry, eventPublisher, properties);
        optimizationService = new RouteOptimizationService(spatialIndex, claimRegistry, binPriority,
                fleetService, lifecycleService, properties);
    }

    public Bin registerBin(String name, double latitude, double longitude, int capacityLiters) {
        BinRequest request = new BinRequest();
        request.setOwnerId("owner-1");
        request.setName(name);
        request.setCapacityLiters(capacityLiters);
        request.setLatitude(latitude);
        request.setLongitude(longitude);
        return binService.registerBin(request);
    }

    /**
     * Registers a bin and reports it straight to {@code level} at {@code reportedAt}.
     */
    public Bin filledBin(String name, double latitude, double longitude, int capacityLiters,
                         FillLevel level, LocalDateTime reportedAt) {
        Bin bin = registerBin(name, latitude, longitude, capacityLiters);
        binService.report(bin.getId(), level, "reporter-1", reportedAt, null, "test");
        return bins.get(bin.getId());
    }

    /**
     * A truck paired with an on-duty driver who shares their location.
     */
    public Truck readyTruck(String plate, int capacityKg) {
        TruckRequest truckRequest = new TruckRequest();
        truckRequest.setLicensePlate(plate);
        truckRequest.setCapacityKg(capacityKg);
        Truck truck = fleetService.registerTruck(truckRequest);

        DriverRequest driverRequest = new DriverRequest();
        driverRequest.setFullName("Driver of " + plate);
        driverRequest.setLicenseNumber("LIC-" + plate);
        Driver driver = fleetService.registerDriver(driverRequest);

        fleetService.assignDriverToTruck(driver.getId(), truck.getId());
        fleetService.setOnDuty(driver.getId(), true);
        fleetService.updateLocationSharing(driver.getId(), true, null);
        return trucks.get(truck.getId());
    }

    public Truck readyTruckAt(String plate, int capacityKg, double latitude, double longitude) {
        Truck truck = readyTruck(plate, capacityKg);
        fleetService.updateTruckPosition(truck.getId(), latitude, longitude, LocalDateTime.now());
        return trucks.get(truck.getId());
    }

    public <T> List<T> eventsOf(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }
}
