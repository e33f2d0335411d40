package com.municipality.wastecollection.controller;

import com.municipality.wastecollection.dto.ActiveDriverStatus;
import com.municipality.wastecollection.dto.DriverRequest;
import com.municipality.wastecollection.dto.DutyRequest;
import com.municipality.wastecollection.dto.LocationSampleRequest;
import com.municipality.wastecollection.dto.LocationSharingRequest;
import com.municipality.wastecollection.model.Driver;
import com.municipality.wastecollection.model.LocationSample;
import com.municipality.wastecollection.service.FleetService;
import com.municipality.wastecollection.service.FleetTrackingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/drivers")
@RequiredArgsConstructor
@Tag(name = "Drivers", description = "Drivers, truck pairing and live location")
public class DriverController {

    private final FleetService fleetService;
    private final FleetTrackingService trackingService;

    @PostMapping
    public ResponseEntity<Driver> registerDriver(@Valid @RequestBody DriverRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(fleetService.registerDriver(request));
    }

    @GetMapping
    public List<Driver> getDrivers() {
        return fleetService.getAllDrivers();
    }

    @Operation(summary = "On-duty drivers", description = "Truck, last position and current route state of every on-duty driver")
    @GetMapping("/active")
    public List<ActiveDriverStatus> getActiveDrivers() {
        return fleetService.getActiveDriverStatus();
    }

    @GetMapping("/{id}")
    public Driver getDriver(@PathVariable String id) {
        return fleetService.getDriver(id);
    }

    @Operation(summary = "Pair a driver with a truck")
    @ApiResponse(responseCode = "409", description = "Driver or truck already paired with someone else")
    @PutMapping("/{id}/truck/{truckId}")
    public Driver assignTruck(@PathVariable String id, @PathVariable String truckId) {
        return fleetService.assignDriverToTruck(id, truckId);
    }

    @Operation(summary = "Unpair a driver from their truck")
    @DeleteMapping("/{id}/truck")
    public Driver releaseTruck(@PathVariable String id) {
        return fleetService.releaseDriver(id);
    }

    @PutMapping("/{id}/duty")
    public Driver setDuty(@PathVariable String id, @RequestBody DutyRequest request) {
        return fleetService.setOnDuty(id, request.isOnDuty());
    }

    @Operation(summary = "Location sharing preferences", description = "Update frequency between 10 and 300 seconds")
    @PutMapping("/{id}/location-sharing")
    public Driver updateLocationSharing(@PathVariable String id, @Valid @RequestBody LocationSharingRequest request) {
        return fleetService.updateLocationSharing(id, request.isEnabled(), request.getUpdateFrequencySeconds());
    }

    @Operation(summary = "Ingest a GPS sample")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "202", description = "Sample accepted"),
        @ApiResponse(responseCode = "400", description = "Sample out of range"),
        @ApiResponse(responseCode = "403", description = "Location sharing disabled"),
        @ApiResponse(responseCode = "404", description = "Unknown driver")
    })
    @PostMapping("/{id}/locations")
    public ResponseEntity<LocationSample> ingestLocation(@PathVariable String id,
                                                        @Valid @RequestBody LocationSampleRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(trackingService.ingest(id, request));
    }

    @Operation(summary = "Recent trail", description = "Most recent samples kept in memory, oldest first")
    @GetMapping("/{id}/trail")
    public List<LocationSample> getTrail(@PathVariable String id) {
        return trackingService.getTrail(id);
    }
}
