package com.municipality.wastecollection.controller;

import com.municipality.wastecollection.dto.TruckRequest;
import com.municipality.wastecollection.dto.TruckStatusRequest;
import com.municipality.wastecollection.model.Truck;
import com.municipality.wastecollection.service.FleetService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/trucks")
@RequiredArgsConstructor
@Tag(name = "Trucks", description = "Fleet registry")
public class TruckController {

    private final FleetService fleetService;

    @Operation(summary = "Register a truck")
    @PostMapping
    public ResponseEntity<Truck> registerTruck(@Valid @RequestBody TruckRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(fleetService.registerTruck(request));
    }

    @Operation(summary = "Get trucks", description = "All trucks, or only those able to take a route now")
    @GetMapping
    public List<Truck> getTrucks(@RequestParam(defaultValue = "false") boolean availableOnly) {
        return availableOnly ? fleetService.getAvailableTrucks() : fleetService.getAllTrucks();
    }

    @GetMapping("/{id}")
    public Truck getTruck(@PathVariable String id) {
        return fleetService.getTruck(id);
    }

    @Operation(summary = "Change a truck's status", description = "ON_ROUTE is managed by route assignment")
    @ApiResponse(responseCode = "409", description = "Truck is on a route")
    @PutMapping("/{id}/status")
    public Truck updateStatus(@PathVariable String id, @Valid @RequestBody TruckStatusRequest request) {
        return fleetService.updateTruckStatus(id, request.getStatus());
    }
}
