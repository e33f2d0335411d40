package com.municipality.wastecollection.controller;

import com.municipality.wastecollection.dto.AssignRouteRequest;
import com.municipality.wastecollection.dto.CancelRouteRequest;
import com.municipality.wastecollection.dto.CollectStopRequest;
import com.municipality.wastecollection.dto.CompleteRouteRequest;
import com.municipality.wastecollection.dto.CreateRouteRequest;
import com.municipality.wastecollection.dto.OptimizationRequest;
import com.municipality.wastecollection.dto.OptimizationResult;
import com.municipality.wastecollection.dto.StartRouteRequest;
import com.municipality.wastecollection.geo.GeoPoint;
import com.municipality.wastecollection.model.CollectionRoute;
import com.municipality.wastecollection.model.RouteStatus;
import com.municipality.wastecollection.routing.RouteLifecycleService;
import com.municipality.wastecollection.routing.RouteOptimizationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/routes")
@RequiredArgsConstructor
@Tag(name = "Routes", description = "Route optimization and execution lifecycle")
public class RouteController {

    private final RouteOptimizationService optimizationService;
    private final RouteLifecycleService lifecycleService;

    @Operation(summary = "Run the optimizer",
            description = "Groups eligible bins into routes and assigns them to available trucks. "
                    + "Without a body or seed point every eligible bin is considered.")
    @PostMapping("/optimize")
    public OptimizationResult optimize(@Valid @RequestBody(required = false) OptimizationRequest request) {
        if (request == null) {
            return optimizationService.runOptimization();
        }
        if ((request.getLatitude() == null) != (request.getLongitude() == null)) {
            throw new IllegalArgumentException("Seed latitude and longitude must be given together");
        }
        GeoPoint seed = request.getLatitude() != null
                ? GeoPoint.of(request.getLatitude(), request.getLongitude())
                : null;
        log.info("🧭 Optimization requested (seed: {}, radius: {})", seed, request.getRadiusMeters());
        return optimizationService.runOptimization(seed, request.getRadiusMeters());
    }

    @Operation(summary = "Create a manual route", description = "PENDING until assigned")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "201", description = "Route created"),
        @ApiResponse(responseCode = "409", description = "A bin is already on another active route")
    })
    @PostMapping
    public ResponseEntity<CollectionRoute> createRoute(@Valid @RequestBody CreateRouteRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(lifecycleService.createRoute(request));
    }

    @GetMapping
    public List<CollectionRoute> getRoutes(@RequestParam(required = false) RouteStatus status,
                                           @RequestParam(defaultValue = "false") boolean activeOnly) {
        return activeOnly ? lifecycleService.getActiveRoutes() : lifecycleService.getRoutesByStatus(status);
    }

    @GetMapping("/{id}")
    public CollectionRoute getRoute(@PathVariable String id) {
        return lifecycleService.getRoute(id);
    }

    @Operation(summary = "Assign a pending route")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "409", description = "Route not pending, or truck not available"),
        @ApiResponse(responseCode = "422", description = "Route mass exceeds truck capacity")
    })
    @PostMapping("/{id}/assign")
    public CollectionRoute assign(@PathVariable String id, @Valid @RequestBody AssignRouteRequest request) {
        return lifecycleService.assignRoute(id, request.getDriverId(), request.getTruckId());
    }

    @Operation(summary = "Start an assigned route")
    @ApiResponse(responseCode = "403", description = "Route belongs to another driver")
    @PostMapping("/{id}/start")
    public CollectionRoute start(@PathVariable String id, @Valid @RequestBody StartRouteRequest request) {
        return lifecycleService.startRoute(id, request.getDriverId());
    }

    @Operation(summary = "Mark a stop collected")
    @ApiResponse(responseCode = "409", description = "Route not in progress, or stop already collected")
    @PostMapping("/{id}/stops/{binId}/collect")
    public CollectionRoute collect(@PathVariable String id, @PathVariable String binId,
                                   @Valid @RequestBody(required = false) CollectStopRequest request) {
        Double weight = request != null ? request.getWeightKg() : null;
        String notes = request != null ? request.getNotes() : null;
        return lifecycleService.markStopCollected(id, binId, weight, notes);
    }

    @PostMapping("/{id}/complete")
    public CollectionRoute complete(@PathVariable String id,
                                    @Valid @RequestBody(required = false) CompleteRouteRequest request) {
        return lifecycleService.completeRoute(id, request != null ? request.getActualDistanceKm() : null);
    }

    @PostMapping("/{id}/cancel")
    public CollectionRoute cancel(@PathVariable String id,
                                  @RequestBody(required = false) CancelRouteRequest request) {
        return lifecycleService.cancelRoute(id, request != null ? request.getReason() : null);
    }
}
