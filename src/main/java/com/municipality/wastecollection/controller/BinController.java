package com.municipality.wastecollection.controller;

import com.municipality.wastecollection.dto.BinRequest;
import com.municipality.wastecollection.dto.FillReportRequest;
import com.municipality.wastecollection.dto.NearbyBin;
import com.municipality.wastecollection.dto.UrgentBin;
import com.municipality.wastecollection.model.Bin;
import com.municipality.wastecollection.model.WasteReport;
import com.municipality.wastecollection.service.BinService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/bins")
@RequiredArgsConstructor
@Tag(name = "Bins", description = "Bin registry, fill level reports and proximity queries")
public class BinController {

    private final BinService binService;

    @Operation(summary = "Get all bins", description = "Active bins, optionally filtered by owner")
    @GetMapping
    public List<Bin> getAllBins(@RequestParam(required = false) String ownerId) {
        return ownerId != null ? binService.getBinsByOwner(ownerId) : binService.getAllBins();
    }

    @Operation(summary = "Get bin by ID")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Bin found"),
        @ApiResponse(responseCode = "404", description = "Bin unknown or deactivated")
    })
    @GetMapping("/{id}")
    public Bin getBin(@Parameter(description = "Bin ID") @PathVariable String id) {
        return binService.getBin(id);
    }

    @Operation(summary = "Register a bin")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "201", description = "Bin registered"),
        @ApiResponse(responseCode = "400", description = "Invalid bin data")
    })
    @PostMapping
    public ResponseEntity<Bin> registerBin(@Valid @RequestBody BinRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(binService.registerBin(request));
    }

    @Operation(summary = "Update a bin", description = "Name, address, position, capacity and waste type")
    @PutMapping("/{id}")
    public Bin updateBin(@PathVariable String id, @Valid @RequestBody BinRequest request) {
        return binService.updateBin(id, request);
    }

    @Operation(summary = "Deactivate a bin", description = "Soft delete; the bin is never scheduled again")
    @ApiResponse(responseCode = "204", description = "Bin deactivated")
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deactivateBin(@PathVariable String id) {
        binService.deactivateBin(id);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Report a fill level")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "201", description = "Report recorded"),
        @ApiResponse(responseCode = "404", description = "Bin unknown or deactivated"),
        @ApiResponse(responseCode = "409", description = "A report with the same timestamp exists")
    })
    @PostMapping("/{id}/reports")
    public ResponseEntity<WasteReport> reportFillLevel(@PathVariable String id,
                                                       @Valid @RequestBody FillReportRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(binService.report(id, request));
    }

    @Operation(summary = "Report history of a bin", description = "Newest first")
    @GetMapping("/{id}/reports")
    public List<WasteReport> getReports(@PathVariable String id) {
        return binService.getReportHistory(id);
    }

    @Operation(summary = "Bins near a point", description = "Nearest first; the radius boundary is inclusive")
    @GetMapping("/nearby")
    public List<NearbyBin> getNearby(@RequestParam double latitude,
                                     @RequestParam double longitude,
                                     @RequestParam(required = false) Double radiusMeters,
                                     @RequestParam(defaultValue = "false") boolean eligibleOnly) {
        return binService.findNearby(latitude, longitude, radiusMeters, eligibleOnly);
    }

    @Operation(summary = "Bins needing collection", description = "Ranked by priority tier, then by report age")
    @GetMapping("/urgent")
    public List<UrgentBin> getUrgent() {
        return binService.getUrgentBins();
    }
}
