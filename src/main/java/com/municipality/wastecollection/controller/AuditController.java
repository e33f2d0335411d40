package com.municipality.wastecollection.controller;

import com.municipality.wastecollection.model.AuditEntry;
import com.municipality.wastecollection.model.AuditedEntity;
import com.municipality.wastecollection.service.AuditTrailService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/audit")
@RequiredArgsConstructor
@Tag(name = "Audit", description = "Recorded changes of bins, routes, trucks and drivers")
public class AuditController {

    private final AuditTrailService auditTrailService;

    @Operation(summary = "Change history of one entity", description = "Oldest first, with old and new field values")
    @GetMapping("/{entityType}/{entityId}")
    public List<AuditEntry> getHistory(@Parameter(description = "BIN, ROUTE, TRUCK or DRIVER") @PathVariable AuditedEntity entityType,
                                       @PathVariable String entityId) {
        return auditTrailService.getHistory(entityType, entityId);
    }

    @Operation(summary = "Changes recorded on one day")
    @GetMapping
    public List<AuditEntry> getEntriesOn(@RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return auditTrailService.getEntriesOn(date);
    }
}
