package com.municipality.wastecollection.controller;

import com.municipality.wastecollection.dto.AuditEvent;
import com.municipality.wastecollection.exception.GlobalExceptionHandler;
import com.municipality.wastecollection.model.AuditAction;
import com.municipality.wastecollection.model.AuditEntry;
import com.municipality.wastecollection.model.AuditedEntity;
import com.municipality.wastecollection.service.AuditTrailService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class AuditControllerTest {

    private MockMvc mockMvc;
    private AuditTrailService auditTrailService;

    private AuditEntry entry;

    @BeforeEach
    void setUp() {
        auditTrailService = mock(AuditTrailService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new AuditController(auditTrailService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();

        LocalDateTime at = LocalDateTime.of(2026, 3, 14, 9, 30);
        entry = new AuditEntry("audit-1", "shop-1", AuditAction.FILL_REPORTED, AuditedEntity.BIN, "bin-1",
                AuditEvent.values("currentFillLevel", "HALF"), AuditEvent.values("currentFillLevel", "FULL"),
                at, at.toLocalDate());
    }

    @Test
    void testHistoryOfBin() throws Exception {
        when(auditTrailService.getHistory(AuditedEntity.BIN, "bin-1")).thenReturn(List.of(entry));

        mockMvc.perform(get("/audit/BIN/bin-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].action").value("FILL_REPORTED"))
                .andExpect(jsonPath("$[0].actorId").value("shop-1"))
                .andExpect(jsonPath("$[0].oldValues.currentFillLevel").value("HALF"))
                .andExpect(jsonPath("$[0].newValues.currentFillLevel").value("FULL"));
    }

    @Test
    void testHistory_unknownEntityType() throws Exception {
        mockMvc.perform(get("/audit/PARKING/bin-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));

        verifyNoInteractions(auditTrailService);
    }

    @Test
    void testEntriesOfDay() throws Exception {
        when(auditTrailService.getEntriesOn(LocalDate.of(2026, 3, 14))).thenReturn(List.of(entry));

        mockMvc.perform(get("/audit").param("date", "2026-03-14"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].entityId").value("bin-1"));
    }
}
