package com.municipality.wastecollection.dto;

import com.municipality.wastecollection.model.FillLevel;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDateTime;

@Data
public class FillReportRequest {

    @NotNull
    private FillLevel fillLevel;

    @NotBlank
    private String reporterId;

    // Client clock; server time is used when absent
    private LocalDateTime reportedAt;

    private String notes;

    private String reportedVia;
}
