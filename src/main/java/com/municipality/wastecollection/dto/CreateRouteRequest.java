package com.municipality.wastecollection.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

@Data
public class CreateRouteRequest {

    private String name;

    // Visit order is the list order
    @NotEmpty
    private List<String> binIds;

    private LocalDate scheduledDate;
    private LocalTime scheduledStartTime;
    private LocalTime scheduledEndTime;

    private String createdBy;
}
