package com.municipality.wastecollection.dto;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class CompleteRouteRequest {

    // Measured from stored location samples when absent
    @PositiveOrZero
    private Double actualDistanceKm;
}
