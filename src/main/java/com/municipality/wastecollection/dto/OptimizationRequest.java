package com.municipality.wastecollection.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * Optional seed for an optimization run. Without a seed point every eligible bin is considered.
 */
@Data
public class OptimizationRequest {

    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    private Double latitude;

    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    private Double longitude;

    @Positive
    private Double radiusMeters;
}
