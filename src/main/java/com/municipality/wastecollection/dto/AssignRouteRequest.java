package com.municipality.wastecollection.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AssignRouteRequest {
    @NotBlank
    private String driverId;

    @NotBlank
    private String truckId;
}
