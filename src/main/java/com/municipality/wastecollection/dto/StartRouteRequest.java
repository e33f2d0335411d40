package com.municipality.wastecollection.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class StartRouteRequest {
    @NotBlank
    private String driverId;
}
