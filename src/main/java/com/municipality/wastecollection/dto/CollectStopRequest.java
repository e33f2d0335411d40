package com.municipality.wastecollection.dto;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class CollectStopRequest {

    @PositiveOrZero
    private Double weightKg;

    private String notes;
}
