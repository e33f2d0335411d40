package com.municipality.wastecollection.dto;

import com.municipality.wastecollection.model.TruckStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class TruckStatusRequest {
    @NotNull
    private TruckStatus status;
}
