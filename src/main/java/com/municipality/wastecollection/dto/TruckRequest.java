package com.municipality.wastecollection.dto;

import com.municipality.wastecollection.model.FuelType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class TruckRequest {

    @NotBlank
    private String licensePlate;

    private String model;

    @Positive
    private int capacityKg;

    private FuelType fuelType;
}
