package com.municipality.wastecollection.dto;

import com.municipality.wastecollection.model.Bin;
import com.municipality.wastecollection.model.WasteType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class BinRequest {

    @NotBlank
    private String ownerId;

    @NotBlank
    private String name;

    private String code;

    @NotNull
    @Min(Bin.MIN_CAPACITY_LITERS)
    @Max(Bin.MAX_CAPACITY_LITERS)
    private Integer capacityLiters;

    private WasteType wasteType;

    @NotNull
    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    private Double latitude;

    @NotNull
    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    private Double longitude;

    private String address;
}
