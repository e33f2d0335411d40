package com.municipality.wastecollection.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class DriverRequest {

    @NotBlank
    private String fullName;

    @NotBlank
    private String licenseNumber;
}
