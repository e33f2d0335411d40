package com.municipality.wastecollection.dto;

import com.municipality.wastecollection.model.Driver;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class LocationSharingRequest {

    private boolean enabled;

    // Keeps the current frequency when null
    @Min(Driver.MIN_UPDATE_FREQUENCY_SECONDS)
    @Max(Driver.MAX_UPDATE_FREQUENCY_SECONDS)
    private Integer updateFrequencySeconds;
}
