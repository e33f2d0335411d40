package com.municipality.wastecollection.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One GPS fix pushed by a driver's device.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LocationSampleRequest {

    @NotNull
    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    private Double latitude;

    @NotNull
    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    private Double longitude;

    @PositiveOrZero
    private Double accuracyMeters;

    @DecimalMin("0.0")
    @DecimalMax("360.0")
    private Double heading;

    @PositiveOrZero
    private Double speedKmh;

    private Double altitude;

    @Min(0)
    @Max(100)
    private Integer batteryLevel;

    private LocalDateTime recordedAt;

    public static LocationSampleRequest at(double latitude, double longitude, LocalDateTime recordedAt) {
        LocationSampleRequest request = new LocationSampleRequest();
        request.setLatitude(latitude);
        request.setLongitude(longitude);
        request.setRecordedAt(recordedAt);
        return request;
    }
}
