package com.municipality.wastecollection.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Live position of a driver (and their truck, when assigned) for map clients.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TruckPositionEvent {
    private String driverId;
    private String truckId;
    private double latitude;
    private double longitude;
    private Double heading;
    private Double speedKmh;
    private LocalDateTime recordedAt;
}
