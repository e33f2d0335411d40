package com.municipality.wastecollection.model;

import lombok.Data;

import java.time.LocalDateTime;

@Data
public class RouteStop {
    private String binId;
    private double latitude;
    private double longitude;
    private int sequenceNumber;
    private double estimatedMassKg;
    private boolean collected;
    private LocalDateTime collectedAt;
    private Double weightKg;
    private String notes;

    public RouteStop() {}

    public RouteStop(String binId, double latitude, double longitude, int sequenceNumber, double estimatedMassKg) {
        this.binId = binId;
        this.latitude = latitude;
        this.longitude = longitude;
        this.sequenceNumber = sequenceNumber;
        this.estimatedMassKg = estimatedMassKg;
        this.collected = false;
    }
}
