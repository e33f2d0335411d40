package com.municipality.wastecollection.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteCompletedEvent {
    private String routeId;
    private String driverId;
    private String truckId;
    private int binsCollected;
    private double totalWasteKg;
    private Double efficiencyScore;
    private LocalDateTime occurredAt;
}
