package com.municipality.wastecollection.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteProgressEvent {
    private String routeId;
    private String binId;
    private int collectedStops;
    private int totalStops;
    private double totalWasteKg;
    private LocalDateTime occurredAt;
}
