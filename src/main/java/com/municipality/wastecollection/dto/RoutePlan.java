package com.municipality.wastecollection.dto;

import com.municipality.wastecollection.model.RouteStop;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A sequenced cluster bound to a truck, ready to be committed as a route.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RoutePlan {
    private String truckId;
    private String driverId;
    private List<RouteStop> stops;
    private double plannedDistanceKm;
    private int estimatedDurationMinutes;
    private double estimatedMassKg;
}
