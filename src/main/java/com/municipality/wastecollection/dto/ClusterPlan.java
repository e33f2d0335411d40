package com.municipality.wastecollection.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A group of bins the optimizer would collect in one trip.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClusterPlan {
    // Highest-priority bin first
    private List<String> binIds;
    private double estimatedMassKg;
    private double centroidLatitude;
    private double centroidLongitude;
}
