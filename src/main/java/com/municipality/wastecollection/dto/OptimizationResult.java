package com.municipality.wastecollection.dto;

import com.municipality.wastecollection.model.CollectionRoute;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class OptimizationResult {

    private int candidateBins;

    // Committed routes, already ASSIGNED
    private List<CollectionRoute> routes = new ArrayList<>();

    // Clusters no available truck could take; nothing was persisted for them
    private List<ClusterPlan> unassignedClusters = new ArrayList<>();

    // Bins still lost to concurrent runs after the last attempt
    private List<String> schedulingConflicts = new ArrayList<>();

    private int attempts;

    public static OptimizationResult empty() {
        return new OptimizationResult();
    }
}
