package com.municipality.wastecollection.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Data
@Document(collection = "collection_routes")
@CompoundIndexes({
    @CompoundIndex(name = "driver_status_idx", def = "{'driverId': 1, 'status': 1}"),
    @CompoundIndex(name = "truck_status_idx", def = "{'truckId': 1, 'status': 1}")
})
public class CollectionRoute {

    @Id
    private String id;

    @Indexed(unique = true, sparse = true)
    private String code;
    private String name;

    private String driverId;
    private String truckId;

    @Indexed
    private LocalDate scheduledDate;
    private LocalTime scheduledStartTime;
    private LocalTime scheduledEndTime;

    @Indexed
    private RouteStatus status = RouteStatus.PENDING;

    private List<RouteStop> stops = new ArrayList<>();

    private double plannedDistanceKm;
    private int estimatedDurationMinutes;
    private double estimatedMassKg;

    private LocalDateTime actualStartTime;
    private LocalDateTime actualEndTime;
    private Double actualDistanceKm;

    private int binsCollected;
    private double totalWasteKg;
    private Double efficiencyScore;

    private String createdBy;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime completedAt;
    private LocalDateTime cancelledAt;
    private String cancellationReason;

    public Optional<RouteStop> findStop(String binId) {
        if (stops == null) {
            return Optional.empty();
        }
        return stops.stream().filter(stop -> stop.getBinId().equals(binId)).findFirst();
    }

    public List<String> getBinIds() {
        if (stops == null) {
            return Collections.emptyList();
        }
        return stops.stream().map(RouteStop::getBinId).collect(Collectors.toList());
    }

    public boolean allStopsCollected() {
        return stops != null && !stops.isEmpty() && stops.stream().allMatch(RouteStop::isCollected);
    }

    public boolean isActive() {
        return status != null && !status.isTerminal();
    }
}
