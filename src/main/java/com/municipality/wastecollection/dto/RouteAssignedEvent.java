package com.municipality.wastecollection.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Sent to the driver's client when a route is bound to them and their truck.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteAssignedEvent {
    private String routeId;
    private String routeCode;
    private String driverId;
    private String truckId;
    private List<String> binIds;
    private LocalDateTime occurredAt;
}
