package com.municipality.wastecollection.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActiveDriverStatus {
    private String driverId;
    private String fullName;
    private String truckId;
    private String licensePlate;
    private Double latitude;
    private Double longitude;
    private LocalDateTime lastLocationUpdate;
    private String routeId;
    // "assigned" / "in_progress" for the driver's current route, "pending" without one
    private String routeStatus;
}
