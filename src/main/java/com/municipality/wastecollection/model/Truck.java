package com.municipality.wastecollection.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.io.Serializable;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@Document(collection = "trucks")
@JsonIgnoreProperties(ignoreUnknown = true)
public class Truck implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    private String id;

    @Indexed(unique = true)
    private String licensePlate;

    private String model;
    private int capacityKg;
    private FuelType fuelType = FuelType.DIESEL;

    // Mirrors Driver.currentTruckId; both sides are written together by FleetService
    @Indexed(unique = true, sparse = true)
    private String currentDriverId;

    @Indexed
    private TruckStatus status = TruckStatus.AVAILABLE;
    private LocalDateTime statusUpdatedAt;

    private Double lastLatitude;
    private Double lastLongitude;
    private LocalDateTime lastLocationUpdate;

    private double totalDistanceKm;

    public boolean hasKnownPosition() {
        return lastLatitude != null && lastLongitude != null;
    }
}
