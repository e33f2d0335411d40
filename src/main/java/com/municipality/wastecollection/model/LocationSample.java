package com.municipality.wastecollection.model;

import lombok.Value;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

@Value
@Document(collection = "location_samples")
@CompoundIndexes({
    @CompoundIndex(name = "driver_time_idx", def = "{'driverId': 1, 'recordedAt': -1}")
})
public class LocationSample {

    @Id
    String id;

    String driverId;

    // Truck the driver was bound to when the sample arrived, null when unassigned
    String truckId;

    double latitude;
    double longitude;
    Double accuracyMeters;
    Double heading;
    Double speedKmh;
    Double altitude;
    Integer batteryLevel;

    @Indexed
    LocalDateTime recordedAt;
}
