package com.municipality.wastecollection.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.io.Serializable;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@Document(collection = "bins")
@JsonIgnoreProperties(ignoreUnknown = true)
@CompoundIndexes({
    @CompoundIndex(name = "active_fill_idx", def = "{'active': 1, 'currentFillLevel': -1}"),
    @CompoundIndex(name = "location_idx", def = "{'latitude': 1, 'longitude': 1}")
})
public class Bin implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final int MIN_CAPACITY_LITERS = 1;
    public static final int MAX_CAPACITY_LITERS = 10000;

    @Id
    private String id;

    @Indexed
    private String ownerId;

    private String name;

    @Indexed(unique = true, sparse = true)
    private String code;

    private int capacityLiters;
    private WasteType wasteType = WasteType.GENERAL;

    private double latitude;
    private double longitude;
    private String address;

    private FillLevel currentFillLevel = FillLevel.EMPTY;
    private LocalDateTime lastReported;
    private LocalDateTime lastEmptied;

    @Indexed
    private boolean active = true;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime deletedAt;

    /**
     * Derived on every read from the fill level and the active flag; never stored.
     */
    public boolean isNeedsCollection() {
        return active && currentFillLevel != null && currentFillLevel.requiresCollection();
    }

    /**
     * Detached copy handed out by the spatial index so callers never see later writes.
     */
    public Bin snapshot() {
        Bin copy = new Bin();
        copy.setId(id);
        copy.setOwnerId(ownerId);
        copy.setName(name);
        copy.setCode(code);
        copy.setCapacityLiters(capacityLiters);
        copy.setWasteType(wasteType);
        copy.setLatitude(latitude);
        copy.setLongitude(longitude);
        copy.setAddress(address);
        copy.setCurrentFillLevel(currentFillLevel);
        copy.setLastReported(lastReported);
        copy.setLastEmptied(lastEmptied);
        copy.setActive(active);
        copy.setCreatedAt(createdAt);
        copy.setUpdatedAt(updatedAt);
        copy.setDeletedAt(deletedAt);
        return copy;
    }
}
