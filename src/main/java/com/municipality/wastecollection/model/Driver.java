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
@Document(collection = "drivers")
@JsonIgnoreProperties(ignoreUnknown = true)
public class Driver implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final int MIN_UPDATE_FREQUENCY_SECONDS = 10;
    public static final int MAX_UPDATE_FREQUENCY_SECONDS = 300;

    @Id
    private String id;

    private String fullName;

    @Indexed(unique = true)
    private String licenseNumber;

    @Indexed(unique = true, sparse = true)
    private String currentTruckId;

    @Indexed
    private boolean onDuty;

    private boolean locationSharingEnabled;
    private int locationUpdateFrequencySeconds = 30;

    private LocalDateTime lastActive;

    public boolean hasTruck() {
        return currentTruckId != null;
    }
}
