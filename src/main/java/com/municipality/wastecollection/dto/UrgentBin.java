package com.municipality.wastecollection.dto;

import com.municipality.wastecollection.model.FillLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Entry of the urgent-collection listing, tagged with its priority tier.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UrgentBin {
    private String binId;
    private String name;
    private String address;
    private double latitude;
    private double longitude;
    private FillLevel fillLevel;
    private LocalDateTime lastReported;
    private String priority;
}
