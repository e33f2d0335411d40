package com.municipality.wastecollection.dto;

import com.municipality.wastecollection.model.FillLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Raised once when a bin crosses into needing collection.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BinEligibleEvent {
    private String binId;
    private FillLevel fillLevel;
    private double latitude;
    private double longitude;
    private LocalDateTime occurredAt;
}
