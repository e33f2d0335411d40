package com.municipality.wastecollection.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteCancelledEvent {
    private String routeId;
    private String driverId;
    private String reason;
    // Bins whose claim was released and that may be scheduled again
    private List<String> releasedBinIds;
    private LocalDateTime occurredAt;
}
