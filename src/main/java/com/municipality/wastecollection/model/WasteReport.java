package com.municipality.wastecollection.model;

import lombok.Value;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

/**
 * Append-only fill level observation. The unique (binId, reportedAt) index backs the
 * duplicate-report check at the storage level.
 */
@Value
@Document(collection = "waste_reports")
@CompoundIndexes({
    @CompoundIndex(name = "bin_reported_uq", def = "{'binId': 1, 'reportedAt': 1}", unique = true),
    @CompoundIndex(name = "bin_reported_desc_idx", def = "{'binId': 1, 'reportedAt': -1}")
})
public class WasteReport {

    @Id
    String id;

    String binId;

    @Indexed
    String reporterId;

    FillLevel fillLevel;
    String notes;
    String reportedVia;

    @Indexed
    LocalDateTime reportedAt;
}
