package com.municipality.wastecollection.model;

import lombok.Value;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * One recorded change of a bin, route, truck or driver. Entries are only ever inserted; the
 * history of an entity is rebuilt by replaying its entries in {@code createdAt} order.
 */
@Value
@Document(collection = "audit_log")
@CompoundIndex(name = "entity_created_idx", def = "{'entityType': 1, 'entityId': 1, 'createdAt': 1}")
public class AuditEntry {

    @Id
    String id;

    @Indexed
    String actorId;

    AuditAction action;
    AuditedEntity entityType;
    String entityId;

    // Only the fields the action touched; null on creation
    Map<String, Object> oldValues;
    Map<String, Object> newValues;

    LocalDateTime createdAt;

    @Indexed
    LocalDate actionDate;
}
