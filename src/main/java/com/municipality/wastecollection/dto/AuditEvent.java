package com.municipality.wastecollection.dto;

import com.municipality.wastecollection.model.AuditAction;
import com.municipality.wastecollection.model.AuditedEntity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A committed change, published by the service that owns the entity.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AuditEvent {
    private AuditedEntity entityType;
    private String entityId;
    private AuditAction action;
    private String actorId;
    private Map<String, Object> oldValues;
    private Map<String, Object> newValues;
    private LocalDateTime occurredAt;

    public static AuditEvent of(AuditedEntity entityType, String entityId, AuditAction action, String actorId,
                                Map<String, Object> oldValues, Map<String, Object> newValues) {
        return new AuditEvent(entityType, entityId, action, actorId, oldValues, newValues, LocalDateTime.now());
    }

    /**
     * Field map from alternating names and values. Null values are kept and enums are stored by name.
     */
    public static Map<String, Object> values(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/value pairs");
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            Object value = namesAndValues[i + 1];
            values.put(String.valueOf(namesAndValues[i]), value instanceof Enum ? ((Enum<?>) value).name() : value);
        }
        return values;
    }
}
