package com.municipality.wastecollection.model;

public enum AuditAction {
    CREATE,
    UPDATE,
    DELETE,
    FILL_REPORTED,
    COLLECTED,
    ASSIGNED,
    STARTED,
    STOP_COLLECTED,
    COMPLETED,
    CANCELLED,
    PAIRED,
    UNPAIRED,
    STATUS_CHANGED
}
