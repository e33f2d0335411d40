package com.municipality.wastecollection.model;

public enum AuditedEntity {
    BIN,
    ROUTE,
    TRUCK,
    DRIVER
}
