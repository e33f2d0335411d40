package com.municipality.wastecollection.model;

public enum TruckStatus {
    AVAILABLE,        // Ready for a new route
    ON_ROUTE,         // Reserved by an assigned or running route
    MAINTENANCE,
    OUT_OF_SERVICE
}
