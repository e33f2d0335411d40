package com.municipality.wastecollection.model;

public enum FuelType {
    DIESEL,
    PETROL,
    ELECTRIC,
    HYBRID,
    CNG
}
