package com.municipality.wastecollection.exception;

import lombok.Getter;

@Getter
public class CapacityExceededException extends RuntimeException {

    private final double requiredKg;
    private final double capacityKg;

    public CapacityExceededException(String truckId, double requiredKg, double capacityKg) {
        super(String.format("Truck %s cannot carry %.1f kg (capacity %.1f kg)", truckId, requiredKg, capacityKg));
        this.requiredKg = requiredKg;
        this.capacityKg = capacityKg;
    }
}
