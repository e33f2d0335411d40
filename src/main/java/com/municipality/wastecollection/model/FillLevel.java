package com.municipality.wastecollection.model;

/**
 * Ordered fill scale reported by establishments.
 * Declaration order is the scale order, so {@link #ordinal()} comparisons are meaningful.
 */
public enum FillLevel {
    EMPTY,
    QUARTER,
    HALF,
    THREE_QUARTERS,
    FULL;

    public boolean requiresCollection() {
        return compareTo(THREE_QUARTERS) >= 0;
    }

    public boolean isLowerThan(FillLevel other) {
        return other != null && compareTo(other) < 0;
    }
}
