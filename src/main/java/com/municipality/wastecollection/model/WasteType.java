package com.municipality.wastecollection.model;

public enum WasteType {
    GENERAL,
    RECYCLABLE,
    ORGANIC,
    HAZARDOUS
}
