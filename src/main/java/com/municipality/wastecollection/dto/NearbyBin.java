package com.municipality.wastecollection.dto;

import com.municipality.wastecollection.model.Bin;
import lombok.Value;

@Value
public class NearbyBin {
    Bin bin;
    double distanceMeters;
}
