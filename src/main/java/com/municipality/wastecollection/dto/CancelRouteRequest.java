package com.municipality.wastecollection.dto;

import lombok.Data;

@Data
public class CancelRouteRequest {
    private String reason;
}
