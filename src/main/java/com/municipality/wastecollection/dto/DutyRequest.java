package com.municipality.wastecollection.dto;

import lombok.Data;

@Data
public class DutyRequest {
    private boolean onDuty;
}
