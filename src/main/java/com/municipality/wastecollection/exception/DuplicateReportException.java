package com.municipality.wastecollection.exception;

import java.time.LocalDateTime;

public class DuplicateReportException extends RuntimeException {

    public DuplicateReportException(String binId, LocalDateTime reportedAt) {
        super("A report for bin " + binId + " already exists at " + reportedAt);
    }
}
