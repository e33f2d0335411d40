package com.municipality.wastecollection.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * A bin or truck was already claimed by another route when this one tried to commit.
 */
@Getter
public class SchedulingConflictException extends RuntimeException {

    private final List<String> conflictingBinIds;

    public SchedulingConflictException(String message) {
        this(message, Collections.emptyList());
    }

    public SchedulingConflictException(String message, List<String> conflictingBinIds) {
        super(message);
        this.conflictingBinIds = List.copyOf(conflictingBinIds);
    }
}
