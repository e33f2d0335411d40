package com.municipality.wastecollection.exception;

/**
 * Raised for an illegal state-machine move, e.g. collecting a stop on a cancelled route.
 */
public class InvalidTransitionException extends RuntimeException {

    public InvalidTransitionException(String message) {
        super(message);
    }
}
