package com.truthbus.contract;

/**
 * Thrown when an observation is structurally invalid. The observation is
 * discarded and the target truth vector is left untouched.
 */
public class ObservationValidationException extends RuntimeException {

    public ObservationValidationException(String message) {
        super(message);
    }
}
