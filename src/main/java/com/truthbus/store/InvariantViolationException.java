package com.truthbus.store;

/**
 * A computed score left its legal range. This is a bug, never a caller error.
 */
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
