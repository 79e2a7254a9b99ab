package com.microsoft.capacityplanner.decoding;

/**
 * Raised when a solution cannot be read back with the layout of the model
 * it was produced for. Signals a bug, never a user error.
 */
public class PlanDecodeException extends RuntimeException {

    public PlanDecodeException(String message) {
        super(message);
    }
}
