package com.phillippitts.modelelector.exception;

/**
 * Thrown when an election finishes without a single successful backend result.
 */
public class NoBackendAvailableException extends ModelElectorException {

    private final int dispatched;

    public NoBackendAvailableException(int dispatched) {
        super("No backend produced a successful prediction (dispatched=" + dispatched + ")");
        this.dispatched = dispatched;
    }

    public int getDispatched() {
        return dispatched;
    }
}
