package com.phillippitts.modelelector.exception;

/**
 * Thrown when the payload chosen by the selection policy is not a valid JSON document.
 */
public class PayloadDecodeException extends ModelElectorException {

    private final String backendName;

    public PayloadDecodeException(String backendName, String message) {
        super(message + " (backend: " + backendName + ")");
        this.backendName = backendName;
    }

    public PayloadDecodeException(String backendName, String message, Throwable cause) {
        super(message + " (backend: " + backendName + ")", cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
