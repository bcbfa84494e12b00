package com.phillippitts.modelelector.exception;

/**
 * Raised by a {@link com.phillippitts.modelelector.service.call.BackendClient} when one outbound
 * call fails. It never leaves {@link com.phillippitts.modelelector.service.call.BackendCallExecutor},
 * which converts it into a TIMEOUT or ERROR call result.
 */
public class BackendCallException extends ModelElectorException {

    private final String backendName;
    private final boolean timedOut;

    public BackendCallException(String backendName, String message, boolean timedOut, Throwable cause) {
        super(message + " (backend: " + backendName + ")", cause);
        this.backendName = backendName;
        this.timedOut = timedOut;
    }

    public BackendCallException(String backendName, String message) {
        super(message + " (backend: " + backendName + ")");
        this.backendName = backendName;
        this.timedOut = false;
    }

    public String getBackendName() {
        return backendName;
    }

    /**
     * Whether the transport gave up waiting for the backend (read timeout).
     */
    public boolean isTimedOut() {
        return timedOut;
    }
}
