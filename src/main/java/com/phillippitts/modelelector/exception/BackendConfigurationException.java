package com.phillippitts.modelelector.exception;

/**
 * Thrown when the resolved backend set is unusable (empty, duplicate names, zero or several
 * primaries, malformed URLs). This is a fatal error that prevents the elector from starting.
 */
public class BackendConfigurationException extends ModelElectorException {

    public BackendConfigurationException(String message) {
        super("Invalid backend configuration: " + message);
    }

    public BackendConfigurationException(String message, Throwable cause) {
        super("Invalid backend configuration: " + message, cause);
    }
}
