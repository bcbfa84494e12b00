package com.phillippitts.modelelector.exception;

/**
 * Base exception for all model-elector application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class ModelElectorException extends RuntimeException {

    public ModelElectorException(String message) {
        super(message);
    }

    public ModelElectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
