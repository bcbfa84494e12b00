/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.modelelector.exception.ModelElectorException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.modelelector.exception.BackendConfigurationException} - Thrown at
 *       startup when the discovered backend set is invalid</li>
 *   <li>{@link com.phillippitts.modelelector.exception.NoBackendAvailableException} - Thrown when
 *       no backend produced a successful result (HTTP 503)</li>
 *   <li>{@link com.phillippitts.modelelector.exception.PayloadDecodeException} - Thrown when the
 *       selected payload is not valid JSON (HTTP 500)</li>
 *   <li>{@link com.phillippitts.modelelector.exception.BackendCallException} - Raised by the
 *       transport for a single failed call, contained by the call executor</li>
 * </ul>
 *
 * <p>Backend call timeouts and transport failures never reach the caller. They are captured as
 * {@link com.phillippitts.modelelector.domain.CallResult} tags at the call executor.
 *
 * @see com.phillippitts.modelelector.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.modelelector.exception;
