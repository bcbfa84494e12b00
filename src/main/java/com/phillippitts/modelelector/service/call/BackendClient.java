package com.phillippitts.modelelector.service.call;

import com.phillippitts.modelelector.domain.BackendTarget;
import com.phillippitts.modelelector.exception.BackendCallException;

/**
 * Transport for a single blocking prediction call to one backend.
 *
 * <p>Implementations must be thread-safe; the call executor invokes them concurrently from
 * the backend call pool.
 */
@FunctionalInterface
public interface BackendClient {

    /**
     * Posts the JSON body to the backend's {@code /predict} endpoint.
     *
     * @param target backend to call
     * @param jsonBody request body
     * @return response body as text (never null, may be empty)
     * @throws BackendCallException if the transport fails or the backend answers with a non-2xx status
     */
    String predict(BackendTarget target, String jsonBody);
}
