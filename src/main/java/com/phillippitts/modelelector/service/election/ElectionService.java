package com.phillippitts.modelelector.service.election;

import com.phillippitts.modelelector.domain.Decision;
import com.phillippitts.modelelector.domain.PredictionFeatures;

/**
 * Runs one election: scatter the request to every backend, gather results until the
 * aggregate deadline, and pick a single answer.
 */
public interface ElectionService {

    /**
     * Elects a prediction payload for the given features.
     *
     * @param features inbound feature vector
     * @return the decision; never null, {@link Decision.Kind#NO_BACKEND_AVAILABLE} when no backend succeeded
     */
    Decision elect(PredictionFeatures features);
}
