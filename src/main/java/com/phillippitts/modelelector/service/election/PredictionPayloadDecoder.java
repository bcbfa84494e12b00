package com.phillippitts.modelelector.service.election;

import com.phillippitts.modelelector.domain.Decision;
import com.phillippitts.modelelector.exception.PayloadDecodeException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * Validates the payload selected by an election as a JSON document.
 *
 * <p>Accepts a single JSON object or array with nothing but whitespace after it. The payload
 * text is returned as the backend sent it (trimmed), so key order and number formatting survive.
 */
public final class PredictionPayloadDecoder {

    private PredictionPayloadDecoder() {
        // Utility class - prevent instantiation
    }

    /**
     * Decodes the payload of a selected decision.
     *
     * @param decision election decision of kind {@link Decision.Kind#SELECTED}
     * @return JSON document text
     * @throws IllegalArgumentException if the decision selected nothing
     * @throws PayloadDecodeException if the selected payload is not a JSON object or array
     */
    public static String decode(Decision decision) {
        if (!decision.isSelected()) {
            throw new IllegalArgumentException("Only selected decisions carry a payload");
        }
        String backend = decision.source().name();
        String payload = decision.payload();
        if (payload.isBlank()) {
            throw new PayloadDecodeException(backend, "Selected payload is empty");
        }
        try {
            JSONTokener tokener = new JSONTokener(payload);
            char first = tokener.nextClean();
            tokener.back();
            if (first == '{') {
                new JSONObject(tokener);
            } else if (first == '[') {
                new JSONArray(tokener);
            } else {
                throw new PayloadDecodeException(backend, "Selected payload is not a JSON object or array");
            }
            if (tokener.nextClean() != 0) {
                throw new PayloadDecodeException(backend, "Selected payload has trailing content");
            }
            return payload.strip();
        } catch (JSONException e) {
            throw new PayloadDecodeException(backend, "Selected payload is not valid JSON: " + e.getMessage(), e);
        }
    }
}
