package com.phillippitts.modelelector.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import org.json.JSONObject;

/**
 * Inbound feature vector for a prediction request (iris measurements in centimetres).
 *
 * <p>Jackson reads {@code 1e400} as infinity and {@code "NaN"} as NaN; neither can be encoded
 * for the backends, so both fail validation.
 *
 * @param sepalLength sepal length ({@code s_l})
 * @param sepalWidth  sepal width ({@code s_w})
 * @param petalLength petal length ({@code p_l})
 * @param petalWidth  petal width ({@code p_w})
 */
public record PredictionFeatures(
        @JsonProperty("s_l") @NotNull Double sepalLength,
        @JsonProperty("s_w") @NotNull Double sepalWidth,
        @JsonProperty("p_l") @NotNull Double petalLength,
        @JsonProperty("p_w") @NotNull Double petalWidth
) {

    @JsonIgnore
    @AssertTrue(message = "requires every feature to be a finite number")
    public boolean isFinite() {
        return finite(sepalLength) && finite(sepalWidth) && finite(petalLength) && finite(petalWidth);
    }

    // null is reported by @NotNull
    private static boolean finite(Double value) {
        return value == null || Double.isFinite(value);
    }

    /**
     * Encodes the features as the JSON body forwarded to every backend.
     *
     * @return JSON object text with keys {@code s_l, s_w, p_l, p_w}
     */
    public String toJson() {
        JSONObject body = new JSONObject();
        body.put("s_l", sepalLength);
        body.put("s_w", sepalWidth);
        body.put("p_l", petalLength);
        body.put("p_w", petalWidth);
        return body.toString();
    }
}
