package com.phillippitts.modelelector.domain;

import java.util.Objects;

/**
 * Tagged outcome of one dispatched backend call.
 *
 * <p>Exactly one {@code CallResult} is produced per dispatched call. Only {@link CallOutcome#SUCCESS}
 * results carry a payload; {@link CallOutcome#ERROR} results carry a reason.
 *
 * @param target     backend the call was sent to
 * @param outcome    terminal outcome
 * @param payload    raw response body (non-null only for SUCCESS)
 * @param reason     failure description (non-null for TIMEOUT and ERROR)
 * @param durationMs time from call start to the recorded outcome
 */
public record CallResult(
        BackendTarget target,
        CallOutcome outcome,
        String payload,
        String reason,
        long durationMs
) {

    public CallResult {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(outcome, "outcome");
        if (outcome == CallOutcome.SUCCESS) {
            Objects.requireNonNull(payload, "Successful call result must carry a payload");
        } else {
            if (payload != null) {
                throw new IllegalArgumentException("Only successful call results carry a payload");
            }
            Objects.requireNonNull(reason, "Failed call result must carry a reason");
        }
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must be >= 0, got: " + durationMs);
        }
    }

    public static CallResult success(BackendTarget target, String payload, long durationMs) {
        return new CallResult(target, CallOutcome.SUCCESS, payload, null, durationMs);
    }

    public static CallResult timeout(BackendTarget target, long durationMs) {
        return new CallResult(target, CallOutcome.TIMEOUT, null,
                "exceeded call timeout after " + durationMs + " ms", durationMs);
    }

    public static CallResult error(BackendTarget target, String reason, long durationMs) {
        return new CallResult(target, CallOutcome.ERROR, null, reason, durationMs);
    }

    public boolean isSuccess() {
        return outcome == CallOutcome.SUCCESS;
    }
}
