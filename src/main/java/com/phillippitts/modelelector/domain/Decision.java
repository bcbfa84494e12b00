package com.phillippitts.modelelector.domain;

import java.util.Objects;

/**
 * Final outcome of an election: either a selected payload with its source, or no backend.
 *
 * @param kind    decision kind
 * @param payload selected payload (null when no backend was available)
 * @param source  backend that produced the payload (null when no backend was available)
 */
public record Decision(Kind kind, String payload, BackendTarget source) {

    public enum Kind { SELECTED, NO_BACKEND_AVAILABLE }

    private static final Decision NO_BACKEND = new Decision(Kind.NO_BACKEND_AVAILABLE, null, null);

    public Decision {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.SELECTED) {
            Objects.requireNonNull(payload, "Selected decision must carry a payload");
            Objects.requireNonNull(source, "Selected decision must carry a source");
        } else if (payload != null || source != null) {
            throw new IllegalArgumentException("NO_BACKEND_AVAILABLE carries neither payload nor source");
        }
    }

    /**
     * Selects the payload of a successful call result.
     *
     * @param result successful call result
     * @return selected decision
     * @throws IllegalArgumentException if the result is not a success
     */
    public static Decision selected(CallResult result) {
        if (!result.isSuccess()) {
            throw new IllegalArgumentException("Cannot select a " + result.outcome() + " result");
        }
        return new Decision(Kind.SELECTED, result.payload(), result.target());
    }

    public static Decision noBackendAvailable() {
        return NO_BACKEND;
    }

    public boolean isSelected() {
        return kind == Kind.SELECTED;
    }
}
