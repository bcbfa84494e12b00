package com.phillippitts.modelelector.domain;

import java.util.Locale;

/**
 * Terminal state of a single backend call. Each call reaches exactly one of these once.
 */
public enum CallOutcome {
    SUCCESS,
    TIMEOUT,
    ERROR;

    /**
     * Lower-case tag used in log lines and metric tags.
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
