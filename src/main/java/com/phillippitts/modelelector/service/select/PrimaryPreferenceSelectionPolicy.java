package com.phillippitts.modelelector.service.select;

import com.phillippitts.modelelector.domain.AggregateOutcome;
import com.phillippitts.modelelector.domain.CallResult;
import com.phillippitts.modelelector.domain.Decision;

import java.util.Objects;

/**
 * Prefers the primary backend's successful result; otherwise takes the first successful
 * secondary in completion order; otherwise reports that no backend is available.
 *
 * <p>A primary that errored, timed out, or was not observed before the aggregate deadline is
 * treated the same way: the primary did not succeed.
 */
public final class PrimaryPreferenceSelectionPolicy implements SelectionPolicy {

    @Override
    public Decision select(AggregateOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        CallResult firstSecondary = null;
        for (CallResult r : outcome.results()) {
            if (!r.isSuccess()) {
                continue;
            }
            if (r.target().primary()) {
                return Decision.selected(r);
            }
            if (firstSecondary == null) {
                firstSecondary = r;
            }
        }
        return firstSecondary != null ? Decision.selected(firstSecondary) : Decision.noBackendAvailable();
    }
}
