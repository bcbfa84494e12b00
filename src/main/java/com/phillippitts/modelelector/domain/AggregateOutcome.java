package com.phillippitts.modelelector.domain;

import java.util.List;
import java.util.Objects;

/**
 * Call results collected by the aggregator before it stopped, in completion order.
 *
 * @param results          collected results, first finisher first
 * @param dispatched       number of calls that were dispatched
 * @param deadlineExceeded whether collection stopped because the aggregate deadline elapsed
 * @param elapsedMs        time from dispatch start until collection stopped
 */
public record AggregateOutcome(
        List<CallResult> results,
        int dispatched,
        boolean deadlineExceeded,
        long elapsedMs
) {

    public AggregateOutcome {
        Objects.requireNonNull(results, "results");
        results = List.copyOf(results);
        if (results.size() > dispatched) {
            throw new IllegalArgumentException("Collected " + results.size()
                    + " results but only " + dispatched + " calls were dispatched");
        }
    }

    /**
     * Number of dispatched calls that produced no observed result.
     */
    public int missing() {
        return dispatched - results.size();
    }
}
