package com.phillippitts.modelelector.service.select;

import com.phillippitts.modelelector.domain.AggregateOutcome;
import com.phillippitts.modelelector.domain.Decision;

/**
 * Reduces the collected call results of one election to a single decision.
 *
 * <p>Implementations must be deterministic: identical results in identical completion order
 * always produce the identical decision. They must never select a payload that is not present
 * in the outcome.
 */
@FunctionalInterface
public interface SelectionPolicy {

    Decision select(AggregateOutcome outcome);
}
