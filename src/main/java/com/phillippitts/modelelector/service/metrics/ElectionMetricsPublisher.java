package com.phillippitts.modelelector.service.metrics;

import com.phillippitts.modelelector.domain.CallResult;
import com.phillippitts.modelelector.domain.Decision;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Null-safe facade over {@link ElectionMetrics} used by the election pipeline.
 *
 * <p>All methods are no-ops when constructed without metrics, which lets the call executor,
 * aggregator and election service run in plain unit tests.
 *
 * @see ElectionMetrics
 */
@Component
public final class ElectionMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(ElectionMetricsPublisher.class);

    /**
     * Singleton no-op instance for test environments and defaults.
     */
    public static final ElectionMetricsPublisher NOOP = new ElectionMetricsPublisher(null);

    private final ElectionMetrics metrics;

    /**
     * Constructs a metrics publisher with optional metrics support.
     *
     * @param metrics metrics tracking service (nullable for test mode)
     */
    public ElectionMetricsPublisher(ElectionMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("ElectionMetricsPublisher created without metrics (test mode)");
        }
    }

    /**
     * Records latency and outcome of one finished backend call.
     */
    public void recordCall(CallResult result) {
        if (metrics == null) {
            return;
        }
        String backend = result.target().name();
        String outcome = result.outcome().tag();
        metrics.recordCallLatency(backend, outcome, result.durationMs());
        metrics.incrementCallOutcome(backend, outcome);
    }

    /**
     * Records the final decision of an election.
     */
    public void recordDecision(Decision decision) {
        if (metrics == null) {
            return;
        }
        String source = decision.isSelected() ? decision.source().name() : "none";
        metrics.recordDecision(decision.kind().name().toLowerCase(Locale.ROOT), source);
    }

    public void recordDeadlineExceeded() {
        if (metrics == null) {
            return;
        }
        metrics.incrementDeadlineExceeded();
    }

    /**
     * Checks if metrics tracking is enabled.
     *
     * @return true if metrics are available, false if running in test mode
     */
    public boolean isEnabled() {
        return metrics != null;
    }
}
