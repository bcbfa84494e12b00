package com.phillippitts.modelelector.service.aggregate;

import com.phillippitts.modelelector.domain.AggregateOutcome;
import com.phillippitts.modelelector.domain.CallResult;
import com.phillippitts.modelelector.service.dispatch.DispatchHandle;
import com.phillippitts.modelelector.service.metrics.ElectionMetricsPublisher;
import com.phillippitts.modelelector.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Collects call results in the order the calls actually finish, bounded by an aggregate deadline.
 *
 * <p>Each in-flight call pushes its result onto the handle's completion queue on the thread that
 * finished it; the aggregating thread takes from that queue with the remaining deadline budget.
 * Calls that finished before aggregation started are therefore still read in finish order. Collection stops
 * when every call has reported or the deadline measured from dispatch start has elapsed,
 * whichever comes first.
 *
 * <p><b>Deadline:</b> a soft cutoff. A warning is logged, results already queued are kept, and
 * calls still pending are simply absent from the outcome. Pending calls are not cancelled.
 *
 * <p><b>Thread Safety:</b> stateless; all per-election state lives in local variables.
 */
public class CompletionOrderAggregator {

    private static final Logger LOG = LogManager.getLogger(CompletionOrderAggregator.class);

    private final Duration totalTimeout;
    private final ElectionMetricsPublisher metrics;

    public CompletionOrderAggregator(Duration totalTimeout, ElectionMetricsPublisher metrics) {
        this.totalTimeout = Objects.requireNonNull(totalTimeout, "totalTimeout");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        if (totalTimeout.isZero() || totalTimeout.isNegative()) {
            throw new IllegalArgumentException("totalTimeout must be positive, got: " + totalTimeout);
        }
    }

    /**
     * Waits for call results in completion order until all arrive or the deadline passes.
     *
     * @param handle in-flight calls of one election
     * @return results collected before stopping, first finisher first
     */
    public AggregateOutcome aggregate(DispatchHandle handle) {
        Objects.requireNonNull(handle, "handle");
        final int expected = handle.size();
        BlockingQueue<CallResult> completions = handle.completions();

        final long deadline = handle.startedAtNanos() + totalTimeout.toNanos();
        List<CallResult> collected = new ArrayList<>(expected);
        boolean deadlineExceeded = false;
        try {
            while (collected.size() < expected) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    deadlineExceeded = true;
                    break;
                }
                CallResult next = completions.poll(remaining, TimeUnit.NANOSECONDS);
                if (next != null) {
                    collected.add(next);
                    LOG.debug("Collected result {}/{}: backend={}, outcome={}",
                            collected.size(), expected, next.target().name(), next.outcome().tag());
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for backend results; {} of {} collected",
                    collected.size(), expected);
        }

        // Results that landed while the deadline check ran are still kept
        while (collected.size() < expected) {
            CallResult late = completions.poll();
            if (late == null) {
                break;
            }
            collected.add(late);
        }

        long elapsedMs = TimeUtils.elapsedMillis(handle.startedAtNanos());
        if (deadlineExceeded && collected.size() < expected) {
            LOG.warn("Aggregate deadline exceeded: totalTimeoutMs={}, elapsedMs={}, collected={}/{}",
                    totalTimeout.toMillis(), elapsedMs, collected.size(), expected);
            metrics.recordDeadlineExceeded();
        } else {
            deadlineExceeded = false;
        }
        return new AggregateOutcome(collected, expected, deadlineExceeded, elapsedMs);
    }
}
