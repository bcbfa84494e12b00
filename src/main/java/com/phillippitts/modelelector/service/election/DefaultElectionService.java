package com.phillippitts.modelelector.service.election;

import com.phillippitts.modelelector.domain.AggregateOutcome;
import com.phillippitts.modelelector.domain.Decision;
import com.phillippitts.modelelector.domain.PredictionFeatures;
import com.phillippitts.modelelector.service.aggregate.CompletionOrderAggregator;
import com.phillippitts.modelelector.service.dispatch.DispatchHandle;
import com.phillippitts.modelelector.service.dispatch.Dispatcher;
import com.phillippitts.modelelector.service.metrics.ElectionMetricsPublisher;
import com.phillippitts.modelelector.service.registry.BackendRegistry;
import com.phillippitts.modelelector.service.select.SelectionPolicy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Default election pipeline: {@link Dispatcher} → {@link CompletionOrderAggregator} →
 * {@link SelectionPolicy}.
 *
 * <p>Per-request state machine: dispatched, aggregating, then resolved with either a selected
 * payload or no backend. No retries happen at any step; a failed or timed-out call is final
 * for the request.
 */
public class DefaultElectionService implements ElectionService {

    private static final Logger LOG = LogManager.getLogger(DefaultElectionService.class);

    private final BackendRegistry registry;
    private final Dispatcher dispatcher;
    private final CompletionOrderAggregator aggregator;
    private final SelectionPolicy selectionPolicy;
    private final ElectionMetricsPublisher metrics;

    public DefaultElectionService(BackendRegistry registry,
                                  Dispatcher dispatcher,
                                  CompletionOrderAggregator aggregator,
                                  SelectionPolicy selectionPolicy,
                                  ElectionMetricsPublisher metrics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.selectionPolicy = Objects.requireNonNull(selectionPolicy, "selectionPolicy");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public Decision elect(PredictionFeatures features) {
        Objects.requireNonNull(features, "features");

        DispatchHandle handle = dispatcher.dispatch(registry.targets(), features.toJson());
        AggregateOutcome outcome = aggregator.aggregate(handle);
        Decision decision = selectionPolicy.select(outcome);

        if (decision.isSelected()) {
            LOG.info("Election resolved: decision=selected, source={}, primary={}, collected={}/{}, elapsedMs={}",
                    decision.source().name(), decision.source().primary(),
                    outcome.results().size(), outcome.dispatched(), outcome.elapsedMs());
        } else {
            LOG.error("Election resolved: decision=no_backend_available, collected={}/{}, elapsedMs={}, outcomes={}",
                    outcome.results().size(), outcome.dispatched(), outcome.elapsedMs(),
                    outcome.results().stream().map(r -> r.target().name() + "=" + r.outcome().tag()).toList());
        }
        metrics.recordDecision(decision);
        return decision;
    }
}
