package com.phillippitts.modelelector.config;

import com.phillippitts.modelelector.config.properties.ElectorProperties;
import com.phillippitts.modelelector.service.aggregate.CompletionOrderAggregator;
import com.phillippitts.modelelector.service.call.BackendCallExecutor;
import com.phillippitts.modelelector.service.call.BackendClient;
import com.phillippitts.modelelector.service.dispatch.Dispatcher;
import com.phillippitts.modelelector.service.election.DefaultElectionService;
import com.phillippitts.modelelector.service.election.ElectionService;
import com.phillippitts.modelelector.service.metrics.ElectionMetricsPublisher;
import com.phillippitts.modelelector.service.registry.BackendRegistry;
import com.phillippitts.modelelector.service.registry.BackendTargetResolver;
import com.phillippitts.modelelector.service.registry.HostnameProbeBackendTargetResolver;
import com.phillippitts.modelelector.service.registry.StaticBackendTargetResolver;
import com.phillippitts.modelelector.service.select.PrimaryPreferenceSelectionPolicy;
import com.phillippitts.modelelector.service.select.SelectionPolicy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Wires the election pipeline explicitly.
 *
 * <p>The backend resolver is a {@link ConditionalOnMissingBean} default, so a deployment can
 * replace discovery (e.g. a service-registry client) by declaring its own
 * {@link BackendTargetResolver} bean.
 */
@Configuration
public class ElectorConfig {

    private static final Logger LOG = LogManager.getLogger(ElectorConfig.class);

    private final ElectorProperties props;

    public ElectorConfig(ElectorProperties props) {
        this.props = props;
        validateTimeouts(props.getCallTimeout(), props.getTotalTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public BackendTargetResolver backendTargetResolver() {
        return switch (props.getDiscovery().getMode()) {
            case STATIC -> new StaticBackendTargetResolver(props.getBackends());
            case HOSTNAME_PROBE -> new HostnameProbeBackendTargetResolver(
                    props.getBackends(), props.getDiscovery().getProbeHost());
        };
    }

    @Bean
    public BackendRegistry backendRegistry(BackendTargetResolver resolver) {
        return new BackendRegistry(resolver);
    }

    @Bean
    public BackendCallExecutor backendCallExecutor(BackendClient backendClient,
                                                   @Qualifier("backendCallPool") Executor backendCallPool,
                                                   ElectionMetricsPublisher metrics) {
        return new BackendCallExecutor(backendClient, backendCallPool, props.getCallTimeout(), metrics);
    }

    @Bean
    public Dispatcher dispatcher(BackendCallExecutor backendCallExecutor) {
        return new Dispatcher(backendCallExecutor);
    }

    @Bean
    public CompletionOrderAggregator completionOrderAggregator(ElectionMetricsPublisher metrics) {
        return new CompletionOrderAggregator(props.getTotalTimeout(), metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public SelectionPolicy selectionPolicy() {
        return new PrimaryPreferenceSelectionPolicy();
    }

    @Bean
    public ElectionService electionService(BackendRegistry registry,
                                           Dispatcher dispatcher,
                                           CompletionOrderAggregator aggregator,
                                           SelectionPolicy selectionPolicy,
                                           ElectionMetricsPublisher metrics) {
        return new DefaultElectionService(registry, dispatcher, aggregator, selectionPolicy, metrics);
    }

    static void validateTimeouts(Duration callTimeout, Duration totalTimeout) {
        if (callTimeout == null || callTimeout.isZero() || callTimeout.isNegative()) {
            throw new IllegalArgumentException("elector.call-timeout must be positive, got: " + callTimeout);
        }
        if (totalTimeout == null || totalTimeout.isZero() || totalTimeout.isNegative()) {
            throw new IllegalArgumentException("elector.total-timeout must be positive, got: " + totalTimeout);
        }
        if (totalTimeout.compareTo(callTimeout) < 0) {
            LOG.warn("elector.total-timeout ({}) is shorter than elector.call-timeout ({}); "
                    + "slow backends will be dropped at the aggregate deadline before they time out",
                    totalTimeout, callTimeout);
        }
    }
}
