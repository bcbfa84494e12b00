package com.phillippitts.modelelector.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes backend call pool metrics via Micrometer.
 *
 * <ul>
 *   <li>elector.pool.size - Current number of threads in the pool</li>
 *   <li>elector.pool.active - Number of actively executing calls</li>
 *   <li>elector.pool.queued - Number of calls waiting in the queue</li>
 *   <li>elector.pool.completed - Cumulative count of completed calls</li>
 * </ul>
 *
 * <p>Additionally logs a pool summary every 5 minutes. Threads still blocked on backends that
 * already timed out show up here as active.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> executorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("backendCallPool") ObjectProvider<ThreadPoolTaskExecutor> executorProvider) {
        this.executorProvider = executorProvider;
    }

    @Bean
    public MeterBinder backendCallPoolMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = this.executorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("elector.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the backend call pool")
                    .register(registry);

            Gauge.builder("elector.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads blocked on backend calls")
                    .register(registry);

            Gauge.builder("elector.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of backend calls waiting in the queue")
                    .register(registry);

            Gauge.builder("elector.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed backend calls")
                    .register(registry);

            LOG.info("Backend call pool metrics registered: elector.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = this.executorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Backend Call Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount()
        );
    }
}
