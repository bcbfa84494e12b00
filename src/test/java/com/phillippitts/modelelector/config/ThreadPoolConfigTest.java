package com.phillippitts.modelelector.config;

import com.phillippitts.modelelector.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void shouldCreateExecutorWithDefaultConfiguration() {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).backendCallPool();

        assertThat(executor.getCorePoolSize()).isEqualTo(8);
        assertThat(executor.getMaxPoolSize()).isEqualTo(32);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("backend-call-");
    }

    @Test
    void shouldUseCorrectThreadNamePrefix() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).backendCallPool();
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> threadName = new AtomicReference<>();

        executor.execute(() -> {
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(threadName.get()).startsWith("backend-call-");
    }

    @Test
    void shouldCopyMdcToWorkerAndClearItAfterwards() throws Exception {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getBackend().setCorePoolSize(1);
        properties.getBackend().setMaxPoolSize(1);
        executor = new ThreadPoolConfig(properties).backendCallPool();

        ThreadContext.put("requestId", "req-42");
        String during = executor.submit(() -> ThreadContext.get("requestId")).get(1, TimeUnit.SECONDS);
        ThreadContext.clearAll();
        // Same single worker thread, submitted without context
        String after = executor.submit(() -> ThreadContext.get("requestId")).get(1, TimeUnit.SECONDS);

        assertThat(during).isEqualTo("req-42");
        assertThat(after).isNull();
    }

    @Test
    void shouldRejectWhenPoolAndQueueAreFull() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getBackend().setCorePoolSize(1);
        properties.getBackend().setMaxPoolSize(1);
        properties.getBackend().setQueueCapacity(1);
        executor = new ThreadPoolConfig(properties).backendCallPool();
        CountDownLatch block = new CountDownLatch(1);

        try {
            executor.execute(() -> awaitQuietly(block));
            executor.execute(() -> awaitQuietly(block));

            assertThatThrownBy(() -> executor.execute(() -> { }))
                    .isInstanceOf(TaskRejectedException.class);
        } finally {
            block.countDown();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
