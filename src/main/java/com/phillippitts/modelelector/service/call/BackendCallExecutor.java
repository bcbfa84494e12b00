package com.phillippitts.modelelector.service.call;

import com.phillippitts.modelelector.domain.BackendTarget;
import com.phillippitts.modelelector.domain.CallOutcome;
import com.phillippitts.modelelector.domain.CallResult;
import com.phillippitts.modelelector.exception.BackendCallException;
import com.phillippitts.modelelector.service.metrics.ElectionMetricsPublisher;
import com.phillippitts.modelelector.config.logging.MdcFilter;
import com.phillippitts.modelelector.util.LogSanitizer;
import com.phillippitts.modelelector.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Issues one outbound prediction call under a fixed call-level timeout.
 *
 * <p>The returned future always completes normally with a {@link CallResult}; transport
 * failures, non-2xx answers, timeouts and pool rejections are all captured as tags.
 *
 * <p><b>Timeout Behavior:</b> the call clock starts at submission. When it exceeds the call
 * timeout the future completes with a TIMEOUT result. The blocking transport call may keep
 * running on its pool thread; its late answer is discarded because a
 * {@link CompletableFuture} completes at most once.
 *
 * <p>Every terminal result is logged with backend, outcome and duration, published to
 * {@link ElectionMetricsPublisher}, and handed to the caller's completion sink on the thread that
 * finished the call, before the returned future completes.
 */
public class BackendCallExecutor {

    private static final Logger LOG = LogManager.getLogger(BackendCallExecutor.class);

    private static final int PAYLOAD_PREVIEW_CHARS = 200;

    private final BackendClient client;
    private final Executor executor;
    private final Duration callTimeout;
    private final ElectionMetricsPublisher metrics;

    /**
     * @param client transport used for the blocking call
     * @param executor pool the blocking call runs on
     * @param callTimeout per-call timeout (must be positive)
     * @param metrics metrics publisher ({@link ElectionMetricsPublisher#NOOP} in tests)
     */
    public BackendCallExecutor(BackendClient client,
                               Executor executor,
                               Duration callTimeout,
                               ElectionMetricsPublisher metrics) {
        this.client = Objects.requireNonNull(client, "client");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        if (callTimeout.isZero() || callTimeout.isNegative()) {
            throw new IllegalArgumentException("callTimeout must be positive, got: " + callTimeout);
        }
    }

    /**
     * Starts one call without blocking the caller.
     *
     * @param target backend to call
     * @param jsonBody request body
     * @param onFinish receives the call result exactly once, at the moment the call finishes
     * @return future that always completes normally with exactly one call result
     */
    public CompletableFuture<CallResult> execute(BackendTarget target,
                                                 String jsonBody,
                                                 Consumer<CallResult> onFinish) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(jsonBody, "jsonBody");
        Objects.requireNonNull(onFinish, "onFinish");
        final long t0 = System.nanoTime();
        LOG.debug("Calling backend {} at {}", target.name(), target.predictUrl());

        CompletableFuture<String> call;
        try {
            call = CompletableFuture.supplyAsync(() -> predictTagged(target, jsonBody), executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(finish(
                    CallResult.error(target, "rejected by backend call pool", TimeUtils.elapsedMillis(t0)), onFinish));
        }

        return call.orTimeout(callTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((payload, failure) ->
                        finish(toResult(target, payload, failure, TimeUtils.elapsedMillis(t0)), onFinish));
    }

    private String predictTagged(BackendTarget target, String jsonBody) {
        ThreadContext.put(MdcFilter.MDC_BACKEND, target.name());
        try {
            return client.predict(target, jsonBody);
        } finally {
            ThreadContext.remove(MdcFilter.MDC_BACKEND);
        }
    }

    private CallResult toResult(BackendTarget target, String payload, Throwable failure, long ms) {
        if (failure == null) {
            return CallResult.success(target, payload, ms);
        }
        Throwable cause = unwrap(failure);
        if (cause instanceof TimeoutException) {
            return CallResult.timeout(target, ms);
        }
        if (cause instanceof BackendCallException bce) {
            return bce.isTimedOut() ? CallResult.timeout(target, ms) : CallResult.error(target, bce.getMessage(), ms);
        }
        return CallResult.error(target, cause.getClass().getSimpleName() + ": " + cause.getMessage(), ms);
    }

    private CallResult finish(CallResult result, Consumer<CallResult> onFinish) {
        if (result.outcome() == CallOutcome.SUCCESS) {
            LOG.info("Backend call finished: backend={}, outcome={}, durationMs={}, payload={}",
                    result.target().name(), result.outcome().tag(), result.durationMs(),
                    LogSanitizer.truncate(result.payload(), PAYLOAD_PREVIEW_CHARS));
        } else if (result.outcome() == CallOutcome.TIMEOUT) {
            LOG.warn("Backend call finished: backend={}, outcome={}, durationMs={}, timeoutMs={}",
                    result.target().name(), result.outcome().tag(), result.durationMs(), callTimeout.toMillis());
        } else {
            LOG.error("Backend call finished: backend={}, outcome={}, durationMs={}, reason={}",
                    result.target().name(), result.outcome().tag(), result.durationMs(), result.reason());
        }
        metrics.recordCall(result);
        onFinish.accept(result);
        return result;
    }

    private static Throwable unwrap(Throwable t) {
        Throwable c = t;
        while (c instanceof CompletionException && c.getCause() != null) {
            c = c.getCause();
        }
        return c;
    }
}
