package com.phillippitts.modelelector.service.dispatch;

import com.phillippitts.modelelector.domain.BackendTarget;
import com.phillippitts.modelelector.domain.CallResult;
import com.phillippitts.modelelector.service.call.BackendCallExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Fans one request out to every backend. Starts all calls and returns immediately.
 */
public class Dispatcher {

    private static final Logger LOG = LogManager.getLogger(Dispatcher.class);

    private final BackendCallExecutor callExecutor;

    public Dispatcher(BackendCallExecutor callExecutor) {
        this.callExecutor = Objects.requireNonNull(callExecutor, "callExecutor");
    }

    /**
     * Starts one call per target.
     *
     * @param targets backends to call, in dispatch order
     * @param jsonBody request body forwarded to every backend
     * @return handle over the in-flight calls and their completion queue
     */
    public DispatchHandle dispatch(List<BackendTarget> targets, String jsonBody) {
        Objects.requireNonNull(targets, "targets");
        long startedAt = System.nanoTime();
        BlockingQueue<CallResult> completions = new LinkedBlockingQueue<>();
        List<CompletableFuture<CallResult>> calls = new ArrayList<>(targets.size());
        for (BackendTarget target : targets) {
            calls.add(callExecutor.execute(target, jsonBody, completions::offer));
        }
        LOG.info("Dispatched prediction to {} backends: {}", targets.size(),
                targets.stream().map(BackendTarget::name).toList());
        return new DispatchHandle(calls, completions, startedAt);
    }
}
