package com.phillippitts.modelelector.service.dispatch;

import com.phillippitts.modelelector.domain.CallResult;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;

/**
 * In-flight calls of one election, in dispatch order, plus the queue they report into.
 *
 * <p>{@code completions} is filled by the call executor the moment each call finishes, so its
 * order is finish order regardless of when anyone starts reading it.
 *
 * @param calls one future per dispatched backend; each completes normally exactly once
 * @param completions results in the order the calls finished
 * @param startedAtNanos {@link System#nanoTime()} taken before the first call was started
 */
public record DispatchHandle(List<CompletableFuture<CallResult>> calls,
                             BlockingQueue<CallResult> completions,
                             long startedAtNanos) {

    public DispatchHandle {
        Objects.requireNonNull(calls, "calls");
        Objects.requireNonNull(completions, "completions");
        calls = List.copyOf(calls);
    }

    public int size() {
        return calls.size();
    }
}
