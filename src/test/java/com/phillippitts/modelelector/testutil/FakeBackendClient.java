package com.phillippitts.modelelector.testutil;

import com.phillippitts.modelelector.domain.BackendTarget;
import com.phillippitts.modelelector.exception.BackendCallException;
import com.phillippitts.modelelector.service.call.BackendClient;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Scriptable {@link BackendClient} for hermetic tests.
 *
 * <p>Each backend name is mapped to a behavior: answer after a delay, fail after a delay, or
 * hang until {@link #releaseAll()} is called. Unscripted backends fail with "unscripted".
 */
public class FakeBackendClient implements BackendClient {

    private final Map<String, Behavior> behaviors = new ConcurrentHashMap<>();
    private final List<String> calls = new CopyOnWriteArrayList<>();
    private volatile CountDownLatch release = new CountDownLatch(1);

    public FakeBackendClient answer(String backend, long delayMs, String payload) {
        behaviors.put(backend, new Behavior(delayMs, payload, null, false));
        return this;
    }

    public FakeBackendClient fail(String backend, long delayMs, String reason) {
        behaviors.put(backend, new Behavior(delayMs, null, reason, false));
        return this;
    }

    public FakeBackendClient failWithTimeout(String backend, long delayMs) {
        behaviors.put(backend, new Behavior(delayMs, null, "read timed out", true));
        return this;
    }

    public FakeBackendClient hang(String backend) {
        behaviors.put(backend, new Behavior(-1, "{\"late\":true}", null, false));
        return this;
    }

    /**
     * Lets calls hanging so far return their late payload. Calls started afterwards hang again.
     */
    public synchronized void releaseAll() {
        CountDownLatch current = release;
        release = new CountDownLatch(1);
        current.countDown();
    }

    /**
     * Backend names in the order their calls started.
     */
    public List<String> calls() {
        return List.copyOf(calls);
    }

    @Override
    public String predict(BackendTarget target, String jsonBody) {
        calls.add(target.name());
        Behavior b = behaviors.get(target.name());
        if (b == null) {
            throw new BackendCallException(target.name(), "unscripted");
        }
        try {
            if (b.delayMs < 0) {
                CountDownLatch gate = release;
                gate.await(30, TimeUnit.SECONDS);
            } else if (b.delayMs > 0) {
                Thread.sleep(b.delayMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendCallException(target.name(), "interrupted");
        }
        if (b.failure != null) {
            throw new BackendCallException(target.name(), b.failure, b.timedOut, null);
        }
        return b.payload;
    }

    private record Behavior(long delayMs, String payload, String failure, boolean timedOut) {}
}
