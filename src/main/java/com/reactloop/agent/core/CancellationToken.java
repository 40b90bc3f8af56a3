package com.reactloop.agent.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for one agent run.
 *
 * The loop checks it between steps only. An LLM request already in flight is bounded by the
 * per-attempt timeout instead. Safe to cancel from any thread.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
