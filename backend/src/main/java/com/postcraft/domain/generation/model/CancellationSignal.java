package com.postcraft.domain.generation.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a caller and one running generation.
 * Work already in flight finishes; no new provider call starts once the flag is set.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CancellationSignal parent;

    public CancellationSignal() {
        this(null);
    }

    private CancellationSignal(CancellationSignal parent) {
        this.parent = parent;
    }

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    /**
     * A signal that is cancelled when either it or this signal is cancelled.
     * Cancelling the child leaves this signal untouched.
     */
    public CancellationSignal child() {
        return new CancellationSignal(this);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || (parent != null && parent.isCancelled());
    }
}
