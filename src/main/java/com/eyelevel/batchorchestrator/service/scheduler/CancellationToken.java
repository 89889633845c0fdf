package com.eyelevel.batchorchestrator.service.scheduler;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag. Workers check it before taking the next item; an item already in
 * flight is never interrupted.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * @return {@code true} if this call cancelled the token, {@code false} if it already was.
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
