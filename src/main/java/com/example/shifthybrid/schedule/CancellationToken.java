package com.example.shifthybrid.schedule;

import com.example.shifthybrid.exception.GenerationCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation, checked between stages only.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled(String nextStage) {
        if (cancelled.get()) {
            throw new GenerationCancelledException(nextStage);
        }
    }
}
