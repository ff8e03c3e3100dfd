package com.raditha.bytelift;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared between a caller and running decompilations.
 * Workers poll it at pass boundaries; nothing is ever interrupted mid-pass.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared none() token cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * @throws DecompilationCancelledException if cancellation has been requested
     */
    public void throwIfCancellationRequested() {
        if (cancelled.get()) {
            throw new DecompilationCancelledException();
        }
    }
}
