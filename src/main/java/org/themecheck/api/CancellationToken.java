package org.themecheck.api;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation flag for one analysis run. Runs poll it at file boundaries and abandon
 * all partial results once it is set.
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    /**
     * @return A token that is never cancelled unless {@link #cancel()} is called on it.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    /**
     * Requests cancellation. Safe to call from any thread.
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @throws CancellationException if cancellation was requested.
     */
    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("Analysis run was cancelled");
        }
    }
}
