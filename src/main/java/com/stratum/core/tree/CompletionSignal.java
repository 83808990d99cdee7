package com.stratum.core.tree;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One-shot, multi-waiter notification that a node's summarization attempt has concluded.
 * <p>
 * Fires at most once. Waiters either block on {@link #await()} or compose on
 * {@link #asFuture()}; the backing future is never exposed for completion.
 */
public final class CompletionSignal {

    private final CompletableFuture<Void> fired = new CompletableFuture<>();

    /**
     * Fires the signal.
     *
     * @return true if this call fired it, false if it had already fired
     */
    public boolean signal() {
        return fired.complete(null);
    }

    public boolean isFired() {
        return fired.isDone();
    }

    public void await() throws InterruptedException {
        try {
            fired.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Completion signal completed exceptionally", e.getCause());
        }
    }

    /**
     * @return true if the signal fired within the timeout
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        try {
            fired.get(timeout, unit);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Completion signal completed exceptionally", e.getCause());
        }
    }

    /**
     * A read-only view for composing dependency joins. Completing or cancelling the
     * returned future has no effect on the signal.
     */
    public CompletableFuture<Void> asFuture() {
        return fired.copy();
    }
}
