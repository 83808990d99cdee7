package com.stratum.core.tree;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A top-level entity (procedure, function, trigger, class) whose descendants' summaries
 * are folded into one container summary.
 * <p>
 * {@code pendingCount} only decreases after collection; {@link #markFinalized()} succeeds once.
 */
public final class ContainerInfo {

    private final String key;
    private final String kind;
    private final String name;
    private final String scope;
    private final int startLine;
    private final int endLine;
    private final AtomicInteger pendingCount = new AtomicInteger();
    private final AtomicBoolean finalized = new AtomicBoolean();

    public ContainerInfo(String key, String kind, String name, String scope, int startLine, int endLine) {
        this.key = key;
        this.kind = kind;
        this.name = name;
        this.scope = scope;
        this.startLine = startLine;
        this.endLine = endLine;
    }

    public String key() {
        return key;
    }

    public String kind() {
        return kind;
    }

    public String name() {
        return name;
    }

    public String scope() {
        return scope;
    }

    public int startLine() {
        return startLine;
    }

    public int endLine() {
        return endLine;
    }

    public int pendingCount() {
        return pendingCount.get();
    }

    public boolean isFinalized() {
        return finalized.get();
    }

    /** Collection-time only. */
    void addPending() {
        pendingCount.incrementAndGet();
    }

    /**
     * Decrements the pending count unless it is already zero.
     *
     * @return true only for the decrement that brought the count to zero
     */
    public boolean decrementPending() {
        while (true) {
            int current = pendingCount.get();
            if (current == 0) {
                return false;
            }
            if (pendingCount.compareAndSet(current, current - 1)) {
                return current == 1;
            }
        }
    }

    /**
     * @return true for the first caller only
     */
    public boolean markFinalized() {
        return finalized.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return "ContainerInfo[" + key + ", kind=" + kind + ", pending=" + pendingCount.get() + "]";
    }
}
