package com.clipfeed.sampler.common;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative abort flag passed into every public read entry point.
 * Callers abort; the engine only checks.
 */
public final class CancellationToken {
    private final AtomicBoolean aborted = new AtomicBoolean(false);
    private final CancellationToken parent;

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    public static CancellationToken create() {
        return new CancellationToken(null);
    }

    public static CancellationToken childOf(CancellationToken parent) {
        return new CancellationToken(parent);
    }

    public static CancellationToken aborted() {
        CancellationToken token = new CancellationToken(null);
        token.abort();
        return token;
    }

    public void abort() {
        aborted.set(true);
    }

    public boolean isAborted() {
        return aborted.get() || (parent != null && parent.isAborted());
    }

    public static boolean isAborted(CancellationToken token) {
        return token != null && token.isAborted();
    }
}
