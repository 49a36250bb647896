package com.riskmgmt.quant.engine.simulation;

/**
 * Cooperative cancellation flag. The simulation engine polls it while sampling;
 * once set it cannot be cleared.
 */
public class CancellationToken {

    private volatile boolean cancelled;

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }
}
