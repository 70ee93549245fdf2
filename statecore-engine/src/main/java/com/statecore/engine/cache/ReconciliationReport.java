package com.statecore.engine.cache;

/**
 * Result of one cache reconciliation sweep.
 */
public record ReconciliationReport(int l1Checked, int l1Evicted, int l2Checked, int l2Evicted, boolean l2Reachable) {

    public int totalEvicted() {
        return l1Evicted + l2Evicted;
    }
}
