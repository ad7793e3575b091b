package com.example.inventory.batch;

public enum RunMode {
    /** Write the latest-state table only. */
    LATEST(true, false),
    /** Reconcile the roster against the latest-state table; write matched and unmatched lists. */
    RECONCILE(false, true),
    LATEST_AND_RECONCILE(true, true);

    private final boolean writesLatest;
    private final boolean reconciles;

    RunMode(boolean writesLatest, boolean reconciles) {
        this.writesLatest = writesLatest;
        this.reconciles = reconciles;
    }

    public boolean writesLatest() {
        return writesLatest;
    }

    public boolean reconciles() {
        return reconciles;
    }
}
