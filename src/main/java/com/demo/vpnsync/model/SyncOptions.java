package com.demo.vpnsync.model;

public final class SyncOptions {
    private static final SyncOptions DEFAULTS = new SyncOptions(false, false);

    private final boolean dryRun;
    private final boolean deleteOrphaned;

    public SyncOptions(boolean dryRun, boolean deleteOrphaned) {
        this.dryRun = dryRun;
        this.deleteOrphaned = deleteOrphaned;
    }

    public static SyncOptions defaults() {
        return DEFAULTS;
    }

    public boolean isDryRun() { return dryRun; }

    public boolean isDeleteOrphaned() { return deleteOrphaned; }

    @Override
    public String toString() {
        return String.format("SyncOptions[dryRun=%s, deleteOrphaned=%s]", dryRun, deleteOrphaned);
    }
}
