package com.demo.vpnsync.model;

import java.time.Instant;
import java.util.List;

/**
 * Comparison of both stores together with scheduler state and recent history.
 */
public final class SyncStatus {
    private final int directoryTotal;
    private final int directoryWithoutUsername;
    private final int directoryUnverified;
    private final int externalTotal;
    private final List<String> inSync;
    private final List<String> missingInExternal;
    private final List<String> orphanedInExternal;
    private final SchedulerState scheduler;
    private final SyncStatistics statistics;
    private final List<SyncRun> recentHistory;
    private final Instant checkedAt;

    public SyncStatus(int directoryTotal, int directoryWithoutUsername, int directoryUnverified,
                      int externalTotal, List<String> inSync, List<String> missingInExternal,
                      List<String> orphanedInExternal, SchedulerState scheduler,
                      SyncStatistics statistics, List<SyncRun> recentHistory, Instant checkedAt) {
        this.directoryTotal = directoryTotal;
        this.directoryWithoutUsername = directoryWithoutUsername;
        this.directoryUnverified = directoryUnverified;
        this.externalTotal = externalTotal;
        this.inSync = List.copyOf(inSync);
        this.missingInExternal = List.copyOf(missingInExternal);
        this.orphanedInExternal = List.copyOf(orphanedInExternal);
        this.scheduler = scheduler;
        this.statistics = statistics;
        this.recentHistory = List.copyOf(recentHistory);
        this.checkedAt = checkedAt;
    }

    public int getDirectoryTotal() { return directoryTotal; }
    public int getDirectoryWithoutUsername() { return directoryWithoutUsername; }
    public int getDirectoryUnverified() { return directoryUnverified; }
    public int getExternalTotal() { return externalTotal; }
    public List<String> getInSync() { return inSync; }
    public List<String> getMissingInExternal() { return missingInExternal; }
    public List<String> getOrphanedInExternal() { return orphanedInExternal; }
    public SchedulerState getScheduler() { return scheduler; }
    public SyncStatistics getStatistics() { return statistics; }
    public List<SyncRun> getRecentHistory() { return recentHistory; }
    public Instant getCheckedAt() { return checkedAt; }

    public int getSyncPercentage() {
        int eligible = inSync.size() + missingInExternal.size();
        return eligible == 0 ? 100 : Math.round(inSync.size() * 100f / eligible);
    }
}
