package com.demo.vpnsync.model;

public final class SyncStatistics {
    private final long totalRuns;
    private final long successfulRuns;
    private final long failedRuns;

    public SyncStatistics(long totalRuns, long successfulRuns, long failedRuns) {
        this.totalRuns = totalRuns;
        this.successfulRuns = successfulRuns;
        this.failedRuns = failedRuns;
    }

    public long getTotalRuns() { return totalRuns; }
    public long getSuccessfulRuns() { return successfulRuns; }
    public long getFailedRuns() { return failedRuns; }

    /** Percentage of runs that were not aborted, 0 when nothing has run yet. */
    public double getSuccessRate() {
        return totalRuns == 0 ? 0.0 : (successfulRuns * 100.0) / totalRuns;
    }
}
