package com.demo.vpnsync.scheduler;

import com.demo.vpnsync.model.SyncRun;
import com.demo.vpnsync.model.SyncStatistics;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Finished runs, most recent first, capped at a fixed size. Oldest entries are evicted first.
 */
public class SyncHistory {
    private final int capacity;
    private final Deque<SyncRun> runs = new ArrayDeque<>();
    private long totalRuns;
    private long successfulRuns;
    private long failedRuns;

    public SyncHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized void record(SyncRun run) {
        if (run.getFinishedAt() == null) {
            throw new IllegalArgumentException("Only finished runs can be recorded");
        }
        runs.addFirst(run);
        while (runs.size() > capacity) {
            runs.removeLast();
        }

        totalRuns++;
        if (run.isAborted()) {
            failedRuns++;
        } else {
            successfulRuns++;
        }
    }

    /** Most recent run, or {@code null}. */
    public synchronized SyncRun latest() {
        return runs.peekFirst();
    }

    public synchronized List<SyncRun> recent(int limit) {
        List<SyncRun> result = new ArrayList<>(Math.min(limit, runs.size()));
        Iterator<SyncRun> it = runs.iterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return result;
    }

    public synchronized SyncStatistics statistics() {
        return new SyncStatistics(totalRuns, successfulRuns, failedRuns);
    }

    public synchronized void clear() {
        runs.clear();
        totalRuns = 0;
        successfulRuns = 0;
        failedRuns = 0;
    }
}
