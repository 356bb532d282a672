package com.demo.vpnsync.model;

import java.time.Instant;

/**
 * Point-in-time snapshot of the scheduler. {@code running} (timer armed) and {@code syncing}
 * (a run in flight) are independent of each other.
 */
public final class SchedulerState {
    private final boolean running;
    private final boolean syncing;
    private final int intervalMinutes;
    private final String scheduleExpression;
    private final SyncRun lastRun;
    private final Instant nextFireTime;

    public SchedulerState(boolean running, boolean syncing, int intervalMinutes,
                          String scheduleExpression, SyncRun lastRun, Instant nextFireTime) {
        this.running = running;
        this.syncing = syncing;
        this.intervalMinutes = intervalMinutes;
        this.scheduleExpression = scheduleExpression;
        this.lastRun = lastRun;
        this.nextFireTime = nextFireTime;
    }

    public boolean isRunning() { return running; }
    public boolean isSyncing() { return syncing; }
    public int getIntervalMinutes() { return intervalMinutes; }
    public String getScheduleExpression() { return scheduleExpression; }
    public SyncRun getLastRun() { return lastRun; }
    public Instant getNextFireTime() { return nextFireTime; }
}
