// src/main/java/com/demo/vpnsync/scheduler/SyncScheduler.java
package com.demo.vpnsync.scheduler;

import com.demo.vpnsync.model.SchedulerState;
import com.demo.vpnsync.model.SyncOptions;
import com.demo.vpnsync.model.SyncReport;
import com.demo.vpnsync.model.SyncRun;
import com.demo.vpnsync.model.SyncStatistics;
import com.demo.vpnsync.model.SyncTrigger;
import com.demo.vpnsync.sync.Reconciler;
import com.demo.vpnsync.sync.SyncAbortedException;
import org.quartz.CronScheduleBuilder;
import org.quartz.JobBuilder;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.quartz.TriggerKey;
import org.quartz.impl.StdSchedulerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the {@link Reconciler} on a recurring Quartz trigger and on demand, with at most one run
 * in flight at any time.
 *
 * <p>States: stopped, armed (timer scheduled) and syncing (a run executing). Being armed and
 * syncing are independent: stopping the timer lets a running sync finish, and manual runs work
 * while the timer is stopped. A manual request that arrives during a run is rejected with
 * {@link AlreadySyncingException}; a timer fire that arrives during a run is skipped.
 *
 * <p>State changes are serialized on an internal lock; status reads may come from any thread.
 */
public class SyncScheduler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SyncScheduler.class);

    public static final int MIN_INTERVAL_MINUTES = 1;
    public static final int MAX_INTERVAL_MINUTES = 60;
    public static final int DEFAULT_INTERVAL_MINUTES = 15;

    static final JobKey JOB_KEY = JobKey.jobKey("reconcileJob", "syncGroup");
    static final TriggerKey TRIGGER_KEY = TriggerKey.triggerKey("reconcileTrigger", "syncGroup");

    private final Reconciler reconciler;
    private final Scheduler quartz;
    private final SyncHistory history;
    private final SyncOptions scheduledOptions;

    private final Object lock = new Object();
    private final AtomicBoolean syncing = new AtomicBoolean();
    private volatile boolean running;
    private volatile int intervalMinutes;

    public SyncScheduler(Reconciler reconciler, Scheduler quartz, SyncHistory history,
                         int intervalMinutes, boolean deleteOrphanedOnSchedule) {
        validateInterval(intervalMinutes);
        this.reconciler = reconciler;
        this.quartz = quartz;
        this.history = history;
        this.intervalMinutes = intervalMinutes;
        this.scheduledOptions = new SyncOptions(false, deleteOrphanedOnSchedule);

        logger.info("Sync scheduler initialized: intervalMinutes={}, schedule='{}'",
            intervalMinutes, scheduleExpression(intervalMinutes));
    }

    /**
     * Creates an in-memory Quartz scheduler with a single worker thread.
     */
    public static Scheduler createQuartzScheduler(String instanceName) throws SchedulerException {
        Properties props = new Properties();
        props.setProperty(StdSchedulerFactory.PROP_SCHED_INSTANCE_NAME, instanceName);
        props.setProperty("org.quartz.scheduler.skipUpdateCheck", "true");
        props.setProperty(StdSchedulerFactory.PROP_THREAD_POOL_CLASS, "org.quartz.simpl.SimpleThreadPool");
        props.setProperty("org.quartz.threadPool.threadCount", "1");
        props.setProperty(StdSchedulerFactory.PROP_JOB_STORE_CLASS, "org.quartz.simpl.RAMJobStore");
        return new StdSchedulerFactory(props).getScheduler();
    }

    /**
     * Quartz cron expression firing every {@code minutes} minutes, aligned to the hour.
     */
    public static String scheduleExpression(int minutes) {
        validateInterval(minutes);
        // Quartz rejects a minute increment of 60
        return minutes == MAX_INTERVAL_MINUTES ? "0 0 * * * ?" : "0 0/" + minutes + " * * * ?";
    }

    public static void validateInterval(int minutes) {
        if (minutes < MIN_INTERVAL_MINUTES || minutes > MAX_INTERVAL_MINUTES) {
            throw new IllegalArgumentException(String.format(
                "Interval must be between %d and %d minutes, got %d",
                MIN_INTERVAL_MINUTES, MAX_INTERVAL_MINUTES, minutes));
        }
    }

    /**
     * Arms the timer. Returns {@code false} without doing anything if it is already armed.
     */
    public boolean start() throws SchedulerException {
        synchronized (lock) {
            if (running) {
                logger.warn("Sync scheduler is already running");
                return false;
            }
            if (!quartz.isStarted()) {
                quartz.start();
            }

            JobDetail job = JobBuilder.newJob(ReconcileJob.class)
                .withIdentity(JOB_KEY)
                .build();
            job.getJobDataMap().put(ReconcileJob.SCHEDULER_KEY, this);

            quartz.scheduleJob(job, buildTrigger(intervalMinutes));
            running = true;

            logger.info("Sync scheduler started: intervalMinutes={}, schedule='{}'",
                intervalMinutes, scheduleExpression(intervalMinutes));
            return true;
        }
    }

    /**
     * Disarms the timer. A run already in progress is left to finish. Returns {@code false} if
     * the timer was not armed.
     */
    public boolean stop() throws SchedulerException {
        synchronized (lock) {
            if (!running) {
                logger.warn("Sync scheduler is not running");
                return false;
            }
            quartz.deleteJob(JOB_KEY);
            running = false;

            logger.info("Sync scheduler stopped{}", syncing.get() ? " (current run will finish)" : "");
            return true;
        }
    }

    /**
     * Changes the period. When the timer is armed it is re-armed with the new period; a run in
     * progress is not affected.
     */
    public void updateInterval(int minutes) throws SchedulerException {
        validateInterval(minutes);
        synchronized (lock) {
            intervalMinutes = minutes;
            if (running) {
                quartz.rescheduleJob(TRIGGER_KEY, buildTrigger(minutes));
            }
            logger.info("Sync interval updated: intervalMinutes={}, schedule='{}'",
                minutes, scheduleExpression(minutes));
        }
    }

    /**
     * Runs a reconciliation on the calling thread.
     *
     * @throws AlreadySyncingException if another run is in flight; nothing is changed
     * @throws SyncAbortedException if the run stopped early; the partial run is still recorded
     */
    public SyncReport runNow(SyncOptions options) throws AlreadySyncingException, SyncAbortedException {
        logger.info("Manual sync triggered");
        return executeSync(SyncTrigger.MANUAL, options);
    }

    void runScheduled() throws AlreadySyncingException, SyncAbortedException {
        executeSync(SyncTrigger.SCHEDULED, scheduledOptions);
    }

    private SyncReport executeSync(SyncTrigger trigger, SyncOptions options)
            throws AlreadySyncingException, SyncAbortedException {
        if (!syncing.compareAndSet(false, true)) {
            logger.warn("Rejected {} sync: a run is already in progress", trigger.getLabel());
            throw new AlreadySyncingException();
        }
        try {
            SyncReport report = reconciler.run(trigger, options);
            history.record(report.getRun());
            logger.info("Sync completed in {} ms", report.getRun().getDuration().toMillis());
            return report;
        } catch (SyncAbortedException e) {
            history.record(e.getPartialRun());
            throw e;
        } finally {
            syncing.set(false);
        }
    }

    public SchedulerState getState() {
        return new SchedulerState(running, syncing.get(), intervalMinutes,
            scheduleExpression(intervalMinutes), history.latest(), nextFireTime());
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isSyncing() {
        return syncing.get();
    }

    public int getIntervalMinutes() {
        return intervalMinutes;
    }

    public List<SyncRun> getRecentHistory(int limit) {
        return history.recent(limit);
    }

    public SyncStatistics getStatistics() {
        return history.statistics();
    }

    public void resetStatistics() {
        history.clear();
        logger.info("Scheduler statistics reset");
    }

    private Instant nextFireTime() {
        if (!running) {
            return null;
        }
        try {
            Trigger trigger = quartz.getTrigger(TRIGGER_KEY);
            Date next = trigger == null ? null : trigger.getNextFireTime();
            return next == null ? null : next.toInstant();
        } catch (SchedulerException e) {
            logger.warn("Could not read next fire time: {}", e.getMessage());
            return null;
        }
    }

    private static Trigger buildTrigger(int minutes) {
        return TriggerBuilder.newTrigger()
            .withIdentity(TRIGGER_KEY)
            .forJob(JOB_KEY)
            .withSchedule(CronScheduleBuilder.cronSchedule(scheduleExpression(minutes))
                .withMisfireHandlingInstructionDoNothing())
            .build();
    }

    /**
     * Shuts down the Quartz scheduler, waiting for a scheduled run in progress to finish.
     */
    @Override
    public void close() throws SchedulerException {
        synchronized (lock) {
            running = false;
            quartz.shutdown(true);
        }
    }
}
