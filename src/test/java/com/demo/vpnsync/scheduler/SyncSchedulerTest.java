package com.demo.vpnsync.scheduler;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.demo.vpnsync.model.SchedulerState;
import com.demo.vpnsync.model.SyncOptions;
import com.demo.vpnsync.model.SyncReport;
import com.demo.vpnsync.model.SyncRun;
import com.demo.vpnsync.model.SyncTrigger;
import com.demo.vpnsync.service.InMemoryDirectory;
import com.demo.vpnsync.service.InMemoryExternalStore;
import com.demo.vpnsync.sync.Reconciler;
import com.demo.vpnsync.sync.SyncAbortedException;
import java.util.Collections;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.quartz.CronTrigger;
import org.quartz.JobBuilder;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.quartz.Scheduler;
import org.quartz.simpl.RAMJobStore;

public class SyncSchedulerTest {

    private InMemoryDirectory directory;
    private InMemoryExternalStore store;
    private String quartzName;
    private Scheduler quartz;
    private SyncScheduler scheduler;
    private ExecutorService executor;

    @Before
    public void setup() throws Exception {
        directory = new InMemoryDirectory().verified(1, "alice").verified(2, "bob");
        store = new InMemoryExternalStore("alice", "dave");
        quartzName = "test-" + UUID.randomUUID();
        quartz = SyncScheduler.createQuartzScheduler(quartzName);
        scheduler = new SyncScheduler(new Reconciler(directory, store), quartz, new SyncHistory(10), 15, true);
        executor = Executors.newSingleThreadExecutor();
    }

    @After
    public void tearDown() throws Exception {
        executor.shutdownNow();
        scheduler.close();
    }

    @Test
    public void testQuartzSchedulerIsInMemoryWithOneThread() throws Exception {
        assertEquals(quartzName, quartz.getSchedulerName());
        assertEquals(RAMJobStore.class, quartz.getMetaData().getJobStoreClass());
        assertEquals(1, quartz.getMetaData().getThreadPoolSize());
        assertFalse(quartz.isStarted());
    }

    @Test
    public void testStartAndStop() throws Exception {
        assertFalse(scheduler.isRunning());
        assertNull(scheduler.getState().getNextFireTime());

        assertTrue(scheduler.start());
        assertFalse(scheduler.start());
        SchedulerState state = scheduler.getState();
        assertTrue(state.isRunning());
        assertFalse(state.isSyncing());
        assertNotNull(state.getNextFireTime());
        assertNotNull(quartz.getTrigger(SyncScheduler.TRIGGER_KEY));

        assertTrue(scheduler.stop());
        assertFalse(scheduler.stop());
        assertFalse(scheduler.isRunning());
        assertNull(scheduler.getState().getNextFireTime());
        assertNull(quartz.getTrigger(SyncScheduler.TRIGGER_KEY));
    }

    @Test
    public void testRestartAfterStop() throws Exception {
        assertTrue(scheduler.start());
        assertTrue(scheduler.stop());
        assertTrue(scheduler.start());
        assertTrue(scheduler.isRunning());
    }

    @Test
    public void testIntervalBounds() throws Exception {
        for (int invalid : new int[] {0, 61, -5}) {
            try {
                scheduler.updateInterval(invalid);
                fail("expected IllegalArgumentException for " + invalid);
            } catch (IllegalArgumentException expected) {
                // expected
            }
        }
        assertEquals(15, scheduler.getIntervalMinutes());

        scheduler.updateInterval(20);
        SchedulerState state = scheduler.getState();
        assertEquals(20, state.getIntervalMinutes());
        assertEquals("0 0/20 * * * ?", state.getScheduleExpression());
    }

    @Test
    public void testUpdateIntervalRearmsRunningTimer() throws Exception {
        scheduler.start();
        scheduler.updateInterval(5);

        CronTrigger trigger = (CronTrigger) quartz.getTrigger(SyncScheduler.TRIGGER_KEY);
        assertEquals("0 0/5 * * * ?", trigger.getCronExpression());
        assertTrue(scheduler.isRunning());
    }

    @Test
    public void testScheduleExpression() {
        assertEquals("0 0/1 * * * ?", SyncScheduler.scheduleExpression(1));
        assertEquals("0 0/15 * * * ?", SyncScheduler.scheduleExpression(15));
        assertEquals("0 0 * * * ?", SyncScheduler.scheduleExpression(60));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testConstructorRejectsInvalidInterval() {
        new SyncScheduler(new Reconciler(directory, store), quartz, new SyncHistory(10), 0, false);
    }

    @Test
    public void testManualRunWhileStoppedIsRecorded() throws Exception {
        SyncReport report = scheduler.runNow(new SyncOptions(false, false));

        assertFalse(scheduler.isRunning());
        SchedulerState state = scheduler.getState();
        assertSame(report.getRun(), state.getLastRun());
        assertEquals(SyncTrigger.MANUAL, state.getLastRun().getTrigger());
        assertEquals(Collections.singletonList("bob"), report.getRun().getCreated());
        assertEquals(1, scheduler.getStatistics().getTotalRuns());
    }

    @Test
    public void testConcurrentManualRunIsRejected() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        store.blockListing(entered, release);

        Future<SyncReport> first = executor.submit(() -> scheduler.runNow(SyncOptions.defaults()));
        assertTrue(entered.await(10, TimeUnit.SECONDS));
        assertTrue(scheduler.isSyncing());

        try {
            scheduler.runNow(SyncOptions.defaults());
            fail("expected AlreadySyncingException");
        } catch (AlreadySyncingException expected) {
            // expected
        }

        release.countDown();
        SyncReport report = first.get(10, TimeUnit.SECONDS);
        assertFalse(scheduler.isSyncing());
        assertEquals(1, scheduler.getStatistics().getTotalRuns());
        assertEquals(1, store.maxConcurrentCalls());
        assertEquals(Collections.singletonList("bob"), report.getRun().getCreated());
    }

    @Test
    public void testStopDuringRunLetsItFinish() throws Exception {
        scheduler.start();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        store.blockListing(entered, release);

        Future<SyncReport> run = executor.submit(() -> scheduler.runNow(SyncOptions.defaults()));
        assertTrue(entered.await(10, TimeUnit.SECONDS));

        assertTrue(scheduler.stop());
        assertFalse(scheduler.isRunning());
        assertTrue(scheduler.isSyncing());

        release.countDown();
        assertNotNull(run.get(10, TimeUnit.SECONDS));
        assertFalse(scheduler.isSyncing());
        assertEquals(1, scheduler.getRecentHistory(5).size());
    }

    @Test
    public void testIntervalChangeDuringRunKeepsSyncingState() throws Exception {
        scheduler.start();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        store.blockListing(entered, release);

        Future<SyncReport> run = executor.submit(() -> scheduler.runNow(SyncOptions.defaults()));
        assertTrue(entered.await(10, TimeUnit.SECONDS));

        scheduler.updateInterval(30);
        assertTrue(scheduler.isSyncing());
        assertEquals(30, scheduler.getIntervalMinutes());

        release.countDown();
        run.get(10, TimeUnit.SECONDS);
    }

    @Test
    public void testAbortedRunIsRecorded() throws Exception {
        store.unavailable(true);

        try {
            scheduler.runNow(SyncOptions.defaults());
            fail("expected SyncAbortedException");
        } catch (SyncAbortedException e) {
            assertSame(e.getPartialRun(), scheduler.getState().getLastRun());
        }
        assertEquals(1, scheduler.getStatistics().getFailedRuns());
        assertFalse(scheduler.isSyncing());
    }

    @Test
    public void testScheduledJobUsesScheduledOptions() throws Exception {
        JobDetail job = JobBuilder.newJob(ReconcileJob.class).withIdentity(SyncScheduler.JOB_KEY).build();
        job.getJobDataMap().put(ReconcileJob.SCHEDULER_KEY, scheduler);
        JobExecutionContext context = mock(JobExecutionContext.class);
        when(context.getJobDetail()).thenReturn(job);

        new ReconcileJob().execute(context);

        SyncRun run = scheduler.getState().getLastRun();
        assertEquals(SyncTrigger.SCHEDULED, run.getTrigger());
        assertFalse(run.isDryRun());
        assertTrue(run.isDeleteOrphaned());
        assertEquals(Collections.singletonList("dave"), run.getDeleted());
    }

    @Test
    public void testScheduledJobSkipsWhileSyncing() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        store.blockListing(entered, release);
        Future<SyncReport> manual = executor.submit(() -> scheduler.runNow(SyncOptions.defaults()));
        assertTrue(entered.await(10, TimeUnit.SECONDS));

        JobDetail job = JobBuilder.newJob(ReconcileJob.class).withIdentity(SyncScheduler.JOB_KEY).build();
        job.getJobDataMap().put(ReconcileJob.SCHEDULER_KEY, scheduler);
        JobExecutionContext context = mock(JobExecutionContext.class);
        when(context.getJobDetail()).thenReturn(job);
        new ReconcileJob().execute(context);

        release.countDown();
        manual.get(10, TimeUnit.SECONDS);
        assertEquals(1, scheduler.getStatistics().getTotalRuns());
        assertEquals(SyncTrigger.MANUAL, scheduler.getState().getLastRun().getTrigger());
    }

    @Test(expected = JobExecutionException.class)
    public void testScheduledJobReportsAbort() throws Exception {
        store.unavailable(true);
        JobDetail job = JobBuilder.newJob(ReconcileJob.class).withIdentity(SyncScheduler.JOB_KEY).build();
        job.getJobDataMap().put(ReconcileJob.SCHEDULER_KEY, scheduler);
        JobExecutionContext context = mock(JobExecutionContext.class);
        when(context.getJobDetail()).thenReturn(job);

        new ReconcileJob().execute(context);
    }

    @Test
    public void testResetStatistics() throws Exception {
        scheduler.runNow(SyncOptions.defaults());
        scheduler.resetStatistics();

        assertNull(scheduler.getState().getLastRun());
        assertEquals(0, scheduler.getStatistics().getTotalRuns());
    }
}
