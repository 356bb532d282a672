package com.demo.vpnsync.scheduler;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import com.demo.vpnsync.model.SyncOptions;
import com.demo.vpnsync.model.SyncRun;
import com.demo.vpnsync.model.SyncStatistics;
import com.demo.vpnsync.model.SyncTrigger;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

public class SyncHistoryTest {

    private static SyncRun finishedRun(boolean aborted) {
        SyncRun.Recorder recorder = SyncRun.start(SyncTrigger.MANUAL, SyncOptions.defaults());
        if (aborted) {
            recorder.aborted("container down");
        }
        return recorder.finish();
    }

    @Test
    public void testMostRecentFirstAndCapped() {
        SyncHistory history = new SyncHistory(3);
        List<SyncRun> runs = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            SyncRun run = finishedRun(false);
            runs.add(run);
            history.record(run);
        }

        List<SyncRun> all = history.recent(10);
        assertEquals(3, all.size());
        assertSame(runs.get(4), all.get(0));
        assertSame(runs.get(3), all.get(1));
        assertSame(runs.get(2), all.get(2));
        assertSame(runs.get(4), history.latest());
        assertEquals(2, history.recent(2).size());
    }

    @Test
    public void testStatisticsCountEvictedRuns() {
        SyncHistory history = new SyncHistory(2);
        history.record(finishedRun(false));
        history.record(finishedRun(true));
        history.record(finishedRun(false));
        history.record(finishedRun(false));

        SyncStatistics statistics = history.statistics();
        assertEquals(4, statistics.getTotalRuns());
        assertEquals(3, statistics.getSuccessfulRuns());
        assertEquals(1, statistics.getFailedRuns());
        assertEquals(75.0, statistics.getSuccessRate(), 0.001);
    }

    @Test
    public void testClear() {
        SyncHistory history = new SyncHistory(2);
        history.record(finishedRun(false));
        history.clear();

        assertNull(history.latest());
        assertEquals(0, history.statistics().getTotalRuns());
        assertEquals(0.0, history.statistics().getSuccessRate(), 0.001);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCapacityMustBePositive() {
        new SyncHistory(0);
    }

    @Test(expected = IllegalStateException.class)
    public void testFinishedRunCannotBeAppendedTo() {
        SyncRun.Recorder recorder = SyncRun.start(SyncTrigger.SCHEDULED, SyncOptions.defaults());
        recorder.finish();
        recorder.created("late");
    }
}
