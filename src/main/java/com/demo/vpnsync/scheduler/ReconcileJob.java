package com.demo.vpnsync.scheduler;

import com.demo.vpnsync.sync.SyncAbortedException;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Quartz entry point for timer-driven runs.
 */
@DisallowConcurrentExecution
public class ReconcileJob implements Job {
    private static final Logger logger = LoggerFactory.getLogger(ReconcileJob.class);

    static final String SCHEDULER_KEY = "syncScheduler";

    @Override
    public void execute(JobExecutionContext context) throws JobExecutionException {
        logger.info("Executing scheduled sync");

        SyncScheduler scheduler = (SyncScheduler)
            context.getJobDetail().getJobDataMap().get(SCHEDULER_KEY);

        try {
            scheduler.runScheduled();
        } catch (AlreadySyncingException e) {
            logger.warn("Sync already in progress, skipping this execution");
        } catch (SyncAbortedException e) {
            logger.error("Scheduled sync failed: {}", e.getMessage());
            throw new JobExecutionException(e);
        }
    }
}
