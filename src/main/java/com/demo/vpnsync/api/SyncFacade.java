package com.demo.vpnsync.api;

import com.demo.vpnsync.model.SchedulerState;
import com.demo.vpnsync.model.SingleUserResult;
import com.demo.vpnsync.model.SkipReason;
import com.demo.vpnsync.model.SyncOptions;
import com.demo.vpnsync.model.SyncReport;
import com.demo.vpnsync.model.SyncStatus;
import com.demo.vpnsync.scheduler.AlreadySyncingException;
import com.demo.vpnsync.scheduler.SyncScheduler;
import com.demo.vpnsync.service.DirectoryException;
import com.demo.vpnsync.service.ExternalStoreException;
import com.demo.vpnsync.sync.DirectoryUserNotFoundException;
import com.demo.vpnsync.sync.Reconciler;
import com.demo.vpnsync.sync.SyncAbortedException;
import com.demo.vpnsync.sync.SyncPlan;
import com.demo.vpnsync.sync.UserNotEligibleException;
import org.quartz.SchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Entry points used by the HTTP API, the CLI and the rest of the application. Every full sync
 * goes through {@link SyncScheduler#runNow} so there is a single guarded path that changes the
 * access server in bulk.
 */
public class SyncFacade implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SyncFacade.class);

    static final int STATUS_HISTORY_LIMIT = 5;

    private final Reconciler reconciler;
    private final SyncScheduler scheduler;
    private final ExecutorService passwordExecutor;

    public SyncFacade(Reconciler reconciler, SyncScheduler scheduler) {
        this.reconciler = reconciler;
        this.scheduler = scheduler;
        this.passwordExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "password-propagation");
            thread.setDaemon(true);
            return thread;
        });
    }

    public SyncReport fullSync(SyncOptions options) throws AlreadySyncingException, SyncAbortedException {
        return scheduler.runNow(options);
    }

    public SingleUserResult syncUser(long userId)
            throws DirectoryException, DirectoryUserNotFoundException, UserNotEligibleException,
            ExternalStoreException {
        return reconciler.syncUser(userId);
    }

    public void removeUser(String username) throws ExternalStoreException {
        reconciler.removeUser(username);
    }

    public SyncStatus status() throws DirectoryException, ExternalStoreException {
        SyncPlan plan = reconciler.plan();

        List<String> inSync = new ArrayList<>();
        plan.getToUpdate().forEach(u -> inSync.add(u.getUsername()));
        List<String> missing = new ArrayList<>();
        plan.getToCreate().forEach(u -> missing.add(u.getUsername()));

        SyncStatus status = new SyncStatus(
            plan.getDirectoryTotal(),
            (int) plan.countSkipped(SkipReason.NO_USERNAME),
            (int) plan.countSkipped(SkipReason.NOT_VERIFIED),
            plan.getExternalTotal(),
            inSync,
            missing,
            plan.getOrphaned(),
            scheduler.getState(),
            scheduler.getStatistics(),
            scheduler.getRecentHistory(STATUS_HISTORY_LIMIT),
            Instant.now());

        logger.info("Sync status: directoryTotal={}, externalTotal={}, inSync={}, missing={}, orphaned={}",
            status.getDirectoryTotal(), status.getExternalTotal(), inSync.size(), missing.size(),
            plan.getOrphaned().size());
        return status;
    }

    public boolean startScheduler() throws SchedulerException {
        return scheduler.start();
    }

    public boolean stopScheduler() throws SchedulerException {
        return scheduler.stop();
    }

    public SchedulerState updateInterval(int minutes) throws SchedulerException {
        scheduler.updateInterval(minutes);
        return scheduler.getState();
    }

    public SchedulerState schedulerState() {
        return scheduler.getState();
    }

    public SyncScheduler getScheduler() {
        return scheduler;
    }

    public void resetStatistics() {
        scheduler.resetStatistics();
    }

    /**
     * Pushes a changed password to the access server in the background. The returned future
     * completes with {@code false} if the push failed; failures are logged and never thrown.
     */
    public CompletableFuture<Boolean> propagatePassword(String username, String newPassword) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                reconciler.propagatePassword(username, newPassword);
                return true;
            } catch (ExternalStoreException | IllegalArgumentException e) {
                logger.error("Failed to propagate password for user {}: {}", username, e.getMessage());
                return false;
            }
        }, passwordExecutor);
    }

    @Override
    public void close() throws InterruptedException {
        passwordExecutor.shutdown();
        if (!passwordExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
            logger.warn("Password propagation still pending at shutdown");
            passwordExecutor.shutdownNow();
        }
    }
}
