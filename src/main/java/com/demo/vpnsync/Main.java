// src/main/java/com/demo/vpnsync/Main.java
package com.demo.vpnsync;

import com.demo.vpnsync.api.SyncApiServer;
import com.demo.vpnsync.api.SyncFacade;
import com.demo.vpnsync.config.SyncSettings;
import com.demo.vpnsync.model.SyncOptions;
import com.demo.vpnsync.model.SyncReport;
import com.demo.vpnsync.model.SyncRun;
import com.demo.vpnsync.scheduler.AlreadySyncingException;
import com.demo.vpnsync.scheduler.SyncHistory;
import com.demo.vpnsync.scheduler.SyncScheduler;
import com.demo.vpnsync.service.DirectoryDataSource;
import com.demo.vpnsync.service.DirectoryReader;
import com.demo.vpnsync.service.DockerExecSacliTransport;
import com.demo.vpnsync.service.ExternalStoreClient;
import com.demo.vpnsync.service.JdbcDirectoryReader;
import com.demo.vpnsync.service.ProfileProxySacliTransport;
import com.demo.vpnsync.service.SacliStoreClient;
import com.demo.vpnsync.service.SacliTransport;
import com.demo.vpnsync.sync.Reconciler;
import com.demo.vpnsync.sync.SyncAbortedException;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Composition root. Runs as a long-lived service by default.
 *
 * <pre>
 *   (no args)                              scheduler + HTTP API
 *   --once [--dry-run] [--delete-orphaned] one reconciliation, then exit
 *   --check                                connectivity check, then exit
 * </pre>
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        List<String> flags = Arrays.asList(args);
        try {
            SyncSettings settings = SyncSettings.load(SyncSettings.DEFAULT_FILE);

            DirectoryDataSource directoryPool = new DirectoryDataSource(
                settings.getDirectoryJdbcUrl(),
                settings.getDirectoryUser(),
                settings.getDirectoryPassword(),
                settings.getDirectoryPoolMaxSize(),
                settings.getDirectoryPoolMinIdle(),
                settings.getDirectoryPoolConnectionTimeoutMs());
            DirectoryReader directory = new JdbcDirectoryReader(
                directoryPool, settings.getDirectoryQueryTimeoutSeconds());
            ExternalStoreClient externalStore = new SacliStoreClient(createTransport(settings));

            if (flags.contains("--check")) {
                boolean ok = new ConnectionCheck(directory, externalStore).run();
                directoryPool.close();
                System.exit(ok ? 0 : 1);
            }

            Reconciler reconciler = new Reconciler(directory, externalStore);
            SyncScheduler scheduler = new SyncScheduler(
                reconciler,
                SyncScheduler.createQuartzScheduler("vpnSyncScheduler"),
                new SyncHistory(settings.getHistorySize()),
                settings.getSyncIntervalMinutes(),
                settings.isScheduledDeleteOrphaned());
            SyncFacade facade = new SyncFacade(reconciler, scheduler);

            if (flags.contains("--once")) {
                SyncOptions options = new SyncOptions(
                    flags.contains("--dry-run"), flags.contains("--delete-orphaned"));
                int exitCode = runOnce(facade, options);
                facade.close();
                scheduler.close();
                directoryPool.close();
                System.exit(exitCode);
            }

            runService(settings, facade, scheduler, directoryPool);

        } catch (Exception e) {
            logger.error("Application failed: ", e);
            System.exit(1);
        }
    }

    private static SacliTransport createTransport(SyncSettings settings) {
        DockerExecSacliTransport docker = new DockerExecSacliTransport(
            settings.getDockerUrl(),
            settings.getContainerName(),
            settings.getExternalTimeoutSeconds());
        if (settings.isProfileProxyEnabled()) {
            return new ProfileProxySacliTransport(
                settings.getProfileProxyUrl(), settings.getExternalTimeoutSeconds(), docker);
        }
        return docker;
    }

    private static int runOnce(SyncFacade facade, SyncOptions options) throws AlreadySyncingException {
        try {
            SyncReport report = facade.fullSync(options);
            printSummary(report.getRun());

            if (!report.getTemporaryPasswords().isEmpty()) {
                System.out.println();
                System.out.println("Temporary passwords (send to users):");
                for (Map.Entry<String, String> entry : report.getTemporaryPasswords().entrySet()) {
                    System.out.println("  " + entry.getKey() + ": " + entry.getValue());
                }
            }
            return 0;
        } catch (SyncAbortedException e) {
            printSummary(e.getPartialRun());
            System.err.println("Sync aborted: " + e.getMessage());
            return 1;
        }
    }

    private static void printSummary(SyncRun run) {
        System.out.println();
        System.out.println("Summary" + (run.isDryRun() ? " (dry run, no changes made)" : "") + ":");
        System.out.println("  Created:  " + run.getCreated());
        System.out.println("  Updated:  " + run.getUpdated());
        System.out.println("  Deleted:  " + run.getDeleted());
        System.out.println("  Orphaned: " + run.getOrphaned());
        System.out.println("  Skipped:  " + run.getSkipped().size());
        System.out.println("  Errors:   " + run.getErrors());
    }

    private static void runService(SyncSettings settings, SyncFacade facade, SyncScheduler scheduler,
                                   DirectoryDataSource directoryPool) throws Exception {
        Vertx vertx = Vertx.vertx();
        SyncApiServer api = new SyncApiServer(vertx, facade);
        if (settings.isApiEnabled()) {
            api.start(settings.getApiPort());
        }

        if (settings.isRunOnStartup()) {
            try {
                facade.fullSync(SyncOptions.defaults());
            } catch (SyncAbortedException e) {
                logger.error("Startup sync failed: {}", e.getMessage());
            }
        }

        if (settings.isSchedulerEnabled()) {
            scheduler.start();
        } else {
            logger.info("Scheduled sync is disabled");
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down");
            try {
                api.close();
                scheduler.close();
                facade.close();
                directoryPool.close();
                vertx.close();
            } catch (Exception e) {
                logger.warn("Error during shutdown: {}", e.getMessage());
            }
        }, "shutdown"));
    }
}
