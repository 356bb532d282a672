// src/main/java/com/demo/vpnsync/config/SyncSettings.java
package com.demo.vpnsync.config;

import com.demo.vpnsync.scheduler.SyncScheduler;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.fluent.Configurations;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed view over {@code application.properties}. JVM system properties override file values.
 */
public class SyncSettings {
    private static final Logger logger = LoggerFactory.getLogger(SyncSettings.class);

    public static final String DEFAULT_FILE = "application.properties";

    private final Configuration config;

    public SyncSettings(Configuration config) {
        this.config = config;
    }

    public static SyncSettings load(String fileName) throws ConfigurationException {
        Configurations configs = new Configurations();
        CompositeConfiguration composite = new CompositeConfiguration();
        composite.addConfiguration(new SystemConfiguration());
        composite.addConfiguration(configs.properties(fileName));
        return new SyncSettings(composite);
    }

    // Directory

    public String getDirectoryJdbcUrl() {
        return config.getString("directory.jdbc.url");
    }

    public String getDirectoryUser() {
        return config.getString("directory.jdbc.user");
    }

    public String getDirectoryPassword() {
        return config.getString("directory.jdbc.password", "");
    }

    public int getDirectoryQueryTimeoutSeconds() {
        return config.getInt("directory.query.timeout.seconds", 10);
    }

    public int getDirectoryPoolMaxSize() {
        return config.getInt("directory.pool.max.size", 5);
    }

    public int getDirectoryPoolMinIdle() {
        return config.getInt("directory.pool.min.idle", 1);
    }

    public long getDirectoryPoolConnectionTimeoutMs() {
        return config.getLong("directory.pool.connection.timeout.ms", 10000L);
    }

    // Access server

    public String getDockerUrl() {
        return config.getString("external.docker.url", "http://localhost:2375");
    }

    public String getContainerName() {
        return config.getString("external.container.name", "openvpn-server");
    }

    public int getExternalTimeoutSeconds() {
        return config.getInt("external.timeout.seconds", 30);
    }

    /** Empty when the profile proxy is not in use. */
    public String getProfileProxyUrl() {
        return config.getString("external.proxy.url", "").trim();
    }

    public boolean isProfileProxyEnabled() {
        return !getProfileProxyUrl().isEmpty();
    }

    // Scheduler

    /**
     * Configured interval, or the default when the configured value is out of range.
     */
    public int getSyncIntervalMinutes() {
        int minutes = config.getInt("sync.interval.minutes", SyncScheduler.DEFAULT_INTERVAL_MINUTES);
        if (minutes < SyncScheduler.MIN_INTERVAL_MINUTES || minutes > SyncScheduler.MAX_INTERVAL_MINUTES) {
            logger.warn("Invalid sync.interval.minutes: {}. Using default: {}",
                minutes, SyncScheduler.DEFAULT_INTERVAL_MINUTES);
            return SyncScheduler.DEFAULT_INTERVAL_MINUTES;
        }
        return minutes;
    }

    public boolean isSchedulerEnabled() {
        return config.getBoolean("sync.scheduler.enabled", true);
    }

    public boolean isRunOnStartup() {
        return config.getBoolean("sync.run.on.startup", false);
    }

    public int getHistorySize() {
        return config.getInt("sync.history.size", 10);
    }

    public boolean isScheduledDeleteOrphaned() {
        return config.getBoolean("sync.scheduled.delete.orphaned", false);
    }

    // HTTP API

    public boolean isApiEnabled() {
        return config.getBoolean("api.enabled", true);
    }

    public int getApiPort() {
        return config.getInt("api.port", 3000);
    }
}
