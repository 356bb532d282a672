package com.demo.vpnsync.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one reconciliation pass. Instances are frozen; a run in progress is tracked by a
 * {@link Recorder} and turned into a {@code SyncRun} once it finishes.
 */
public final class SyncRun {
    private final SyncTrigger trigger;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final boolean dryRun;
    private final boolean deleteOrphaned;
    private final List<String> created;
    private final List<String> updated;
    private final List<String> deleted;
    private final List<String> orphaned;
    private final List<SkippedUser> skipped;
    private final List<SyncError> errors;
    private final String abortReason;

    private SyncRun(Recorder recorder, Instant finishedAt) {
        this.trigger = recorder.trigger;
        this.startedAt = recorder.startedAt;
        this.finishedAt = finishedAt;
        this.dryRun = recorder.options.isDryRun();
        this.deleteOrphaned = recorder.options.isDeleteOrphaned();
        this.created = Collections.unmodifiableList(new ArrayList<>(recorder.created));
        this.updated = Collections.unmodifiableList(new ArrayList<>(recorder.updated));
        this.deleted = Collections.unmodifiableList(new ArrayList<>(recorder.deleted));
        this.orphaned = Collections.unmodifiableList(new ArrayList<>(recorder.orphaned));
        this.skipped = Collections.unmodifiableList(new ArrayList<>(recorder.skipped));
        this.errors = Collections.unmodifiableList(new ArrayList<>(recorder.errors));
        this.abortReason = recorder.abortReason;
    }

    public static Recorder start(SyncTrigger trigger, SyncOptions options) {
        return new Recorder(trigger, options, Instant.now());
    }

    public SyncTrigger getTrigger() { return trigger; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public boolean isDryRun() { return dryRun; }
    public boolean isDeleteOrphaned() { return deleteOrphaned; }
    public List<String> getCreated() { return created; }
    public List<String> getUpdated() { return updated; }
    public List<String> getDeleted() { return deleted; }
    public List<String> getOrphaned() { return orphaned; }
    public List<SkippedUser> getSkipped() { return skipped; }
    public List<SyncError> getErrors() { return errors; }

    /** Set when the run stopped early because a store was unreachable. */
    public String getAbortReason() { return abortReason; }

    public boolean isAborted() {
        return abortReason != null;
    }

    public Duration getDuration() {
        return Duration.between(startedAt, finishedAt);
    }

    @Override
    public String toString() {
        return String.format(
            "SyncRun[trigger=%s, dryRun=%s, created=%d, updated=%d, deleted=%d, orphaned=%d, "
                + "skipped=%d, errors=%d, aborted=%s]",
            trigger.getLabel(), dryRun, created.size(), updated.size(), deleted.size(),
            orphaned.size(), skipped.size(), errors.size(), isAborted());
    }

    /**
     * Collects results while a run is executing. Not thread-safe; owned by the run's thread.
     */
    public static final class Recorder {
        private final SyncTrigger trigger;
        private final SyncOptions options;
        private final Instant startedAt;
        private final List<String> created = new ArrayList<>();
        private final List<String> updated = new ArrayList<>();
        private final List<String> deleted = new ArrayList<>();
        private final List<String> orphaned = new ArrayList<>();
        private final List<SkippedUser> skipped = new ArrayList<>();
        private final List<SyncError> errors = new ArrayList<>();
        private String abortReason;
        private SyncRun finished;

        private Recorder(SyncTrigger trigger, SyncOptions options, Instant startedAt) {
            this.trigger = trigger;
            this.options = options;
            this.startedAt = startedAt;
        }

        public SyncOptions getOptions() {
            return options;
        }

        public void created(String username) {
            checkOpen();
            created.add(username);
        }

        public void updated(String username) {
            checkOpen();
            updated.add(username);
        }

        public void deleted(String username) {
            checkOpen();
            deleted.add(username);
        }

        public void orphaned(String username) {
            checkOpen();
            orphaned.add(username);
        }

        public void skipped(SkippedUser user) {
            checkOpen();
            skipped.add(user);
        }

        public void error(String username, String message) {
            checkOpen();
            errors.add(new SyncError(username, message));
        }

        public void aborted(String reason) {
            checkOpen();
            abortReason = reason;
        }

        public SyncRun finish() {
            checkOpen();
            finished = new SyncRun(this, Instant.now());
            return finished;
        }

        private void checkOpen() {
            if (finished != null) {
                throw new IllegalStateException("Run already finished at " + finished.getFinishedAt());
            }
        }
    }
}
