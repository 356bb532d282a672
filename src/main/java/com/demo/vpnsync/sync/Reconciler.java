// src/main/java/com/demo/vpnsync/sync/Reconciler.java
package com.demo.vpnsync.sync;

import com.demo.vpnsync.model.DirectoryUser;
import com.demo.vpnsync.model.SingleUserResult;
import com.demo.vpnsync.model.SkipReason;
import com.demo.vpnsync.model.SkippedUser;
import com.demo.vpnsync.model.SyncAction;
import com.demo.vpnsync.model.SyncOptions;
import com.demo.vpnsync.model.SyncReport;
import com.demo.vpnsync.model.SyncRun;
import com.demo.vpnsync.model.SyncTrigger;
import com.demo.vpnsync.model.UserAttributes;
import com.demo.vpnsync.service.DirectoryException;
import com.demo.vpnsync.service.DirectoryReader;
import com.demo.vpnsync.service.ExternalStoreClient;
import com.demo.vpnsync.service.ExternalStoreException;
import com.demo.vpnsync.service.ExternalStoreUnavailableException;
import com.demo.vpnsync.service.Usernames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Makes the access server's user list agree with the eligible part of the directory.
 *
 * <p>Each run takes one snapshot of both stores, decides every action from that snapshot, then
 * applies creates and updates followed by orphan deletes. Changes made to the directory while a
 * run is applying are picked up by the next run. A dry run decides the same actions but never
 * applies them.
 *
 * <p>This class does not guard against concurrent runs; callers go through
 * {@link com.demo.vpnsync.scheduler.SyncScheduler} for that.
 */
public class Reconciler {
    private static final Logger logger = LoggerFactory.getLogger(Reconciler.class);

    private final DirectoryReader directory;
    private final ExternalStoreClient externalStore;
    private final TempPasswordGenerator passwordGenerator;

    public Reconciler(DirectoryReader directory, ExternalStoreClient externalStore) {
        this(directory, externalStore, new TempPasswordGenerator());
    }

    public Reconciler(DirectoryReader directory, ExternalStoreClient externalStore,
                      TempPasswordGenerator passwordGenerator) {
        this.directory = directory;
        this.externalStore = externalStore;
        this.passwordGenerator = passwordGenerator;
    }

    public SyncReport run(SyncTrigger trigger, SyncOptions options) throws SyncAbortedException {
        logger.info("=== Starting {} user synchronization ({}) ===", trigger.getLabel(), options);
        SyncRun.Recorder recorder = SyncRun.start(trigger, options);

        SyncPlan plan;
        try {
            plan = plan();
        } catch (DirectoryException | ExternalStoreException e) {
            throw abort(recorder, "Could not read current state: " + e.getMessage(), e);
        }

        for (SkippedUser skipped : plan.getSkipped()) {
            logger.warn("Skipping user {} ({}) - {}", skipped.getId(), skipped.getUsername(), skipped.getReason());
            recorder.skipped(skipped);
        }
        for (DirectoryUser user : plan.getMalformed()) {
            logger.error("User {} has a username the access server cannot accept: {}",
                user.getId(), user.getUsername());
            recorder.error(user.getUsername(), "Malformed username");
        }

        List<SyncAction> actions = decide(plan, recorder);
        Map<String, String> temporaryPasswords = new LinkedHashMap<>();

        for (SyncAction action : actions) {
            if (options.isDryRun()) {
                record(recorder, action);
                continue;
            }
            try {
                apply(action);
                record(recorder, action);
                if (action.getType() == SyncAction.Type.CREATE) {
                    temporaryPasswords.put(action.getUsername(), action.getTempPassword());
                }
            } catch (ExternalStoreUnavailableException e) {
                recorder.error(action.getUsername(), e.getMessage());
                throw abort(recorder, "Access server unavailable: " + e.getMessage(), e);
            } catch (ExternalStoreException | IllegalArgumentException e) {
                logger.error("Error syncing user {}: {}", action.getUsername(), e.getMessage());
                recorder.error(action.getUsername(), e.getMessage());
            }
        }

        SyncRun run = recorder.finish();
        logger.info("=== User synchronization completed: created={}, updated={}, deleted={}, orphaned={}, "
                + "skipped={}, errors={} ===",
            run.getCreated().size(), run.getUpdated().size(), run.getDeleted().size(),
            run.getOrphaned().size(), run.getSkipped().size(), run.getErrors().size());
        return new SyncReport(run, temporaryPasswords);
    }

    /**
     * Reads both stores and partitions them. Used by {@link #run} and by status queries.
     */
    public SyncPlan plan() throws DirectoryException, ExternalStoreException {
        List<DirectoryUser> users = directory.listUsers();
        List<String> externalUsers = externalStore.list();
        logger.info("Comparing {} directory users against {} access server users",
            users.size(), externalUsers.size());
        return SyncPlan.compute(users, externalUsers);
    }

    /**
     * Creates or updates a single directory user on the access server.
     */
    public SingleUserResult syncUser(long userId)
            throws DirectoryException, DirectoryUserNotFoundException, UserNotEligibleException,
            ExternalStoreException {
        logger.info("Syncing single user: ID {}", userId);

        DirectoryUser user = directory.getById(userId);
        if (user == null) {
            throw new DirectoryUserNotFoundException(userId);
        }
        SkipReason reason = user.getIneligibility();
        if (reason != null) {
            throw new UserNotEligibleException(userId, reason);
        }
        Usernames.requireValid(user.getUsername());

        SyncAction action = actionFor(user, externalStore.list());
        apply(action);

        logger.info("User {} synced successfully ({})", user.getUsername(), action.getType());
        if (action.getType() == SyncAction.Type.CREATE) {
            return new SingleUserResult(userId, user.getUsername(), SingleUserResult.Action.CREATED,
                action.getTempPassword());
        }
        return new SingleUserResult(userId, user.getUsername(), SingleUserResult.Action.UPDATED, null);
    }

    /**
     * Deletes a user from the access server whether or not the directory still knows it.
     */
    public void removeUser(String username) throws ExternalStoreException {
        Usernames.requireValid(username);
        apply(SyncAction.delete(username));
    }

    /**
     * Pushes a changed password straight to the access server without waiting for a run.
     */
    public void propagatePassword(String username, String newPassword) throws ExternalStoreException {
        Usernames.requireValid(username);
        if (newPassword == null || newPassword.isEmpty()) {
            throw new IllegalArgumentException("Password must not be empty");
        }
        externalStore.setPassword(username, newPassword);
        logger.info("Access server password updated for user: {}", username);
    }

    private List<SyncAction> decide(SyncPlan plan, SyncRun.Recorder recorder) {
        List<SyncAction> actions = new ArrayList<>();
        for (DirectoryUser user : plan.getToCreate()) {
            actions.add(create(user));
        }
        for (DirectoryUser user : plan.getToUpdate()) {
            actions.add(update(user));
        }

        // Deletes go last so nobody is briefly missing from both stores
        for (String username : plan.getOrphaned()) {
            recorder.orphaned(username);
            if (recorder.getOptions().isDeleteOrphaned()) {
                if (Usernames.isValid(username)) {
                    actions.add(SyncAction.delete(username));
                } else {
                    logger.error("Orphaned access server user has a malformed username, not deleting: {}",
                        username);
                    recorder.error(username, "Malformed username");
                }
            } else {
                logger.info("Orphaned access server user left in place: {}", username);
            }
        }
        return actions;
    }

    private SyncAction actionFor(DirectoryUser user, Collection<String> externalUsernames) {
        return externalUsernames.contains(user.getUsername()) ? update(user) : create(user);
    }

    private SyncAction create(DirectoryUser user) {
        return SyncAction.create(user.getUsername(), passwordGenerator.generate(), UserAttributes.of(user));
    }

    private SyncAction update(DirectoryUser user) {
        return SyncAction.update(user.getUsername(), UserAttributes.of(user));
    }

    private void apply(SyncAction action) throws ExternalStoreException {
        switch (action.getType()) {
            case CREATE:
                externalStore.create(action.getUsername(), action.getTempPassword(), action.getAttributes());
                break;
            case UPDATE:
                externalStore.update(action.getUsername(), action.getAttributes());
                break;
            case DELETE:
                externalStore.delete(action.getUsername());
                break;
            default:
                throw new IllegalStateException("Unknown action type: " + action.getType());
        }
    }

    private static void record(SyncRun.Recorder recorder, SyncAction action) {
        switch (action.getType()) {
            case CREATE:
                recorder.created(action.getUsername());
                break;
            case UPDATE:
                recorder.updated(action.getUsername());
                break;
            case DELETE:
                recorder.deleted(action.getUsername());
                break;
            default:
                throw new IllegalStateException("Unknown action type: " + action.getType());
        }
    }

    private static SyncAbortedException abort(SyncRun.Recorder recorder, String reason, Exception cause) {
        logger.error("User synchronization aborted: {}", reason, cause);
        recorder.aborted(reason);
        return new SyncAbortedException(reason, recorder.finish(), cause);
    }
}
