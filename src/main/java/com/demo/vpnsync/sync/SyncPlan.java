package com.demo.vpnsync.sync;

import com.demo.vpnsync.model.DirectoryUser;
import com.demo.vpnsync.model.SkipReason;
import com.demo.vpnsync.model.SkippedUser;
import com.demo.vpnsync.service.Usernames;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Three-way partition of a directory snapshot against the access server's username set.
 *
 * <p>With {@code D} the eligible directory usernames and {@code E} the access server usernames:
 * {@code toCreate = D \ E}, {@code toUpdate = D ∩ E}, {@code orphaned = E \ D}. Ineligible users
 * are listed under {@code skipped}. Eligible users whose username the access server cannot accept
 * are listed under {@code malformed}: they still count as part of {@code D}, so a matching access
 * server entry is never reported as orphaned, but they are neither created nor updated.
 */
public final class SyncPlan {
    private final List<DirectoryUser> toCreate;
    private final List<DirectoryUser> toUpdate;
    private final List<String> orphaned;
    private final List<SkippedUser> skipped;
    private final List<DirectoryUser> malformed;
    private final int directoryTotal;
    private final int externalTotal;

    private SyncPlan(List<DirectoryUser> toCreate, List<DirectoryUser> toUpdate, List<String> orphaned,
                     List<SkippedUser> skipped, List<DirectoryUser> malformed,
                     int directoryTotal, int externalTotal) {
        this.toCreate = Collections.unmodifiableList(toCreate);
        this.toUpdate = Collections.unmodifiableList(toUpdate);
        this.orphaned = Collections.unmodifiableList(orphaned);
        this.skipped = Collections.unmodifiableList(skipped);
        this.malformed = Collections.unmodifiableList(malformed);
        this.directoryTotal = directoryTotal;
        this.externalTotal = externalTotal;
    }

    public static SyncPlan compute(List<DirectoryUser> directoryUsers, Collection<String> externalUsernames) {
        Set<String> external = new LinkedHashSet<>(externalUsernames);
        Map<String, DirectoryUser> eligible = new LinkedHashMap<>();
        Set<String> eligibleUsernames = new HashSet<>();
        List<SkippedUser> skipped = new ArrayList<>();
        List<DirectoryUser> malformed = new ArrayList<>();

        for (DirectoryUser user : directoryUsers) {
            SkipReason reason = user.getIneligibility();
            if (reason != null) {
                skipped.add(new SkippedUser(user.getId(), user.getUsername(), reason));
                continue;
            }
            eligibleUsernames.add(user.getUsername());
            if (!Usernames.isValid(user.getUsername())) {
                malformed.add(user);
            } else {
                eligible.putIfAbsent(user.getUsername(), user);
            }
        }

        List<DirectoryUser> toCreate = new ArrayList<>();
        List<DirectoryUser> toUpdate = new ArrayList<>();
        for (DirectoryUser user : eligible.values()) {
            if (external.contains(user.getUsername())) {
                toUpdate.add(user);
            } else {
                toCreate.add(user);
            }
        }

        List<String> orphaned = new ArrayList<>();
        for (String username : external) {
            if (!eligibleUsernames.contains(username)) {
                orphaned.add(username);
            }
        }

        return new SyncPlan(toCreate, toUpdate, orphaned, skipped, malformed,
            directoryUsers.size(), external.size());
    }

    public List<DirectoryUser> getToCreate() { return toCreate; }
    public List<DirectoryUser> getToUpdate() { return toUpdate; }
    public List<String> getOrphaned() { return orphaned; }
    public List<SkippedUser> getSkipped() { return skipped; }
    public List<DirectoryUser> getMalformed() { return malformed; }
    public int getDirectoryTotal() { return directoryTotal; }
    public int getExternalTotal() { return externalTotal; }

    public long countSkipped(SkipReason reason) {
        return skipped.stream().filter(s -> s.getReason() == reason).count();
    }
}
