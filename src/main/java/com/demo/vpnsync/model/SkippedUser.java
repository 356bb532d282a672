package com.demo.vpnsync.model;

public final class SkippedUser {
    private final long id;
    private final String username;
    private final SkipReason reason;

    public SkippedUser(long id, String username, SkipReason reason) {
        this.id = id;
        this.username = username;
        this.reason = reason;
    }

    public long getId() { return id; }

    /** May be {@code null} when the reason is {@link SkipReason#NO_USERNAME}. */
    public String getUsername() { return username; }

    public SkipReason getReason() { return reason; }

    @Override
    public String toString() {
        return String.format("Skipped[id=%d, username=%s, reason=%s]", id, username, reason);
    }
}
