package com.demo.vpnsync.sync;

import com.demo.vpnsync.model.SkipReason;

public class UserNotEligibleException extends Exception {
    private final long userId;
    private final SkipReason reason;

    public UserNotEligibleException(long userId, SkipReason reason) {
        super(String.format("User %d is not eligible for sync (%s)", userId, reason.getCode()));
        this.userId = userId;
        this.reason = reason;
    }

    public long getUserId() {
        return userId;
    }

    public SkipReason getReason() {
        return reason;
    }
}
