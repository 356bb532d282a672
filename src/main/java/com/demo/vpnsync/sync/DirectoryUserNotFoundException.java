package com.demo.vpnsync.sync;

public class DirectoryUserNotFoundException extends Exception {
    private final long userId;

    public DirectoryUserNotFoundException(long userId) {
        super("User " + userId + " not found in directory");
        this.userId = userId;
    }

    public long getUserId() {
        return userId;
    }
}
