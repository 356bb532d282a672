package com.demo.vpnsync.model;

public final class SyncError {
    private final String username;
    private final String message;

    public SyncError(String username, String message) {
        this.username = username;
        this.message = message;
    }

    public String getUsername() { return username; }

    public String getMessage() { return message; }

    @Override
    public String toString() {
        return username + ": " + message;
    }
}
