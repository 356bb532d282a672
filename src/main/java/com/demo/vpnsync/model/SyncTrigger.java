package com.demo.vpnsync.model;

public enum SyncTrigger {
    MANUAL("manual"),
    SCHEDULED("scheduled");

    private final String label;

    SyncTrigger(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
