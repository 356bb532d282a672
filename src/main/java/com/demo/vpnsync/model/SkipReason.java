package com.demo.vpnsync.model;

public enum SkipReason {
    NO_USERNAME("no-username"),
    NOT_VERIFIED("not-verified");

    private final String code;

    SkipReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
