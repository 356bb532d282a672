package com.demo.vpnsync.sync;

import com.demo.vpnsync.model.SyncRun;

/**
 * A reconciliation run stopped early because the directory or the access server could not be
 * reached. Actions applied before the failure are listed in {@link #getPartialRun()}.
 */
public class SyncAbortedException extends Exception {
    private final SyncRun partialRun;

    public SyncAbortedException(String message, SyncRun partialRun, Throwable cause) {
        super(message, cause);
        this.partialRun = partialRun;
    }

    public SyncRun getPartialRun() {
        return partialRun;
    }
}
