package com.demo.vpnsync.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a caller gets back from a full reconciliation: the recorded run plus the temporary
 * passwords issued for newly created users. Passwords are handed to the caller only and are
 * not kept in run history.
 */
public final class SyncReport {
    private final SyncRun run;
    private final Map<String, String> temporaryPasswords;

    public SyncReport(SyncRun run, Map<String, String> temporaryPasswords) {
        this.run = run;
        this.temporaryPasswords = Collections.unmodifiableMap(new LinkedHashMap<>(temporaryPasswords));
    }

    public SyncRun getRun() { return run; }

    public Map<String, String> getTemporaryPasswords() { return temporaryPasswords; }
}
