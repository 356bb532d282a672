package com.demo.vpnsync.api;

import com.demo.vpnsync.model.SchedulerState;
import com.demo.vpnsync.model.SingleUserResult;
import com.demo.vpnsync.model.SkippedUser;
import com.demo.vpnsync.model.SyncError;
import com.demo.vpnsync.model.SyncReport;
import com.demo.vpnsync.model.SyncRun;
import com.demo.vpnsync.model.SyncStatistics;
import com.demo.vpnsync.model.SyncStatus;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JSON renderings of the sync model for the HTTP API.
 */
final class JsonViews {

    private JsonViews() {
    }

    static JSONObject run(SyncRun run) {
        JSONObject json = new JSONObject();
        json.put("trigger", run.getTrigger().getLabel());
        json.put("startedAt", timestamp(run.getStartedAt()));
        json.put("finishedAt", timestamp(run.getFinishedAt()));
        json.put("durationMs", run.getDuration().toMillis());
        json.put("dryRun", run.isDryRun());
        json.put("deleteOrphaned", run.isDeleteOrphaned());
        json.put("success", !run.isAborted());
        json.put("abortReason", run.isAborted() ? run.getAbortReason() : JSONObject.NULL);
        json.put("created", new JSONArray(run.getCreated()));
        json.put("updated", new JSONArray(run.getUpdated()));
        json.put("deleted", new JSONArray(run.getDeleted()));
        json.put("orphaned", new JSONArray(run.getOrphaned()));
        json.put("skipped", skipped(run.getSkipped()));
        json.put("errors", errors(run.getErrors()));
        return json;
    }

    static JSONObject report(SyncReport report) {
        SyncRun run = report.getRun();
        JSONObject json = run(run);

        JSONObject summary = new JSONObject();
        summary.put("created", run.getCreated().size());
        summary.put("updated", run.getUpdated().size());
        summary.put("deleted", run.getDeleted().size());
        summary.put("orphaned", run.getOrphaned().size());
        summary.put("skipped", run.getSkipped().size());
        summary.put("errors", run.getErrors().size());
        json.put("summary", summary);

        JSONObject passwords = new JSONObject();
        for (Map.Entry<String, String> entry : report.getTemporaryPasswords().entrySet()) {
            passwords.put(entry.getKey(), entry.getValue());
        }
        json.put("temporaryPasswords", passwords);
        return json;
    }

    static JSONObject singleUser(SingleUserResult result) {
        JSONObject json = new JSONObject();
        json.put("userId", result.getUserId());
        json.put("username", result.getUsername());
        json.put("action", result.getAction().getLabel());
        json.put("tempPassword", result.getTempPassword() != null ? result.getTempPassword() : JSONObject.NULL);
        return json;
    }

    static JSONObject scheduler(SchedulerState state) {
        JSONObject json = new JSONObject();
        json.put("isRunning", state.isRunning());
        json.put("isSyncing", state.isSyncing());
        json.put("intervalMinutes", state.getIntervalMinutes());
        json.put("scheduleExpression", state.getScheduleExpression());
        json.put("nextFireTime", timestamp(state.getNextFireTime()));
        json.put("lastRun", state.getLastRun() != null ? run(state.getLastRun()) : JSONObject.NULL);
        return json;
    }

    static JSONObject statistics(SyncStatistics statistics) {
        JSONObject json = new JSONObject();
        json.put("totalRuns", statistics.getTotalRuns());
        json.put("successfulRuns", statistics.getSuccessfulRuns());
        json.put("failedRuns", statistics.getFailedRuns());
        json.put("successRate", String.format(Locale.ROOT, "%.2f%%", statistics.getSuccessRate()));
        return json;
    }

    static JSONObject status(SyncStatus status) {
        JSONObject json = new JSONObject();
        json.put("directoryTotal", status.getDirectoryTotal());
        json.put("directoryWithoutUsername", status.getDirectoryWithoutUsername());
        json.put("directoryUnverified", status.getDirectoryUnverified());
        json.put("externalTotal", status.getExternalTotal());
        json.put("inSync", status.getInSync().size());
        json.put("missingInExternal", status.getMissingInExternal().size());
        json.put("orphanedInExternal", status.getOrphanedInExternal().size());
        json.put("syncPercentage", status.getSyncPercentage());

        JSONObject details = new JSONObject();
        details.put("inSync", new JSONArray(status.getInSync()));
        details.put("missingInExternal", new JSONArray(status.getMissingInExternal()));
        details.put("orphanedInExternal", new JSONArray(status.getOrphanedInExternal()));
        json.put("details", details);

        json.put("scheduler", scheduler(status.getScheduler()));
        json.put("statistics", statistics(status.getStatistics()));
        json.put("recentHistory", runs(status.getRecentHistory()));
        json.put("checkedAt", timestamp(status.getCheckedAt()));
        return json;
    }

    static JSONArray runs(List<SyncRun> runs) {
        JSONArray array = new JSONArray();
        for (SyncRun run : runs) {
            array.put(run(run));
        }
        return array;
    }

    private static JSONArray skipped(List<SkippedUser> skipped) {
        JSONArray array = new JSONArray();
        for (SkippedUser user : skipped) {
            JSONObject json = new JSONObject();
            json.put("id", user.getId());
            json.put("username", user.getUsername() != null ? user.getUsername() : JSONObject.NULL);
            json.put("reason", user.getReason().getCode());
            array.put(json);
        }
        return array;
    }

    private static JSONArray errors(List<SyncError> errors) {
        JSONArray array = new JSONArray();
        for (SyncError error : errors) {
            JSONObject json = new JSONObject();
            json.put("username", error.getUsername() != null ? error.getUsername() : JSONObject.NULL);
            json.put("message", error.getMessage());
            array.put(json);
        }
        return array;
    }

    private static Object timestamp(Instant instant) {
        return instant != null ? instant.toString() : JSONObject.NULL;
    }
}
