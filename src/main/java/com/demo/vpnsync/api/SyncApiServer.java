// src/main/java/com/demo/vpnsync/api/SyncApiServer.java
package com.demo.vpnsync.api;

import com.demo.vpnsync.model.SchedulerState;
import com.demo.vpnsync.model.SingleUserResult;
import com.demo.vpnsync.model.SyncOptions;
import com.demo.vpnsync.model.SyncReport;
import com.demo.vpnsync.scheduler.AlreadySyncingException;
import com.demo.vpnsync.service.DirectoryException;
import com.demo.vpnsync.service.ExternalStoreException;
import com.demo.vpnsync.service.ExternalStoreUnavailableException;
import com.demo.vpnsync.sync.DirectoryUserNotFoundException;
import com.demo.vpnsync.sync.SyncAbortedException;
import com.demo.vpnsync.sync.UserNotEligibleException;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerRequest;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP surface for operators:
 *
 * <pre>
 * POST   /api/sync/full                {dryRun?, deleteOrphaned?}
 * POST   /api/sync/user/{id}
 * DELETE /api/sync/user/{username}
 * GET    /api/sync/status
 * POST   /api/scheduler/control        {action: "start" | "stop"}
 * PUT    /api/scheduler/interval       {intervalMinutes}
 * POST   /api/scheduler/reset
 * GET    /health
 * </pre>
 *
 * Responses use the envelope {@code {success, message?, data?}}. Handlers block on I/O, so they
 * run on Vert.x worker threads.
 */
public class SyncApiServer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SyncApiServer.class);

    private static final String SYNC_USER_PREFIX = "/api/sync/user/";
    private static final String UNAVAILABLE_HINT =
        "Unable to reach the OpenVPN container. Please ensure the container is running.";
    private static final String DIRECTORY_HINT =
        "Unable to read the user directory. Please check the database connection.";

    private final Vertx vertx;
    private final SyncFacade facade;
    private HttpServer server;

    public SyncApiServer(Vertx vertx, SyncFacade facade) {
        this.vertx = vertx;
        this.facade = facade;
    }

    /**
     * Binds the server and returns the actual port, which differs from {@code port} when it is 0.
     */
    public int start(int port) throws InterruptedException, ExecutionException, TimeoutException {
        server = vertx.createHttpServer()
            .requestHandler(this::handle)
            .listen(port)
            .toCompletionStage()
            .toCompletableFuture()
            .get(30, TimeUnit.SECONDS);
        logger.info("Sync API listening on port {}", server.actualPort());
        return server.actualPort();
    }

    private void handle(HttpServerRequest request) {
        request.body()
            .onSuccess(buffer -> vertx.<ApiResponse>executeBlocking(promise ->
                    promise.complete(route(request.method(), request.path(), buffer.toString())), false)
                .onComplete(result -> {
                    if (result.succeeded()) {
                        write(request, result.result());
                    } else {
                        logger.error("Request {} {} failed", request.method(), request.path(), result.cause());
                        write(request, ApiResponse.error(500, "Internal server error"));
                    }
                }))
            .onFailure(e -> write(request, ApiResponse.error(400, "Could not read request body")));
    }

    ApiResponse route(HttpMethod method, String path, String body) {
        try {
            if ("/health".equals(path)) {
                return requireMethod(method, HttpMethod.GET) ? health() : methodNotAllowed();
            }
            if ("/api/sync/full".equals(path)) {
                return requireMethod(method, HttpMethod.POST) ? fullSync(parse(body)) : methodNotAllowed();
            }
            if ("/api/sync/status".equals(path)) {
                return requireMethod(method, HttpMethod.GET) ? status() : methodNotAllowed();
            }
            if ("/api/scheduler/control".equals(path)) {
                return requireMethod(method, HttpMethod.POST) ? control(parse(body)) : methodNotAllowed();
            }
            if ("/api/scheduler/interval".equals(path)) {
                return requireMethod(method, HttpMethod.PUT) ? interval(parse(body)) : methodNotAllowed();
            }
            if ("/api/scheduler/reset".equals(path)) {
                return requireMethod(method, HttpMethod.POST) ? resetStatistics() : methodNotAllowed();
            }
            if (path.startsWith(SYNC_USER_PREFIX) && path.length() > SYNC_USER_PREFIX.length()) {
                String target = URLDecoder.decode(path.substring(SYNC_USER_PREFIX.length()), StandardCharsets.UTF_8);
                if (HttpMethod.POST.equals(method)) {
                    return syncUser(target);
                }
                if (HttpMethod.DELETE.equals(method)) {
                    return removeUser(target);
                }
                return methodNotAllowed();
            }
            return ApiResponse.error(404, "Not found: " + path);
        } catch (IllegalArgumentException e) {
            return ApiResponse.error(400, e.getMessage());
        } catch (DirectoryUserNotFoundException e) {
            return ApiResponse.error(404, e.getMessage());
        } catch (UserNotEligibleException e) {
            return ApiResponse.error(400, e.getMessage());
        } catch (AlreadySyncingException e) {
            return ApiResponse.error(409, e.getMessage());
        } catch (SyncAbortedException e) {
            logger.error("Sync aborted: {}", e.getMessage());
            ApiResponse response = unavailable(hintFor(e.getCause()), e.getMessage());
            response.body.put("data", JsonViews.run(e.getPartialRun()));
            return response;
        } catch (ExternalStoreUnavailableException | DirectoryException e) {
            logger.error("Store unavailable: {}", e.getMessage());
            return unavailable(hintFor(e), e.getMessage());
        } catch (ExternalStoreException e) {
            return ApiResponse.error(502, "Access server rejected the request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Unexpected error handling {} {}", method, path, e);
            return ApiResponse.error(500, e.getMessage());
        }
    }

    private ApiResponse fullSync(JSONObject body) throws AlreadySyncingException, SyncAbortedException {
        boolean dryRun = optionalBoolean(body, "dryRun");
        boolean deleteOrphaned = optionalBoolean(body, "deleteOrphaned");
        logger.info("Full sync requested: dryRun={}, deleteOrphaned={}", dryRun, deleteOrphaned);

        SyncReport report = facade.fullSync(new SyncOptions(dryRun, deleteOrphaned));

        String message = dryRun
            ? "Dry run completed successfully (no changes made)"
            : "User synchronization completed successfully";
        int errors = report.getRun().getErrors().size();
        if (errors > 0) {
            message += " with " + errors + " error(s)";
        }
        return ApiResponse.ok(message, JsonViews.report(report));
    }

    private ApiResponse syncUser(String rawId) throws Exception {
        long userId;
        try {
            userId = Long.parseLong(rawId);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid user ID. Must be a numeric value.");
        }
        SingleUserResult result = facade.syncUser(userId);
        return ApiResponse.ok(String.format("User %s %s in OpenVPN Access Server",
            result.getUsername(), result.getAction().getLabel()), JsonViews.singleUser(result));
    }

    private ApiResponse removeUser(String rawUsername) throws ExternalStoreException {
        String username = rawUsername.trim();
        facade.removeUser(username);

        JSONObject data = new JSONObject();
        data.put("username", username);
        return ApiResponse.ok("User " + username + " removed from OpenVPN Access Server", data);
    }

    private ApiResponse status() throws DirectoryException, ExternalStoreException {
        return ApiResponse.ok(null, JsonViews.status(facade.status()));
    }

    private ApiResponse control(JSONObject body) throws Exception {
        String action = body.optString("action", "");
        boolean changed;
        if ("start".equals(action)) {
            changed = facade.startScheduler();
        } else if ("stop".equals(action)) {
            changed = facade.stopScheduler();
        } else {
            throw new IllegalArgumentException("Invalid action. Must be \"start\" or \"stop\"");
        }

        if (!changed) {
            return ApiResponse.error(400, "Scheduler is already " + ("start".equals(action) ? "running" : "stopped"));
        }
        SchedulerState state = facade.schedulerState();
        JSONObject data = new JSONObject();
        data.put("isRunning", state.isRunning());
        data.put("intervalMinutes", state.getIntervalMinutes());
        return ApiResponse.ok("Scheduler " + ("start".equals(action) ? "started" : "stopped") + " successfully", data);
    }

    private ApiResponse interval(JSONObject body) throws Exception {
        Object value = body.opt("intervalMinutes");
        if (!(value instanceof Integer)) {
            throw new IllegalArgumentException("Invalid intervalMinutes. Must be an integer between 1 and 60");
        }
        SchedulerState state = facade.updateInterval((Integer) value);

        JSONObject data = new JSONObject();
        data.put("intervalMinutes", state.getIntervalMinutes());
        data.put("scheduleExpression", state.getScheduleExpression());
        data.put("isRunning", state.isRunning());
        return ApiResponse.ok("Scheduler interval updated to " + state.getIntervalMinutes() + " minutes", data);
    }

    private ApiResponse resetStatistics() {
        facade.resetStatistics();
        return ApiResponse.ok("Scheduler statistics reset", null);
    }

    private ApiResponse health() {
        JSONObject data = new JSONObject();
        data.put("status", "OK");
        data.put("timestamp", Instant.now().toString());
        data.put("scheduler", JsonViews.scheduler(facade.schedulerState()));
        data.put("statistics", JsonViews.statistics(facade.getScheduler().getStatistics()));
        return ApiResponse.ok(null, data);
    }

    private static boolean requireMethod(HttpMethod actual, HttpMethod expected) {
        return expected.equals(actual);
    }

    private static String hintFor(Throwable cause) {
        return cause instanceof DirectoryException ? DIRECTORY_HINT : UNAVAILABLE_HINT;
    }

    private static ApiResponse unavailable(String hint, String error) {
        ApiResponse response = ApiResponse.error(503, hint);
        response.body.put("error", error);
        return response;
    }

    private static ApiResponse methodNotAllowed() {
        return ApiResponse.error(405, "Method not allowed");
    }

    private static JSONObject parse(String body) {
        if (body == null || body.trim().isEmpty()) {
            return new JSONObject();
        }
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Request body must be a JSON object");
        }
    }

    private static boolean optionalBoolean(JSONObject body, String key) {
        if (!body.has(key)) {
            return false;
        }
        Object value = body.get(key);
        if (!(value instanceof Boolean)) {
            throw new IllegalArgumentException(key + " must be a boolean value");
        }
        return (Boolean) value;
    }

    private static void write(HttpServerRequest request, ApiResponse response) {
        request.response()
            .setStatusCode(response.status)
            .putHeader("Content-Type", "application/json")
            .end(response.body.toString());
    }

    @Override
    public void close() throws InterruptedException, ExecutionException, TimeoutException {
        if (server != null) {
            server.close().toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
            logger.info("Sync API stopped");
        }
    }

    static final class ApiResponse {
        final int status;
        final JSONObject body;

        private ApiResponse(int status, JSONObject body) {
            this.status = status;
            this.body = body;
        }

        static ApiResponse ok(String message, JSONObject data) {
            JSONObject body = new JSONObject();
            body.put("success", true);
            if (message != null) {
                body.put("message", message);
            }
            if (data != null) {
                body.put("data", data);
            }
            return new ApiResponse(200, body);
        }

        static ApiResponse error(int status, String message) {
            JSONObject body = new JSONObject();
            body.put("success", false);
            body.put("message", message != null ? message : "Error");
            return new ApiResponse(status, body);
        }
    }
}
