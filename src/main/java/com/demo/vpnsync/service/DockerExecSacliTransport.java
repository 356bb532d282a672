// src/main/java/com/demo/vpnsync/service/DockerExecSacliTransport.java
package com.demo.vpnsync.service;

import kong.unirest.HttpResponse;
import kong.unirest.Unirest;
import kong.unirest.UnirestException;
import kong.unirest.UnirestInstance;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs {@code sacli} inside the access server container through the Docker Engine HTTP API
 * (create exec, start it attached with a TTY, then inspect the exit code).
 *
 * <p>The engine must be reachable over TCP, directly or through a socket proxy.
 */
public class DockerExecSacliTransport implements SacliTransport, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DockerExecSacliTransport.class);

    private static final String API_VERSION = "/v1.41";
    private static final String PASSWORD_FLAG = "--new_pass";

    private final String engineUrl;
    private final String containerName;
    private final UnirestInstance unirest;

    public DockerExecSacliTransport(String engineUrl, String containerName, int timeoutSeconds) {
        this.engineUrl = stripTrailingSlash(engineUrl) + API_VERSION;
        this.containerName = containerName;
        this.unirest = Unirest.spawnInstance();
        this.unirest.config()
            .connectTimeout(timeoutSeconds * 1000)
            .socketTimeout(timeoutSeconds * 1000);
    }

    @Override
    public JSONObject userPropGet() throws ExternalStoreException {
        String output = sacli("UserPropGet");
        try {
            return new JSONObject(output);
        } catch (JSONException e) {
            logger.error("Unexpected UserPropGet output: {}", output);
            throw new ExternalStoreException("UserPropGet returned non-JSON output", e);
        }
    }

    @Override
    public void setLocalPassword(String username, String password) throws ExternalStoreException {
        sacli("--user", username, PASSWORD_FLAG, password, "SetLocalPassword");
    }

    @Override
    public void userPropPut(String username, String key, String value) throws ExternalStoreException {
        sacli("--user", username, "--key", key, "--value", value, "UserPropPut");
    }

    @Override
    public void userPropDelAll(String username) throws ExternalStoreException {
        sacli("--user", username, "UserPropDelAll");
    }

    /**
     * Runs one sacli command and returns its output. Arguments are passed as an argv array,
     * never through a shell.
     */
    String sacli(String... args) throws ExternalStoreException {
        List<String> command = new ArrayList<>();
        command.add("sacli");
        command.addAll(Arrays.asList(args));
        String printable = describe(command);
        logger.debug("Executing in {}: {}", containerName, printable);

        try {
            String execId = createExec(command);
            String output = startExec(execId);
            int exitCode = inspectExitCode(execId);

            if (exitCode != 0) {
                logger.error("Command '{}' exited with code {}: {}", printable, exitCode, output.trim());
                throw new ExternalStoreException(String.format(
                    "%s exited with code %d: %s", command.get(command.size() - 1), exitCode, output.trim()));
            }
            return output.trim();
        } catch (UnirestException e) {
            logger.error("Docker engine at {} unreachable: {}", engineUrl, e.getMessage());
            throw new ExternalStoreUnavailableException(
                "Cannot reach Docker engine for container " + containerName + ": " + e.getMessage(), e);
        }
    }

    private String createExec(List<String> command) throws ExternalStoreException {
        JSONObject request = new JSONObject();
        request.put("AttachStdout", true);
        request.put("AttachStderr", true);
        request.put("Tty", true);
        request.put("Cmd", new JSONArray(command));

        HttpResponse<String> response = unirest.post(engineUrl + "/containers/{name}/exec")
            .routeParam("name", containerName)
            .header("Content-Type", "application/json")
            .body(request.toString())
            .asString();

        checkEngineStatus(response, 201, "create exec");
        try {
            return new JSONObject(response.getBody()).getString("Id");
        } catch (JSONException e) {
            throw new ExternalStoreUnavailableException("Docker engine returned no exec id: " + response.getBody(), e);
        }
    }

    private String startExec(String execId) throws ExternalStoreException {
        JSONObject request = new JSONObject();
        request.put("Detach", false);
        request.put("Tty", true);

        HttpResponse<String> response = unirest.post(engineUrl + "/exec/{id}/start")
            .routeParam("id", execId)
            .header("Content-Type", "application/json")
            .body(request.toString())
            .asString();

        checkEngineStatus(response, 200, "start exec");
        return response.getBody() == null ? "" : response.getBody();
    }

    private int inspectExitCode(String execId) throws ExternalStoreException {
        HttpResponse<String> response = unirest.get(engineUrl + "/exec/{id}/json")
            .routeParam("id", execId)
            .asString();

        checkEngineStatus(response, 200, "inspect exec");
        try {
            JSONObject inspect = new JSONObject(response.getBody());
            if (inspect.optBoolean("Running", false)) {
                throw new ExternalStoreUnavailableException("Command still running after output closed");
            }
            return inspect.optInt("ExitCode", -1);
        } catch (JSONException e) {
            throw new ExternalStoreUnavailableException("Unreadable exec inspect response: " + response.getBody(), e);
        }
    }

    private void checkEngineStatus(HttpResponse<String> response, int expected, String step)
            throws ExternalStoreException {
        int status = response.getStatus();
        if (status == expected) {
            return;
        }
        String message = engineMessage(response);
        logger.error("Docker engine {} failed with status {}: {}", step, status, message);

        // 404: no such container, 409: container paused or not running
        if (status == 404 || status == 409 || status >= 500) {
            throw new ExternalStoreUnavailableException(String.format(
                "Container %s is not available (%s, status %d): %s", containerName, step, status, message));
        }
        throw new ExternalStoreException(String.format("Docker engine rejected %s (status %d): %s",
            step, status, message));
    }

    private static String engineMessage(HttpResponse<String> response) {
        String body = response.getBody();
        if (body == null) {
            return "";
        }
        try {
            return new JSONObject(body).optString("message", body);
        } catch (JSONException e) {
            return body;
        }
    }

    private static String describe(List<String> command) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < command.size(); i++) {
            if (i > 0) {
                line.append(' ');
            }
            boolean secret = i > 0 && PASSWORD_FLAG.equals(command.get(i - 1));
            line.append(secret ? "****" : command.get(i));
        }
        return line.toString();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public void close() {
        unirest.close();
    }
}
