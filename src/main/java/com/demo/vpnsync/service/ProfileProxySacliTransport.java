// src/main/java/com/demo/vpnsync/service/ProfileProxySacliTransport.java
package com.demo.vpnsync.service;

import kong.unirest.HttpResponse;
import kong.unirest.Unirest;
import kong.unirest.UnirestException;
import kong.unirest.UnirestInstance;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends sacli operations to the host-side profile proxy instead of executing them in the
 * container directly. The proxy has no delete endpoint, so deletes go to {@code fallback}.
 */
public class ProfileProxySacliTransport implements SacliTransport, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ProfileProxySacliTransport.class);

    private final String proxyUrl;
    private final SacliTransport fallback;
    private final UnirestInstance unirest;

    public ProfileProxySacliTransport(String proxyUrl, int timeoutSeconds, SacliTransport fallback) {
        this.proxyUrl = proxyUrl.endsWith("/") ? proxyUrl.substring(0, proxyUrl.length() - 1) : proxyUrl;
        this.fallback = fallback;
        this.unirest = Unirest.spawnInstance();
        this.unirest.config()
            .connectTimeout(timeoutSeconds * 1000)
            .socketTimeout(timeoutSeconds * 1000);
        logger.info("Using profile proxy at {} for sacli operations", this.proxyUrl);
    }

    @Override
    public JSONObject userPropGet() throws ExternalStoreException {
        HttpResponse<String> response = call("UserPropGet", () ->
            unirest.get(proxyUrl + "/sacli/userpropget")
                .header("Accept", "application/json")
                .asString());
        try {
            return new JSONObject(response.getBody());
        } catch (JSONException e) {
            logger.error("Unexpected UserPropGet output from proxy: {}", response.getBody());
            throw new ExternalStoreException("Profile proxy returned non-JSON UserPropGet output", e);
        }
    }

    @Override
    public void setLocalPassword(String username, String password) throws ExternalStoreException {
        JSONObject body = new JSONObject();
        body.put("password", password);
        call("SetLocalPassword", () ->
            unirest.post(proxyUrl + "/sacli/user/{username}/setpassword")
                .routeParam("username", username)
                .header("Content-Type", "application/json")
                .body(body.toString())
                .asString());
    }

    @Override
    public void userPropPut(String username, String key, String value) throws ExternalStoreException {
        JSONObject body = new JSONObject();
        body.put("key", key);
        body.put("value", value);
        call("UserPropPut", () ->
            unirest.post(proxyUrl + "/sacli/user/{username}/prop")
                .routeParam("username", username)
                .header("Content-Type", "application/json")
                .body(body.toString())
                .asString());
    }

    @Override
    public void userPropDelAll(String username) throws ExternalStoreException {
        fallback.userPropDelAll(username);
    }

    private HttpResponse<String> call(String operation, ProxyRequest request) throws ExternalStoreException {
        HttpResponse<String> response;
        try {
            response = request.send();
        } catch (UnirestException e) {
            logger.error("Profile proxy at {} unreachable: {}", proxyUrl, e.getMessage());
            throw new ExternalStoreUnavailableException(
                "Cannot reach profile proxy at " + proxyUrl + ": " + e.getMessage(), e);
        }

        int status = response.getStatus();
        if (status == 200) {
            return response;
        }
        logger.error("Profile proxy {} failed with status {}: {}", operation, status, response.getBody());
        if (status >= 500) {
            throw new ExternalStoreUnavailableException(String.format(
                "Profile proxy could not run %s (status %d): %s", operation, status, response.getBody()));
        }
        throw new ExternalStoreException(String.format(
            "Profile proxy rejected %s (status %d): %s", operation, status, response.getBody()));
    }

    @FunctionalInterface
    private interface ProxyRequest {
        HttpResponse<String> send();
    }

    @Override
    public void close() {
        unirest.close();
    }
}
