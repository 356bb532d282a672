package com.demo.vpnsync.service;

import org.json.JSONObject;

/**
 * Carries {@code sacli} commands to the access server. Implementations differ only in how the
 * command reaches the container.
 */
public interface SacliTransport {

    /** Output of {@code sacli UserPropGet}: a JSON object keyed by user or group name. */
    JSONObject userPropGet() throws ExternalStoreException;

    void setLocalPassword(String username, String password) throws ExternalStoreException;

    void userPropPut(String username, String key, String value) throws ExternalStoreException;

    void userPropDelAll(String username) throws ExternalStoreException;
}
