package com.demo.vpnsync.service;

import com.demo.vpnsync.model.UserAttributes;

import java.util.List;

/**
 * Management operations on the access server's own user list. This is the only way the
 * application talks to the access server.
 *
 * <p>All mutations are upserts or idempotent deletes so that a retried reconciliation can be
 * applied again safely: creating a user that already exists overwrites its password and
 * attributes, and updating writes every attribute unconditionally.
 *
 * <p>Every operation fails with {@link ExternalStoreUnavailableException} when the server's
 * container cannot be reached, and with a plain {@link ExternalStoreException} when the command
 * ran but was rejected.
 */
public interface ExternalStoreClient {

    /** Returns the usernames currently known to the access server. */
    List<String> list() throws ExternalStoreException;

    void create(String username, String password, UserAttributes attributes) throws ExternalStoreException;

    void update(String username, UserAttributes attributes) throws ExternalStoreException;

    void delete(String username) throws ExternalStoreException;

    void setPassword(String username, String password) throws ExternalStoreException;
}
