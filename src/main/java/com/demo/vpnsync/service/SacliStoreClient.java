// src/main/java/com/demo/vpnsync/service/SacliStoreClient.java
package com.demo.vpnsync.service;

import com.demo.vpnsync.model.UserAttributes;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * {@link ExternalStoreClient} for OpenVPN Access Server, expressed as {@code sacli} commands.
 */
public class SacliStoreClient implements ExternalStoreClient {
    private static final Logger logger = LoggerFactory.getLogger(SacliStoreClient.class);

    static final String DEFAULT_PROFILE = "__DEFAULT__";
    static final String PROP_EMAIL = "prop_email";
    static final String PROP_NAME = "prop_c_name";
    static final String PROP_SUPERUSER = "prop_superuser";

    private final SacliTransport transport;

    public SacliStoreClient(SacliTransport transport) {
        this.transport = transport;
    }

    @Override
    public List<String> list() throws ExternalStoreException {
        JSONObject profiles = transport.userPropGet();

        TreeSet<String> usernames = new TreeSet<>();
        for (String name : profiles.keySet()) {
            if (DEFAULT_PROFILE.equals(name)) {
                continue;
            }
            // Group profiles share the namespace with users
            JSONObject props = profiles.optJSONObject(name);
            if (props != null && "group".equals(props.optString("type"))) {
                continue;
            }
            usernames.add(name);
        }

        logger.info("Retrieved {} users from access server", usernames.size());
        return new ArrayList<>(usernames);
    }

    @Override
    public void create(String username, String password, UserAttributes attributes)
            throws ExternalStoreException {
        Usernames.requireValid(username);
        logger.info("Creating access server user: {}", username);

        transport.setLocalPassword(username, password);
        putAttributes(username, attributes);

        logger.info("Access server user created: {}", username);
    }

    @Override
    public void update(String username, UserAttributes attributes) throws ExternalStoreException {
        Usernames.requireValid(username);
        logger.info("Updating access server user: {}", username);

        putAttributes(username, attributes);
    }

    @Override
    public void delete(String username) throws ExternalStoreException {
        Usernames.requireValid(username);
        logger.info("Deleting access server user: {}", username);

        transport.userPropDelAll(username);

        logger.info("Access server user deleted: {}", username);
    }

    @Override
    public void setPassword(String username, String password) throws ExternalStoreException {
        Usernames.requireValid(username);
        logger.info("Setting access server password for user: {}", username);

        transport.setLocalPassword(username, password);
    }

    private void putAttributes(String username, UserAttributes attributes) throws ExternalStoreException {
        if (attributes.getEmail() != null && !attributes.getEmail().isEmpty()) {
            transport.userPropPut(username, PROP_EMAIL, attributes.getEmail());
        }
        if (attributes.getDisplayName() != null && !attributes.getDisplayName().isEmpty()) {
            transport.userPropPut(username, PROP_NAME, attributes.getDisplayName());
        }
        // Always written so that a demoted admin loses the flag
        transport.userPropPut(username, PROP_SUPERUSER, Boolean.toString(attributes.isSuperuser()));
    }
}
