// src/main/java/com/demo/vpnsync/service/JdbcDirectoryReader.java
package com.demo.vpnsync.service;

import com.demo.vpnsync.model.DirectoryUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads users from the directory's {@code users} table. Soft-deleted rows are never returned.
 */
public class JdbcDirectoryReader implements DirectoryReader {
    private static final Logger logger = LoggerFactory.getLogger(JdbcDirectoryReader.class);

    static final String SELECT_USERS =
        "SELECT id, username, email, name, role, email_verified FROM users "
            + "WHERE deleted_at IS NULL ORDER BY id";
    static final String SELECT_USER_BY_ID =
        "SELECT id, username, email, name, role, email_verified FROM users "
            + "WHERE id = ? AND deleted_at IS NULL";

    private final DirectoryConnectionFactory connectionFactory;
    private final int queryTimeoutSeconds;

    public JdbcDirectoryReader(DirectoryConnectionFactory connectionFactory, int queryTimeoutSeconds) {
        this.connectionFactory = connectionFactory;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    @Override
    public List<DirectoryUser> listUsers() throws DirectoryException {
        List<DirectoryUser> users = new ArrayList<>();

        try (Connection connection = connectionFactory.open();
             PreparedStatement statement = connection.prepareStatement(SELECT_USERS)) {
            statement.setQueryTimeout(queryTimeoutSeconds);

            try (ResultSet rows = statement.executeQuery()) {
                while (rows.next()) {
                    DirectoryUser user = toUser(rows);
                    users.add(user);
                    logger.debug("Read directory user: {}", user);
                }
            }
        } catch (SQLException e) {
            logger.error("Directory query failed: {}", e.getMessage());
            throw new DirectoryException("Failed to read users from directory: " + e.getMessage(), e);
        }

        logger.info("Retrieved {} users from directory", users.size());
        return users;
    }

    @Override
    public DirectoryUser getById(long id) throws DirectoryException {
        try (Connection connection = connectionFactory.open();
             PreparedStatement statement = connection.prepareStatement(SELECT_USER_BY_ID)) {
            statement.setQueryTimeout(queryTimeoutSeconds);
            statement.setLong(1, id);

            try (ResultSet rows = statement.executeQuery()) {
                return rows.next() ? toUser(rows) : null;
            }
        } catch (SQLException e) {
            logger.error("Directory lookup for user {} failed: {}", id, e.getMessage());
            throw new DirectoryException("Failed to read user " + id + " from directory: " + e.getMessage(), e);
        }
    }

    private DirectoryUser toUser(ResultSet row) throws SQLException {
        DirectoryUser user = new DirectoryUser();
        user.setId(row.getLong("id"));

        // Blank usernames are treated like missing ones
        String username = row.getString("username");
        user.setUsername(username != null && !username.trim().isEmpty() ? username.trim() : null);

        user.setEmail(row.getString("email"));
        user.setDisplayName(row.getString("name"));
        user.setRole(row.getString("role"));
        user.setEmailVerified(row.getBoolean("email_verified"));
        return user;
    }
}
