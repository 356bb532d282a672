// src/main/java/com/demo/vpnsync/model/DirectoryUser.java
package com.demo.vpnsync.model;

/**
 * Read-only projection of a row in the directory's users table.
 */
public class DirectoryUser {
    public static final String ADMIN_ROLE = "admin";

    private long id;
    private String username;
    private String email;
    private boolean emailVerified;
    private String displayName;
    private String role;

    public DirectoryUser() {
    }

    public DirectoryUser(long id, String username, String email, boolean emailVerified,
                         String displayName, String role) {
        this.id = id;
        this.username = username;
        this.email = email;
        this.emailVerified = emailVerified;
        this.displayName = displayName;
        this.role = role;
    }

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }

    public boolean isEmailVerified() { return emailVerified; }
    public void setEmailVerified(boolean emailVerified) { this.emailVerified = emailVerified; }

    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }

    public String getRole() { return role; }
    public void setRole(String role) { this.role = role; }

    public boolean isAdmin() {
        return ADMIN_ROLE.equals(role);
    }

    public boolean hasUsername() {
        return username != null && !username.isEmpty();
    }

    /**
     * Returns why this user may not take part in synchronization, or {@code null} when it may.
     */
    public SkipReason getIneligibility() {
        if (!hasUsername()) {
            return SkipReason.NO_USERNAME;
        }
        if (!emailVerified) {
            return SkipReason.NOT_VERIFIED;
        }
        return null;
    }

    public boolean isEligible() {
        return getIneligibility() == null;
    }

    @Override
    public String toString() {
        return String.format("DirectoryUser[id=%d, username=%s, email=%s, verified=%s]",
            id, username, email, emailVerified);
    }
}
