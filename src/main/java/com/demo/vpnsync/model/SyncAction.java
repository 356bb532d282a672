package com.demo.vpnsync.model;

/**
 * One mutation decided by a reconciliation pass. Actions are applied immediately and never stored.
 */
public final class SyncAction {

    public enum Type {
        CREATE, UPDATE, DELETE
    }

    private final Type type;
    private final String username;
    private final String tempPassword;
    private final UserAttributes attributes;

    private SyncAction(Type type, String username, String tempPassword, UserAttributes attributes) {
        this.type = type;
        this.username = username;
        this.tempPassword = tempPassword;
        this.attributes = attributes;
    }

    public static SyncAction create(String username, String tempPassword, UserAttributes attributes) {
        return new SyncAction(Type.CREATE, username, tempPassword, attributes);
    }

    public static SyncAction update(String username, UserAttributes attributes) {
        return new SyncAction(Type.UPDATE, username, null, attributes);
    }

    public static SyncAction delete(String username) {
        return new SyncAction(Type.DELETE, username, null, null);
    }

    public Type getType() { return type; }

    public String getUsername() { return username; }

    /** Only set for {@link Type#CREATE}. */
    public String getTempPassword() { return tempPassword; }

    /** Not set for {@link Type#DELETE}. */
    public UserAttributes getAttributes() { return attributes; }

    @Override
    public String toString() {
        return type + "(" + username + ")";
    }
}
