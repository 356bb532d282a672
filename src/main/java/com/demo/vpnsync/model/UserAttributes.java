package com.demo.vpnsync.model;

import java.util.Objects;

/**
 * Attributes pushed to the access server for a user. The server cannot read them back
 * reliably, so they are always written in full.
 */
public final class UserAttributes {
    private final String email;
    private final String displayName;
    private final boolean superuser;

    public UserAttributes(String email, String displayName, boolean superuser) {
        this.email = email;
        this.displayName = displayName;
        this.superuser = superuser;
    }

    public static UserAttributes of(DirectoryUser user) {
        return new UserAttributes(user.getEmail(), user.getDisplayName(), user.isAdmin());
    }

    public String getEmail() { return email; }

    public String getDisplayName() { return displayName; }

    public boolean isSuperuser() { return superuser; }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UserAttributes)) {
            return false;
        }
        UserAttributes that = (UserAttributes) o;
        return superuser == that.superuser
            && Objects.equals(email, that.email)
            && Objects.equals(displayName, that.displayName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(email, displayName, superuser);
    }

    @Override
    public String toString() {
        return String.format("UserAttributes[email=%s, name=%s, superuser=%s]",
            email, displayName, superuser);
    }
}
