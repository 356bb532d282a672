package com.demo.vpnsync.service;

import java.util.regex.Pattern;

/**
 * Usernames that may be handed to {@code sacli}: letters, digits, underscores and hyphens as the
 * registration form allows, plus the dots and at-signs of email-style access server accounts. A
 * leading hyphen is refused since sacli would read the name as an option.
 */
public final class Usernames {
    private static final Pattern VALID = Pattern.compile("[A-Za-z0-9_][A-Za-z0-9_.@-]{0,63}");

    private Usernames() {
    }

    public static boolean isValid(String username) {
        return username != null && VALID.matcher(username).matches();
    }

    /**
     * Returns the username unchanged, or throws if it cannot be passed to the access server.
     */
    public static String requireValid(String username) {
        if (!isValid(username)) {
            throw new IllegalArgumentException("Malformed username: " + username);
        }
        return username;
    }
}
