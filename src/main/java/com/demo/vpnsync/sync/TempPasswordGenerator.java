package com.demo.vpnsync.sync;

import java.security.SecureRandom;

/**
 * Issues one-time passwords for users newly created on the access server.
 */
public class TempPasswordGenerator {
    static final String CHARSET =
        "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789!@#$%^&*";
    static final int LENGTH = 16;

    private final SecureRandom random;

    public TempPasswordGenerator() {
        this(new SecureRandom());
    }

    TempPasswordGenerator(SecureRandom random) {
        this.random = random;
    }

    public String generate() {
        StringBuilder password = new StringBuilder(LENGTH);
        for (int i = 0; i < LENGTH; i++) {
            password.append(CHARSET.charAt(random.nextInt(CHARSET.length())));
        }
        return password.toString();
    }
}
