package com.demo.vpnsync.service;

/**
 * A command reached the access server but was rejected or produced unusable output, for example
 * an unknown user or malformed input. Failures of this kind concern a single username.
 */
public class ExternalStoreException extends Exception {

    public ExternalStoreException(String message) {
        super(message);
    }

    public ExternalStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
