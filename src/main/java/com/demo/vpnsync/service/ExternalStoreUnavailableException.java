package com.demo.vpnsync.service;

/**
 * The access server's container could not be reached at all: the engine or proxy refused the
 * connection, timed out, or reported the container as missing or stopped. Retrying later may help.
 */
public class ExternalStoreUnavailableException extends ExternalStoreException {

    public ExternalStoreUnavailableException(String message) {
        super(message);
    }

    public ExternalStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
