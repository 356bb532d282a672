package com.demo.vpnsync.service;

/**
 * The user directory could not be read.
 */
public class DirectoryException extends Exception {

    public DirectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
