package com.demo.vpnsync.scheduler;

/**
 * A run was requested while another one was still in flight. Nothing was changed.
 */
public class AlreadySyncingException extends Exception {

    public AlreadySyncingException() {
        super("A synchronization run is already in progress");
    }
}
