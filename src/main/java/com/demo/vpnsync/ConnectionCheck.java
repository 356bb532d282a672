package com.demo.vpnsync;

import com.demo.vpnsync.model.DirectoryUser;
import com.demo.vpnsync.service.DirectoryException;
import com.demo.vpnsync.service.DirectoryReader;
import com.demo.vpnsync.service.ExternalStoreClient;
import com.demo.vpnsync.service.ExternalStoreException;

import java.io.PrintStream;
import java.util.List;

/**
 * Verifies that both stores answer, printing a short report.
 */
public class ConnectionCheck {
    private final DirectoryReader directory;
    private final ExternalStoreClient externalStore;
    private final PrintStream out;

    public ConnectionCheck(DirectoryReader directory, ExternalStoreClient externalStore) {
        this(directory, externalStore, System.out);
    }

    ConnectionCheck(DirectoryReader directory, ExternalStoreClient externalStore, PrintStream out) {
        this.directory = directory;
        this.externalStore = externalStore;
        this.out = out;
    }

    public boolean run() {
        out.println("=== Testing Connections ===");
        out.println();
        boolean directoryOk = checkDirectory();
        boolean externalOk = checkExternalStore();
        out.println();
        out.println("=== Test Complete ===");
        return directoryOk && externalOk;
    }

    private boolean checkDirectory() {
        out.println("1. Testing directory connection...");
        try {
            List<DirectoryUser> users = directory.listUsers();
            long eligible = users.stream().filter(DirectoryUser::isEligible).count();
            out.println("   OK  found " + users.size() + " users (" + eligible + " eligible)");
            users.stream().limit(3).forEach(u ->
                out.println("     - " + u.getUsername() + " (" + u.getEmail() + ")"));
            return true;
        } catch (DirectoryException e) {
            out.println("   FAILED  " + e.getMessage());
            return false;
        }
    }

    private boolean checkExternalStore() {
        out.println("2. Testing access server connection...");
        try {
            List<String> usernames = externalStore.list();
            out.println("   OK  found " + usernames.size() + " users");
            return true;
        } catch (ExternalStoreException e) {
            out.println("   FAILED  " + e.getMessage());
            return false;
        }
    }
}
