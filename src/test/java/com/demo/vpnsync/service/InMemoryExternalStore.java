package com.demo.vpnsync.service;

import com.demo.vpnsync.model.UserAttributes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Access server fake backed by a map. Like the sacli client it refuses malformed usernames before
 * any call. Records every call and can be told to reject specific usernames, to become
 * unreachable, or to block inside {@link #list()}.
 */
public class InMemoryExternalStore implements ExternalStoreClient {
    private final Map<String, UserAttributes> users = Collections.synchronizedMap(new TreeMap<>());
    private final Map<String, String> passwords = new ConcurrentHashMap<>();
    private final List<String> calls = new CopyOnWriteArrayList<>();
    private final Set<String> rejected = Collections.synchronizedSet(new HashSet<>());
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    private volatile boolean unavailable;
    private volatile int unavailableAfterMutations = -1;
    private volatile CountDownLatch listEntered;
    private volatile CountDownLatch listRelease;
    private final AtomicInteger mutations = new AtomicInteger();

    public InMemoryExternalStore(String... usernames) {
        for (String username : usernames) {
            users.put(username, new UserAttributes(null, null, false));
        }
    }

    public InMemoryExternalStore reject(String username) {
        rejected.add(username);
        return this;
    }

    public InMemoryExternalStore unavailable(boolean unavailable) {
        this.unavailable = unavailable;
        return this;
    }

    /** Mutations beyond the first {@code count} fail as unreachable. */
    public InMemoryExternalStore unavailableAfterMutations(int count) {
        this.unavailableAfterMutations = count;
        return this;
    }

    public void blockListing(CountDownLatch entered, CountDownLatch release) {
        this.listEntered = entered;
        this.listRelease = release;
    }

    @Override
    public List<String> list() throws ExternalStoreException {
        enter("list");
        try {
            CountDownLatch entered = listEntered;
            if (entered != null) {
                entered.countDown();
                try {
                    listRelease.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            synchronized (users) {
                return new ArrayList<>(users.keySet());
            }
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @Override
    public void create(String username, String password, UserAttributes attributes) throws ExternalStoreException {
        mutate("create:" + username, username);
        try {
            users.put(username, attributes);
            passwords.put(username, password);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @Override
    public void update(String username, UserAttributes attributes) throws ExternalStoreException {
        mutate("update:" + username, username);
        try {
            if (!users.containsKey(username)) {
                throw new ExternalStoreException("User not found: " + username);
            }
            users.put(username, attributes);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @Override
    public void delete(String username) throws ExternalStoreException {
        mutate("delete:" + username, username);
        try {
            users.remove(username);
            passwords.remove(username);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @Override
    public void setPassword(String username, String password) throws ExternalStoreException {
        mutate("password:" + username, username);
        try {
            passwords.put(username, password);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void enter(String call) throws ExternalStoreException {
        calls.add(call);
        if (unavailable) {
            throw new ExternalStoreUnavailableException("Container openvpn-server is not running");
        }
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
    }

    private void mutate(String call, String username) throws ExternalStoreException {
        Usernames.requireValid(username);
        int limit = unavailableAfterMutations;
        if (limit >= 0 && mutations.get() >= limit) {
            calls.add(call);
            throw new ExternalStoreUnavailableException("Container openvpn-server is not running");
        }
        enter(call);
        if (rejected.contains(username)) {
            inFlight.decrementAndGet();
            throw new ExternalStoreException("sacli rejected user " + username);
        }
        mutations.incrementAndGet();
    }

    public List<String> usernames() {
        synchronized (users) {
            return new ArrayList<>(users.keySet());
        }
    }

    public UserAttributes attributes(String username) {
        return users.get(username);
    }

    public String password(String username) {
        return passwords.get(username);
    }

    public List<String> calls() {
        return new ArrayList<>(calls);
    }

    /** Calls other than {@code list}. */
    public List<String> mutationCalls() {
        List<String> result = new ArrayList<>();
        for (String call : calls) {
            if (!"list".equals(call)) {
                result.add(call);
            }
        }
        return result;
    }

    public int maxConcurrentCalls() {
        return maxInFlight.get();
    }
}
