package com.demo.vpnsync.service;

import com.demo.vpnsync.model.DirectoryUser;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryDirectory implements DirectoryReader {
    private final List<DirectoryUser> users = new CopyOnWriteArrayList<>();
    private volatile boolean unavailable;

    public InMemoryDirectory add(DirectoryUser user) {
        users.add(user);
        return this;
    }

    public InMemoryDirectory verified(long id, String username) {
        return add(new DirectoryUser(id, username, username + "@example.com", true, "User " + username, "user"));
    }

    public InMemoryDirectory admin(long id, String username) {
        return add(new DirectoryUser(id, username, username + "@example.com", true, "Admin " + username, "admin"));
    }

    public InMemoryDirectory unverified(long id, String username) {
        return add(new DirectoryUser(id, username, username + "@example.com", false, "User " + username, "user"));
    }

    public InMemoryDirectory withoutUsername(long id, String email) {
        return add(new DirectoryUser(id, null, email, true, "No Name", "user"));
    }

    public void remove(String username) {
        users.removeIf(u -> username.equals(u.getUsername()));
    }

    public void unavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    @Override
    public List<DirectoryUser> listUsers() throws DirectoryException {
        if (unavailable) {
            throw new DirectoryException("Connection refused", null);
        }
        return new ArrayList<>(users);
    }

    @Override
    public DirectoryUser getById(long id) throws DirectoryException {
        if (unavailable) {
            throw new DirectoryException("Connection refused", null);
        }
        for (DirectoryUser user : users) {
            if (user.getId() == id) {
                return user;
            }
        }
        return null;
    }
}
