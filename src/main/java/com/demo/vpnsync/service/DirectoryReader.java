package com.demo.vpnsync.service;

import com.demo.vpnsync.model.DirectoryUser;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Read access to the authoritative user directory.
 */
public interface DirectoryReader {

    /**
     * Returns every active (not soft-deleted) user, eligible or not.
     */
    List<DirectoryUser> listUsers() throws DirectoryException;

    /**
     * Returns the active user with the given id, or {@code null} if there is none.
     */
    DirectoryUser getById(long id) throws DirectoryException;

    default List<DirectoryUser> listEligibleUsers() throws DirectoryException {
        return listUsers().stream()
            .filter(DirectoryUser::isEligible)
            .collect(Collectors.toList());
    }
}
