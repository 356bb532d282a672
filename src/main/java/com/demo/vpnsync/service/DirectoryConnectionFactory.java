package com.demo.vpnsync.service;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of directory connections. Callers close every connection they open.
 */
@FunctionalInterface
public interface DirectoryConnectionFactory {

    Connection open() throws SQLException;
}
