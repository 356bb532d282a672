package com.demo.vpnsync.service;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.demo.vpnsync.model.DirectoryUser;
import com.demo.vpnsync.model.SkipReason;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import org.junit.Before;
import org.junit.Test;

public class JdbcDirectoryReaderTest {

    private Connection connection;
    private PreparedStatement statement;
    private ResultSet rows;
    private JdbcDirectoryReader reader;

    @Before
    public void setup() throws Exception {
        connection = mock(Connection.class);
        statement = mock(PreparedStatement.class);
        rows = mock(ResultSet.class);
        when(statement.executeQuery()).thenReturn(rows);
        reader = new JdbcDirectoryReader(() -> connection, 7);
    }

    @Test
    public void testListUsersMapsRows() throws Exception {
        when(connection.prepareStatement(JdbcDirectoryReader.SELECT_USERS)).thenReturn(statement);
        when(rows.next()).thenReturn(true, true, false);
        when(rows.getLong("id")).thenReturn(1L, 2L);
        when(rows.getString("username")).thenReturn("alice", "   ");
        when(rows.getString("email")).thenReturn("alice@example.com", "bob@example.com");
        when(rows.getString("name")).thenReturn("Alice", "Bob");
        when(rows.getString("role")).thenReturn("admin", "user");
        when(rows.getBoolean("email_verified")).thenReturn(true, true);

        List<DirectoryUser> users = reader.listUsers();

        assertEquals(2, users.size());
        DirectoryUser alice = users.get(0);
        assertEquals(1L, alice.getId());
        assertEquals("alice", alice.getUsername());
        assertEquals("Alice", alice.getDisplayName());
        assertTrue(alice.isAdmin());
        assertTrue(alice.isEligible());

        DirectoryUser blank = users.get(1);
        assertNull(blank.getUsername());
        assertEquals(SkipReason.NO_USERNAME, blank.getIneligibility());

        verify(statement).setQueryTimeout(7);
        verify(rows).close();
        verify(statement).close();
        verify(connection).close();
    }

    @Test
    public void testListEligibleUsersFiltersUnverified() throws Exception {
        when(connection.prepareStatement(JdbcDirectoryReader.SELECT_USERS)).thenReturn(statement);
        when(rows.next()).thenReturn(true, true, false);
        when(rows.getLong("id")).thenReturn(1L, 2L);
        when(rows.getString("username")).thenReturn("alice", "bob");
        when(rows.getBoolean("email_verified")).thenReturn(true, false);

        List<DirectoryUser> eligible = reader.listEligibleUsers();

        assertEquals(1, eligible.size());
        assertEquals("alice", eligible.get(0).getUsername());
    }

    @Test
    public void testQueryExcludesSoftDeletedRows() {
        assertTrue(JdbcDirectoryReader.SELECT_USERS.contains("deleted_at IS NULL"));
        assertTrue(JdbcDirectoryReader.SELECT_USER_BY_ID.contains("deleted_at IS NULL"));
    }

    @Test
    public void testGetById() throws Exception {
        when(connection.prepareStatement(JdbcDirectoryReader.SELECT_USER_BY_ID)).thenReturn(statement);
        when(rows.next()).thenReturn(true);
        when(rows.getLong("id")).thenReturn(42L);
        when(rows.getString("username")).thenReturn("erin");
        when(rows.getBoolean("email_verified")).thenReturn(false);

        DirectoryUser user = reader.getById(42);

        verify(statement).setLong(1, 42L);
        assertEquals("erin", user.getUsername());
        assertFalse(user.isEmailVerified());
    }

    @Test
    public void testGetByIdNotFound() throws Exception {
        when(connection.prepareStatement(JdbcDirectoryReader.SELECT_USER_BY_ID)).thenReturn(statement);
        when(rows.next()).thenReturn(false);

        assertNull(reader.getById(99));
    }

    @Test
    public void testSqlFailureIsWrapped() throws Exception {
        SQLException cause = new SQLException("Communications link failure");
        JdbcDirectoryReader failing = new JdbcDirectoryReader(() -> {
            throw cause;
        }, 7);

        try {
            failing.listUsers();
            fail("expected DirectoryException");
        } catch (DirectoryException e) {
            assertSame(cause, e.getCause());
            assertTrue(e.getMessage().contains("Communications link failure"));
        }
    }
}
