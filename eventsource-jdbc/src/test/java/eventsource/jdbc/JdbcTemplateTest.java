package eventsource.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTemplateTest {

    private JdbcDataSource dataSource;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = JdbcTestSupport.h2();
    }

    @Test
    void updateAndQueryBindParameterTypes() throws SQLException {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        try (Connection conn = dataSource.getConnection()) {
            int rows = JdbcTemplate.update(conn, 5,
                    "INSERT INTO event_listener_checkpoints (listener_name, last_position, updated_at) VALUES (?,?,?)",
                    "a", 42L, now);
            assertEquals(1, rows);

            List<Long> positions = JdbcTemplate.query(conn, 5,
                    "SELECT last_position FROM event_listener_checkpoints WHERE listener_name=?",
                    rs -> rs.getLong(1), "a");
            assertEquals(List.of(42L), positions);

            Instant stored = JdbcTemplate.queryOne(conn, 0,
                    "SELECT updated_at FROM event_listener_checkpoints WHERE listener_name=?",
                    rs -> rs.getTimestamp(1).toInstant(), "a");
            assertEquals(now, stored);
        }
    }

    @Test
    void queryOneReturnsNullWhenNoRow() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            assertNull(JdbcTemplate.queryOne(conn, 5,
                    "SELECT last_position FROM event_listener_checkpoints WHERE listener_name=?",
                    rs -> rs.getLong(1), "missing"));
        }
    }

    @Test
    void duplicateKeyIsAConstraintViolation() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            String sql = "INSERT INTO event_listener_checkpoints (listener_name, last_position, updated_at) VALUES (?,?,?)";
            JdbcTemplate.update(conn, 5, sql, "a", 1L, Instant.now());
            SQLException ex = assertThrows(SQLException.class,
                    () -> JdbcTemplate.update(conn, 5, sql, "a", 2L, Instant.now()));
            assertTrue(JdbcTemplate.isConstraintViolation(ex));
        }
    }

    @Test
    void syntaxErrorIsNotAConstraintViolation() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            SQLException ex = assertThrows(SQLException.class,
                    () -> JdbcTemplate.update(conn, 5, "UPDATE no_such_table SET x=1"));
            assertFalse(JdbcTemplate.isConstraintViolation(ex));
        }
    }

    @Test
    void interruptedThreadIsRejectedBeforeTheRoundTrip() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            Thread.currentThread().interrupt();
            try {
                assertThrows(CancellationException.class,
                        () -> JdbcTemplate.query(conn, 5, "SELECT 1", rs -> rs.getInt(1)));
            } finally {
                Thread.interrupted();
            }
        }
    }
}
