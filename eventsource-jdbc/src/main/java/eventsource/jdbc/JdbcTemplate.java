package eventsource.jdbc;

import eventsource.util.Cancellation;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Lightweight JDBC helper to reduce boilerplate in event and snapshot store implementations.
 *
 * <p>Every call checks the calling thread for cancellation before the round-trip and
 * applies the given query timeout in seconds ({@code 0} means no timeout). Errors are
 * returned as {@link SQLException} so each store can translate them into its own
 * exception type.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute INSERT/UPDATE/DELETE, return rows affected. */
  public static int update(Connection conn, int timeoutSeconds, String sql, Object... params) throws SQLException {
    Cancellation.throwIfCancelled("JDBC update");
    try (PreparedStatement ps = prepare(conn, timeoutSeconds, sql, params)) {
      return ps.executeUpdate();
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, int timeoutSeconds, String sql, RowMapper<T> mapper,
      Object... params) throws SQLException {
    Cancellation.throwIfCancelled("JDBC query");
    try (PreparedStatement ps = prepare(conn, timeoutSeconds, sql, params);
         ResultSet rs = ps.executeQuery()) {
      List<T> results = new ArrayList<>();
      while (rs.next()) {
        results.add(mapper.map(rs));
      }
      return results;
    }
  }

  /** Execute a SELECT expected to return at most one row. */
  public static <T> T queryOne(Connection conn, int timeoutSeconds, String sql, RowMapper<T> mapper,
      Object... params) throws SQLException {
    List<T> rows = query(conn, timeoutSeconds, sql, mapper, params);
    return rows.isEmpty() ? null : rows.get(0);
  }

  /** True for SQLSTATE class 23 (integrity constraint violation). */
  public static boolean isConstraintViolation(SQLException e) {
    for (SQLException current = e; current != null; current = current.getNextException()) {
      String state = current.getSQLState();
      if (state != null && state.startsWith("23")) {
        return true;
      }
    }
    return false;
  }

  /** Rolls back, attaching any rollback failure to {@code primary}. */
  public static void rollbackQuietly(Connection conn, Throwable primary) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      primary.addSuppressed(e);
    }
  }

  private static PreparedStatement prepare(Connection conn, int timeoutSeconds, String sql, Object... params)
      throws SQLException {
    PreparedStatement ps = conn.prepareStatement(sql);
    try {
      if (timeoutSeconds > 0) {
        ps.setQueryTimeout(timeoutSeconds);
      }
      bindParams(ps, params);
      return ps;
    } catch (SQLException e) {
      ps.close();
      throw e;
    }
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Instant instant) {
        ps.setTimestamp(i + 1, Timestamp.from(instant));
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
