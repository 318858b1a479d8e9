package com.bezdurakov.db.util;

import com.bezdurakov.common.status.Status;
import com.bezdurakov.common.status.StatusCode;
import com.bezdurakov.game.Scores;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** Utility methods for database operations. */
public final class DbUtil {

  /** PostgreSQL {@code unique_violation}. */
  static final String SQLSTATE_UNIQUE_VIOLATION = "23505";

  /** SQLite primary result code {@code SQLITE_CONSTRAINT}. */
  static final int SQLITE_CONSTRAINT = 19;

  static final String SQLITE_PRODUCT_NAME = "SQLite";

  /** MySQL {@code ER_DUP_ENTRY}. */
  static final int MYSQL_DUPLICATE_ENTRY = 1062;

  private DbUtil() {
    // Utility class, no instances
  }

  /** Converts a java.time.Instant to java.sql.Timestamp. */
  @Nonnull
  public static Timestamp toSqlTimestamp(Instant instant) {
    if (instant == null) {
      throw new IllegalArgumentException("Instant cannot be null");
    }
    return Timestamp.from(instant);
  }

  /** Gets a nullable Instant from a ResultSet column. */
  @Nullable
  public static Instant getOptionalInstant(ResultSet rs, String columnName) throws SQLException {
    Timestamp timestamp = rs.getTimestamp(columnName);
    if (timestamp == null) {
      return null;
    }
    return timestamp.toInstant();
  }

  /**
   * Binds a calendar date. SQLite receives ISO {@code yyyy-MM-dd} text; other drivers receive a
   * {@link LocalDate} object.
   */
  public static void setLocalDate(PreparedStatement stmt, int index, LocalDate date)
      throws SQLException {
    if (isSqlite(stmt.getConnection())) {
      stmt.setString(index, date.toString());
    } else {
      stmt.setObject(index, date);
    }
  }

  /** Reads a required calendar date stored as a SQL DATE or as ISO {@code yyyy-MM-dd} text. */
  @Nonnull
  public static LocalDate getLocalDate(ResultSet rs, String columnName) throws SQLException {
    String text = rs.getString(columnName);
    if (text == null) {
      throw new SQLException("Column " + columnName + " is null");
    }
    String trimmed = text.trim();
    try {
      return LocalDate.parse(trimmed.length() > 10 ? trimmed.substring(0, 10) : trimmed);
    } catch (DateTimeParseException e) {
      throw new SQLException("Column " + columnName + " holds no ISO date: " + text, e);
    }
  }

  /** Whether the connection talks to SQLite. */
  public static boolean isSqlite(Connection conn) throws SQLException {
    return SQLITE_PRODUCT_NAME.equalsIgnoreCase(conn.getMetaData().getDatabaseProductName());
  }

  /** Binds a fixed-point value, or SQL NULL when the value is absent. */
  public static void setDecimal(PreparedStatement stmt, int index, @Nullable BigDecimal value)
      throws SQLException {
    if (value == null) {
      stmt.setNull(index, Types.NUMERIC);
    } else {
      stmt.setBigDecimal(index, value);
    }
  }

  /** Reads a required fixed-point column at scale 2. */
  @Nonnull
  public static BigDecimal getDecimal(ResultSet rs, String columnName) throws SQLException {
    BigDecimal value = getOptionalDecimal(rs, columnName);
    if (value == null) {
      throw new SQLException("Column " + columnName + " is null");
    }
    return value;
  }

  /** Reads a nullable fixed-point column at scale 2. */
  @Nullable
  public static BigDecimal getOptionalDecimal(ResultSet rs, String columnName)
      throws SQLException {
    BigDecimal value = rs.getBigDecimal(columnName);
    if (value == null) {
      return null;
    }
    return Scores.fromStore(value);
  }

  /**
   * Whether the exception reports a violated UNIQUE or PRIMARY KEY constraint. Covers the
   * PostgreSQL, SQLite and MySQL drivers.
   */
  public static boolean isUniqueViolation(SQLException e) {
    if (SQLSTATE_UNIQUE_VIOLATION.equals(e.getSQLState())) {
      return true;
    }
    if (e instanceof SQLIntegrityConstraintViolationException
        && e.getErrorCode() == MYSQL_DUPLICATE_ENTRY) {
      return true;
    }
    String message = e.getMessage() == null ? "" : e.getMessage().toUpperCase(Locale.ROOT);
    return e.getErrorCode() == SQLITE_CONSTRAINT
        && (message.contains("UNIQUE") || message.contains("PRIMARY KEY"));
  }

  /** Whether the exception means the connection to the store was lost or never established. */
  public static boolean isConnectionFailure(SQLException e) {
    if (e instanceof SQLTransientConnectionException
        || e instanceof SQLNonTransientConnectionException) {
      return true;
    }
    String state = e.getSQLState();
    return state != null && state.startsWith("08");
  }

  /** Whether the exception is a serialization failure or deadlock the caller may retry. */
  public static boolean isSerializationFailure(SQLException e) {
    return "40001".equals(e.getSQLState()) || "40P01".equals(e.getSQLState());
  }

  /**
   * Converts a driver exception to a status.
   *
   * @param e the exception thrown by the driver
   * @param context what was being attempted, used as message prefix
   * @return UNAVAILABLE for connectivity failures, ABORTED for serialization conflicts and
   *     INTERNAL for everything else
   */
  @Nonnull
  public static Status toStatus(SQLException e, String context) {
    String message = context + ": " + e.getMessage();
    if (isConnectionFailure(e)) {
      return Status.unavailable(message, e);
    }
    if (isSerializationFailure(e)) {
      return Status.of(StatusCode.ABORTED, message, e);
    }
    return Status.internal(message, e);
  }
}
