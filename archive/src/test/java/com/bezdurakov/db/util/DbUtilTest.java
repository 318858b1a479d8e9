package com.bezdurakov.db.util;

import static org.junit.jupiter.api.Assertions.*;

import com.bezdurakov.common.status.Status;
import com.bezdurakov.common.status.StatusCode;
import com.bezdurakov.game.Scores;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;
import java.time.LocalDate;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for the DbUtil class. Exception classification is checked on constructed exceptions; the
 * binding helpers run against a real SQLite driver.
 */
class DbUtilTest {

  @TempDir static Path tempDir;

  private static SqliteTestHelper.SqliteContext sqliteContext;
  private static Connection connection;

  @BeforeAll
  static void setUp() throws SQLException {
    sqliteContext = SqliteTestHelper.setupSqlite(tempDir, DbUtilTest.class);
    connection = sqliteContext.getConnection();
    try (Statement stmt = connection.createStatement()) {
      stmt.execute(
          """
          CREATE TABLE db_util_test (
            id INTEGER PRIMARY KEY,
            date_col DATE,
            amount_col NUMERIC(10,2)
          )
          """);
    }
  }

  @AfterAll
  static void tearDown() {
    sqliteContext.close();
  }

  @BeforeEach
  void clearTable() throws SQLException {
    try (Statement stmt = connection.createStatement()) {
      stmt.execute("DELETE FROM db_util_test");
    }
  }

  @Test
  void testDateAndDecimal_RoundTrip() throws SQLException {
    // Given: A date and a value that is inexact in binary floating point
    LocalDate date = LocalDate.of(2024, 1, 15);
    BigDecimal amount = Scores.of("42.10");

    // When: They are written and read back
    try (PreparedStatement insert =
        connection.prepareStatement(
            "INSERT INTO db_util_test (id, date_col, amount_col) VALUES (1, ?, ?)")) {
      DbUtil.setLocalDate(insert, 1, date);
      DbUtil.setDecimal(insert, 2, amount);
      insert.executeUpdate();
    }

    // Then: Both come back unchanged, the value at scale 2
    try (Statement stmt = connection.createStatement();
        ResultSet rs = stmt.executeQuery("SELECT date_col, amount_col FROM db_util_test")) {
      assertTrue(rs.next());
      assertEquals(date, DbUtil.getLocalDate(rs, "date_col"));
      assertEquals(amount, DbUtil.getDecimal(rs, "amount_col"));
    }
  }

  @Test
  void testOptionalDecimal_ReturnsNull_ForSqlNull() throws SQLException {
    // Given: A row with a NULL amount
    try (PreparedStatement insert =
        connection.prepareStatement("INSERT INTO db_util_test (id, amount_col) VALUES (2, ?)")) {
      DbUtil.setDecimal(insert, 1, null);
      insert.executeUpdate();
    }

    // Then: The optional getter yields null and the required getter refuses
    try (Statement stmt = connection.createStatement();
        ResultSet rs = stmt.executeQuery("SELECT amount_col FROM db_util_test")) {
      assertTrue(rs.next());
      assertNull(DbUtil.getOptionalDecimal(rs, "amount_col"));
      assertThrows(SQLException.class, () -> DbUtil.getDecimal(rs, "amount_col"));
    }
  }

  @Test
  void testLocalDate_StoredAsIsoText_OnSqlite() throws SQLException {
    // When: A date is bound
    try (PreparedStatement insert =
        connection.prepareStatement("INSERT INTO db_util_test (id, date_col) VALUES (3, ?)")) {
      DbUtil.setLocalDate(insert, 1, LocalDate.of(2024, 1, 15));
      insert.executeUpdate();
    }

    // Then: SQLite holds plain ISO text, independent of the JVM time zone
    assertTrue(DbUtil.isSqlite(connection));
    try (Statement stmt = connection.createStatement();
        ResultSet rs = stmt.executeQuery("SELECT typeof(date_col), date_col FROM db_util_test")) {
      assertTrue(rs.next());
      assertEquals("text", rs.getString(1));
      assertEquals("2024-01-15", rs.getString(2));
    }
  }

  @Test
  void testGetLocalDate_RejectsNonDateValue() throws SQLException {
    try (Statement stmt = connection.createStatement()) {
      stmt.executeUpdate("INSERT INTO db_util_test (id, date_col) VALUES (4, 'yesterday')");
    }

    try (Statement stmt = connection.createStatement();
        ResultSet rs = stmt.executeQuery("SELECT date_col FROM db_util_test")) {
      assertTrue(rs.next());
      SQLException e = assertThrows(SQLException.class, () -> DbUtil.getLocalDate(rs, "date_col"));
      assertTrue(e.getMessage().contains("yesterday"));
    }
  }

  @Test
  void testIsUniqueViolation_RecognizesEachDriver() {
    assertTrue(DbUtil.isUniqueViolation(new SQLException("duplicate key", "23505")));
    assertTrue(
        DbUtil.isUniqueViolation(
            new SQLException("[SQLITE_CONSTRAINT_UNIQUE] UNIQUE constraint failed", null, 19)));
    assertTrue(
        DbUtil.isUniqueViolation(
            new SQLIntegrityConstraintViolationException("Duplicate entry", "23000", 1062)));

    assertFalse(
        DbUtil.isUniqueViolation(
            new SQLException(
                "[SQLITE_CONSTRAINT_FOREIGNKEY] FOREIGN KEY constraint failed", null, 19)));
    assertFalse(DbUtil.isUniqueViolation(new SQLException("syntax error", "42601")));
  }

  @Test
  void testToStatus_ClassifiesFailures() {
    Status unavailable =
        DbUtil.toStatus(new SQLTransientConnectionException("pool timeout"), "Failed to load");
    assertEquals(StatusCode.UNAVAILABLE, unavailable.getCode());
    assertEquals("Failed to load: pool timeout", unavailable.getMessage());

    assertEquals(
        StatusCode.UNAVAILABLE,
        DbUtil.toStatus(new SQLException("refused", "08001"), "ctx").getCode());
    assertEquals(
        StatusCode.ABORTED,
        DbUtil.toStatus(new SQLException("could not serialize", "40001"), "ctx").getCode());
    assertEquals(
        StatusCode.INTERNAL,
        DbUtil.toStatus(new SQLException("FOREIGN KEY constraint failed", null, 19), "ctx")
            .getCode());
  }
}
