package com.bezdurakov.db;

import com.bezdurakov.common.status.Status;
import com.bezdurakov.common.status.StatusCode;
import com.bezdurakov.common.status.StatusOr;
import com.bezdurakov.db.util.DbUtil;
import com.google.common.collect.ImmutableList;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * DAO helper class for the 'teams' table.
 *
 * <p>Teams are never cached in-process: every lookup goes to the store so that teams created by
 * other writers are seen.
 */
public final class Teams {

  /** Lookup/insert rounds made by {@link #getOrCreate} before giving up. */
  static final int MAX_CREATE_ATTEMPTS = 3;

  private Teams() {
    // Utility class
  }

  /**
   * Loads all teams ordered by name.
   *
   * @param conn an open JDBC connection
   * @return StatusOr containing a list of Team objects or an error
   */
  @Nonnull
  public static StatusOr<List<Team>> loadAll(Connection conn) {
    String sql =
        """
        SELECT team_id, team_name
          FROM teams
         ORDER BY team_name
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql);
        ResultSet rs = stmt.executeQuery()) {
      List<Team> result = new ArrayList<>();
      while (rs.next()) {
        result.add(extractTeam(rs));
      }
      return StatusOr.ofValue(ImmutableList.copyOf(result));
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.toStatus(e, "Failed to load teams"));
    }
  }

  /**
   * Loads a team by its exact, case-sensitive name.
   *
   * @param conn an open JDBC connection
   * @param teamName the name to look up
   * @return StatusOr containing an Optional Team or an error
   */
  @Nonnull
  public static StatusOr<Optional<Team>> loadByName(Connection conn, String teamName) {
    String sql =
        """
        SELECT team_id, team_name
          FROM teams
         WHERE team_name = ?
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, teamName);
      try (ResultSet rs = stmt.executeQuery()) {
        if (rs.next()) {
          return StatusOr.ofValue(Optional.of(extractTeam(rs)));
        }
        return StatusOr.ofValue(Optional.empty());
      }
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.toStatus(e, "Failed to load team '" + teamName + "'"));
    }
  }

  /**
   * Inserts a new team.
   *
   * @param conn an open JDBC connection
   * @param teamName the unique name of the team
   * @return StatusOr containing the new team id, ALREADY_EXISTS if the name is taken, or an error
   */
  @Nonnull
  public static StatusOr<Long> insert(Connection conn, String teamName) {
    try {
      return StatusOr.ofValue(insertRow(conn, teamName));
    } catch (SQLException e) {
      return StatusOr.ofStatus(insertFailure(e, teamName));
    }
  }

  /**
   * Returns the id of the named team, creating the team when it does not exist yet.
   *
   * <p>Runs on the caller's connection and therefore inside the caller's transaction. When another
   * writer creates the same name between the lookup and the insert, the insert is rolled back to
   * a savepoint and the lookup repeated, up to {@link #MAX_CREATE_ATTEMPTS} times.
   *
   * @param conn an open JDBC connection
   * @param teamName the exact team name
   * @return StatusOr containing the team id, ABORTED when the race could not be resolved, or an
   *     error
   */
  @Nonnull
  public static StatusOr<Long> getOrCreate(Connection conn, String teamName) {
    for (int attempt = 1; attempt <= MAX_CREATE_ATTEMPTS; attempt++) {
      StatusOr<Optional<Team>> existingOr = loadByName(conn, teamName);
      if (existingOr.isNotOk()) {
        return StatusOr.ofStatus(existingOr.getStatus());
      }
      if (existingOr.getValue().isPresent()) {
        return StatusOr.ofValue(existingOr.getValue().get().teamId());
      }

      StatusOr<Long> insertedOr = insertUnderSavepoint(conn, teamName);
      if (insertedOr.isOk() || insertedOr.getStatus().getCode() != StatusCode.ALREADY_EXISTS) {
        if (insertedOr.isOk()) {
          Logger.debug("Created team '{}' with id {}", teamName, insertedOr.getValue());
        }
        return insertedOr;
      }
      Logger.warn(
          "Team '{}' was created concurrently, retrying lookup (attempt {} of {})",
          teamName,
          attempt,
          MAX_CREATE_ATTEMPTS);
    }
    return StatusOr.ofStatus(
        Status.aborted(
            "Team '"
                + teamName
                + "' could not be created or found after "
                + MAX_CREATE_ATTEMPTS
                + " attempts"));
  }

  /**
   * Deletes every team. Only valid once no game references them.
   *
   * @param conn an open JDBC connection
   * @return StatusOr containing the number of deleted teams or an error
   */
  @Nonnull
  public static StatusOr<Integer> deleteAll(Connection conn) {
    String sql = "DELETE FROM teams";
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      return StatusOr.ofValue(stmt.executeUpdate());
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.toStatus(e, "Failed to delete teams"));
    }
  }

  /**
   * Inserts the team inside a savepoint when a transaction is open, so a unique violation leaves
   * the surrounding transaction usable.
   */
  @Nonnull
  private static StatusOr<Long> insertUnderSavepoint(Connection conn, String teamName) {
    Savepoint savepoint = null;
    try {
      if (!conn.getAutoCommit()) {
        savepoint = conn.setSavepoint();
      }
      long teamId = insertRow(conn, teamName);
      if (savepoint != null) {
        conn.releaseSavepoint(savepoint);
      }
      return StatusOr.ofValue(teamId);
    } catch (SQLException e) {
      Status rollbackFailure = rollbackTo(conn, savepoint);
      if (rollbackFailure != null) {
        return StatusOr.ofStatus(rollbackFailure);
      }
      return StatusOr.ofStatus(insertFailure(e, teamName));
    }
  }

  @Nonnull
  private static Status insertFailure(SQLException e, String teamName) {
    if (DbUtil.isUniqueViolation(e)) {
      return Status.alreadyExists("Team '" + teamName + "' already exists");
    }
    return DbUtil.toStatus(e, "Failed to insert team '" + teamName + "'");
  }

  @Nullable
  private static Status rollbackTo(Connection conn, @Nullable Savepoint savepoint) {
    if (savepoint == null) {
      return null;
    }
    try {
      conn.rollback(savepoint);
      return null;
    } catch (SQLException e) {
      Logger.error(e, "Failed to roll back to savepoint");
      return DbUtil.toStatus(e, "Failed to roll back to savepoint");
    }
  }

  private static long insertRow(Connection conn, String teamName) throws SQLException {
    String sql =
        """
        INSERT INTO teams (team_name)
        VALUES (?)
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
      stmt.setString(1, teamName);
      stmt.executeUpdate();
      try (ResultSet keys = stmt.getGeneratedKeys()) {
        if (!keys.next()) {
          throw new SQLException("No id returned for new team '" + teamName + "'");
        }
        return keys.getLong(1);
      }
    }
  }

  /** Extracts a Team from the current row of a ResultSet. */
  @Nonnull
  private static Team extractTeam(ResultSet rs) throws SQLException {
    return new Team(rs.getLong("team_id"), rs.getString("team_name"));
  }
}
