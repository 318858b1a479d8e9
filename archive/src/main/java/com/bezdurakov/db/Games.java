package com.bezdurakov.db;

import com.bezdurakov.common.status.StatusOr;
import com.bezdurakov.db.util.DbUtil;
import com.google.common.collect.ImmutableList;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nonnull;

/** DAO helper class for the 'games' table. */
public final class Games {

  private Games() {
    // Utility class
  }

  /**
   * Loads all games ordered by date, then id.
   *
   * @param conn an open JDBC connection
   * @return StatusOr containing a list of Game objects or an error
   */
  @Nonnull
  public static StatusOr<List<Game>> loadAll(Connection conn) {
    String sql =
        """
        SELECT game_id, game_date, created_at
          FROM games
         ORDER BY game_date, game_id
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql);
        ResultSet rs = stmt.executeQuery()) {
      List<Game> result = new ArrayList<>();
      while (rs.next()) {
        result.add(extractGame(rs));
      }
      return StatusOr.ofValue(ImmutableList.copyOf(result));
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.toStatus(e, "Failed to load games"));
    }
  }

  /**
   * Loads a single game by ID.
   *
   * @param conn an open JDBC connection
   * @param gameId the id of the game to load
   * @return StatusOr containing an Optional Game or an error
   */
  @Nonnull
  public static StatusOr<Optional<Game>> loadById(Connection conn, long gameId) {
    String sql =
        """
        SELECT game_id, game_date, created_at
          FROM games
         WHERE game_id = ?
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setLong(1, gameId);
      try (ResultSet rs = stmt.executeQuery()) {
        if (rs.next()) {
          return StatusOr.ofValue(Optional.of(extractGame(rs)));
        }
        return StatusOr.ofValue(Optional.empty());
      }
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.toStatus(e, "Failed to load game " + gameId));
    }
  }

  /**
   * Loads the ids of games played between two dates, both inclusive, ordered by date, then id.
   *
   * @param conn an open JDBC connection
   * @param start first date of the range
   * @param end last date of the range
   * @return StatusOr containing the matching ids or an error
   */
  @Nonnull
  public static StatusOr<List<Long>> loadIdsByDateRange(
      Connection conn, LocalDate start, LocalDate end) {
    String sql =
        """
        SELECT game_id
          FROM games
         WHERE game_date >= ? AND game_date <= ?
         ORDER BY game_date, game_id
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      DbUtil.setLocalDate(stmt, 1, start);
      DbUtil.setLocalDate(stmt, 2, end);
      try (ResultSet rs = stmt.executeQuery()) {
        List<Long> ids = new ArrayList<>();
        while (rs.next()) {
          ids.add(rs.getLong("game_id"));
        }
        return StatusOr.ofValue(ImmutableList.copyOf(ids));
      }
    } catch (SQLException e) {
      return StatusOr.ofStatus(
          DbUtil.toStatus(e, "Failed to load games between " + start + " and " + end));
    }
  }

  /**
   * Inserts a new game row.
   *
   * @param conn an open JDBC connection
   * @param gameDate the date the game was played
   * @param createdAt the creation timestamp to record
   * @return StatusOr containing the id assigned by the store or an error
   */
  @Nonnull
  public static StatusOr<Long> insert(Connection conn, LocalDate gameDate, Instant createdAt) {
    String sql =
        """
        INSERT INTO games (game_date, created_at)
        VALUES (?, ?)
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
      DbUtil.setLocalDate(stmt, 1, gameDate);
      stmt.setTimestamp(2, DbUtil.toSqlTimestamp(createdAt));
      stmt.executeUpdate();
      try (ResultSet keys = stmt.getGeneratedKeys()) {
        if (!keys.next()) {
          throw new SQLException("No id returned for new game");
        }
        return StatusOr.ofValue(keys.getLong(1));
      }
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.toStatus(e, "Failed to insert game on " + gameDate));
    }
  }

  /**
   * Deletes a game row. Memberships and round scores must be gone first.
   *
   * @param conn an open JDBC connection
   * @param gameId the id of the game to delete
   * @return StatusOr containing the number of affected rows or an error
   */
  @Nonnull
  public static StatusOr<Integer> delete(Connection conn, long gameId) {
    String sql =
        """
        DELETE FROM games
         WHERE game_id = ?
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setLong(1, gameId);
      return StatusOr.ofValue(stmt.executeUpdate());
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.toStatus(e, "Failed to delete game " + gameId));
    }
  }

  /** Extracts a Game from the current row of a ResultSet. */
  @Nonnull
  private static Game extractGame(ResultSet rs) throws SQLException {
    return new Game(
        rs.getLong("game_id"),
        DbUtil.getLocalDate(rs, "game_date"),
        DbUtil.getOptionalInstant(rs, "created_at"));
  }
}
