package com.bezdurakov.db;

import com.bezdurakov.common.status.StatusOr;
import com.bezdurakov.db.util.DbUtil;
import com.google.common.collect.ImmutableList;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nonnull;

/** DAO helper class for the 'game_teams' membership table. */
public final class GameTeams {

  private GameTeams() {
    // Utility class
  }

  /**
   * Loads the membership rows of one game ordered by team id.
   *
   * @param conn an open JDBC connection
   * @param gameId the game
   * @return StatusOr containing the memberships or an error
   */
  @Nonnull
  public static StatusOr<List<GameTeam>> loadByGame(Connection conn, long gameId) {
    String sql =
        """
        SELECT game_id, team_id
          FROM game_teams
         WHERE game_id = ?
         ORDER BY team_id
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setLong(1, gameId);
      try (ResultSet rs = stmt.executeQuery()) {
        List<GameTeam> result = new ArrayList<>();
        while (rs.next()) {
          result.add(new GameTeam(rs.getLong("game_id"), rs.getLong("team_id")));
        }
        return StatusOr.ofValue(ImmutableList.copyOf(result));
      }
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.toStatus(e, "Failed to load teams of game " + gameId));
    }
  }

  /**
   * Loads the teams that played in one game, ordered by team id.
   *
   * @param conn an open JDBC connection
   * @param gameId the game
   * @return StatusOr containing the teams or an error
   */
  @Nonnull
  public static StatusOr<List<Team>> loadTeamsOfGame(Connection conn, long gameId) {
    String sql =
        """
        SELECT t.team_id, t.team_name
          FROM game_teams gt
          JOIN teams t ON t.team_id = gt.team_id
         WHERE gt.game_id = ?
         ORDER BY t.team_id
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setLong(1, gameId);
      try (ResultSet rs = stmt.executeQuery()) {
        List<Team> result = new ArrayList<>();
        while (rs.next()) {
          result.add(new Team(rs.getLong("team_id"), rs.getString("team_name")));
        }
        return StatusOr.ofValue(ImmutableList.copyOf(result));
      }
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.toStatus(e, "Failed to load teams of game " + gameId));
    }
  }

  /**
   * Records that a team played in a game.
   *
   * @param conn an open JDBC connection
   * @param gameId an existing game
   * @param teamId an existing team
   * @return StatusOr containing the number of affected rows or an error
   */
  @Nonnull
  public static StatusOr<Integer> insert(Connection conn, long gameId, long teamId) {
    String sql =
        """
        INSERT INTO game_teams (game_id, team_id)
        VALUES (?, ?)
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setLong(1, gameId);
      stmt.setLong(2, teamId);
      return StatusOr.ofValue(stmt.executeUpdate());
    } catch (SQLException e) {
      return StatusOr.ofStatus(
          DbUtil.toStatus(e, "Failed to add team " + teamId + " to game " + gameId));
    }
  }

  /**
   * Deletes every membership of one game.
   *
   * @param conn an open JDBC connection
   * @param gameId the game
   * @return StatusOr containing the number of affected rows or an error
   */
  @Nonnull
  public static StatusOr<Integer> deleteByGame(Connection conn, long gameId) {
    String sql =
        """
        DELETE FROM game_teams
         WHERE game_id = ?
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setLong(1, gameId);
      return StatusOr.ofValue(stmt.executeUpdate());
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.toStatus(e, "Failed to delete teams of game " + gameId));
    }
  }
}
