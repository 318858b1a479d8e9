package com.bezdurakov.db;

import com.bezdurakov.common.status.StatusOr;
import com.bezdurakov.db.util.DbUtil;
import com.bezdurakov.game.RoundKind;
import com.bezdurakov.game.Scores;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nonnull;

/** Read-only DAO helper class for the 'team_game_scores' aggregation view. */
public final class TeamGameScores {

  private static final ImmutableMap<RoundKind, String> SUBTOTAL_COLUMNS =
      ImmutableMap.<RoundKind, String>builder()
          .put(RoundKind.SELECTION, "vybor_points")
          .put(RoundKind.NUMBERS, "chisla_points")
          .put(RoundKind.BIDDING, "pref_points")
          .put(RoundKind.PAIRS, "pairs_points")
          .put(RoundKind.EXPOSURE, "razobl_points")
          .put(RoundKind.AUCTION, "auction_points")
          .put(RoundKind.MOMENT_OF_TRUTH, "mot_points")
          .buildOrThrow();

  private static final String SELECT =
      """
      SELECT game_id, game_date, team_id, team_name,
             vybor_points, chisla_points, pref_points, pairs_points,
             razobl_points, auction_points, mot_points, total_points
        FROM team_game_scores
      """;

  private TeamGameScores() {
    // Utility class
  }

  /**
   * Loads the rows of every game played on a date, ordered by game id, then team id.
   *
   * @param conn an open JDBC connection
   * @param gameDate the date
   * @return StatusOr containing the rows or an error
   */
  @Nonnull
  public static StatusOr<List<TeamGameScore>> loadByDate(Connection conn, LocalDate gameDate) {
    String sql = SELECT + " WHERE game_date = ? ORDER BY game_id, team_id";
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      DbUtil.setLocalDate(stmt, 1, gameDate);
      return StatusOr.ofValue(extractAll(stmt));
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.toStatus(e, "Failed to load scores of " + gameDate));
    }
  }

  /**
   * Loads the standings of one game: highest total first, ties by team name.
   *
   * @param conn an open JDBC connection
   * @param gameId the game
   * @return StatusOr containing the rows or an error
   */
  @Nonnull
  public static StatusOr<List<TeamGameScore>> loadByGame(Connection conn, long gameId) {
    String sql = SELECT + " WHERE game_id = ? ORDER BY total_points DESC, team_name";
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setLong(1, gameId);
      return StatusOr.ofValue(extractAll(stmt));
    } catch (SQLException e) {
      return StatusOr.ofStatus(DbUtil.toStatus(e, "Failed to load scores of game " + gameId));
    }
  }

  /**
   * Loads one team's rows from a date on, ordered by date, then game id.
   *
   * @param conn an open JDBC connection
   * @param teamName the exact team name
   * @param since first date to include
   * @return StatusOr containing the rows or an error
   */
  @Nonnull
  public static StatusOr<List<TeamGameScore>> loadByTeamSince(
      Connection conn, String teamName, LocalDate since) {
    String sql = SELECT + " WHERE team_name = ? AND game_date >= ? ORDER BY game_date, game_id";
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, teamName);
      DbUtil.setLocalDate(stmt, 2, since);
      return StatusOr.ofValue(extractAll(stmt));
    } catch (SQLException e) {
      return StatusOr.ofStatus(
          DbUtil.toStatus(e, "Failed to load scores of team '" + teamName + "'"));
    }
  }

  private static List<TeamGameScore> extractAll(PreparedStatement stmt) throws SQLException {
    try (ResultSet rs = stmt.executeQuery()) {
      List<TeamGameScore> result = new ArrayList<>();
      while (rs.next()) {
        result.add(extractRow(rs));
      }
      return ImmutableList.copyOf(result);
    }
  }

  @Nonnull
  private static TeamGameScore extractRow(ResultSet rs) throws SQLException {
    Map<RoundKind, BigDecimal> subtotals = new EnumMap<>(RoundKind.class);
    for (Map.Entry<RoundKind, String> column : SUBTOTAL_COLUMNS.entrySet()) {
      BigDecimal value = DbUtil.getOptionalDecimal(rs, column.getValue());
      if (value != null) {
        subtotals.put(column.getKey(), value);
      }
    }
    BigDecimal total = DbUtil.getOptionalDecimal(rs, "total_points");
    return new TeamGameScore(
        rs.getLong("game_id"),
        DbUtil.getLocalDate(rs, "game_date"),
        rs.getLong("team_id"),
        rs.getString("team_name"),
        subtotals,
        total == null ? Scores.ZERO : total);
  }
}
