package com.bezdurakov.db;

import com.bezdurakov.common.status.StatusOr;
import com.bezdurakov.db.util.DbUtil;
import com.bezdurakov.game.AuctionScore;
import com.bezdurakov.game.BiddingScore;
import com.bezdurakov.game.ExposureScore;
import com.bezdurakov.game.MomentOfTruthScore;
import com.bezdurakov.game.NumbersScore;
import com.bezdurakov.game.PairsScore;
import com.bezdurakov.game.RoundKind;
import com.bezdurakov.game.RoundScore;
import com.bezdurakov.game.SelectionScore;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * DAO helper class for the seven round tables.
 *
 * <p>Each {@link RoundKind} has its own table keyed by (game_id, team_id) with a fixed column
 * layout. Column names below are constants, never user input.
 */
public final class RoundScores {

  private static final ImmutableMap<RoundKind, String> TABLES =
      ImmutableMap.<RoundKind, String>builder()
          .put(RoundKind.SELECTION, "vybor")
          .put(RoundKind.NUMBERS, "chisla")
          .put(RoundKind.BIDDING, "pref")
          .put(RoundKind.PAIRS, "pairs")
          .put(RoundKind.EXPOSURE, "razobl")
          .put(RoundKind.AUCTION, "auction")
          .put(RoundKind.MOMENT_OF_TRUTH, "mot")
          .buildOrThrow();

  private static final ImmutableMap<RoundKind, ImmutableList<String>> COLUMNS =
      ImmutableMap.<RoundKind, ImmutableList<String>>builder()
          .put(RoundKind.SELECTION, ImmutableList.of("points"))
          .put(RoundKind.NUMBERS, taskColumns(NumbersScore.TASK_COUNT, "total_sum"))
          .put(
              RoundKind.BIDDING,
              taskColumns(BiddingScore.TASK_COUNT, "points", "penalty", "bonus", "total_sum"))
          .put(RoundKind.PAIRS, ImmutableList.of("points"))
          .put(RoundKind.EXPOSURE, taskColumns(ExposureScore.TASK_COUNT, "total_sum"))
          .put(RoundKind.AUCTION, auctionColumns())
          .put(RoundKind.MOMENT_OF_TRUTH, taskColumns(MomentOfTruthScore.TASK_COUNT, "total_sum"))
          .buildOrThrow();

  private RoundScores() {
    // Utility class
  }

  /** Name of the table holding rounds of the given kind. */
  @Nonnull
  public static String tableOf(RoundKind kind) {
    return TABLES.get(kind);
  }

  /**
   * Inserts one round record for a team of a game. The membership row must exist.
   *
   * @param conn an open JDBC connection
   * @param gameId the game
   * @param teamId the team
   * @param score the round record; its kind selects the table
   * @return StatusOr containing the number of affected rows or an error
   */
  @Nonnull
  public static StatusOr<Integer> insert(
      Connection conn, long gameId, long teamId, RoundScore score) {
    RoundKind kind = score.kind();
    List<String> columns = COLUMNS.get(kind);
    String sql =
        "INSERT INTO "
            + tableOf(kind)
            + " (game_id, team_id, "
            + String.join(", ", columns)
            + ") VALUES (?, ?"
            + ", ?".repeat(columns.size())
            + ")";
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setLong(1, gameId);
      stmt.setLong(2, teamId);
      List<BigDecimal> values = columnValues(score);
      for (int i = 0; i < values.size(); i++) {
        DbUtil.setDecimal(stmt, i + 3, values.get(i));
      }
      return StatusOr.ofValue(stmt.executeUpdate());
    } catch (SQLException e) {
      return StatusOr.ofStatus(
          DbUtil.toStatus(
              e,
              "Failed to save " + kind + " round of team " + teamId + " in game " + gameId));
    }
  }

  /**
   * Loads every round record of a game.
   *
   * @param conn an open JDBC connection
   * @param gameId the game
   * @return StatusOr containing a table of team id and round kind to record, or an error
   */
  @Nonnull
  public static StatusOr<Table<Long, RoundKind, RoundScore>> loadByGame(
      Connection conn, long gameId) {
    ImmutableTable.Builder<Long, RoundKind, RoundScore> result = ImmutableTable.builder();
    for (RoundKind kind : RoundKind.values()) {
      String sql =
          "SELECT team_id, "
              + String.join(", ", COLUMNS.get(kind))
              + " FROM "
              + tableOf(kind)
              + " WHERE game_id = ? ORDER BY team_id";
      try (PreparedStatement stmt = conn.prepareStatement(sql)) {
        stmt.setLong(1, gameId);
        try (ResultSet rs = stmt.executeQuery()) {
          while (rs.next()) {
            result.put(rs.getLong("team_id"), kind, extractScore(kind, rs));
          }
        }
      } catch (SQLException e) {
        return StatusOr.ofStatus(
            DbUtil.toStatus(e, "Failed to load " + kind + " rounds of game " + gameId));
      }
    }
    return StatusOr.ofValue(result.build());
  }

  /**
   * Deletes the round records of a game from all seven tables.
   *
   * @param conn an open JDBC connection
   * @param gameId the game
   * @return StatusOr containing the total number of deleted rows or an error
   */
  @Nonnull
  public static StatusOr<Integer> deleteByGame(Connection conn, long gameId) {
    int deleted = 0;
    for (RoundKind kind : RoundKind.values()) {
      String sql = "DELETE FROM " + tableOf(kind) + " WHERE game_id = ?";
      try (PreparedStatement stmt = conn.prepareStatement(sql)) {
        stmt.setLong(1, gameId);
        deleted += stmt.executeUpdate();
      } catch (SQLException e) {
        return StatusOr.ofStatus(
            DbUtil.toStatus(e, "Failed to delete " + kind + " rounds of game " + gameId));
      }
    }
    return StatusOr.ofValue(deleted);
  }

  /** Values of a round record in column order; an auction lot without rate yields null. */
  @Nonnull
  static List<BigDecimal> columnValues(RoundScore score) {
    List<BigDecimal> values = new ArrayList<>();
    switch (score.kind()) {
      case SELECTION:
        values.add(((SelectionScore) score).points());
        break;
      case PAIRS:
        values.add(((PairsScore) score).points());
        break;
      case NUMBERS:
        NumbersScore numbers = (NumbersScore) score;
        values.addAll(numbers.tasks());
        values.add(numbers.totalSum());
        break;
      case BIDDING:
        BiddingScore bidding = (BiddingScore) score;
        values.addAll(bidding.tasks());
        values.add(bidding.points());
        values.add(bidding.penalty());
        values.add(bidding.bonus());
        values.add(bidding.totalSum());
        break;
      case EXPOSURE:
        ExposureScore exposure = (ExposureScore) score;
        values.addAll(exposure.tasks());
        values.add(exposure.totalSum());
        break;
      case AUCTION:
        AuctionScore auction = (AuctionScore) score;
        for (AuctionScore.Lot lot : auction.lots()) {
          values.add(lot.bid());
          values.add(lot.points());
          values.add(lot.rate());
        }
        values.add(auction.totalSum());
        break;
      case MOMENT_OF_TRUTH:
        MomentOfTruthScore mot = (MomentOfTruthScore) score;
        values.addAll(mot.tasks());
        values.add(mot.totalSum());
        break;
      default:
        throw new IllegalArgumentException("Unknown round kind: " + score.kind());
    }
    return Collections.unmodifiableList(values);
  }

  @Nonnull
  private static RoundScore extractScore(RoundKind kind, ResultSet rs) throws SQLException {
    switch (kind) {
      case SELECTION:
        return new SelectionScore(DbUtil.getDecimal(rs, "points"));
      case PAIRS:
        return new PairsScore(DbUtil.getDecimal(rs, "points"));
      case NUMBERS:
        return new NumbersScore(
            extractTasks(rs, NumbersScore.TASK_COUNT), DbUtil.getDecimal(rs, "total_sum"));
      case BIDDING:
        return new BiddingScore(
            extractTasks(rs, BiddingScore.TASK_COUNT),
            DbUtil.getDecimal(rs, "points"),
            DbUtil.getDecimal(rs, "penalty"),
            DbUtil.getDecimal(rs, "bonus"),
            DbUtil.getDecimal(rs, "total_sum"));
      case EXPOSURE:
        return new ExposureScore(
            extractTasks(rs, ExposureScore.TASK_COUNT), DbUtil.getDecimal(rs, "total_sum"));
      case AUCTION:
        List<AuctionScore.Lot> lots = new ArrayList<>();
        for (int n = 1; n <= AuctionScore.LOT_COUNT; n++) {
          lots.add(
              new AuctionScore.Lot(
                  DbUtil.getDecimal(rs, "task_" + n + "_bid"),
                  DbUtil.getDecimal(rs, "task_" + n + "_points"),
                  DbUtil.getOptionalDecimal(rs, "task_" + n + "_rate")));
        }
        return new AuctionScore(lots, DbUtil.getDecimal(rs, "total_sum"));
      case MOMENT_OF_TRUTH:
        return new MomentOfTruthScore(
            extractTasks(rs, MomentOfTruthScore.TASK_COUNT), DbUtil.getDecimal(rs, "total_sum"));
      default:
        throw new IllegalArgumentException("Unknown round kind: " + kind);
    }
  }

  private static List<BigDecimal> extractTasks(ResultSet rs, int count) throws SQLException {
    List<BigDecimal> tasks = new ArrayList<>(count);
    for (int n = 1; n <= count; n++) {
      tasks.add(DbUtil.getDecimal(rs, "task_" + n));
    }
    return tasks;
  }

  private static ImmutableList<String> taskColumns(int count, String... trailing) {
    ImmutableList.Builder<String> columns = ImmutableList.builder();
    for (int n = 1; n <= count; n++) {
      columns.add("task_" + n);
    }
    return columns.add(trailing).build();
  }

  private static ImmutableList<String> auctionColumns() {
    ImmutableList.Builder<String> columns = ImmutableList.builder();
    for (int n = 1; n <= AuctionScore.LOT_COUNT; n++) {
      columns.add("task_" + n + "_bid", "task_" + n + "_points", "task_" + n + "_rate");
    }
    return columns.add("total_sum").build();
  }
}
