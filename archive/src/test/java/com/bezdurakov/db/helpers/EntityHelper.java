package com.bezdurakov.db.helpers;

import com.bezdurakov.common.status.StatusOr;
import com.bezdurakov.db.GameTeams;
import com.bezdurakov.db.Games;
import com.bezdurakov.db.Teams;
import com.bezdurakov.game.AuctionScore;
import com.bezdurakov.game.BiddingScore;
import com.bezdurakov.game.ExposureScore;
import com.bezdurakov.game.MomentOfTruthScore;
import com.bezdurakov.game.NumbersScore;
import com.bezdurakov.game.PairsScore;
import com.bezdurakov.game.Scores;
import com.bezdurakov.game.SelectionScore;
import com.bezdurakov.game.TeamResult;
import java.math.BigDecimal;
import java.sql.Connection;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

/** Helper class for creating test games, teams and scores. */
public final class EntityHelper {

  private EntityHelper() {
    // Utility class, no instances
  }

  /** A team that only played the selection round. */
  public static TeamResult selectionOnly(String teamName, String points) {
    return TeamResult.of(teamName, new SelectionScore(Scores.of(points)));
  }

  /**
   * A team with a record for every round. Values are derived from {@code offset} so different
   * offsets give different totals.
   */
  public static TeamResult fullTeam(String teamName, int offset) {
    BigDecimal base = BigDecimal.valueOf(offset);
    return TeamResult.of(
        teamName,
        new SelectionScore(plus(base, "5.00")),
        new NumbersScore(
            values(base, "1.00", "2.50", "0.00", "3.25", "1.75"), plus(base, "8.50")),
        new BiddingScore(
            values(base, "1.00", "1.00", "0.50", "0.00", "2.00", "1.00", "0.25"),
            plus(base, "5.75"),
            Scores.of("-1.00"),
            Scores.of("2.00"),
            plus(base, "6.75")),
        new PairsScore(plus(base, "4.00")),
        new ExposureScore(values(base, "2.00", "2.00", "1.00", "0.50"), plus(base, "5.50")),
        new AuctionScore(
            List.of(
                new AuctionScore.Lot(Scores.of("10.00"), plus(base, "3.00"), Scores.of("1.50")),
                new AuctionScore.Lot(Scores.of("5.00"), plus(base, "0.00"), null),
                new AuctionScore.Lot(Scores.of("7.50"), plus(base, "2.00"), Scores.of("0.75")),
                new AuctionScore.Lot(Scores.of("0.00"), plus(base, "1.00"), null)),
            plus(base, "6.00")),
        new MomentOfTruthScore(values(base, "3.00", "2.00", "1.00"), plus(base, "6.00")));
  }

  /**
   * Inserts a game with its memberships directly through the DAO helpers.
   *
   * @return the new game id
   */
  public static long insertGameWithTeams(
      Connection connection, LocalDate date, String... teamNames) {
    StatusOr<Long> gameIdOr = Games.insert(connection, date, Instant.now());
    long gameId = gameIdOr.getValue();
    for (String teamName : teamNames) {
      long teamId = Teams.getOrCreate(connection, teamName).getValue();
      GameTeams.insert(connection, gameId, teamId).getValue();
    }
    return gameId;
  }

  private static BigDecimal plus(BigDecimal base, String value) {
    return Scores.of(value).add(base);
  }

  private static List<BigDecimal> values(BigDecimal base, String... values) {
    return Arrays.stream(values).map(v -> plus(base, v)).toList();
  }
}
