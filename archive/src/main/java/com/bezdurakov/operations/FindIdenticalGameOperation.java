package com.bezdurakov.operations;

import com.bezdurakov.common.status.Status;
import com.bezdurakov.common.status.StatusOr;
import com.bezdurakov.db.TeamGameScore;
import com.bezdurakov.db.TeamGameScores;
import com.bezdurakov.game.GameResults;
import com.bezdurakov.game.RoundKind;
import com.bezdurakov.game.TeamResult;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import java.math.BigDecimal;
import java.sql.Connection;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.tinylog.Logger;

/**
 * Looks for a stored game with the same results as a candidate.
 *
 * <p>A stored game matches when it was played on the candidate's date, has exactly the same set
 * of team names, and every team has the same subtotal in each round and the same total. Values are
 * compared exactly; a round a team has no record for counts as zero on both sides. When several
 * stored games match, the lowest id wins. The candidate's own id is not consulted.
 */
public class FindIdenticalGameOperation {
  private final Connection dbConnection;

  /**
   * Creates a new FindIdenticalGameOperation.
   *
   * @param dbConnection the database connection to read from
   */
  public FindIdenticalGameOperation(Connection dbConnection) {
    this.dbConnection = dbConnection;
  }

  /**
   * Searches the games played on the candidate's date.
   *
   * @param candidate the results to look for
   * @return StatusOr containing the id of the first identical game, empty when there is none
   */
  public StatusOr<Optional<Long>> execute(GameResults candidate) {
    Status valid = candidate.validate();
    if (valid.isError()) {
      return StatusOr.ofStatus(valid);
    }

    StatusOr<List<TeamGameScore>> rowsOr =
        TeamGameScores.loadByDate(dbConnection, candidate.date());
    if (rowsOr.isNotOk()) {
      Logger.error(
          "Failed to load scores for {}: {}", candidate.date(), rowsOr.getStatus().getMessage());
      return StatusOr.ofStatus(rowsOr.getStatus());
    }

    // Rows arrive ordered by game id, so keys iterate lowest id first.
    ListMultimap<Long, TeamGameScore> byGame =
        MultimapBuilder.linkedHashKeys().arrayListValues().build();
    for (TeamGameScore row : rowsOr.getValue()) {
      byGame.put(row.gameId(), row);
    }

    for (Map.Entry<Long, Collection<TeamGameScore>> game : byGame.asMap().entrySet()) {
      if (matches(candidate, game.getValue())) {
        Logger.info("Game on {} is identical to stored game {}", candidate.date(), game.getKey());
        return StatusOr.ofValue(Optional.of(game.getKey()));
      }
    }
    Logger.debug(
        "No identical game among {} stored on {}", byGame.keySet().size(), candidate.date());
    return StatusOr.ofValue(Optional.empty());
  }

  static boolean matches(GameResults candidate, Collection<TeamGameScore> stored) {
    if (stored.size() != candidate.teams().size()) {
      return false;
    }
    for (TeamGameScore row : stored) {
      Optional<TeamResult> team = candidate.team(row.teamName());
      if (team.isEmpty() || !sameScores(team.get(), row)) {
        return false;
      }
    }
    return true;
  }

  private static boolean sameScores(TeamResult team, TeamGameScore row) {
    for (RoundKind kind : RoundKind.values()) {
      if (!sameValue(team.subtotal(kind), row.subtotal(kind))) {
        return false;
      }
    }
    return sameValue(team.totalPoints(), row.totalPoints());
  }

  private static boolean sameValue(BigDecimal a, BigDecimal b) {
    return a.compareTo(b) == 0;
  }
}
