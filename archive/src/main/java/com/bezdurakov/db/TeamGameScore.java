package com.bezdurakov.db;

import com.bezdurakov.game.RoundKind;
import com.bezdurakov.game.Scores;
import com.google.common.collect.Maps;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Represents a row of the 'team_game_scores' view: one team's subtotals in one game.
 *
 * @param gameId The game
 * @param gameDate The date of the game
 * @param teamId The team
 * @param teamName The name of the team
 * @param subtotals Subtotal per round the team has a record for
 * @param totalPoints Sum of all subtotals, missing rounds counted as zero
 */
public record TeamGameScore(
    long gameId,
    LocalDate gameDate,
    long teamId,
    String teamName,
    Map<RoundKind, BigDecimal> subtotals,
    BigDecimal totalPoints) {

  public TeamGameScore {
    subtotals = Maps.immutableEnumMap(subtotals);
  }

  /** Subtotal of one round, zero when the team has no record for it. */
  public BigDecimal subtotal(RoundKind kind) {
    return subtotals.getOrDefault(kind, Scores.ZERO);
  }
}
