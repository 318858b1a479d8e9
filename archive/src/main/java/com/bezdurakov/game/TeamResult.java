package com.bezdurakov.game;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * One team's results within a game.
 *
 * @param teamName the exact team name, compared case-sensitively
 * @param rounds the rounds the team has a score for; a round may be missing
 */
public record TeamResult(String teamName, Map<RoundKind, RoundScore> rounds) {

  public TeamResult {
    checkNotNull(teamName, "teamName");
    checkNotNull(rounds, "rounds");
    for (Map.Entry<RoundKind, RoundScore> entry : rounds.entrySet()) {
      checkNotNull(entry.getValue(), "score for %s", entry.getKey());
      checkArgument(
          entry.getKey() == entry.getValue().kind(),
          "Score of kind %s filed under %s for team '%s'",
          entry.getValue().kind(),
          entry.getKey(),
          teamName);
    }
    rounds = Maps.immutableEnumMap(rounds);
  }

  /** Builds a result from a list of scores, keying each by its own kind. */
  public static TeamResult of(String teamName, RoundScore... scores) {
    ImmutableMap.Builder<RoundKind, RoundScore> rounds = ImmutableMap.builder();
    for (RoundScore score : scores) {
      rounds.put(score.kind(), score);
    }
    return new TeamResult(teamName, rounds.buildOrThrow());
  }

  public Optional<RoundScore> round(RoundKind kind) {
    return Optional.ofNullable(rounds.get(kind));
  }

  /** The subtotal for a round, zero when the team has no score for it. */
  public BigDecimal subtotal(RoundKind kind) {
    RoundScore score = rounds.get(kind);
    return score == null ? Scores.ZERO : score.subtotal();
  }

  /** Sum of all round subtotals. */
  public BigDecimal totalPoints() {
    BigDecimal total = Scores.ZERO;
    for (RoundScore score : rounds.values()) {
      total = total.add(score.subtotal());
    }
    return total;
  }
}
