package com.bezdurakov.game;

import static com.google.common.base.Preconditions.checkNotNull;

import java.math.BigDecimal;
import java.util.List;

/** Result of the pairs round: a single points value. */
public record PairsScore(BigDecimal points) implements RoundScore {

  public PairsScore {
    points = Scores.scaled(checkNotNull(points, "points"));
  }

  @Override
  public RoundKind kind() {
    return RoundKind.PAIRS;
  }

  @Override
  public BigDecimal subtotal() {
    return points;
  }

  @Override
  public List<BigDecimal> values() {
    return List.of(points);
  }
}
