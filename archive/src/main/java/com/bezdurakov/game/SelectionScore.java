package com.bezdurakov.game;

import static com.google.common.base.Preconditions.checkNotNull;

import java.math.BigDecimal;
import java.util.List;

/** Result of the selection round: a single points value. */
public record SelectionScore(BigDecimal points) implements RoundScore {

  public SelectionScore {
    points = Scores.scaled(checkNotNull(points, "points"));
  }

  @Override
  public RoundKind kind() {
    return RoundKind.SELECTION;
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
