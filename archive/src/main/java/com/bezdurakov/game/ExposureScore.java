package com.bezdurakov.game;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;

/**
 * Result of the exposure round.
 *
 * @param tasks the four task scores, in task order
 * @param totalSum the round total
 */
public record ExposureScore(List<BigDecimal> tasks, BigDecimal totalSum) implements RoundScore {

  public static final int TASK_COUNT = 4;

  public ExposureScore {
    tasks = Scores.tasks(tasks, TASK_COUNT, RoundKind.EXPOSURE);
    totalSum = Scores.scaled(checkNotNull(totalSum, "totalSum"));
  }

  @Override
  public RoundKind kind() {
    return RoundKind.EXPOSURE;
  }

  @Override
  public BigDecimal subtotal() {
    return totalSum;
  }

  @Override
  public List<BigDecimal> values() {
    return ImmutableList.<BigDecimal>builder().addAll(tasks).add(totalSum).build();
  }
}
