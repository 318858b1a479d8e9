package com.bezdurakov.game;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;

/**
 * Result of the closing moment-of-truth round.
 *
 * @param tasks the three task scores, in task order
 * @param totalSum the round total
 */
public record MomentOfTruthScore(List<BigDecimal> tasks, BigDecimal totalSum)
    implements RoundScore {

  public static final int TASK_COUNT = 3;

  public MomentOfTruthScore {
    tasks = Scores.tasks(tasks, TASK_COUNT, RoundKind.MOMENT_OF_TRUTH);
    totalSum = Scores.scaled(checkNotNull(totalSum, "totalSum"));
  }

  @Override
  public RoundKind kind() {
    return RoundKind.MOMENT_OF_TRUTH;
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
