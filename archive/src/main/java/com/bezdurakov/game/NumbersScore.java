package com.bezdurakov.game;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;

/**
 * Result of the numbers round.
 *
 * @param tasks the five task scores, in task order
 * @param totalSum the round total as reported by the score sheet
 */
public record NumbersScore(List<BigDecimal> tasks, BigDecimal totalSum) implements RoundScore {

  public static final int TASK_COUNT = 5;

  public NumbersScore {
    tasks = Scores.tasks(tasks, TASK_COUNT, RoundKind.NUMBERS);
    totalSum = Scores.scaled(checkNotNull(totalSum, "totalSum"));
  }

  @Override
  public RoundKind kind() {
    return RoundKind.NUMBERS;
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
