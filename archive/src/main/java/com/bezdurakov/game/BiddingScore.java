package com.bezdurakov.game;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;

/**
 * Result of the bidding round. Besides the seven task scores the sheet reports the points won,
 * a penalty and a bonus; {@code totalSum} is the figure that counts towards the game total.
 *
 * @param tasks the seven task scores, in task order
 * @param points points won in the round
 * @param penalty penalty applied to the team
 * @param bonus bonus awarded to the team
 * @param totalSum the round total
 */
public record BiddingScore(
    List<BigDecimal> tasks,
    BigDecimal points,
    BigDecimal penalty,
    BigDecimal bonus,
    BigDecimal totalSum)
    implements RoundScore {

  public static final int TASK_COUNT = 7;

  public BiddingScore {
    tasks = Scores.tasks(tasks, TASK_COUNT, RoundKind.BIDDING);
    points = Scores.scaled(checkNotNull(points, "points"));
    penalty = Scores.scaled(checkNotNull(penalty, "penalty"));
    bonus = Scores.scaled(checkNotNull(bonus, "bonus"));
    totalSum = Scores.scaled(checkNotNull(totalSum, "totalSum"));
  }

  @Override
  public RoundKind kind() {
    return RoundKind.BIDDING;
  }

  @Override
  public BigDecimal subtotal() {
    return totalSum;
  }

  @Override
  public List<BigDecimal> values() {
    return ImmutableList.<BigDecimal>builder()
        .addAll(tasks)
        .add(points, penalty, bonus, totalSum)
        .build();
  }
}
