package com.bezdurakov.game;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** Fixed-point helpers shared by the round score records. */
public final class Scores {

  /** Every score is stored as NUMERIC(10,2). */
  public static final int SCALE = 2;

  public static final int PRECISION = 10;

  public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

  private static final BigDecimal LIMIT = BigDecimal.TEN.pow(PRECISION - SCALE);

  private Scores() {
    // Utility class
  }

  /**
   * Parses a decimal literal such as {@code "42.5"} into a scale-2 value.
   *
   * @throws NumberFormatException if the literal is not a number
   */
  @Nonnull
  public static BigDecimal of(String literal) {
    return scaled(new BigDecimal(literal));
  }

  /**
   * Rescales a value to two decimal places when that is exact. Values carrying more precision are
   * returned unchanged so that {@link #isStorable(BigDecimal)} can reject them.
   */
  @Nonnull
  public static BigDecimal scaled(@Nonnull BigDecimal value) {
    checkNotNull(value, "score value");
    if (value.stripTrailingZeros().scale() <= SCALE) {
      return value.setScale(SCALE, RoundingMode.UNNECESSARY);
    }
    return value;
  }

  @Nullable
  public static BigDecimal scaledOrNull(@Nullable BigDecimal value) {
    return value == null ? null : scaled(value);
  }

  /**
   * Normalizes a value read back from the store. Some backends keep NUMERIC columns as binary
   * floating point, so sums can carry noise beyond the second decimal.
   */
  @Nullable
  public static BigDecimal fromStore(@Nullable BigDecimal value) {
    return value == null ? null : value.setScale(SCALE, RoundingMode.HALF_UP);
  }

  /** Whether the value fits a NUMERIC(10,2) column without rounding. */
  public static boolean isStorable(@Nonnull BigDecimal value) {
    return value.scale() <= SCALE && value.abs().compareTo(LIMIT) < 0;
  }

  /** Copies a task list, checking the count expected by the round. */
  static ImmutableList<BigDecimal> tasks(List<BigDecimal> tasks, int expected, RoundKind kind) {
    checkNotNull(tasks, "%s tasks", kind);
    checkArgument(
        tasks.size() == expected,
        "%s expects %s task values but got %s",
        kind,
        expected,
        tasks.size());
    ImmutableList.Builder<BigDecimal> copy = ImmutableList.builderWithExpectedSize(expected);
    for (BigDecimal task : tasks) {
      copy.add(scaled(task));
    }
    return copy.build();
  }
}
