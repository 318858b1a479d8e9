package com.bezdurakov.game;

import java.math.BigDecimal;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * One team's result in one round. Each {@link RoundKind} has exactly one implementing record with
 * a fixed set of task fields.
 */
public interface RoundScore {

  /** The round this score belongs to. */
  @Nonnull
  RoundKind kind();

  /** The amount this round contributes to the team's game total. */
  @Nonnull
  BigDecimal subtotal();

  /** Every non-null numeric value held by this score, subtotal included. */
  @Nonnull
  List<BigDecimal> values();
}
