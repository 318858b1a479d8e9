package com.bezdurakov.game;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Result of the auction round.
 *
 * @param lots the four lots, in play order
 * @param totalSum the round total
 */
public record AuctionScore(List<AuctionScore.Lot> lots, BigDecimal totalSum)
    implements RoundScore {

  public static final int LOT_COUNT = 4;

  /**
   * One auction lot.
   *
   * @param bid the amount the team bid
   * @param points the points the team won on the lot
   * @param rate the multiplier applied, absent when the sheet leaves it blank
   */
  public record Lot(BigDecimal bid, BigDecimal points, @Nullable BigDecimal rate) {
    public Lot {
      bid = Scores.scaled(checkNotNull(bid, "bid"));
      points = Scores.scaled(checkNotNull(points, "points"));
      rate = Scores.scaledOrNull(rate);
    }
  }

  public AuctionScore {
    checkNotNull(lots, "lots");
    checkArgument(
        lots.size() == LOT_COUNT,
        "AUCTION expects %s lots but got %s",
        LOT_COUNT,
        lots.size());
    lots = ImmutableList.copyOf(lots);
    totalSum = Scores.scaled(checkNotNull(totalSum, "totalSum"));
  }

  @Override
  public RoundKind kind() {
    return RoundKind.AUCTION;
  }

  @Override
  public BigDecimal subtotal() {
    return totalSum;
  }

  @Override
  public List<BigDecimal> values() {
    ImmutableList.Builder<BigDecimal> values = ImmutableList.builder();
    for (Lot lot : lots) {
      values.add(lot.bid(), lot.points());
      if (lot.rate() != null) {
        values.add(lot.rate());
      }
    }
    return values.add(totalSum).build();
  }
}
