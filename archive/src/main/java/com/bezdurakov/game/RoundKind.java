package com.bezdurakov.game;

/** The seven fixed scoring rounds of a game, in play order. */
public enum RoundKind {
  /** Opening round: a single points value per team. */
  SELECTION,
  /** Five numeric tasks and their sum. */
  NUMBERS,
  /** Preference-style bidding round: seven tasks plus points, penalty and bonus. */
  BIDDING,
  /** A single points value per team. */
  PAIRS,
  /** Four tasks and their sum. */
  EXPOSURE,
  /** Four lots, each with a bid, points won and an optional rate. */
  AUCTION,
  /** Final round: three tasks and their sum. */
  MOMENT_OF_TRUTH
}
