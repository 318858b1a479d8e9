/**
 * The in-memory game model.
 *
 * <p>A {@link com.bezdurakov.game.GameResults} holds a date and one
 * {@link com.bezdurakov.game.TeamResult} per team. Each team maps
 * {@link com.bezdurakov.game.RoundKind}s to the record type for that round, so a round's task
 * fields are fixed by its type rather than looked up by key. All numbers are {@code BigDecimal}s
 * at scale 2.
 */
package com.bezdurakov.game;
