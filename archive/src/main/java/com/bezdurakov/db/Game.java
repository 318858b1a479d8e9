package com.bezdurakov.db;

import java.time.Instant;
import java.time.LocalDate;
import javax.annotation.Nullable;

/**
 * Represents a row in the 'games' table.
 *
 * @param gameId The store-assigned identifier of the game
 * @param gameDate The calendar date the game was played; several games may share a date
 * @param createdAt When the row was inserted, null for rows written before the column existed
 */
public record Game(long gameId, LocalDate gameDate, @Nullable Instant createdAt) {}
