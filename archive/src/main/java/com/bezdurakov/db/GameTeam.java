package com.bezdurakov.db;

/**
 * Represents a row in the 'game_teams' table: the team took part in the game.
 *
 * @param gameId The game
 * @param teamId The participating team
 */
public record GameTeam(long gameId, long teamId) {}
