package com.bezdurakov.db;

/**
 * Represents a row in the 'teams' table.
 *
 * @param teamId The store-assigned identifier of the team
 * @param teamName The unique, case-sensitive team name
 */
public record Team(long teamId, String teamName) {}
