package com.bezdurakov.game;

import static com.google.common.base.Preconditions.checkNotNull;

import com.bezdurakov.common.status.Status;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * In-memory representation of one game: its date and every team's per-round results. This is
 * the shape submitted to the archive and the shape it reconstructs on reads.
 *
 * @param gameId the stored game id, or null for a game that has not been stored
 * @param date the calendar date the game was played
 * @param teams the participating teams
 */
public record GameResults(@Nullable Long gameId, LocalDate date, List<TeamResult> teams) {

  /** Longest team name the teams table accepts. */
  public static final int MAX_TEAM_NAME_LENGTH = 256;

  public GameResults {
    checkNotNull(date, "date");
    teams = ImmutableList.copyOf(checkNotNull(teams, "teams"));
  }

  /** Creates results for a game that has not been stored yet. */
  public static GameResults of(LocalDate date, List<TeamResult> teams) {
    return new GameResults(null, date, teams);
  }

  public static GameResults of(LocalDate date, TeamResult... teams) {
    return new GameResults(null, date, List.of(teams));
  }

  public Optional<Long> storedId() {
    return Optional.ofNullable(gameId);
  }

  public GameResults withGameId(long id) {
    return new GameResults(id, date, teams);
  }

  /** Team names in submission order. */
  public ImmutableSet<String> teamNames() {
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    for (TeamResult team : teams) {
      names.add(team.teamName());
    }
    return names.build();
  }

  public Optional<TeamResult> team(String teamName) {
    return teams.stream().filter(t -> t.teamName().equals(teamName)).findFirst();
  }

  /**
   * Checks the submission before anything is written: at least one team, non-blank and distinct
   * team names that fit the teams table, and every score value storable as NUMERIC(10,2).
   *
   * @return OK, or an INVALID_ARGUMENT status describing the first problem found
   */
  @Nonnull
  public Status validate() {
    if (teams.isEmpty()) {
      return Status.invalidArgument("Game on " + date + " has no teams");
    }
    Set<String> seen = new HashSet<>();
    for (TeamResult team : teams) {
      String name = team.teamName();
      if (Strings.isNullOrEmpty(name) || name.isBlank()) {
        return Status.invalidArgument("Team name must not be blank");
      }
      if (name.length() > MAX_TEAM_NAME_LENGTH) {
        return Status.invalidArgument(
            "Team name longer than " + MAX_TEAM_NAME_LENGTH + " characters: " + name);
      }
      if (!seen.add(name)) {
        return Status.invalidArgument("Team '" + name + "' appears more than once");
      }
      for (RoundScore score : team.rounds().values()) {
        for (BigDecimal value : score.values()) {
          if (!Scores.isStorable(value)) {
            return Status.invalidArgument(
                "Value "
                    + value.toPlainString()
                    + " in "
                    + score.kind()
                    + " for team '"
                    + name
                    + "' does not fit NUMERIC("
                    + Scores.PRECISION
                    + ","
                    + Scores.SCALE
                    + ")");
          }
        }
      }
    }
    return Status.ok();
  }
}
