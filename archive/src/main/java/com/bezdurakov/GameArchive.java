package com.bezdurakov;

import static com.google.common.base.Preconditions.checkNotNull;

import com.bezdurakov.common.status.Status;
import com.bezdurakov.common.status.StatusOr;
import com.bezdurakov.db.Game;
import com.bezdurakov.db.GameTeams;
import com.bezdurakov.db.Games;
import com.bezdurakov.db.RoundScores;
import com.bezdurakov.db.Team;
import com.bezdurakov.db.TeamGameScore;
import com.bezdurakov.db.TeamGameScores;
import com.bezdurakov.db.Teams;
import com.bezdurakov.db.util.DbUtil;
import com.bezdurakov.game.GameResults;
import com.bezdurakov.game.RoundKind;
import com.bezdurakov.game.RoundScore;
import com.bezdurakov.game.TeamResult;
import com.bezdurakov.operations.ClearArchiveOperation;
import com.bezdurakov.operations.ClearArchiveOperation.ClearSummary;
import com.bezdurakov.operations.FindIdenticalGameOperation;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Table;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.tinylog.Logger;

/**
 * Entry point of the game archive: stores, reads, deduplicates and removes games.
 *
 * <p>Every write runs in a single serializable transaction on a pooled connection and is either
 * applied completely or not at all. Reads run on auto-commit connections. Nothing is cached
 * between calls, so several instances may share one database.
 */
public class GameArchive {

  public record Config(HikariDataSource dataSource) {}

  /** Whether {@link #saveIfNew} stored the game or found it already archived. */
  public enum SaveResult {
    SAVED,
    DUPLICATE
  }

  /**
   * Outcome of {@link #saveIfNew}.
   *
   * @param result what happened
   * @param gameId the new id when saved, the existing id when a duplicate
   */
  public record SaveOutcome(SaveResult result, long gameId) {

    public static SaveOutcome saved(long gameId) {
      return new SaveOutcome(SaveResult.SAVED, gameId);
    }

    public static SaveOutcome duplicate(long gameId) {
      return new SaveOutcome(SaveResult.DUPLICATE, gameId);
    }

    public boolean isDuplicate() {
      return result == SaveResult.DUPLICATE;
    }
  }

  @FunctionalInterface
  private interface ConnectionWork<T> {
    StatusOr<T> run(Connection connection) throws SQLException;
  }

  private final Config config;

  public GameArchive(Config config) {
    this.config = config;
  }

  /**
   * Stores a complete game. Teams are looked up by name and created when new.
   *
   * @param game the results to store; its game id, if any, is ignored
   * @return StatusOr containing the id of the new game, INVALID_ARGUMENT for a malformed
   *     submission, or the failure that rolled the transaction back
   */
  public StatusOr<Long> addGame(GameResults game) {
    checkNotNull(game, "game");
    Logger.info("Adding game on {} with {} teams", game.date(), game.teams().size());

    Status valid = game.validate();
    if (valid.isError()) {
      Logger.error("Rejected game on {}: {}", game.date(), valid.getMessage());
      return StatusOr.ofStatus(valid);
    }

    StatusOr<Long> gameIdOr = inTransaction("add game on " + game.date(), c -> insertGame(c, game));
    if (gameIdOr.isOk()) {
      Logger.info("Game on {} stored with id {}", game.date(), gameIdOr.getValue());
    }
    return gameIdOr;
  }

  /**
   * Removes a game with its memberships and round records. Teams are kept.
   *
   * @param gameId the game to remove
   * @return StatusOr containing true when the game was removed, false when it did not exist
   */
  public StatusOr<Boolean> removeGame(long gameId) {
    Logger.info("Removing game {}", gameId);
    return inTransaction("remove game " + gameId, c -> deleteGame(c, gameId));
  }

  /**
   * Reconstructs a stored game. Teams come in ascending team id order.
   *
   * @param gameId the game to load
   * @return StatusOr containing the game, or empty when no game has this id
   */
  public StatusOr<Optional<GameResults>> getGameData(long gameId) {
    return withConnection("load game " + gameId, c -> loadGame(c, gameId));
  }

  /** Every stored game ordered by date, then id. */
  public StatusOr<List<Game>> getAllGames() {
    return withConnection("load games", Games::loadAll);
  }

  /** Ids of the games played on one date, ascending. */
  public StatusOr<List<Long>> getGameIdsByDate(LocalDate date) {
    return getGameIdsByDate(date, date);
  }

  /**
   * Ids of the games played between two dates, both inclusive, ordered by date then id.
   *
   * @return StatusOr containing the ids, or INVALID_ARGUMENT when end is before start
   */
  public StatusOr<List<Long>> getGameIdsByDate(LocalDate start, LocalDate end) {
    checkNotNull(start, "start");
    checkNotNull(end, "end");
    if (end.isBefore(start)) {
      return StatusOr.ofStatus(
          Status.invalidArgument("End date " + end + " is before start date " + start));
    }
    return withConnection(
        "load games between " + start + " and " + end,
        c -> Games.loadIdsByDateRange(c, start, end));
  }

  /**
   * Looks for a stored game identical to the candidate.
   *
   * @see FindIdenticalGameOperation
   * @return StatusOr containing the lowest matching id, or empty when nothing matches
   */
  public StatusOr<Optional<Long>> findIdenticalGame(GameResults candidate) {
    checkNotNull(candidate, "candidate");
    return withConnection(
        "find game identical to one on " + candidate.date(),
        c -> new FindIdenticalGameOperation(c).execute(candidate));
  }

  /**
   * Stores a game unless an identical one is already archived.
   *
   * @param game the results to store
   * @return StatusOr containing SAVED with the new id, or DUPLICATE with the existing id
   */
  public StatusOr<SaveOutcome> saveIfNew(GameResults game) {
    StatusOr<Optional<Long>> existingOr = findIdenticalGame(game);
    if (existingOr.isNotOk()) {
      Logger.error("Duplicate check failed: {}", existingOr.getStatus().getMessage());
      return StatusOr.ofStatus(existingOr.getStatus());
    }
    if (existingOr.getValue().isPresent()) {
      long existingId = existingOr.getValue().get();
      Logger.info("Game on {} already stored as {}, skipping", game.date(), existingId);
      return StatusOr.ofValue(SaveOutcome.duplicate(existingId));
    }
    return addGame(game).map(SaveOutcome::saved);
  }

  /**
   * Removes every game and, when asked, every team.
   *
   * @param clearTeams whether teams are deleted once all games are gone
   * @return StatusOr containing the counts of what was found and removed
   */
  public StatusOr<ClearSummary> clearAll(boolean clearTeams) {
    return new ClearArchiveOperation(this).execute(clearTeams);
  }

  /**
   * Deletes every team in one transaction. Fails while any game still references a team.
   *
   * @return StatusOr containing the number of deleted teams
   */
  public StatusOr<Integer> removeAllTeams() {
    Logger.info("Removing all teams");
    return inTransaction("remove all teams", Teams::deleteAll);
  }

  /** Every team ordered by name. */
  public StatusOr<List<Team>> getAllTeams() {
    return withConnection("load teams", Teams::loadAll);
  }

  /** The team with exactly this name, if any. */
  public StatusOr<Optional<Team>> findTeam(String teamName) {
    checkNotNull(teamName, "teamName");
    return withConnection("find team '" + teamName + "'", c -> Teams.loadByName(c, teamName));
  }

  /**
   * One team's per-game subtotals from a date on.
   *
   * @param teamName the exact team name
   * @param since first date to include
   * @return StatusOr containing rows ordered by date, empty for an unknown team
   */
  public StatusOr<List<TeamGameScore>> getTeamScores(String teamName, LocalDate since) {
    checkNotNull(teamName, "teamName");
    checkNotNull(since, "since");
    return withConnection(
        "load scores of team '" + teamName + "'",
        c -> TeamGameScores.loadByTeamSince(c, teamName, since));
  }

  /**
   * Standings of one game: highest total first, ties broken by team name.
   *
   * @param gameId the game
   * @return StatusOr containing the rows, empty for an unknown game
   */
  public StatusOr<List<TeamGameScore>> getGameScores(long gameId) {
    return withConnection(
        "load scores of game " + gameId, c -> TeamGameScores.loadByGame(c, gameId));
  }

  private static StatusOr<Long> insertGame(Connection connection, GameResults game) {
    StatusOr<Long> gameIdOr = Games.insert(connection, game.date(), Instant.now());
    if (gameIdOr.isNotOk()) {
      return gameIdOr;
    }
    long gameId = gameIdOr.getValue();

    for (TeamResult team : game.teams()) {
      StatusOr<Long> teamIdOr = Teams.getOrCreate(connection, team.teamName());
      if (teamIdOr.isNotOk()) {
        return teamIdOr;
      }
      long teamId = teamIdOr.getValue();

      StatusOr<Integer> memberOr = GameTeams.insert(connection, gameId, teamId);
      if (memberOr.isNotOk()) {
        return StatusOr.ofStatus(memberOr.getStatus());
      }
      for (RoundScore score : team.rounds().values()) {
        StatusOr<Integer> savedOr = RoundScores.insert(connection, gameId, teamId, score);
        if (savedOr.isNotOk()) {
          return StatusOr.ofStatus(savedOr.getStatus());
        }
      }
      Logger.debug(
          "Stored {} rounds for team '{}' in game {}",
          team.rounds().size(),
          team.teamName(),
          gameId);
    }
    return StatusOr.ofValue(gameId);
  }

  private static StatusOr<Boolean> deleteGame(Connection connection, long gameId) {
    StatusOr<Optional<Game>> gameOr = Games.loadById(connection, gameId);
    if (gameOr.isNotOk()) {
      return StatusOr.ofStatus(gameOr.getStatus());
    }
    if (gameOr.getValue().isEmpty()) {
      Logger.warn("Game {} not found, nothing to remove", gameId);
      return StatusOr.ofValue(false);
    }

    StatusOr<Integer> roundsOr = RoundScores.deleteByGame(connection, gameId);
    if (roundsOr.isNotOk()) {
      return StatusOr.ofStatus(roundsOr.getStatus());
    }
    StatusOr<Integer> membersOr = GameTeams.deleteByGame(connection, gameId);
    if (membersOr.isNotOk()) {
      return StatusOr.ofStatus(membersOr.getStatus());
    }
    StatusOr<Integer> deletedOr = Games.delete(connection, gameId);
    if (deletedOr.isNotOk()) {
      return StatusOr.ofStatus(deletedOr.getStatus());
    }
    Logger.info(
        "Removed game {} ({} round records, {} teams)",
        gameId,
        roundsOr.getValue(),
        membersOr.getValue());
    return StatusOr.ofValue(true);
  }

  private static StatusOr<Optional<GameResults>> loadGame(Connection connection, long gameId) {
    StatusOr<Optional<Game>> gameOr = Games.loadById(connection, gameId);
    if (gameOr.isNotOk()) {
      return StatusOr.ofStatus(gameOr.getStatus());
    }
    if (gameOr.getValue().isEmpty()) {
      return StatusOr.ofValue(Optional.empty());
    }
    Game game = gameOr.getValue().get();

    StatusOr<List<Team>> teamsOr = GameTeams.loadTeamsOfGame(connection, gameId);
    if (teamsOr.isNotOk()) {
      return StatusOr.ofStatus(teamsOr.getStatus());
    }
    StatusOr<Table<Long, RoundKind, RoundScore>> roundsOr =
        RoundScores.loadByGame(connection, gameId);
    if (roundsOr.isNotOk()) {
      return StatusOr.ofStatus(roundsOr.getStatus());
    }

    ImmutableList.Builder<TeamResult> teams = ImmutableList.builder();
    for (Team team : teamsOr.getValue()) {
      Map<RoundKind, RoundScore> rounds = roundsOr.getValue().row(team.teamId());
      teams.add(new TeamResult(team.teamName(), rounds));
    }
    return StatusOr.ofValue(
        Optional.of(new GameResults(game.gameId(), game.gameDate(), teams.build())));
  }

  /** Runs the work in one serializable transaction, committing only when it reports success. */
  private <T> StatusOr<T> inTransaction(String action, ConnectionWork<T> work) {
    StatusOr<Connection> connectionOr = borrowConnection(action);
    if (connectionOr.isNotOk()) {
      return StatusOr.ofStatus(connectionOr.getStatus());
    }
    try (Connection connection = connectionOr.getValue()) {
      connection.setAutoCommit(false);
      connection.setTransactionIsolation(Connection.TRANSACTION_SERIALIZABLE);
      try {
        StatusOr<T> result = work.run(connection);
        if (result.isOk()) {
          connection.commit();
        } else {
          Logger.error("Failed to {}: {}", action, result.getStatus().getMessage());
          rollback(connection, action);
        }
        return result;
      } catch (SQLException e) {
        rollback(connection, action);
        throw e;
      }
    } catch (SQLException e) {
      Logger.error(e, "Database error during {}: {}", action, e.getMessage());
      return StatusOr.ofStatus(DbUtil.toStatus(e, "Failed to " + action));
    }
  }

  private <T> StatusOr<T> withConnection(String action, ConnectionWork<T> work) {
    StatusOr<Connection> connectionOr = borrowConnection(action);
    if (connectionOr.isNotOk()) {
      return StatusOr.ofStatus(connectionOr.getStatus());
    }
    try (Connection connection = connectionOr.getValue()) {
      StatusOr<T> result = work.run(connection);
      if (result.isNotOk()) {
        Logger.error("Failed to {}: {}", action, result.getStatus().getMessage());
      }
      return result;
    } catch (SQLException e) {
      Logger.error(e, "Database error during {}: {}", action, e.getMessage());
      return StatusOr.ofStatus(DbUtil.toStatus(e, "Failed to " + action));
    }
  }

  /** Any failure to obtain a connection is reported as UNAVAILABLE. */
  private StatusOr<Connection> borrowConnection(String action) {
    try {
      return StatusOr.ofValue(config.dataSource().getConnection());
    } catch (SQLException e) {
      Logger.error(e, "No database connection to {}", action);
      return StatusOr.ofStatus(
          Status.unavailable("No database connection to " + action + ": " + e.getMessage(), e));
    }
  }

  private static void rollback(Connection connection, String action) {
    try {
      connection.rollback();
    } catch (SQLException e) {
      Logger.error(e, "Rollback after failed {} did not complete", action);
    }
  }
}
