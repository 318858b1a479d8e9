package com.bezdurakov.operations;

import com.bezdurakov.GameArchive;
import com.bezdurakov.common.status.StatusOr;
import com.bezdurakov.db.Game;
import java.util.List;
import org.tinylog.Logger;

/**
 * Empties the archive game by game, optionally deleting the teams afterwards.
 *
 * <p>Each game is removed in its own transaction, so one failing game does not keep the others.
 * Teams are only deleted when every game was removed.
 */
public class ClearArchiveOperation {
  static final int PROGRESS_INTERVAL = 10;

  private final GameArchive archive;

  public ClearArchiveOperation(GameArchive archive) {
    this.archive = archive;
  }

  /**
   * Counts of one clearing run.
   *
   * @param gamesFound games present when the run started
   * @param gamesRemoved games no longer stored, including those another writer removed first
   * @param gamesFailed games that could not be removed
   * @param teamsRemoved teams deleted, zero unless teams were cleared
   */
  public record ClearSummary(int gamesFound, int gamesRemoved, int gamesFailed, int teamsRemoved) {

    public boolean isComplete() {
      return gamesFailed == 0;
    }
  }

  /**
   * Removes every game and, if requested, every team.
   *
   * @param clearTeams whether to delete all teams once the games are gone
   * @return StatusOr containing the summary, or the error that prevented listing or team removal
   */
  public StatusOr<ClearSummary> execute(boolean clearTeams) {
    StatusOr<List<Game>> gamesOr = archive.getAllGames();
    if (gamesOr.isNotOk()) {
      Logger.error("Failed to list games to clear: {}", gamesOr.getStatus().getMessage());
      return StatusOr.ofStatus(gamesOr.getStatus());
    }
    List<Game> games = gamesOr.getValue();
    Logger.info("Clearing {} games", games.size());

    int removed = 0;
    int failed = 0;
    for (Game game : games) {
      StatusOr<Boolean> removedOr = archive.removeGame(game.gameId());
      if (removedOr.isOk()) {
        // A game another writer removed meanwhile is gone all the same.
        if (!removedOr.getValue()) {
          Logger.info("Game {} was already removed", game.gameId());
        }
        removed++;
      } else {
        failed++;
        Logger.warn(
            "Could not remove game {}: {}", game.gameId(), removedOr.getStatus().getMessage());
      }
      int processed = removed + failed;
      if (processed % PROGRESS_INTERVAL == 0) {
        Logger.info("Processed {} of {} games", processed, games.size());
      }
    }
    Logger.info("Removed {} games, {} failed", removed, failed);

    int teamsRemoved = 0;
    if (clearTeams) {
      if (failed > 0) {
        Logger.warn("Keeping teams because {} games are still stored", failed);
      } else {
        StatusOr<Integer> teamsOr = archive.removeAllTeams();
        if (teamsOr.isNotOk()) {
          return StatusOr.ofStatus(teamsOr.getStatus());
        }
        teamsRemoved = teamsOr.getValue();
        Logger.info("Removed {} teams", teamsRemoved);
      }
    }
    return StatusOr.ofValue(new ClearSummary(games.size(), removed, failed, teamsRemoved));
  }
}
