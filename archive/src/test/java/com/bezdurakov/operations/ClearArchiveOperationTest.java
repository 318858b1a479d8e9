package com.bezdurakov.operations;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.bezdurakov.GameArchive;
import com.bezdurakov.common.status.Status;
import com.bezdurakov.common.status.StatusOr;
import com.bezdurakov.db.Game;
import com.bezdurakov.db.helpers.EntityHelper;
import com.bezdurakov.db.util.SqliteTestHelper;
import com.bezdurakov.db.util.SqliteTestHelper.SqliteContext;
import com.bezdurakov.game.GameResults;
import com.bezdurakov.operations.ClearArchiveOperation.ClearSummary;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for ClearArchiveOperation. */
class ClearArchiveOperationTest {

  @TempDir static Path tempDir;

  private static SqliteContext sqliteContext;
  private static Connection connection;
  private static GameArchive archive;

  @BeforeAll
  static void setUp() throws SQLException {
    sqliteContext = SqliteTestHelper.setupSqlite(tempDir, ClearArchiveOperationTest.class);
    connection = sqliteContext.getConnection();
    archive = new GameArchive(new GameArchive.Config(sqliteContext.getDataSource()));
  }

  @AfterAll
  static void tearDown() {
    sqliteContext.close();
  }

  @BeforeEach
  void clearDatabase() throws SQLException {
    SqliteTestHelper.clearTables(connection);
  }

  private void storeGames(int count) {
    LocalDate date = LocalDate.of(2024, 1, 1);
    for (int i = 0; i < count; i++) {
      GameResults game =
          GameResults.of(
              date.plusDays(i),
              EntityHelper.fullTeam("Alpha", i),
              EntityHelper.selectionOnly("Team " + (i % 3), "10.00"));
      assertTrue(archive.addGame(game).isOk());
    }
  }

  @Test
  void testExecute_RemovesGamesAndTeams() {
    // Given: More games than one progress interval
    storeGames(12);

    // When: The archive is cleared including teams
    StatusOr<ClearSummary> result = new ClearArchiveOperation(archive).execute(true);

    // Then: Everything is gone and the counts say so
    assertTrue(result.isOk());
    assertEquals(new ClearSummary(12, 12, 0, 4), result.getValue());
    assertTrue(result.getValue().isComplete());
    assertTrue(archive.getAllGames().getValue().isEmpty());
    assertTrue(archive.getAllTeams().getValue().isEmpty());
  }

  @Test
  void testExecute_KeepsTeams_WhenNotAsked() {
    // Given: Some stored games
    storeGames(3);

    // When: Only games are cleared
    ClearSummary summary = new ClearArchiveOperation(archive).execute(false).getValue();

    // Then: Teams survive for later games
    assertEquals(new ClearSummary(3, 3, 0, 0), summary);
    assertEquals(4, archive.getAllTeams().getValue().size());
  }

  @Test
  void testExecute_OnEmptyArchive_ReportsNothingFound() {
    ClearSummary summary = new ClearArchiveOperation(archive).execute(true).getValue();

    assertEquals(new ClearSummary(0, 0, 0, 0), summary);
  }

  @Test
  void testExecute_CountsFailures_AndKeepsTeams() {
    // Given: An archive where one of two removals fails
    GameArchive failing = mock(GameArchive.class);
    Instant now = Instant.now();
    when(failing.getAllGames())
        .thenReturn(
            StatusOr.ofValue(
                List.of(
                    new Game(1L, LocalDate.of(2024, 1, 1), now),
                    new Game(2L, LocalDate.of(2024, 1, 2), now))));
    when(failing.removeGame(1L)).thenReturn(StatusOr.ofValue(true));
    when(failing.removeGame(2L))
        .thenReturn(StatusOr.ofStatus(Status.aborted("could not serialize access")));

    // When: The archive is cleared including teams
    ClearSummary summary = new ClearArchiveOperation(failing).execute(true).getValue();

    // Then: The failure is counted and teams are left alone
    assertEquals(new ClearSummary(2, 1, 1, 0), summary);
    assertFalse(summary.isComplete());
    verify(failing, never()).removeAllTeams();
  }

  @Test
  void testExecute_CountsGameRemovedElsewhere_AndClearsTeams() {
    // Given: A listed game that another writer removes before this run reaches it
    GameArchive racing = mock(GameArchive.class);
    Instant now = Instant.now();
    when(racing.getAllGames())
        .thenReturn(
            StatusOr.ofValue(
                List.of(
                    new Game(1L, LocalDate.of(2024, 1, 1), now),
                    new Game(2L, LocalDate.of(2024, 1, 2), now))));
    when(racing.removeGame(1L)).thenReturn(StatusOr.ofValue(true));
    when(racing.removeGame(2L)).thenReturn(StatusOr.ofValue(false));
    when(racing.removeAllTeams()).thenReturn(StatusOr.ofValue(3));

    // When: The archive is cleared including teams
    ClearSummary summary = new ClearArchiveOperation(racing).execute(true).getValue();

    // Then: Both games count as removed and the teams are deleted
    assertEquals(new ClearSummary(2, 2, 0, 3), summary);
    assertTrue(summary.isComplete());
    verify(racing).removeAllTeams();
  }

  @Test
  void testExecute_ReturnsError_WhenGamesCannotBeListed() {
    GameArchive failing = mock(GameArchive.class);
    when(failing.getAllGames())
        .thenReturn(StatusOr.ofStatus(Status.unavailable("pool closed", null)));

    StatusOr<ClearSummary> result = new ClearArchiveOperation(failing).execute(true);

    assertTrue(result.isNotOk());
    verify(failing, never()).removeGame(1L);
  }
}
