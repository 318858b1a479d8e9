package com.bezdurakov.db.helpers;

import static org.junit.jupiter.api.Assertions.*;

import com.bezdurakov.common.status.StatusCode;
import com.bezdurakov.common.status.StatusOr;
import com.bezdurakov.db.GameTeam;
import com.bezdurakov.db.GameTeams;
import com.bezdurakov.db.Games;
import com.bezdurakov.db.Team;
import com.bezdurakov.db.Teams;
import com.bezdurakov.db.util.SqliteTestHelper;
import com.bezdurakov.db.util.SqliteTestHelper.SqliteContext;
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

/** Tests for the GameTeams helper class against a SQLite database. */
class GameTeamsTest {

  @TempDir static Path tempDir;

  private static SqliteContext sqliteContext;
  private static Connection connection;

  @BeforeAll
  static void setUp() throws SQLException {
    sqliteContext = SqliteTestHelper.setupSqlite(tempDir, GameTeamsTest.class);
    connection = sqliteContext.getConnection();
  }

  @AfterAll
  static void tearDown() {
    sqliteContext.close();
  }

  @BeforeEach
  void clearDatabase() throws SQLException {
    SqliteTestHelper.clearTables(connection);
  }

  @Test
  void testLoadTeamsOfGame_ReturnsTeamsInIdOrder() {
    // Given: Teams created in a known order and added to a game in reverse
    long alpha = Teams.insert(connection, "Alpha").getValue();
    long beta = Teams.insert(connection, "Beta").getValue();
    long gameId = Games.insert(connection, LocalDate.of(2024, 1, 15), Instant.now()).getValue();
    GameTeams.insert(connection, gameId, beta);
    GameTeams.insert(connection, gameId, alpha);

    // When: We load the teams of the game
    StatusOr<List<Team>> result = GameTeams.loadTeamsOfGame(connection, gameId);

    // Then: They are ordered by team id
    assertTrue(result.isOk());
    assertEquals(List.of(new Team(alpha, "Alpha"), new Team(beta, "Beta")), result.getValue());
  }

  @Test
  void testInsert_Fails_WhenGameDoesNotExist() {
    // Given: A team but no game
    long teamId = Teams.insert(connection, "Alpha").getValue();

    // When: A membership for a missing game is inserted
    StatusOr<Integer> result = GameTeams.insert(connection, 424_242L, teamId);

    // Then: The foreign key rejects it
    assertTrue(result.isNotOk());
    assertEquals(StatusCode.INTERNAL, result.getStatus().getCode());
  }

  @Test
  void testInsert_Fails_WhenTeamAlreadyInGame() {
    // Given: A team already in a game
    long gameId =
        EntityHelper.insertGameWithTeams(connection, LocalDate.of(2024, 1, 15), "Alpha");
    long teamId = Teams.loadByName(connection, "Alpha").getValue().get().teamId();

    // When: The same membership is inserted again
    StatusOr<Integer> result = GameTeams.insert(connection, gameId, teamId);

    // Then: The primary key rejects it
    assertTrue(result.isNotOk());
  }

  @Test
  void testDeleteByGame_RemovesOnlyThatGamesMemberships() {
    // Given: Two games sharing a team
    LocalDate date = LocalDate.of(2024, 1, 15);
    long first = EntityHelper.insertGameWithTeams(connection, date, "Alpha", "Beta");
    long second = EntityHelper.insertGameWithTeams(connection, date, "Alpha");

    // When: The memberships of the first game are deleted
    StatusOr<Integer> result = GameTeams.deleteByGame(connection, first);

    // Then: Both of its rows are gone and the other game is untouched
    assertEquals(2, result.getValue());
    assertTrue(GameTeams.loadByGame(connection, first).getValue().isEmpty());
    List<GameTeam> remaining = GameTeams.loadByGame(connection, second).getValue();
    assertEquals(1, remaining.size());
    assertEquals(second, remaining.get(0).gameId());
  }
}
