package com.bezdurakov.db.util;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.io.Resources;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Checks that both shipped schema scripts define the same objects. */
class SchemaScriptsTest {

  private static List<String> load(String path) throws IOException {
    return SchemaScripts.statements(
        Resources.toString(SchemaScriptsTest.class.getResource(path), StandardCharsets.UTF_8));
  }

  @Test
  void testStatements_DropsCommentsAndBlankFragments() {
    List<String> statements =
        SchemaScripts.statements("-- header\nCREATE TABLE a (x INT);\n\n-- note\n;SELECT 1;");

    assertEquals(List.of("CREATE TABLE a (x INT)", "SELECT 1"), statements);
  }

  @Test
  void testStatements_IgnoresSemicolonInsideComment() {
    List<String> statements =
        SchemaScripts.statements("-- first; second\nCREATE TABLE a (x INT);\nSELECT 1;");

    assertEquals(List.of("CREATE TABLE a (x INT)", "SELECT 1"), statements);
  }

  @Test
  void testBothSchemas_CreateTablesIndexAndView() throws IOException {
    List<String> postgres = load("/db/postgres/01-schema.sql");
    List<String> sqlite = load("/db/sqlite/01-schema.sql");

    // 10 tables, 1 index, 1 view
    assertEquals(12, postgres.size());
    assertEquals(postgres.size(), sqlite.size());
    assertTrue(postgres.get(postgres.size() - 1).startsWith("CREATE VIEW team_game_scores"));
    assertTrue(sqlite.get(sqlite.size() - 1).startsWith("CREATE VIEW team_game_scores"));
    for (String sql : sqlite) {
      assertTrue(sql.startsWith("CREATE "), sql);
    }
    for (String sql : postgres) {
      assertTrue(sql.startsWith("CREATE "), sql);
    }
  }
}
