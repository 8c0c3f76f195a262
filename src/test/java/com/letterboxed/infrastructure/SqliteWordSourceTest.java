package com.letterboxed.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.Statement;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteWordSourceTest {

  private static String createDictionary(Path dir, String... words) throws Exception {
    String url = "jdbc:sqlite:" + dir.resolve("dict.db");
    try (Connection c = DriverManager.getConnection(url);
        Statement s = c.createStatement()) {
      s.execute("CREATE TABLE dict (word TEXT NOT NULL, def TEXT)");
      try (PreparedStatement ps = c.prepareStatement("INSERT INTO dict (word, def) VALUES (?, ?)")) {
        for (String w : words) {
          ps.setString(1, w);
          ps.setString(2, "definition of " + w);
          ps.executeUpdate();
        }
      }
    }
    return url;
  }

  @Test
  void readsWordColumnAndSanitizes(@TempDir Path dir) throws Exception {
    String url = createDictionary(dir, "Who", "objectively", "co-op", "123");

    SqliteWordSource source = new SqliteWordSource(url);

    assertThat(source.loadWords()).containsExactlyInAnyOrder("who", "objectively", "coop");
    assertThat(source.describe()).isEqualTo(url);
  }

  @Test
  void missingDatabaseFailsLoudly(@TempDir Path dir) {
    SqliteWordSource source = new SqliteWordSource("jdbc:sqlite:" + dir.resolve("missing.db"));
    assertThatThrownBy(source::loadWords)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("not found");
  }

  @Test
  void missingTableFailsLoudly(@TempDir Path dir) throws Exception {
    String url = "jdbc:sqlite:" + dir.resolve("empty.db");
    try (Connection c = DriverManager.getConnection(url);
        Statement s = c.createStatement()) {
      s.execute("CREATE TABLE other (x INTEGER)");
    }
    assertThatThrownBy(() -> new SqliteWordSource(url).loadWords())
        .isInstanceOf(IllegalStateException.class);
  }
}
