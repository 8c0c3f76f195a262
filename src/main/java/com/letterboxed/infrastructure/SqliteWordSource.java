package com.letterboxed.infrastructure;

import com.letterboxed.application.port.WordSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteOpenMode;

/**
 * Word list read from the {@code word} column of a read-only SQLite {@code dict} table.
 *
 * <p>The connection is opened read-only for the duration of one load and closed afterwards. If
 * the JDBC URL points to a file path, the file's existence is verified first. Words go through
 * {@link WordSanitizer} like any other source.
 */
@Component
@ConditionalOnProperty(name = "letterboxed.word-source", havingValue = "sqlite")
public class SqliteWordSource implements WordSource {
  private static final Logger log = LoggerFactory.getLogger(SqliteWordSource.class);

  private static final String SQL_ALL_WORDS = "SELECT word FROM dict";

  private final String jdbcUrl;

  public SqliteWordSource(@Value("${letterboxed.dictionary-jdbc-url}") String jdbcUrl) {
    this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "letterboxed.dictionary-jdbc-url");
  }

  /**
   * Read all words with conservative PRAGMAs applied:
   * - query_only=ON
   * - busy_timeout=3000
   * - temp_store=MEMORY
   *
   * @throws IllegalStateException if the database is missing or the query fails
   */
  @Override
  public List<String> loadWords() {
    if (jdbcUrl.startsWith("jdbc:sqlite:")) {
      String path = jdbcUrl.substring("jdbc:sqlite:".length());
      if (!path.startsWith(":")) {
        Path db = Path.of(path).toAbsolutePath().normalize();
        if (Files.notExists(db)) throw new IllegalStateException("Dictionary DB not found: " + db);
      }
    }

    SQLiteConfig cfg = new SQLiteConfig();
    cfg.setReadOnly(true);
    cfg.setOpenMode(SQLiteOpenMode.READONLY);

    List<String> words = new ArrayList<>();
    try (Connection conn = DriverManager.getConnection(jdbcUrl, cfg.toProperties())) {
      conn.setReadOnly(true);
      try (Statement s = conn.createStatement()) {
        s.execute("PRAGMA query_only=ON");
        s.execute("PRAGMA busy_timeout=3000");
        s.execute("PRAGMA temp_store=MEMORY");
        try (ResultSet rs = s.executeQuery(SQL_ALL_WORDS)) {
          while (rs.next()) {
            String w = WordSanitizer.sanitize(rs.getString(1));
            if (!w.isEmpty()) words.add(w);
          }
        }
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to read words from " + jdbcUrl, e);
    }
    log.debug("Read {} words from {}", words.size(), jdbcUrl);
    return words;
  }

  @Override
  public String describe() {
    return jdbcUrl;
  }
}
