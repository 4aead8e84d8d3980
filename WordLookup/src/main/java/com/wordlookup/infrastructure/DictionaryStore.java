package com.wordlookup.infrastructure;

import com.wordlookup.domain.DictionaryInitializationException;
import com.wordlookup.infrastructure.seed.SeedLoader;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.sqlite.SQLiteConfig;

/**
 * Owner of the single SQLite connection behind the dictionary.
 *
 * <p>With a data directory configured the store lives in {@code <dir>/dictionary.db} and survives
 * restarts; otherwise it is an in-memory database rebuilt on every start. The connection is opened
 * once, the schema is created if missing, and the table is seeded only when it is empty. All access
 * after that goes through {@link #query(String, SqlWork)}, which holds one lock for the duration of
 * the work.
 */
@Component
public class DictionaryStore {
  private static final Logger log = LoggerFactory.getLogger(DictionaryStore.class);

  public static final String DB_FILE_NAME = "dictionary.db";

  private static final String SQL_CREATE_TABLE =
      "CREATE TABLE IF NOT EXISTS dictionary ("
          + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
          + "word TEXT NOT NULL COLLATE NOCASE, "
          + "definition TEXT NOT NULL)";
  private static final String SQL_CREATE_INDEX =
      "CREATE INDEX IF NOT EXISTS idx_word ON dictionary(word COLLATE NOCASE)";
  private static final String SQL_COUNT = "SELECT COUNT(*) FROM dictionary";

  private final Path dataDir;
  private final int busyTimeoutMs;
  private final SeedLoader seeder;
  private final Object lock = new Object();

  private Connection conn;

  public DictionaryStore(
      @Value("${wordlookup.data-dir:}") String dataDir,
      @Value("${wordlookup.busy-timeout-ms:3000}") int busyTimeoutMs,
      SeedLoader seeder) {
    this.dataDir = dataDir == null || dataDir.isBlank() ? null : Path.of(dataDir.trim());
    this.busyTimeoutMs = busyTimeoutMs;
    this.seeder = seeder;
  }

  /** Work executed against the shared connection while the store lock is held. */
  @FunctionalInterface
  public interface SqlWork<T> {
    T apply(Connection conn) throws SQLException;
  }

  /**
   * Open (or create) the store, ensure schema and index exist, and seed an empty table.
   *
   * @throws DictionaryInitializationException if the store cannot be opened, the schema cannot be
   *     created, or seeding fails
   */
  @PostConstruct
  public void load() {
    long t0 = System.nanoTime();
    String url = jdbcUrl();
    synchronized (lock) {
      try {
        SQLiteConfig cfg = new SQLiteConfig();
        cfg.setBusyTimeout(busyTimeoutMs);

        conn = DriverManager.getConnection(url, cfg.toProperties());
        conn.setAutoCommit(true);

        try (Statement s = conn.createStatement()) {
          s.execute(SQL_CREATE_TABLE);
          s.execute(SQL_CREATE_INDEX);
        }

        int count = countRows(conn);
        if (count == 0) {
          count = seeder.seed(conn);
        } else {
          log.debug("Dictionary already holds {} entries, skipping seed", count);
        }

        long ms = (System.nanoTime() - t0) / 1_000_000;
        log.info("Dictionary store ready at {} with {} entries ({} ms).", location(), count, ms);
      } catch (SQLException e) {
        closeQuietly();
        throw new DictionaryInitializationException(
            "Failed to initialize dictionary store at " + location() + ": " + e.getMessage(), e);
      }
    }
  }

  /** Close the connection. Later queries fail with {@link SQLException}. */
  @PreDestroy
  public void close() {
    synchronized (lock) {
      closeQuietly();
    }
  }

  /**
   * Run {@code work} against the shared connection, serialized with every other caller.
   *
   * @param op operation name for logging
   * @throws SQLException if the store is closed or the work fails
   */
  public <T> T query(String op, SqlWork<T> work) throws SQLException {
    synchronized (lock) {
      if (conn == null) {
        throw new SQLException("Dictionary store is closed (" + op + ")");
      }
      return work.apply(conn);
    }
  }

  /** Number of entries currently stored. */
  public int count() throws SQLException {
    return query("count", DictionaryStore::countRows);
  }

  public boolean isPersistent() {
    return dataDir != null;
  }

  /** Database file path, or {@code :memory:} for the transient store. */
  public String location() {
    return isPersistent() ? dataDir.resolve(DB_FILE_NAME).toString() : ":memory:";
  }

  private String jdbcUrl() {
    if (!isPersistent()) {
      return "jdbc:sqlite::memory:";
    }
    try {
      Files.createDirectories(dataDir);
    } catch (IOException e) {
      // Opening the database below reports the real problem, if any.
      log.warn("Could not create data directory {}: {}", dataDir, e.toString());
    }
    return "jdbc:sqlite:" + dataDir.resolve(DB_FILE_NAME).toAbsolutePath().normalize();
  }

  private static int countRows(Connection c) throws SQLException {
    try (Statement s = c.createStatement();
        ResultSet rs = s.executeQuery(SQL_COUNT)) {
      return rs.next() ? rs.getInt(1) : 0;
    }
  }

  private void closeQuietly() {
    try {
      if (conn != null) conn.close();
    } catch (SQLException e) {
      log.warn("Closing dictionary store failed: {}", e.getMessage());
    }
    conn = null;
  }
}
