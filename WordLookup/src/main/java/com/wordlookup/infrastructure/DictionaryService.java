package com.wordlookup.infrastructure;

import com.wordlookup.application.port.Dictionary;
import com.wordlookup.domain.DictionaryLookupException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Dictionary implementation backed by {@link DictionaryStore}.
 *
 * <p>Queries are trimmed and lower-cased (Locale.ROOT). Exact matches are returned in full; only
 * when there are none does the lookup fall back to a capped number of prefix matches. Prefix
 * queries use SQLite LIKE with an explicit ESCAPE clause so that user input is never read as a
 * wildcard. Both phases run under the store lock as one unit.
 */
@Service
public class DictionaryService implements Dictionary {
  private static final Logger log = LoggerFactory.getLogger(DictionaryService.class);

  private static final String SQL_EXACT =
      "SELECT definition FROM dictionary WHERE word = ? COLLATE NOCASE ORDER BY id";
  private static final String SQL_PREFIX =
      "SELECT definition FROM dictionary WHERE word LIKE ? ESCAPE '\\'"
          + " ORDER BY id LIMIT ?";

  private final DictionaryStore store;
  private final int prefixLimit;

  public DictionaryService(
      DictionaryStore store, @Value("${wordlookup.prefix-limit:3}") int prefixLimit) {
    if (prefixLimit < 1) {
      throw new IllegalArgumentException("wordlookup.prefix-limit must be positive");
    }
    this.store = store;
    this.prefixLimit = prefixLimit;
  }

  /**
   * Look up definitions for the given word.
   *
   * @param w word to look up (may be null or blank)
   * @return every exact match, otherwise up to {@code prefixLimit} prefix matches; empty if none
   * @throws DictionaryLookupException if the store could not be queried
   */
  @Override
  public List<String> search(String w) {
    String word = norm(w);
    if (word.isEmpty()) return List.of();
    try {
      return store.query(
          "search",
          c -> {
            List<String> exact = definitions(c, SQL_EXACT, word, -1);
            if (!exact.isEmpty()) return exact;
            return definitions(c, SQL_PREFIX, escapeLike(word) + "%", prefixLimit);
          });
    } catch (SQLException e) {
      log.debug("search failed for '{}': {}", word, e.getMessage());
      throw new DictionaryLookupException(word, "Lookup failed: " + e.getMessage(), e);
    }
  }

  public int prefixLimit() {
    return prefixLimit;
  }

  /**
   * Execute a single-column definition query.
   *
   * @param limit row cap bound as the second parameter, or negative if the query has none
   */
  private static List<String> definitions(Connection c, String sql, String param, int limit)
      throws SQLException {
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, param);
      if (limit >= 0) ps.setInt(2, limit);
      try (ResultSet rs = ps.executeQuery()) {
        List<String> out = new ArrayList<>();
        while (rs.next()) {
          out.add(rs.getString(1));
        }
        return List.copyOf(out);
      }
    }
  }

  /** Normalize input string by trimming and lower-casing (Locale.ROOT). */
  static String norm(String s) {
    return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
  }

  /** Escape special LIKE wildcard characters in user input. */
  static String escapeLike(String s) {
    return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }
}
