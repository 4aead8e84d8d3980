package com.wordlookup.infrastructure.seed;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wordlookup.domain.DictionaryEntry;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Fills an empty dictionary table with its initial entries.
 *
 * <p>Sources are tried in order (the configured seed file, if any, then the built-in fallback) and
 * the first one that yields entries wins. Seed file problems never fail seeding; insert failures
 * do.
 */
@Component
public class SeedLoader {
  private static final Logger log = LoggerFactory.getLogger(SeedLoader.class);

  static final String SQL_INSERT = "INSERT INTO dictionary (word, definition) VALUES (?, ?)";

  private final List<SeedSource> sources;

  @Autowired
  public SeedLoader(
      ResourceLoader resources,
      ObjectMapper mapper,
      @Value("${wordlookup.seed-resource:}") String seedResource) {
    this(sourcesFor(resources, mapper, seedResource));
  }

  public SeedLoader(List<SeedSource> sources) {
    this.sources = List.copyOf(sources);
  }

  private static List<SeedSource> sourcesFor(
      ResourceLoader resources, ObjectMapper mapper, String seedResource) {
    List<SeedSource> list = new ArrayList<>();
    if (seedResource != null && !seedResource.isBlank()) {
      list.add(new JsonSeedSource(resources.getResource(seedResource.trim()), mapper));
    }
    list.add(new FallbackSeedSource());
    return list;
  }

  /** The entries that a seeding pass would insert, with the source they came from. */
  public SeedPlan resolve() {
    for (SeedSource s : sources) {
      var entries = s.entries();
      if (entries.isPresent()) {
        return new SeedPlan(s.name(), entries.get());
      }
    }
    FallbackSeedSource fallback = new FallbackSeedSource();
    return new SeedPlan(fallback.name(), FallbackSeedSource.ENTRIES);
  }

  /**
   * Insert the resolved entries, words lower-cased, as a single batch in one transaction.
   *
   * @param conn open connection to a store whose dictionary table exists
   * @return number of entries inserted
   * @throws SQLException if the insert fails; the transaction is rolled back
   */
  public int seed(Connection conn) throws SQLException {
    SeedPlan plan = resolve();
    boolean autoCommit = conn.getAutoCommit();
    conn.setAutoCommit(false);
    try (PreparedStatement ps = conn.prepareStatement(SQL_INSERT)) {
      for (DictionaryEntry e : plan.entries()) {
        DictionaryEntry n = e.normalized();
        ps.setString(1, n.word());
        ps.setString(2, n.definition());
        ps.addBatch();
      }
      ps.executeBatch();
      conn.commit();
    } catch (SQLException e) {
      try {
        conn.rollback();
      } catch (SQLException re) {
        e.addSuppressed(re);
      }
      throw e;
    } finally {
      conn.setAutoCommit(autoCommit);
    }
    log.info("Loaded {} dictionary entries from {}", plan.entries().size(), plan.source());
    return plan.entries().size();
  }

  public record SeedPlan(String source, List<DictionaryEntry> entries) {}
}
