package com.wordlookup.infrastructure.seed;

import com.wordlookup.domain.DictionaryEntry;
import java.util.List;
import java.util.Optional;

/** A candidate origin of the initial dictionary entries. */
public interface SeedSource {
  /** Short label used in log lines. */
  String name();

  /**
   * Entries offered by this source, or empty if the source is unavailable. Implementations never
   * throw for a missing or unreadable source.
   */
  Optional<List<DictionaryEntry>> entries();
}
