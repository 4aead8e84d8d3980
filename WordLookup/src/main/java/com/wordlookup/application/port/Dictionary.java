package com.wordlookup.application.port;

import java.util.List;

public interface Dictionary {
  /**
   * Definitions for the word: every exact match, or else a few prefix matches.
   *
   * @throws com.wordlookup.domain.DictionaryLookupException if the store could not be queried
   */
  List<String> search(String word);
}
