package com.wordlookup.domain;

import java.util.Locale;

public record DictionaryEntry(String word, String definition) {

  /** Copy of this entry with the word lower-cased (Locale.ROOT), as it is stored. */
  public DictionaryEntry normalized() {
    return new DictionaryEntry(word.toLowerCase(Locale.ROOT), definition);
  }
}
