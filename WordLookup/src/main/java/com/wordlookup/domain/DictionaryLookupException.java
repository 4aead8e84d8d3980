package com.wordlookup.domain;

/** A lookup could not be executed against the store. Distinct from "no definitions found". */
public class DictionaryLookupException extends RuntimeException {
  private final String query;

  public DictionaryLookupException(String query, String message, Throwable cause) {
    super(message, cause);
    this.query = query;
  }

  public String query() {
    return query;
  }
}
