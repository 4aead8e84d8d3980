package com.wordlookup.domain;

public class DictionaryInitializationException extends RuntimeException {
  public DictionaryInitializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
