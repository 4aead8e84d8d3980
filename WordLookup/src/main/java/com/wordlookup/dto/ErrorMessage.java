package com.wordlookup.dto;

public record ErrorMessage(String type, String query, String message) {
  public ErrorMessage(String query, String message) {
    this("error", query, message);
  }
}
