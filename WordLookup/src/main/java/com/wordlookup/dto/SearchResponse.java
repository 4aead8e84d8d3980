package com.wordlookup.dto;

import java.util.List;

public record SearchResponse(String type, String query, List<String> definitions) {
  public SearchResponse(String query, List<String> definitions) {
    this("definitions", query, definitions);
  }
}
