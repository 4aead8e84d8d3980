package com.wordlookup.interfaces.rest;

import com.wordlookup.application.port.Dictionary;
import com.wordlookup.domain.DictionaryLookupException;
import com.wordlookup.dto.ErrorMessage;
import com.wordlookup.dto.SearchResponse;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequestMapping("/api")
public class SearchController {
  static final int MAX_QUERY_LENGTH = 100;

  private final Dictionary dict;

  public SearchController(Dictionary dict) {
    this.dict = dict;
  }

  @GetMapping("/search")
  public SearchResponse search(
      @RequestParam(name = "word", defaultValue = "") @Size(max = MAX_QUERY_LENGTH) String word) {
    return new SearchResponse(word, dict.search(word));
  }

  @ExceptionHandler(DictionaryLookupException.class)
  public ResponseEntity<ErrorMessage> onLookupFailure(DictionaryLookupException e) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ErrorMessage(e.query(), e.getMessage()));
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ErrorMessage> onInvalidQuery(ConstraintViolationException e) {
    String query =
        e.getConstraintViolations().stream()
            .map(ConstraintViolation::getInvalidValue)
            .filter(String.class::isInstance)
            .map(v -> truncate((String) v))
            .findFirst()
            .orElse(null);
    return ResponseEntity.badRequest()
        .body(new ErrorMessage(query, "Query must be at most " + MAX_QUERY_LENGTH + " characters"));
  }

  /** Rejected queries are echoed back cut to the accepted length. */
  private static String truncate(String s) {
    return s.length() <= MAX_QUERY_LENGTH ? s : s.substring(0, MAX_QUERY_LENGTH);
  }
}
