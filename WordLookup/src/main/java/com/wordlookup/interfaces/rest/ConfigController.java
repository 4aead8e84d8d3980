package com.wordlookup.interfaces.rest;

import com.wordlookup.dto.ErrorMessage;
import com.wordlookup.infrastructure.DictionaryService;
import com.wordlookup.infrastructure.DictionaryStore;
import java.sql.SQLException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ConfigController {
  private final DictionaryStore store;
  private final DictionaryService dict;

  public ConfigController(DictionaryStore store, DictionaryService dict) {
    this.store = store;
    this.dict = dict;
  }

  @GetMapping("/config")
  public Map<String, Object> config() throws SQLException {
    return Map.of(
        "prefixLimit", dict.prefixLimit(),
        "persistent", store.isPersistent(),
        "entries", store.count(),
        "protocolVersion", 1);
  }

  @ExceptionHandler(SQLException.class)
  public ResponseEntity<ErrorMessage> onStoreFailure(SQLException e) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ErrorMessage(null, "Dictionary store unavailable: " + e.getMessage()));
  }
}
