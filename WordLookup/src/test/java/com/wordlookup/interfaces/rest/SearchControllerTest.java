package com.wordlookup.interfaces.rest;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.wordlookup.application.port.Dictionary;
import com.wordlookup.domain.DictionaryLookupException;
import java.sql.SQLException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SearchController.class)
class SearchControllerTest {

  @Autowired MockMvc mvc;

  @MockBean Dictionary dict;

  @Test
  void returnsDefinitions() throws Exception {
    when(dict.search("Api")).thenReturn(List.of("Application Programming Interface."));

    mvc.perform(get("/api/search").param("word", "Api"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.type").value("definitions"))
        .andExpect(jsonPath("$.query").value("Api"))
        .andExpect(jsonPath("$.definitions[0]").value("Application Programming Interface."));
  }

  @Test
  void noMatchesIsSuccessWithEmptyList() throws Exception {
    when(dict.search("zzzzz")).thenReturn(List.of());

    mvc.perform(get("/api/search").param("word", "zzzzz"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.definitions").isEmpty());
  }

  @Test
  void missingWordIsTreatedAsEmptyQuery() throws Exception {
    when(dict.search("")).thenReturn(List.of());

    mvc.perform(get("/api/search"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.definitions").isEmpty());
  }

  @Test
  void lookupFailureIsReportedAsError() throws Exception {
    when(dict.search("api"))
        .thenThrow(
            new DictionaryLookupException(
                "api", "Lookup failed: store closed", new SQLException("store closed")));

    mvc.perform(get("/api/search").param("word", "api"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.type").value("error"))
        .andExpect(jsonPath("$.query").value("api"))
        .andExpect(jsonPath("$.message").value("Lookup failed: store closed"));
  }

  @Test
  void overlongQueryIsRejected() throws Exception {
    String word = "a".repeat(SearchController.MAX_QUERY_LENGTH + 1);

    mvc.perform(get("/api/search").param("word", word))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("error"))
        .andExpect(jsonPath("$.query").value("a".repeat(SearchController.MAX_QUERY_LENGTH)));
    verifyNoInteractions(dict);
  }
}
