package com.wordlookup.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wordlookup.domain.DictionaryInitializationException;
import com.wordlookup.infrastructure.seed.SeedLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

class DictionaryStoreTest {

  @TempDir Path tmp;

  private static DictionaryStore store(String dataDir, String seedResource) {
    SeedLoader seeder =
        new SeedLoader(new DefaultResourceLoader(), new ObjectMapper(), seedResource);
    return new DictionaryStore(dataDir, 3000, seeder);
  }

  @Test
  void inMemoryStoreIsSeededWithFallbackSet() throws SQLException {
    DictionaryStore store = store("", "");
    store.load();
    try {
      assertThat(store.isPersistent()).isFalse();
      assertThat(store.location()).isEqualTo(":memory:");
      assertThat(store.count()).isEqualTo(20);
    } finally {
      store.close();
    }
  }

  @Test
  void reopeningPersistentStoreDoesNotReseed() throws SQLException {
    String dir = tmp.resolve("nested/data").toString();

    DictionaryStore first = store(dir, "");
    first.load();
    assertThat(first.count()).isEqualTo(20);
    first.close();

    // A seed file on the second run must be ignored: the table is no longer empty.
    DictionaryStore second = store(dir, "classpath:seed/valid.json");
    second.load();
    try {
      assertThat(second.isPersistent()).isTrue();
      assertThat(second.count()).isEqualTo(20);
    } finally {
      second.close();
    }
    assertThat(tmp.resolve("nested/data").resolve(DictionaryStore.DB_FILE_NAME)).exists();
  }

  @Test
  void seedFileIsUsedWhenAvailable() throws SQLException {
    DictionaryStore store = store(tmp.toString(), "classpath:seed/valid.json");
    store.load();
    try {
      assertThat(store.count()).isEqualTo(11);
    } finally {
      store.close();
    }
  }

  @Test
  void unusableDataDirectoryFailsInitialization() throws Exception {
    Path notADir = Files.writeString(tmp.resolve("plain-file"), "x");
    DictionaryStore store = store(notADir.toString(), "");

    assertThatThrownBy(store::load)
        .isInstanceOf(DictionaryInitializationException.class)
        .hasMessageContaining(DictionaryStore.DB_FILE_NAME)
        .hasCauseInstanceOf(SQLException.class);
  }

  @Test
  void queriesAfterCloseFail() {
    DictionaryStore store = store("", "");
    store.load();
    store.close();

    assertThatThrownBy(store::count)
        .isInstanceOf(SQLException.class)
        .hasMessageContaining("closed");
  }
}
