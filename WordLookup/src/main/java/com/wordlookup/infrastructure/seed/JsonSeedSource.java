package com.wordlookup.infrastructure.seed;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.wordlookup.domain.DictionaryEntry;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

/**
 * Seed entries read from a JSON document of the form
 * {@code {"words": [{"word": "...", "definition": "..."}]}}.
 *
 * <p>Unknown properties are ignored. A missing resource, unreadable content, a document without a
 * {@code words} array, an element lacking a word or definition, a word or definition that is not a
 * JSON string, content after the document, or an empty array all make the source unavailable.
 */
public class JsonSeedSource implements SeedSource {
  private static final Logger log = LoggerFactory.getLogger(JsonSeedSource.class);

  private final Resource resource;
  private final ObjectMapper mapper;

  public JsonSeedSource(Resource resource, ObjectMapper mapper) {
    this.resource = resource;
    this.mapper =
        mapper
            .copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
    // Numbers and booleans are not words.
    this.mapper
        .coercionConfigFor(LogicalType.Textual)
        .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
  }

  @Override
  public String name() {
    return resource.getDescription();
  }

  @Override
  public Optional<List<DictionaryEntry>> entries() {
    if (!resource.exists()) {
      log.info("Seed file {} not found", name());
      return Optional.empty();
    }

    SeedDocument doc;
    try (InputStream in = resource.getInputStream()) {
      doc = mapper.readValue(in, SeedDocument.class);
    } catch (IOException e) {
      log.warn("Seed file {} unreadable: {}", name(), e.getMessage());
      return Optional.empty();
    }

    if (doc == null || doc.words() == null) {
      log.warn("Seed file {} has no 'words' array", name());
      return Optional.empty();
    }
    if (doc.words().isEmpty()) {
      log.warn("Seed file {} has an empty 'words' array", name());
      return Optional.empty();
    }
    for (DictionaryEntry e : doc.words()) {
      if (e == null || e.word() == null || e.definition() == null) {
        log.warn("Seed file {} has an entry without word or definition", name());
        return Optional.empty();
      }
    }
    return Optional.of(List.copyOf(doc.words()));
  }

  public record SeedDocument(List<DictionaryEntry> words) {}
}
