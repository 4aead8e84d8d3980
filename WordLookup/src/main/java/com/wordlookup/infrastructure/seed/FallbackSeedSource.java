package com.wordlookup.infrastructure.seed;

import com.wordlookup.domain.DictionaryEntry;
import java.util.List;
import java.util.Optional;

/** Built-in list of common technical terms, used when no seed file is available. */
public class FallbackSeedSource implements SeedSource {

  static final List<DictionaryEntry> ENTRIES =
      List.of(
          new DictionaryEntry("algorithm", "A step-by-step procedure for solving a problem."),
          new DictionaryEntry(
              "api", "Application Programming Interface; protocols for building software."),
          new DictionaryEntry("array", "A data structure containing a collection of elements."),
          new DictionaryEntry(
              "bank", "An institution for handling money; also, the land beside water."),
          new DictionaryEntry("boolean", "A data type with only two values: true or false."),
          new DictionaryEntry("buffer", "Temporary storage for data being transferred."),
          new DictionaryEntry("cache", "Storage for faster future data access."),
          new DictionaryEntry("class", "A blueprint for creating objects in OOP."),
          new DictionaryEntry(
              "compiler", "A program that translates source code into machine code."),
          new DictionaryEntry("database", "An organized collection of structured data."),
          new DictionaryEntry("debug", "To find and fix errors in software."),
          new DictionaryEntry("function", "A reusable block of code that performs a task."),
          new DictionaryEntry("interpreter", "A program that executes instructions directly."),
          new DictionaryEntry("loop", "A construct that repeats a block of code."),
          new DictionaryEntry("memory", "Storage for data and instructions."),
          new DictionaryEntry("object", "An instance of a class with data and methods."),
          new DictionaryEntry("pointer", "A variable storing a memory address."),
          new DictionaryEntry("recursion", "A technique where a function calls itself."),
          new DictionaryEntry("string", "A sequence of characters representing text."),
          new DictionaryEntry("variable", "A named storage location for data."));

  @Override
  public String name() {
    return "built-in fallback";
  }

  @Override
  public Optional<List<DictionaryEntry>> entries() {
    return Optional.of(ENTRIES);
  }
}
