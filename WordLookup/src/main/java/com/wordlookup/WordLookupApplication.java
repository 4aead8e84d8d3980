package com.wordlookup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WordLookupApplication {

  public static void main(String[] args) {
    SpringApplication.run(WordLookupApplication.class, args);
  }
}
