package com.letterboxed.application.port;

import java.util.List;

/** Supplies the raw word list the base dictionary is built from. */
public interface WordSource {
  /**
   * Load every word, already sanitized. Entries that are empty after sanitization are dropped.
   *
   * @throws IllegalStateException if the underlying source cannot be read
   */
  List<String> loadWords();

  /** Human-readable origin, for logs and the config endpoint. */
  String describe();
}
