package com.letterboxed.domain;

import java.util.Locale;

/** Named expansion strategies, selectable per solve. */
public enum Strategy {
  /** Letter-by-letter trie walk with duplicate-state detection. */
  LETTER(new LetterExpansion()),
  /** Whole-word greedy placement, no duplicate-state detection. */
  WORD(new WordExpansion());

  private final ExpansionStrategy expansion;

  Strategy(ExpansionStrategy expansion) {
    this.expansion = expansion;
  }

  public ExpansionStrategy expansion() {
    return expansion;
  }

  /**
   * Case-insensitive lookup.
   *
   * @throws IllegalArgumentException for unknown names
   */
  public static Strategy parse(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Strategy is required");
    }
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown strategy: " + name + " (expected letter or word)");
    }
  }
}
