package com.letterboxed.infrastructure;

/**
 * Normalizes raw word-list entries.
 *
 * <p>Only letters survive, lower-cased code point by code point. Punctuation is removed rather
 * than split on, so {@code "well-being"} becomes {@code "wellbeing"}.
 */
public final class WordSanitizer {
  private WordSanitizer() {}

  /** Sanitized form of {@code line}; empty when nothing alphabetic remains. */
  public static String sanitize(String line) {
    if (line == null) return "";
    StringBuilder sb = new StringBuilder(line.length());
    line.codePoints()
        .filter(Character::isLetter)
        .map(Character::toLowerCase)
        .forEach(sb::appendCodePoint);
    return sb.toString();
  }
}
