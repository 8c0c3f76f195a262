package com.letterboxed.domain;

import java.util.List;
import java.util.Locale;

/**
 * Words of a final state with its statistics.
 *
 * @param words words in play order
 * @param numLetters letters placed, connecting letters counted once
 * @param duplicateLetters letters placed beyond the board's dot count
 */
public record Solution(List<String> words, int numLetters, int duplicateLetters) {
  public Solution {
    words = List.copyOf(words);
  }

  public static Solution of(SearchState state, Board board) {
    return new Solution(
        state.words(), state.numLetters(), state.numLetters() - board.numDots());
  }

  public int numWords() {
    return words.size();
  }

  /** Upper-case words joined by dashes, e.g. {@code WHO - OBJECTIVELY}. */
  public String display() {
    return String.join(" - ", words).toUpperCase(Locale.ROOT);
  }
}
