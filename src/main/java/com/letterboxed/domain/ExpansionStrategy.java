package com.letterboxed.domain;

import java.util.List;
import java.util.Random;

/** Produces the successors of a search state. */
public interface ExpansionStrategy {
  /**
   * Legal successors of {@code state}, shuffled with {@code random}.
   *
   * @param game board and playable words
   * @param state state to expand
   * @param random source used to order siblings
   */
  List<SearchState> children(LetterBoxedGame game, SearchState state, Random random);

  /** Whether the solver should skip successors it has already scheduled. */
  boolean deduplicates();
}
