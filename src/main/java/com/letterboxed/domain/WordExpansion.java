package com.letterboxed.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Plays whole words: every playable word that starts with the connecting letter (any word on an
 * empty board) is laid greedily with {@link LetterBoxedGame#tryPlayingOnBoard(String,
 * SearchState)}.
 */
final class WordExpansion implements ExpansionStrategy {
  @Override
  public List<SearchState> children(LetterBoxedGame game, SearchState state, Random random) {
    String connect = state.wordInProgress();
    List<SearchState> next = new ArrayList<>();
    // only reachable from states built by the letter walk
    if (connect.length() > 1) {
      return next;
    }
    Iterable<String> candidates =
        connect.isEmpty() ? game.dictionary() : game.wordsStartingWith(connect.charAt(0));
    for (String word : candidates) {
      game.tryPlayingOnBoard(word, state).ifPresent(next::add);
    }
    Collections.shuffle(next, random);
    return next;
  }

  @Override
  public boolean deduplicates() {
    return false;
  }
}
