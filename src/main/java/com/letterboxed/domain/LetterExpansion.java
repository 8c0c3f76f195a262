package com.letterboxed.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Walks the trie one letter at a time: every letter on every edge other than the last one used,
 * plus finishing the current word when it is complete.
 */
final class LetterExpansion implements ExpansionStrategy {
  @Override
  public List<SearchState> children(LetterBoxedGame game, SearchState state, Random random) {
    Board board = game.board();
    List<SearchState> next = new ArrayList<>();
    for (int edge = 0; edge < board.numEdges(); edge++) {
      if (!state.isValidNextEdge(edge)) continue;
      for (char c : board.edgeLetters(edge)) {
        if (state.canPlaceLetter(c, edge)) {
          next.add(state.placeLetter(c, edge));
        }
      }
    }
    if (state.canFinishWord()) {
      next.add(state.finishWord());
    }
    Collections.shuffle(next, random);
    return next;
  }

  @Override
  public boolean deduplicates() {
    return true;
  }
}
