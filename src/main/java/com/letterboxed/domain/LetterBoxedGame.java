package com.letterboxed.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A board together with the words that can be played on it.
 *
 * <p>The dictionary handed to the constructor is filtered once, with {@link
 * #tryPlayingOnBoard(String)}'s greedy placement, down to the words that fit this board and the
 * minimum word length. The unfiltered trie is kept for {@link #canBePlayed(String)}.
 */
public final class LetterBoxedGame {
  public static final int DEFAULT_MIN_WORD_LENGTH = 3;

  private static final Logger log = LoggerFactory.getLogger(LetterBoxedGame.class);

  private final Board board;
  private final int minWordLength;
  private final Trie sourceTrie;
  private final Map<Character, int[]> letterEdges;
  private final Dictionary dictionary;
  private final Map<Character, List<String>> wordsByInitial;

  public LetterBoxedGame(Dictionary dictionary, Board board) {
    this(dictionary, board, DEFAULT_MIN_WORD_LENGTH);
  }

  public LetterBoxedGame(Dictionary dictionary, Board board, int minWordLength) {
    if (minWordLength < 1) {
      throw new IllegalArgumentException("Minimum word length must be at least 1");
    }
    this.board = board;
    this.minWordLength = minWordLength;
    this.sourceTrie = dictionary.trie();
    this.letterEdges = indexEdges(board);

    SearchState start = SearchState.initial(sourceTrie, board, minWordLength);
    this.dictionary = dictionary.filter(w -> play(w, start).isPresent());

    Map<Character, List<String>> byInitial = new HashMap<>();
    for (String w : this.dictionary) {
      byInitial.computeIfAbsent(w.charAt(0), k -> new ArrayList<>()).add(w);
    }
    byInitial.replaceAll((k, v) -> Collections.unmodifiableList(v));
    this.wordsByInitial = Collections.unmodifiableMap(byInitial);

    log.info(
        "Scaled dictionary from {} to {} entries for board {}.",
        dictionary.size(),
        this.dictionary.size(),
        board);
  }

  public Dictionary dictionary() {
    return dictionary;
  }

  public Board board() {
    return board;
  }

  public int minWordLength() {
    return minWordLength;
  }

  public SearchState initialState() {
    return SearchState.initial(dictionary.trie(), board, minWordLength);
  }

  /** Playable words starting with {@code c}. */
  public List<String> wordsStartingWith(char c) {
    return wordsByInitial.getOrDefault(c, List.of());
  }

  /** Greedy placement of {@code word} as the first word of a fresh board. */
  public Optional<SearchState> tryPlayingOnBoard(String word) {
    return tryPlayingOnBoard(word, initialState());
  }

  /**
   * Lay {@code word} onto the board after {@code start} and finish it.
   *
   * <p>Each letter takes the first edge, in index order, that holds it and differs from the
   * previous edge. Earlier choices are never revisited, so a word that only fits through another
   * copy of a repeated letter is rejected. When {@code start} already holds words, the
   * first letter of {@code word} is the connecting letter and is not placed again.
   *
   * @return the finished state, or empty if the word does not fit
   */
  public Optional<SearchState> tryPlayingOnBoard(String word, SearchState start) {
    return play(word, start);
  }

  /**
   * Whether {@code word} can be laid on an empty board through any combination of edges, trying
   * every dot that carries a repeated letter. Not used by the search.
   */
  public boolean canBePlayed(String word) {
    if (word == null || word.length() < minWordLength) return false;
    String w = word.toLowerCase(Locale.ROOT);
    return canBePlayed(w, 0, SearchState.initial(sourceTrie, board, minWordLength));
  }

  private boolean canBePlayed(String word, int pos, SearchState state) {
    if (pos == word.length()) {
      return state.canFinishWord();
    }
    char c = word.charAt(pos);
    for (int edge : letterEdges.getOrDefault(c, new int[0])) {
      if (state.canPlaceLetter(c, edge) && canBePlayed(word, pos + 1, state.placeLetter(c, edge))) {
        return true;
      }
    }
    return false;
  }

  private Optional<SearchState> play(String word, SearchState start) {
    SearchState state = start;
    int from = start.numWords() > 0 ? 1 : 0;
    for (int i = from; i < word.length(); i++) {
      char c = word.charAt(i);
      int edge = firstFreeEdge(c, state);
      if (edge < 0 || !state.canPlaceLetter(c, edge)) {
        return Optional.empty();
      }
      state = state.placeLetter(c, edge);
    }
    return state.canFinishWord() ? Optional.of(state.finishWord()) : Optional.empty();
  }

  /** Lowest edge index holding {@code c} that differs from the last edge used, or -1. */
  private int firstFreeEdge(char c, SearchState state) {
    int[] edges = letterEdges.get(c);
    if (edges == null) return -1;
    for (int edge : edges) {
      if (state.isValidNextEdge(edge)) return edge;
    }
    return -1;
  }

  private static Map<Character, int[]> indexEdges(Board board) {
    Map<Character, List<Integer>> edges = new HashMap<>();
    for (int i = 0; i < board.numEdges(); i++) {
      for (char c : board.edgeLetters(i)) {
        edges.computeIfAbsent(c, k -> new ArrayList<>()).add(i);
      }
    }
    Map<Character, int[]> out = new HashMap<>();
    edges.forEach((c, list) -> out.put(c, list.stream().mapToInt(Integer::intValue).toArray()));
    return Collections.unmodifiableMap(out);
  }
}
