package com.letterboxed.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a partially played board.
 *
 * <p>Transitions return new states; the receiver stays valid and may be shared by other branches
 * of the search. All states of a game point into the same read-only {@link Trie}.
 *
 * <p>Two states are equal when their edge history, letter history and word in progress are
 * equal. The completed words are implied by those three.
 */
public final class SearchState {
  /** Lower is explored first: fewer words, then fewer unused dots, then fewer letters. */
  public static final Comparator<SearchState> PRIORITY =
      Comparator.comparingInt(SearchState::numWords)
          .thenComparingInt(SearchState::numUnusedDots)
          .thenComparingInt(SearchState::numLetters);

  private final Trie trie;
  private final Board board;
  private final int minWordLength;

  private final int node;
  private final List<String> words;
  private final String wordInProgress;
  private final String letters;
  private final int[] edges;
  private final int distinctLetters;

  private SearchState(
      Trie trie,
      Board board,
      int minWordLength,
      int node,
      List<String> words,
      String wordInProgress,
      String letters,
      int[] edges) {
    this.trie = trie;
    this.board = board;
    this.minWordLength = minWordLength;
    this.node = node;
    this.words = words;
    this.wordInProgress = wordInProgress;
    this.letters = letters;
    this.edges = edges;
    this.distinctLetters = (int) letters.chars().distinct().count();
  }

  /** Empty state positioned at the trie root. */
  public static SearchState initial(Trie trie, Board board, int minWordLength) {
    return new SearchState(
        trie, board, minWordLength, Trie.ROOT, List.of(), "", "", new int[0]);
  }

  public boolean isValidNextEdge(int edgeIndex) {
    return edges.length == 0 || edges[edges.length - 1] != edgeIndex;
  }

  public boolean canPlaceLetter(char letter, int edgeIndex) {
    return trie.hasChild(node, letter) && isValidNextEdge(edgeIndex);
  }

  /**
   * Place {@code letter} from edge {@code edgeIndex}.
   *
   * @throws IllegalStateException if {@link #canPlaceLetter} does not hold
   */
  public SearchState placeLetter(char letter, int edgeIndex) {
    if (!canPlaceLetter(letter, edgeIndex)) {
      throw new IllegalStateException(
          "Cannot place '" + letter + "' from edge " + edgeIndex + " after \"" + wordInProgress + "\"");
    }
    int[] nextEdges = Arrays.copyOf(edges, edges.length + 1);
    nextEdges[edges.length] = edgeIndex;
    return new SearchState(
        trie,
        board,
        minWordLength,
        trie.child(node, letter),
        words,
        wordInProgress + letter,
        letters + letter,
        nextEdges);
  }

  public boolean canFinishWord() {
    return wordInProgress.length() >= minWordLength && trie.isWordEnd(node);
  }

  /**
   * Complete the word in progress. The next word is seeded with its last letter.
   *
   * @throws IllegalStateException if {@link #canFinishWord} does not hold
   */
  public SearchState finishWord() {
    if (!canFinishWord()) {
      throw new IllegalStateException("\"" + wordInProgress + "\" is not a playable word here");
    }
    List<String> nextWords = new ArrayList<>(words.size() + 1);
    nextWords.addAll(words);
    nextWords.add(wordInProgress);
    char connect = letters.charAt(letters.length() - 1);
    return new SearchState(
        trie,
        board,
        minWordLength,
        trie.childOrEmpty(Trie.ROOT, connect),
        Collections.unmodifiableList(nextWords),
        String.valueOf(connect),
        letters,
        edges);
  }

  /**
   * Dots not yet covered, counted by distinct letter values. Undercounts on boards that repeat a
   * letter on several dots.
   */
  public int numUnusedDots() {
    return board.numDots() - distinctLetters;
  }

  /** True when no word is half-built and every dot is used. Search continues past it. */
  public boolean isFinalState() {
    return wordInProgress.length() < 2 && numUnusedDots() == 0;
  }

  public int numWords() {
    return words.size();
  }

  public int numLetters() {
    return letters.length();
  }

  public List<String> words() {
    return words;
  }

  public String wordInProgress() {
    return wordInProgress;
  }

  public String letters() {
    return letters;
  }

  public int[] edgeSequence() {
    return edges.clone();
  }

  public int lastEdge() {
    return edges.length == 0 ? -1 : edges[edges.length - 1];
  }

  int node() {
    return node;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SearchState other)) return false;
    return Arrays.equals(edges, other.edges)
        && letters.equals(other.letters)
        && wordInProgress.equals(other.wordInProgress);
  }

  @Override
  public int hashCode() {
    return Objects.hash(Arrays.hashCode(edges), letters, wordInProgress);
  }

  @Override
  public String toString() {
    return "SearchState{words="
        + words
        + ", inProgress='"
        + wordInProgress
        + "', letters='"
        + letters
        + "', edges="
        + Arrays.toString(edges)
        + "}";
  }
}
