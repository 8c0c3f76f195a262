package com.letterboxed.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * The square of dots, split into edges.
 *
 * <p>Letters are read clockwise from the top-left corner: the top edge left to right, then the
 * right, bottom and left edges. Edge {@code i} is the {@code i}-th contiguous group of the input,
 * so only the grouping matters to the solver. A letter may sit on more than one dot.
 */
public final class Board {
  public static final int DEFAULT_EDGES = 4;

  private final String letters;
  private final List<String> edges;
  private final List<Set<Character>> edgeSets;

  private Board(String letters, List<String> edges) {
    this.letters = letters;
    this.edges = edges;
    List<Set<Character>> sets = new ArrayList<>(edges.size());
    for (String edge : edges) {
      Set<Character> s = new LinkedHashSet<>();
      for (char c : edge.toCharArray()) s.add(c);
      sets.add(Collections.unmodifiableSet(s));
    }
    this.edgeSets = Collections.unmodifiableList(sets);
  }

  public static Board of(String letters) {
    return of(letters, DEFAULT_EDGES);
  }

  /**
   * Partition {@code letters} into {@code numEdges} equal contiguous edges.
   *
   * @throws IllegalArgumentException if the letters are blank, contain non-letters, or their
   *     count is not a multiple of {@code numEdges}
   */
  public static Board of(String letters, int numEdges) {
    if (numEdges <= 0) {
      throw new IllegalArgumentException("Number of edges must be positive");
    }
    if (letters == null || letters.isBlank()) {
      throw new IllegalArgumentException("Board letters are required");
    }
    String norm = letters.trim().toLowerCase(Locale.ROOT);
    for (int i = 0; i < norm.length(); i++) {
      if (!Character.isLetter(norm.charAt(i))) {
        throw new IllegalArgumentException("Board may only contain letters: " + letters);
      }
    }
    if (norm.length() % numEdges != 0) {
      throw new IllegalArgumentException(
          "Board has " + norm.length() + " letters, not divisible into " + numEdges + " edges");
    }
    int perEdge = norm.length() / numEdges;
    List<String> edges = new ArrayList<>(numEdges);
    for (int i = 0; i < numEdges; i++) {
      edges.add(norm.substring(i * perEdge, (i + 1) * perEdge));
    }
    return new Board(norm, Collections.unmodifiableList(edges));
  }

  public int numDots() {
    return letters.length();
  }

  public int numEdges() {
    return edges.size();
  }

  public Set<Character> edgeLetters(int index) {
    return edgeSets.get(index);
  }

  public List<String> edges() {
    return edges;
  }

  public String allLetters() {
    return letters;
  }

  @Override
  public String toString() {
    return String.join("-", edges).toUpperCase(Locale.ROOT);
  }
}
