package com.letterboxed.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Prefix tree stored as an arena of nodes addressed by integer ids.
 *
 * <p>Node {@link #EMPTY} has no children and is shared by every word end: a word ends at a node
 * when that node maps {@link #END} to {@link #EMPTY}. No other key maps to the empty node. The
 * arena is built once by {@link Builder} and is read-only afterwards, so search states can hold a
 * plain node id instead of a copy of the subtree.
 */
public final class Trie {
  /** Reserved end-of-word key. Never produced by word sanitization. */
  public static final char END = '\0';

  /** Returned by {@link #child} when no such child exists. */
  public static final int NONE = -1;

  public static final int EMPTY = 0;
  public static final int ROOT = 1;

  private final List<Map<Character, Integer>> nodes;

  private Trie(List<Map<Character, Integer>> nodes) {
    this.nodes = nodes;
  }

  /** Child of {@code node} keyed by {@code c}, or {@link #NONE}. */
  public int child(int node, char c) {
    Integer id = nodes.get(node).get(c);
    return id == null ? NONE : id;
  }

  /** Child of {@code node} keyed by {@code c}, or the empty node when there is none. */
  public int childOrEmpty(int node, char c) {
    return nodes.get(node).getOrDefault(c, EMPTY);
  }

  public boolean hasChild(int node, char c) {
    return c != END && nodes.get(node).containsKey(c);
  }

  public boolean isWordEnd(int node) {
    return nodes.get(node).containsKey(END);
  }

  /** Number of nodes in the arena, including the empty node and the root. */
  public int size() {
    return nodes.size();
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private final List<Map<Character, Integer>> nodes = new ArrayList<>();

    private Builder() {
      nodes.add(Map.of());
      nodes.add(new HashMap<>());
    }

    Builder insert(String word) {
      int node = ROOT;
      for (int i = 0; i < word.length(); i++) {
        char c = word.charAt(i);
        if (c == END) {
          throw new IllegalArgumentException("Word contains the reserved end marker");
        }
        Integer next = nodes.get(node).get(c);
        if (next == null) {
          next = nodes.size();
          nodes.add(new HashMap<>());
          nodes.get(node).put(c, next);
        }
        node = next;
      }
      nodes.get(node).put(END, EMPTY);
      return this;
    }

    Trie build() {
      List<Map<Character, Integer>> frozen = new ArrayList<>(nodes.size());
      for (Map<Character, Integer> n : nodes) {
        frozen.add(Collections.unmodifiableMap(n));
      }
      return new Trie(Collections.unmodifiableList(frozen));
    }
  }
}
