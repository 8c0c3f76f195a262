package com.letterboxed.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Immutable set of lower-case words together with the {@link Trie} built from them.
 *
 * <p>Words are normalized with {@link Locale#ROOT}. Empty and null entries are ignored. The
 * receiver of {@link #filter} is never modified; a new dictionary and trie are built instead.
 */
public final class Dictionary implements Iterable<String> {
  private final Set<String> words;
  private final Trie trie;

  private Dictionary(Set<String> words, Trie trie) {
    this.words = words;
    this.trie = trie;
  }

  /**
   * Build a dictionary over the given words.
   *
   * @param words raw words, any case
   * @return dictionary with one trie path per distinct lower-cased word
   */
  public static Dictionary build(Collection<String> words) {
    Set<String> set = new TreeSet<>();
    for (String w : words) {
      if (w != null && !w.isEmpty()) set.add(w.toLowerCase(Locale.ROOT));
    }
    Trie.Builder builder = Trie.builder();
    set.forEach(builder::insert);
    return new Dictionary(Collections.unmodifiableSet(set), builder.build());
  }

  public boolean contains(String word) {
    return word != null && words.contains(word.toLowerCase(Locale.ROOT));
  }

  /** New dictionary over the words that satisfy {@code predicate}. */
  public Dictionary filter(Predicate<String> predicate) {
    return build(words.stream().filter(predicate).toList());
  }

  public int size() {
    return words.size();
  }

  public Trie trie() {
    return trie;
  }

  public Set<String> words() {
    return words;
  }

  /** Iterates the words in an order callers must not rely on. */
  @Override
  public Iterator<String> iterator() {
    return words.iterator();
  }
}
