package com.letterboxed.domain;

import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.PriorityQueue;
import java.util.Random;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Best-first search over {@link SearchState}s, consumed one solution at a time.
 *
 * <p>The queue is ordered by {@link SearchState#PRIORITY}; equal priorities leave the queue in
 * insertion order. Each call to {@link #next()} does just enough work to reach the next final
 * state. A final state is still expanded, on the following call, so longer solutions built on
 * top of it are found too. The solver is not thread-safe.
 *
 * <p>Boards without a solution can still chain words forever, so the search stops after {@code
 * maxExpansions} expanded states. {@link #budgetSpent()} tells that apart from an exhausted queue.
 */
public final class LetterBoxedSolver implements Iterator<SearchState> {
  private static final Comparator<Entry> ORDER =
      Comparator.comparing(Entry::state, SearchState.PRIORITY)
          .thenComparingLong(Entry::sequence);

  private final LetterBoxedGame game;
  private final ExpansionStrategy strategy;
  private final Random random;
  private final long maxExpansions;

  private final PriorityQueue<Entry> queue = new PriorityQueue<>(ORDER);
  private final Set<SearchState> seen = new HashSet<>();

  private long sequence;
  private long expanded;
  private SearchState pendingExpansion;
  private SearchState nextSolution;

  public LetterBoxedSolver(LetterBoxedGame game, Strategy strategy, Random random) {
    this(game, strategy.expansion(), random, Long.MAX_VALUE);
  }

  public LetterBoxedSolver(
      LetterBoxedGame game, Strategy strategy, Random random, long maxExpansions) {
    this(game, strategy.expansion(), random, maxExpansions);
  }

  /**
   * @param maxExpansions number of states the search may expand before it gives up
   * @throws IllegalArgumentException if {@code maxExpansions} is not positive
   */
  public LetterBoxedSolver(
      LetterBoxedGame game, ExpansionStrategy strategy, Random random, long maxExpansions) {
    if (maxExpansions < 1) {
      throw new IllegalArgumentException("Expansion budget must be positive");
    }
    this.game = game;
    this.strategy = strategy;
    this.random = random;
    this.maxExpansions = maxExpansions;
    SearchState initial = game.initialState();
    seen.add(initial);
    enqueue(initial);
  }

  @Override
  public boolean hasNext() {
    if (nextSolution == null) {
      nextSolution = advance();
    }
    return nextSolution != null;
  }

  @Override
  public SearchState next() {
    if (!hasNext()) {
      throw new NoSuchElementException("No more solutions");
    }
    SearchState s = nextSolution;
    nextSolution = null;
    return s;
  }

  /** Lazy stream over the remaining final states. */
  public Stream<SearchState> stream() {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  /** Lazy stream over the remaining solutions. */
  public Stream<Solution> solutions() {
    return stream().map(s -> Solution.of(s, game.board()));
  }

  /** Number of states expanded so far. */
  public long expanded() {
    return expanded;
  }

  /** True once the search stopped because the expansion budget ran out. */
  public boolean budgetSpent() {
    return expanded >= maxExpansions;
  }

  /** Number of states waiting in the queue. */
  public int frontier() {
    return queue.size();
  }

  private SearchState advance() {
    if (pendingExpansion != null && !budgetSpent()) {
      expand(pendingExpansion);
      pendingExpansion = null;
    }
    while (!queue.isEmpty() && !budgetSpent()) {
      SearchState state = queue.poll().state();
      if (state.isFinalState()) {
        pendingExpansion = state;
        return state;
      }
      expand(state);
    }
    return null;
  }

  private void expand(SearchState state) {
    expanded++;
    boolean dedup = strategy.deduplicates();
    for (SearchState child : strategy.children(game, state, random)) {
      if (!dedup || seen.add(child)) {
        enqueue(child);
      }
    }
  }

  private void enqueue(SearchState state) {
    queue.add(new Entry(state, sequence++));
  }

  private record Entry(SearchState state, long sequence) {}
}
