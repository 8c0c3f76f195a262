package com.letterboxed.domain;

import java.util.concurrent.locks.ReentrantLock;

/**
 * One client's interactive solve: a game, its solver and how many solutions were handed out.
 *
 * <p>The solver is not thread-safe; callers hold {@link #lock()} while pulling from it.
 */
public class SolveSession {
  private final String id;
  private final LetterBoxedGame game;
  private final Strategy strategy;
  private final LetterBoxedSolver solver;
  private final ReentrantLock lock = new ReentrantLock();

  private int delivered;

  public SolveSession(String id, LetterBoxedGame game, Strategy strategy, LetterBoxedSolver solver) {
    this.id = id;
    this.game = game;
    this.strategy = strategy;
    this.solver = solver;
  }

  public String id() {
    return id;
  }

  public LetterBoxedGame game() {
    return game;
  }

  public Strategy strategy() {
    return strategy;
  }

  public LetterBoxedSolver solver() {
    return solver;
  }

  public ReentrantLock lock() {
    return lock;
  }

  public int delivered() {
    return delivered;
  }

  /** Record one more solution handed out and return its 1-based index. */
  public int markDelivered() {
    return ++delivered;
  }
}
