package com.letterboxed.application;

import com.letterboxed.application.port.WordSource;
import com.letterboxed.domain.Board;
import com.letterboxed.domain.Dictionary;
import com.letterboxed.domain.LetterBoxedGame;
import com.letterboxed.domain.LetterBoxedSolver;
import com.letterboxed.domain.Solution;
import com.letterboxed.domain.Strategy;
import com.letterboxed.dto.SolutionMessage;
import com.letterboxed.dto.SolveResponse;
import com.letterboxed.dto.WordCheckResponse;
import jakarta.annotation.PostConstruct;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Owns the base dictionary and turns board specifications into games and solvers.
 *
 * <p>The dictionary is loaded once from the configured {@link WordSource} at startup and shared
 * read-only by every game. Each solver gets its own {@link Random}: seeded with {@code
 * letterboxed.random-seed} so repeated solves of one board agree, or a {@link SecureRandom} when
 * {@code letterboxed.randomize} is set.
 */
@Service
public class SolverService {
  private static final Logger log = LoggerFactory.getLogger(SolverService.class);

  private final WordSource source;
  private final int defaultMinWordLength;
  private final int numEdges;
  private final Strategy defaultStrategy;
  private final long seed;
  private final boolean randomize;
  private final int defaultLimit;
  private final int maxLimit;
  private final long maxExpansions;

  private volatile Dictionary dictionary;

  public SolverService(
      WordSource source,
      @Value("${letterboxed.min-word-length:3}") int defaultMinWordLength,
      @Value("${letterboxed.num-edges:4}") int numEdges,
      @Value("${letterboxed.strategy:word}") String defaultStrategy,
      @Value("${letterboxed.random-seed:0}") long seed,
      @Value("${letterboxed.randomize:false}") boolean randomize,
      @Value("${letterboxed.max-solutions:10}") int defaultLimit,
      @Value("${letterboxed.max-solutions-cap:50}") int maxLimit,
      @Value("${letterboxed.max-expansions:100000}") long maxExpansions) {
    this.source = source;
    this.defaultMinWordLength = defaultMinWordLength;
    this.numEdges = numEdges;
    this.defaultStrategy = Strategy.parse(defaultStrategy);
    this.seed = seed;
    this.randomize = randomize;
    this.defaultLimit = defaultLimit;
    this.maxLimit = maxLimit;
    this.maxExpansions = maxExpansions;
  }

  /** Build the base dictionary from the word source. */
  @PostConstruct
  public void load() {
    long t0 = System.nanoTime();
    List<String> words = source.loadWords();
    dictionary = Dictionary.build(words);
    long ms = (System.nanoTime() - t0) / 1_000_000;
    log.info(
        "Dictionary ready: {} words, {} trie nodes from {} ({} ms).",
        dictionary.size(),
        dictionary.trie().size(),
        source.describe(),
        ms);
  }

  public Dictionary dictionary() {
    if (dictionary == null) {
      throw new IllegalStateException("Dictionary not loaded");
    }
    return dictionary;
  }

  /**
   * Build a game for the given board.
   *
   * @param letters board letters, read clockwise from the top-left corner
   * @param minWordLength minimum word length, or null for the configured default
   * @throws IllegalArgumentException if the board or word length is invalid
   */
  public LetterBoxedGame newGame(String letters, Integer minWordLength) {
    Board board = Board.of(letters, numEdges);
    int min = minWordLength == null ? defaultMinWordLength : minWordLength;
    return new LetterBoxedGame(dictionary(), board, min);
  }

  /** Solver for {@code game}, bounded by {@code letterboxed.max-expansions} expanded states. */
  public LetterBoxedSolver newSolver(LetterBoxedGame game, Strategy strategy) {
    return new LetterBoxedSolver(game, strategy, newRandom(), maxExpansions);
  }

  /** Strategy by name, or the configured default when {@code name} is blank. */
  public Strategy strategy(String name) {
    return name == null || name.isBlank() ? defaultStrategy : Strategy.parse(name);
  }

  /**
   * Solve a board and return its first solutions.
   *
   * @param letters board letters
   * @param limit number of solutions wanted, or null for the default; capped at the configured
   *     maximum
   * @param strategy strategy name, or null for the default
   * @param minWordLength minimum word length, or null for the default
   * @throws IllegalArgumentException on invalid board, strategy, limit or word length
   */
  public SolveResponse solve(String letters, Integer limit, String strategy, Integer minWordLength) {
    int n = limit == null ? defaultLimit : limit;
    if (n < 1) {
      throw new IllegalArgumentException("Limit must be positive");
    }
    n = Math.min(n, maxLimit);
    Strategy s = strategy(strategy);
    LetterBoxedGame game = newGame(letters, minWordLength);

    long t0 = System.nanoTime();
    LetterBoxedSolver solver = newSolver(game, s);
    List<Solution> solutions = solver.solutions().limit(n).toList();
    List<SolutionMessage> messages = new ArrayList<>(solutions.size());
    for (int i = 0; i < solutions.size(); i++) {
      messages.add(SolutionMessage.of(i + 1, solutions.get(i)));
    }
    long ms = (System.nanoTime() - t0) / 1_000_000;
    log.debug(
        "Board {} ({}): {} solutions, {} states expanded, {} queued ({} ms)",
        game.board(),
        s,
        solutions.size(),
        solver.expanded(),
        solver.frontier(),
        ms);
    if (solver.budgetSpent()) {
      log.info(
          "Board {} ({}): search stopped after {} expansions with {} solutions",
          game.board(),
          s,
          solver.expanded(),
          solutions.size());
    }

    return new SolveResponse(
        game.board().edges(), s.name().toLowerCase(Locale.ROOT), game.dictionary().size(), messages);
  }

  /**
   * Report how a word relates to a board.
   *
   * @throws IllegalArgumentException if the board is invalid or the word is blank
   */
  public WordCheckResponse check(String letters, String word, Integer minWordLength) {
    if (word == null || word.isBlank()) {
      throw new IllegalArgumentException("Word is required");
    }
    LetterBoxedGame game = newGame(letters, minWordLength);
    String w = word.trim().toLowerCase(Locale.ROOT);
    return new WordCheckResponse(
        w,
        dictionary().contains(w),
        game.tryPlayingOnBoard(w).isPresent(),
        game.canBePlayed(w));
  }

  public int defaultMinWordLength() {
    return defaultMinWordLength;
  }

  public int numEdges() {
    return numEdges;
  }

  public Strategy defaultStrategy() {
    return defaultStrategy;
  }

  public int defaultLimit() {
    return defaultLimit;
  }

  public int maxLimit() {
    return maxLimit;
  }

  public long maxExpansions() {
    return maxExpansions;
  }

  public String sourceDescription() {
    return source.describe();
  }

  private Random newRandom() {
    return randomize ? new SecureRandom() : new Random(seed);
  }
}
