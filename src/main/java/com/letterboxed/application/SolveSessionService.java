package com.letterboxed.application;

import com.letterboxed.domain.LetterBoxedGame;
import com.letterboxed.domain.SearchState;
import com.letterboxed.domain.Solution;
import com.letterboxed.domain.SolveSession;
import com.letterboxed.domain.Strategy;
import com.letterboxed.dto.ExhaustedMessage;
import com.letterboxed.dto.SessionStartedMessage;
import com.letterboxed.dto.SolutionMessage;
import com.letterboxed.dto.SolveReply;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Interactive solving: a client opens a session for a board and pulls solutions one at a time.
 *
 * <p>Responsibilities:
 * - Open a session per WebSocket session id, replacing any previous one
 * - Hand out the next solution on request, or report exhaustion
 * - Drop sessions on exit or disconnect
 *
 * <p>Sessions live in memory. Each pull is guarded by the session's {@link
 * java.util.concurrent.locks.ReentrantLock} because solvers are not thread-safe.
 */
@Service
public class SolveSessionService {
  private final Logger log = LoggerFactory.getLogger(getClass());

  private final Map<String, SolveSession> sessions = new ConcurrentHashMap<>();

  private final SolverService solver;
  private final int maxSessions;

  public SolveSessionService(
      SolverService solver, @Value("${letterboxed.max-sessions:100}") int maxSessions) {
    this.solver = solver;
    this.maxSessions = maxSessions;
  }

  /**
   * Open a solve session for {@code sid}. An existing session of the same client is replaced.
   *
   * @param sid WebSocket session id
   * @param letters board letters
   * @param minWordLength minimum word length, or null for the default
   * @param strategy strategy name, or null for the default
   * @return message describing the board that will be solved
   * @throws IllegalArgumentException if the board, strategy or word length is invalid
   * @throws IllegalStateException if the session limit is reached
   */
  public SessionStartedMessage start(String sid, String letters, Integer minWordLength, String strategy) {
    Strategy s = solver.strategy(strategy);
    LetterBoxedGame game = solver.newGame(letters, minWordLength);

    SolveSession session = new SolveSession(sid, game, s, solver.newSolver(game, s));
    synchronized (sessions) {
      sessions.remove(sid);
      if (sessions.size() >= maxSessions) {
        throw new IllegalStateException("Too many open solve sessions");
      }
      sessions.put(sid, session);
    }
    log.info("Session {} solving {} with {} strategy", sid, game.board(), s);
    return new SessionStartedMessage(
        game.board().edges(),
        s.name().toLowerCase(Locale.ROOT),
        game.minWordLength(),
        game.dictionary().size());
  }

  /**
   * Pull the next solution of the caller's session.
   *
   * @param sid WebSocket session id
   * @return a {@link SolutionMessage}, or an {@link ExhaustedMessage} once the search is over
   * @throws NoSuchElementException if the caller has no open session
   */
  public SolveReply next(String sid) {
    SolveSession session = getSession(sid);
    session.lock().lock();
    try {
      if (!session.solver().hasNext()) {
        log.info(
            "Session {} ({} strategy) exhausted after {} solutions{}",
            session.id(),
            session.strategy(),
            session.delivered(),
            session.solver().budgetSpent()
                ? ", expansion budget of " + solver.maxExpansions() + " spent"
                : "");
        return new ExhaustedMessage(session.delivered());
      }
      SearchState state = session.solver().next();
      int index = session.markDelivered();
      return SolutionMessage.of(index, Solution.of(state, session.game().board()));
    } finally {
      session.lock().unlock();
    }
  }

  /**
   * Close the session of {@code sid}, if any.
   *
   * @param sid WebSocket session id
   */
  public void end(String sid) {
    SolveSession removed = sessions.remove(sid);
    if (removed != null) {
      log.info("Session {} closed after {} solutions", sid, removed.delivered());
    }
  }

  public int openSessions() {
    return sessions.size();
  }

  private SolveSession getSession(String sid) {
    SolveSession s = sessions.get(sid);
    if (s == null) throw new NoSuchElementException("No solve session; send a board first");
    return s;
  }
}
