package com.letterboxed.interfaces.ws;

import static org.assertj.core.api.Assertions.assertThat;

import com.letterboxed.application.SolveSessionService;
import com.letterboxed.application.SolverService;
import com.letterboxed.dto.ErrorMessage;
import com.letterboxed.dto.SolutionMessage;
import com.letterboxed.dto.StartSolveRequest;
import com.letterboxed.infrastructure.TextWordListSource;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class SolveWsControllerTest {
  private SolveSessionService sessions;
  private SolveWsController controller;

  @BeforeEach
  void setUp() {
    SolverService solver =
        new SolverService(
            new TextWordListSource(new ClassPathResource("word_list.txt")),
            3, 4, "word", 0L, false, 10, 50, 100_000L);
    solver.load();
    sessions = new SolveSessionService(solver, 10);
    controller = new SolveWsController(sessions);
  }

  @Test
  void playsAnInteractiveSession() {
    controller.solve(new StartSolveRequest("GIYERCPOLAHX", null, "word"), "sid-1");

    SolutionMessage first = (SolutionMessage) controller.next("sid-1");
    assertThat(first.display()).isEqualTo("LEXICOGRAPHY");
    assertThat(first.numWords()).isEqualTo(1);

    controller.exit("sid-1");
    assertThat(sessions.openSessions()).isZero();
  }

  @Test
  void errorsBecomeErrorReplies() {
    ErrorMessage m = controller.onError(new NoSuchElementException("No solve session; send a board first"));
    assertThat(m.type()).isEqualTo("error");
    assertThat(m.message()).contains("No solve session");
    assertThat(m.status()).isNull();
  }
}
