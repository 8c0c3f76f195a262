package com.letterboxed.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.letterboxed.infrastructure.TextWordListSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.springframework.core.io.FileSystemResource;

/**
 * Known boards solved against a full English word list such as dwyl {@code words_alpha.txt} or
 * ENABLE. The list is read from {@code $LETTERBOXED_WORD_LIST}, falling back to {@code
 * /usr/share/dict/words}; the tests are skipped when neither exists.
 */
class StandardWordListTest {
  private static Dictionary dictionary;

  @BeforeAll
  static void loadWordList() {
    String configured = System.getenv("LETTERBOXED_WORD_LIST");
    Path path =
        Path.of(configured == null || configured.isBlank() ? "/usr/share/dict/words" : configured);
    if (Files.isReadable(path)) {
      dictionary = Dictionary.build(new TextWordListSource(new FileSystemResource(path)).loadWords());
    }
  }

  @ParameterizedTest
  @MethodSource("com.letterboxed.domain.LetterBoxedSolverTest#knownBoards")
  @Timeout(120)
  void wordStrategyFindsKnownSolutionAmongFirstTen(String letters, List<String> expected) {
    assumeTrue(dictionary != null, "no standard word list available");
    LetterBoxedGame game = new LetterBoxedGame(dictionary, Board.of(letters));
    LetterBoxedSolver solver = new LetterBoxedSolver(game, Strategy.WORD, new Random(0), 1_000_000);

    List<List<String>> first = solver.stream().limit(10).map(SearchState::words).toList();

    assertThat(first).contains(expected);
  }
}
