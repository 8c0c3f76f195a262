package com.letterboxed.dto;

import com.letterboxed.domain.Solution;
import java.util.List;

public record SolutionMessage(
    String type,
    int index,
    List<String> words,
    String display,
    int numWords,
    int numLetters,
    int duplicateLetters) implements SolveReply {

  public static SolutionMessage of(int index, Solution s) {
    return new SolutionMessage(
        "solution", index, s.words(), s.display(), s.numWords(), s.numLetters(), s.duplicateLetters());
  }
}
