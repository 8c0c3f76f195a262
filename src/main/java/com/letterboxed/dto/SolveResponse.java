package com.letterboxed.dto;

import java.util.List;

public record SolveResponse(
    List<String> edges, String strategy, int playableWords, List<SolutionMessage> solutions) {}
