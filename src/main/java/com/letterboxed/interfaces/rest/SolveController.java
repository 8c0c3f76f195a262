package com.letterboxed.interfaces.rest;

import com.letterboxed.application.SolverService;
import com.letterboxed.dto.SolveResponse;
import com.letterboxed.dto.WordCheckResponse;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
public class SolveController {
  private final SolverService solver;

  public SolveController(SolverService solver) {
    this.solver = solver;
  }

  @GetMapping("/solve")
  public SolveResponse solve(
      @RequestParam @NotBlank String letters,
      @RequestParam(required = false) @Min(1) Integer limit,
      @RequestParam(required = false) String strategy,
      @RequestParam(required = false) @Min(1) Integer minWordLength) {
    return solver.solve(letters, limit, strategy, minWordLength);
  }

  @GetMapping("/check")
  public WordCheckResponse check(
      @RequestParam @NotBlank String letters,
      @RequestParam @NotBlank String word,
      @RequestParam(required = false) @Min(1) Integer minWordLength) {
    return solver.check(letters, word, minWordLength);
  }
}
