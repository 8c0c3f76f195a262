package com.letterboxed.interfaces.rest;

import com.letterboxed.application.SolverService;
import java.util.Locale;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ConfigController {
  private final SolverService solver;

  public ConfigController(SolverService solver) {
    this.solver = solver;
  }

  @GetMapping("/config")
  public Map<String, Object> config() {
    return Map.of(
        "minWordLength", solver.defaultMinWordLength(),
        "numEdges", solver.numEdges(),
        "strategy", solver.defaultStrategy().name().toLowerCase(Locale.ROOT),
        "maxSolutions", solver.defaultLimit(),
        "maxSolutionsCap", solver.maxLimit(),
        "maxExpansions", solver.maxExpansions(),
        "dictionarySize", solver.dictionary().size(),
        "wordSource", solver.sourceDescription(),
        "protocolVersion", 1);
  }
}
