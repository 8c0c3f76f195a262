package com.letterboxed.dto;

import java.util.List;

public record SessionStartedMessage(
    String type, List<String> edges, String strategy, int minWordLength, int playableWords) {
  public SessionStartedMessage(List<String> edges, String strategy, int minWordLength, int playableWords) {
    this("session_started", edges, strategy, minWordLength, playableWords);
  }
}
