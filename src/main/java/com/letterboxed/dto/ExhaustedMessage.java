package com.letterboxed.dto;

public record ExhaustedMessage(String type, int delivered) implements SolveReply {
  public ExhaustedMessage(int delivered) {
    this("exhausted", delivered);
  }
}
