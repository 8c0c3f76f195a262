package com.letterboxed.dto;

/** Reply to a request for the next solution of a session. */
public interface SolveReply {
  String type();
}
