package com.letterboxed.dto;

/**
 * Error reply shared by the REST and STOMP interfaces.
 *
 * @param status HTTP status for REST replies, null on STOMP
 */
public record ErrorMessage(String type, String message, Integer status) {
  public ErrorMessage(String message) {
    this("error", message, null);
  }

  public static ErrorMessage http(int status, String message) {
    return new ErrorMessage("error", message, status);
  }
}
