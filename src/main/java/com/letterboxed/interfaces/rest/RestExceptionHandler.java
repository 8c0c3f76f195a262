package com.letterboxed.interfaces.rest;

import com.letterboxed.dto.ErrorMessage;
import jakarta.validation.ConstraintViolationException;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

/** Maps service exceptions onto {@link ErrorMessage} replies. */
@RestControllerAdvice
public class RestExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

  @ExceptionHandler({
    IllegalArgumentException.class,
    ConstraintViolationException.class,
    HandlerMethodValidationException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<ErrorMessage> badRequest(Exception e) {
    return reply(HttpStatus.BAD_REQUEST, e);
  }

  @ExceptionHandler(NoSuchElementException.class)
  public ResponseEntity<ErrorMessage> notFound(NoSuchElementException e) {
    return reply(HttpStatus.NOT_FOUND, e);
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<ErrorMessage> conflict(IllegalStateException e) {
    return reply(HttpStatus.CONFLICT, e);
  }

  private static ResponseEntity<ErrorMessage> reply(HttpStatus status, Exception e) {
    log.debug("{} -> {}: {}", e.getClass().getSimpleName(), status.value(), e.getMessage());
    return ResponseEntity.status(status).body(ErrorMessage.http(status.value(), e.getMessage()));
  }
}
