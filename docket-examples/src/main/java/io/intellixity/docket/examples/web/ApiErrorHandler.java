package io.intellixity.docket.examples.web;

import io.intellixity.docket.exec.PreconditionViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public final class ApiErrorHandler {

  @ExceptionHandler(PreconditionViolationException.class)
  public ResponseEntity<Map<String, String>> precondition(PreconditionViolationException e) {
    return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
  }

  @ExceptionHandler({IllegalArgumentException.class, UnsupportedOperationException.class})
  public ResponseEntity<Map<String, String>> badRequest(RuntimeException e) {
    return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
  }
}
