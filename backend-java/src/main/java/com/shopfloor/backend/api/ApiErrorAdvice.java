package com.shopfloor.backend.api;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.shopfloor.backend.service.InspectionValidationException;

/** Maps failures to {@code {"detail": ...}} bodies. */
@RestControllerAdvice
public class ApiErrorAdvice {
  private static final Logger logger = LoggerFactory.getLogger(ApiErrorAdvice.class);

  @ExceptionHandler(ApiNotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleNotFound(ApiNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("detail", ex.getMessage() == null ? "not found" : ex.getMessage()));
  }

  @ExceptionHandler(InspectionValidationException.class)
  public ResponseEntity<Map<String, Object>> handleIncomplete(InspectionValidationException ex) {
    return ResponseEntity.badRequest()
        .body(Map.of("detail", "please fill in all required fields", "errors", ex.getErrors()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> handleInvalid(MethodArgumentNotValidException ex) {
    List<String> errors = ex.getBindingResult().getFieldErrors().stream()
        .map(e -> e.getField() + " " + e.getDefaultMessage())
        .toList();
    return ResponseEntity.badRequest()
        .body(Map.of("detail", "invalid request", "errors", errors));
  }

  @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
    return ResponseEntity.badRequest()
        .body(Map.of("detail", ex.getMessage() == null ? "bad request" : ex.getMessage()));
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<Map<String, Object>> handleStorage(DataAccessException ex) {
    logger.warn("Storage failure: {}", ex.getMessage(), ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("detail", "could not save, try again"));
  }
}
