package com.wxradar.api.api;

import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Centralized REST exception mapping for the lookup API.
 *
 * <p>Known domain and backend exceptions are converted into stable JSON error payloads.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(BadRequestException.class)
  public ResponseEntity<Map<String, Object>> handleBadRequest(BadRequestException ex) {
    return ResponseEntity.badRequest().body(errorBody("bad_request", ex.getMessage()));
  }

  @ExceptionHandler(ForbiddenException.class)
  public ResponseEntity<Map<String, Object>> handleForbidden(ForbiddenException ex) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(errorBody("forbidden", ex.getMessage()));
  }

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorBody("not_found", ex.getMessage()));
  }

  @ExceptionHandler(UnprocessableEntityException.class)
  public ResponseEntity<Map<String, Object>> handleUnprocessable(UnprocessableEntityException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(errorBody("unprocessable_entity", ex.getMessage()));
  }

  /**
   * Unmatched routes are outside the API surface and answer 403 like any other foreign path.
   *
   * @param ex Spring MVC no-resource/no-handler exception
   * @return standardized forbidden payload
   */
  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<Map<String, Object>> handleMissingRoute(Exception ex) {
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(errorBody("forbidden", "path not served"));
  }

  /**
   * Maps storage failures to HTTP 500.
   *
   * @param ex backend data access failure
   * @return standardized error payload
   */
  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<Map<String, Object>> handleDataAccess(DataAccessException ex) {
    log.error("Storage read failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(errorBody("storage_unavailable", "weather storage unavailable"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
    log.error("Unhandled request failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(errorBody("internal_error", "internal server error"));
  }

  /**
   * Builds the error payload shared by handlers and servlet filters.
   *
   * @param code stable machine-readable error code
   * @param message human-readable description
   * @return {@code error}, {@code message} and {@code timestamp} entries
   */
  public static Map<String, Object> errorBody(String code, String message) {
    return Map.of(
        "error", code,
        "message", message,
        "timestamp", Instant.now().toString());
  }
}
