package com.joinwatch.tracker.monitor.api;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class MonitorExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(MonitorExceptionHandler.class);

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<Map<String, String>> handleStoreUnavailable(DataAccessException ex) {
    log.warn("Request failed on store access", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "store_unavailable", "message", String.valueOf(ex.getMostSpecificCause().getMessage())));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadInput(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_request", "message", String.valueOf(ex.getMessage())));
  }
}
