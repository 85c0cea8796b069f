package com.delta.listener.signal.api;

import com.delta.listener.signal.keywords.DuplicateKeywordException;
import com.delta.listener.signal.keywords.KeywordNotFoundException;
import com.delta.listener.signal.service.ActiveScanRunException;
import com.delta.listener.signal.service.AuthorNotFoundException;
import com.delta.listener.signal.service.DiscoveryNotFoundException;
import com.delta.listener.signal.service.ScanRunNotFoundException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ListenerExceptionHandler {

  @ExceptionHandler(ActiveScanRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveScanRunException ex) {
    return error(HttpStatus.CONFLICT, "active_scan_run", ex.getMessage());
  }

  @ExceptionHandler(DuplicateKeywordException.class)
  public ResponseEntity<Map<String, String>> handleDuplicateKeyword(DuplicateKeywordException ex) {
    return error(HttpStatus.CONFLICT, "duplicate_keyword", ex.getMessage());
  }

  @ExceptionHandler({
      DiscoveryNotFoundException.class,
      KeywordNotFoundException.class,
      ScanRunNotFoundException.class,
      AuthorNotFoundException.class
  })
  public ResponseEntity<Map<String, String>> handleNotFound(RuntimeException ex) {
    return error(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
  }

  @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
  public ResponseEntity<Map<String, String>> handleBadRequest(RuntimeException ex) {
    return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
  }

  private static ResponseEntity<Map<String, String>> error(HttpStatus status, String code, String message) {
    return ResponseEntity.status(status)
        .body(Map.of("error", code, "message", message == null ? code : message));
  }
}
