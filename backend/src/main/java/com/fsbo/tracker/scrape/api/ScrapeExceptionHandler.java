package com.fsbo.tracker.scrape.api;

import com.fsbo.tracker.scrape.service.ActiveScrapeRunException;
import com.fsbo.tracker.scrape.service.UnknownSourceException;
import java.io.UncheckedIOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ScrapeExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ScrapeExceptionHandler.class);

  @ExceptionHandler(ActiveScrapeRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveScrapeRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_scrape_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(UnknownSourceException.class)
  public ResponseEntity<Map<String, String>> handleUnknownSource(UnknownSourceException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "unknown_source", "message", ex.getMessage()));
  }

  @ExceptionHandler(UncheckedIOException.class)
  public ResponseEntity<Map<String, String>> handleExportFailure(UncheckedIOException ex) {
    log.error("Export failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", "export_failed", "message", ex.getMessage()));
  }
}
