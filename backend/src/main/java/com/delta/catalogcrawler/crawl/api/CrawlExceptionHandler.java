package com.delta.catalogcrawler.crawl.api;

import com.delta.catalogcrawler.crawl.fetch.CrawlErrorKind;
import com.delta.catalogcrawler.crawl.fetch.CrawlException;
import com.delta.catalogcrawler.crawl.service.ActiveCrawlRunException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CrawlExceptionHandler {

  @ExceptionHandler(ActiveCrawlRunException.class)
  public ResponseEntity<Map<String, Object>> handleActiveRun(ActiveCrawlRunException ex) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "active_crawl_run");
    body.put("activeRunId", ex.activeRunId());
    body.put("message", ex.getMessage());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
  }

  @ExceptionHandler(CrawlException.class)
  public ResponseEntity<Map<String, String>> handleCrawlFailure(CrawlException ex) {
    HttpStatus status =
        ex.kind() == CrawlErrorKind.INITIALIZATION ? HttpStatus.BAD_GATEWAY : HttpStatus.INTERNAL_SERVER_ERROR;
    String error = ex.kind() == CrawlErrorKind.INITIALIZATION ? "initialization_failed" : "crawl_failed";
    return ResponseEntity.status(status)
        .body(Map.of("error", error, "kind", ex.kind().name(), "message", String.valueOf(ex.getMessage())));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleInvalidRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_request", "message", String.valueOf(ex.getMessage())));
  }
}
