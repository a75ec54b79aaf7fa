package com.lphedge.strategy.web;

import com.lphedge.hedge.error.HedgeException;
import com.lphedge.http.VenueHttpException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class StrategyExceptionHandler {

  @ExceptionHandler(VenueHttpException.class)
  public ResponseEntity<UpstreamHttpErrorResponse> handle(VenueHttpException e) {
    log.warn("upstream error: status={} method={} url={}", e.statusCode(), e.method(), e.redactedUri());
    return ResponseEntity.status(e.statusCode())
        .body(new UpstreamHttpErrorResponse(e.statusCode(), e.method(), e.redactedUri(), e.responseSnippet()));
  }

  @ExceptionHandler(HedgeException.class)
  public ResponseEntity<HedgeErrorResponse> handle(HedgeException e) {
    log.warn("hedge error: kind={} message={}", e.kind(), e.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(new HedgeErrorResponse(e.kind().name(), e.getMessage()));
  }

  public record UpstreamHttpErrorResponse(int status, String method, String url, String bodySnippet) {
  }

  public record HedgeErrorResponse(String kind, String message) {
  }
}
