package com.lphedge.http;

import java.util.Optional;

/**
 * Backoff for idempotent venue calls. Order placement is never retried.
 */
public record RetryPolicy(
    boolean enabled,
    int maxAttempts,
    long initialBackoffMillis,
    long maxBackoffMillis
) {

  public static RetryPolicy disabled() {
    return new RetryPolicy(false, 1, 0, 0);
  }

  public boolean isRetryableStatus(int statusCode) {
    // 418 is Binance's IP ban after ignoring 429s; retrying only extends the ban
    if (statusCode == 429 || statusCode == 408) {
      return true;
    }
    return statusCode >= 500 && statusCode <= 599;
  }

  public long computeDelayMillis(int attempt, Optional<String> retryAfterHeader) {
    if (retryAfterHeader != null && retryAfterHeader.isPresent()) {
      Long seconds = parseRetryAfterSeconds(retryAfterHeader.get());
      if (seconds != null && seconds > 0) {
        return seconds * 1000L;
      }
    }
    long base = Math.max(0, initialBackoffMillis);
    long max = Math.max(base, maxBackoffMillis);
    long delay = base;
    for (int i = 1; i < attempt; i++) {
      delay = Math.min(max, delay * 2);
    }
    return delay;
  }

  private static Long parseRetryAfterSeconds(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException notSeconds) {
      // HTTP-date form; fall back to exponential backoff
      return null;
    }
  }
}
