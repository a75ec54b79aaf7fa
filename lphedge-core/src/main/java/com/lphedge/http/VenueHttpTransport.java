package com.lphedge.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Sends venue requests through the shared rate limiter. GET and HEAD are retried per {@link RetryPolicy};
 * everything else is sent exactly once.
 */
@Slf4j
public final class VenueHttpTransport {

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final RequestRateLimiter rateLimiter;
  private final RetryPolicy retryPolicy;

  public VenueHttpTransport(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      RequestRateLimiter rateLimiter,
      RetryPolicy retryPolicy
  ) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
  }

  public <T> T sendJson(HttpRequest request, Class<T> type) {
    String body = sendString(request, isIdempotent(request.method()));
    try {
      return objectMapper.readValue(body, type);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to decode JSON response from " + VenueHttpException.redact(request.uri()), e);
    }
  }

  public String sendString(HttpRequest request, boolean idempotent) {
    int maxAttempts = (idempotent && retryPolicy.enabled())
        ? Math.max(1, retryPolicy.maxAttempts())
        : 1;

    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      rateLimiter.acquire();
      try {
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
          return response.body();
        }
        if (attempt < maxAttempts && retryPolicy.isRetryableStatus(status)) {
          long delayMillis = retryPolicy.computeDelayMillis(attempt, response.headers().firstValue("retry-after"));
          log.debug("retrying {} {} after status={} attempt={} delayMillis={}",
              request.method(), VenueHttpException.redact(request.uri()), status, attempt, delayMillis);
          pause(jitter(delayMillis), request);
          continue;
        }
        throw new VenueHttpException(request.method(), request.uri(), status, response.body());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("HTTP request interrupted: " + VenueHttpException.redact(request.uri()), e);
      } catch (IOException e) {
        if (attempt < maxAttempts) {
          pause(jitter(retryPolicy.computeDelayMillis(attempt, Optional.empty())), request);
          continue;
        }
        throw new UncheckedIOException("HTTP request failed: " + VenueHttpException.redact(request.uri()), e);
      }
    }

    throw new IllegalStateException("Unreachable");
  }

  private static boolean isIdempotent(String method) {
    return "GET".equalsIgnoreCase(method) || "HEAD".equalsIgnoreCase(method);
  }

  private static long jitter(long delayMillis) {
    if (delayMillis <= 0) {
      return 0;
    }
    return delayMillis + ThreadLocalRandom.current().nextLong(0, Math.min(250, delayMillis + 1));
  }

  private static void pause(long delayMillis, HttpRequest request) {
    if (delayMillis <= 0) {
      return;
    }
    try {
      TimeUnit.MILLISECONDS.sleep(delayMillis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("HTTP retry interrupted: " + VenueHttpException.redact(request.uri()), e);
    }
  }
}
