package com.lphedge.http;

public interface RequestRateLimiter {

  void acquire();

  static RequestRateLimiter noop() {
    return () -> {
    };
  }
}
