package com.lphedge.events;

import java.time.Instant;

public interface HedgeEventPublisher {

  boolean isEnabled();

  void publish(Instant ts, String type, String key, Object data);

  default void publish(String type, String key, Object data) {
    publish(null, type, key, data);
  }
}
