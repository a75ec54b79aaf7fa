package com.lphedge.events;

import java.time.Instant;

public final class NoopHedgeEventPublisher implements HedgeEventPublisher {

  @Override
  public boolean isEnabled() {
    return false;
  }

  @Override
  public void publish(Instant ts, String type, String key, Object data) {
    // events disabled
  }
}
