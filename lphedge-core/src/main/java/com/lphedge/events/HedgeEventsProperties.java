package com.lphedge.events;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "lph.events")
public record HedgeEventsProperties(
    @NotNull Boolean enabled,
    String topic
) {
  public HedgeEventsProperties {
    if (enabled == null) {
      enabled = false;
    }
    if (topic == null || topic.isBlank()) {
      topic = "lphedge.events";
    }
  }
}
