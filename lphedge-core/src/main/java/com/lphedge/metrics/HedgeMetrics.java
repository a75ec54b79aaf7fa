package com.lphedge.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Thin helper over the Micrometer registry for lphedge services.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HedgeMetrics {

  private final MeterRegistry registry;

  /**
   * Register a gauge backed by a mutable double. NaN is reported until the first value is set.
   */
  public AtomicReference<Double> registerAtomicDoubleGauge(String name, String description, Tag... tags) {
    AtomicReference<Double> ref = new AtomicReference<>(Double.NaN);
    Gauge.builder(name, ref, r -> {
          Double value = r.get();
          return value != null ? value : Double.NaN;
        })
        .description(description)
        .tags(List.of(tags))
        .register(registry);
    log.debug("Registered gauge: {} with description: {}", name, description);
    return ref;
  }

  public Counter createCounter(String name, String description, Tag... tags) {
    Counter counter = Counter.builder(name)
        .description(description)
        .tags(List.of(tags))
        .register(registry);
    log.debug("Created counter: {} with description: {}", name, description);
    return counter;
  }
}
