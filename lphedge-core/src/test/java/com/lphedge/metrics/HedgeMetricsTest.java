package com.lphedge.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class HedgeMetricsTest {

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final HedgeMetrics metrics = new HedgeMetrics(registry);

  @Test
  void gaugeReportsNaNUntilSet() {
    AtomicReference<Double> ref = metrics.registerAtomicDoubleGauge("lph_test_gauge", "test", Tag.of("symbol", "BNBUSDC"));

    assertThat(registry.get("lph_test_gauge").tag("symbol", "BNBUSDC").gauge().value()).isNaN();
    ref.set(-1.5);
    assertThat(registry.get("lph_test_gauge").gauge().value()).isEqualTo(-1.5);
  }

  @Test
  void countersAreDistinguishedByTags() {
    Counter sell = metrics.createCounter("lph_test_orders", "test", Tag.of("direction", "increase"));
    metrics.createCounter("lph_test_orders", "test", Tag.of("direction", "decrease"));

    sell.increment();

    assertThat(registry.get("lph_test_orders").tag("direction", "increase").counter().count()).isEqualTo(1.0);
    assertThat(registry.get("lph_test_orders").tag("direction", "decrease").counter().count()).isZero();
  }
}
