package com.lphedge.strategy;

import com.lphedge.config.HedgeProperties;
import com.lphedge.events.HedgeEventPublisher;
import com.lphedge.events.HedgeEventTypes;
import com.lphedge.hedge.CycleResult;
import com.lphedge.hedge.LphStrategy;
import com.lphedge.hedge.OrderResult;
import com.lphedge.hedge.PositionSnapshot;
import com.lphedge.hedge.RebalanceAction;
import com.lphedge.hedge.error.HedgeException;
import com.lphedge.hedge.error.NotificationFailureException;
import com.lphedge.strategy.metrics.StrategyMetricsService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Polls the hedge strategy on a single thread. A failed cycle is logged and counted; the next one runs
 * after the usual delay. Absent when {@code lph.strategy.enabled=false}.
 */
@Component
@ConditionalOnProperty(prefix = "lph.strategy", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
@RequiredArgsConstructor
public class LphStrategyRunner {

  private final @NonNull HedgeProperties properties;
  private final @NonNull LphStrategy strategy;
  private final @NonNull StrategyMetricsService metrics;
  private final @NonNull HedgeEventPublisher events;
  private final @NonNull Clock clock;

  private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
    Thread t = new Thread(r, "lph-strategy");
    t.setDaemon(true);
    return t;
  });

  private final AtomicLong cycles = new AtomicLong();
  private final AtomicLong failures = new AtomicLong();

  private volatile Instant lastCycleAt;
  private volatile PositionSnapshot lastSnapshot;
  private volatile RebalanceAction lastAction;
  private volatile OrderResult lastOrder;
  private volatile String lastError;

  @PostConstruct
  void start() {
    HedgeProperties.Strategy cfg = properties.strategy();
    long periodMs = cfg.pollIntervalMillis();
    executor.scheduleWithFixedDelay(this::runOnce, 0, periodMs, TimeUnit.MILLISECONDS);
    log.info("lph strategy started (mode={}, symbol={}, pollIntervalMillis={})",
        properties.mode(), cfg.symbol(), periodMs);
  }

  @PreDestroy
  void shutdown() {
    executor.shutdownNow();
  }

  /**
   * Runs one cycle and records its outcome. Returns {@code null} when the cycle failed. When only the
   * notification failed, the snapshot and any placed order are still recorded before the failure.
   */
  public CycleResult runOnce() {
    Instant startedAt = Instant.now(clock);
    lastCycleAt = startedAt;
    CycleResult result;
    try {
      result = strategy.runCycle();
    } catch (NotificationFailureException e) {
      recordOutcome(startedAt, e.completedCycle());
      onFailure(startedAt, e);
      return null;
    } catch (RuntimeException e) {
      onFailure(startedAt, e);
      return null;
    }

    cycles.incrementAndGet();
    lastError = null;
    metrics.recordCycle();
    recordOutcome(startedAt, result);

    PositionSnapshot s = result.snapshot();
    log.info("lph cycle block={} delta={} ratio={} action={}", s.blockNumber(), s.baseDelta(),
        s.baseDeltaRatio(), result.action().direction());
    return result;
  }

  public RunnerStatus status() {
    return new RunnerStatus(
        true,
        lastCycleAt == null ? 0L : lastCycleAt.toEpochMilli(),
        cycles.get(),
        failures.get(),
        lastSnapshot,
        lastAction,
        lastOrder,
        lastError
    );
  }

  private void recordOutcome(Instant startedAt, CycleResult result) {
    lastSnapshot = result.snapshot();
    lastAction = result.action();
    metrics.recordSnapshot(result.snapshot());
    publishSnapshot(startedAt, result);
    if (result.order() != null) {
      lastOrder = result.order();
      metrics.recordOrder(result.action().direction());
      publishOrder(startedAt, result);
    }
  }

  private void onFailure(Instant startedAt, RuntimeException e) {
    long n = failures.incrementAndGet();
    String kind = e instanceof HedgeException he ? he.kind().name() : e.getClass().getSimpleName();
    lastError = kind + ": " + e.getMessage();
    metrics.recordFailure();
    log.warn("lph cycle failed (failures={}): {}", n, lastError, e);

    if (events.isEnabled()) {
      Map<String, Object> data = new LinkedHashMap<>();
      data.put("symbol", strategy.config().symbol());
      data.put("kind", kind);
      data.put("message", e.getMessage());
      events.publish(startedAt, HedgeEventTypes.STRATEGY_LPH_CYCLE_FAILED, strategy.config().symbol(), data);
    }
  }

  private void publishSnapshot(Instant ts, CycleResult result) {
    if (!events.isEnabled()) {
      return;
    }
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("snapshot", result.snapshot());
    data.put("action", result.action());
    events.publish(ts, HedgeEventTypes.STRATEGY_LPH_SNAPSHOT, result.snapshot().symbol(), data);
  }

  private void publishOrder(Instant ts, CycleResult result) {
    if (!events.isEnabled()) {
      return;
    }
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("mode", properties.mode().name());
    data.put("action", result.action());
    data.put("order", result.order());
    events.publish(ts, HedgeEventTypes.STRATEGY_LPH_ORDER, result.snapshot().symbol(), data);
  }

  public record RunnerStatus(
      boolean enabled,
      long lastCycleEpochMillis,
      long cycles,
      long failures,
      PositionSnapshot lastSnapshot,
      RebalanceAction lastAction,
      OrderResult lastOrder,
      String lastError
  ) {
    public static RunnerStatus disabled() {
      return new RunnerStatus(false, 0L, 0L, 0L, null, null, null, null);
    }
  }
}
