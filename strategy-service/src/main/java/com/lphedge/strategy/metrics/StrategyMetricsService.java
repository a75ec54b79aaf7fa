package com.lphedge.strategy.metrics;

import com.lphedge.hedge.PositionSnapshot;
import com.lphedge.hedge.RebalanceDirection;
import com.lphedge.metrics.HedgeMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Tag;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Hedge gauges and counters for strategy-service.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StrategyMetricsService {

  private final HedgeMetrics metrics;

  // Snapshot gauges
  private AtomicReference<Double> baseDelta;
  private AtomicReference<Double> baseDeltaRatio;
  private AtomicReference<Double> ammBaseAmount;
  private AtomicReference<Double> futuresPosition;
  private AtomicReference<Double> totalValueUsdt;
  private AtomicReference<Double> collectableValueUsdt;
  private AtomicReference<Double> lastBlockNumber;

  // Cycle counters
  private Counter cycles;
  private Counter failures;
  private Counter increaseOrders;
  private Counter decreaseOrders;

  @PostConstruct
  public void initializeMetrics() {
    baseDelta = metrics.registerAtomicDoubleGauge(
        "lph_base_delta", "Net base exposure: LP base amount plus futures position");
    baseDeltaRatio = metrics.registerAtomicDoubleGauge(
        "lph_base_delta_ratio", "Net base exposure normalised by the larger leg");
    ammBaseAmount = metrics.registerAtomicDoubleGauge(
        "lph_amm_base_amount", "Withdrawable base amount in the LP position");
    futuresPosition = metrics.registerAtomicDoubleGauge(
        "lph_futures_position", "Signed futures position in base units (negative = short)");
    totalValueUsdt = metrics.registerAtomicDoubleGauge(
        "lph_total_value_usdt", "LP value plus futures unrealized PnL in USDT");
    collectableValueUsdt = metrics.registerAtomicDoubleGauge(
        "lph_collectable_value_usdt", "Uncollected LP fees in USDT");
    lastBlockNumber = metrics.registerAtomicDoubleGauge(
        "lph_snapshot_block", "Block number of the last snapshot");

    cycles = metrics.createCounter("lph_cycles_total", "Completed hedge cycles");
    failures = metrics.createCounter("lph_cycle_failures_total", "Failed hedge cycles");
    increaseOrders = metrics.createCounter("lph_orders_total", "Hedge orders placed",
        Tag.of("direction", "increase"));
    decreaseOrders = metrics.createCounter("lph_orders_total", "Hedge orders placed",
        Tag.of("direction", "decrease"));
    log.info("lph metrics initialized");
  }

  public void recordSnapshot(PositionSnapshot s) {
    baseDelta.set(s.baseDelta());
    baseDeltaRatio.set(s.baseDeltaRatio());
    ammBaseAmount.set(s.ammBaseAmount());
    futuresPosition.set(s.futuresPosition());
    totalValueUsdt.set(s.totalValueUsdt());
    collectableValueUsdt.set(s.ammCollectableValueUsdt());
    lastBlockNumber.set((double) s.blockNumber());
  }

  public void recordCycle() {
    cycles.increment();
  }

  public void recordFailure() {
    failures.increment();
  }

  public void recordOrder(RebalanceDirection direction) {
    if (direction == RebalanceDirection.INCREASE) {
      increaseOrders.increment();
    } else if (direction == RebalanceDirection.DECREASE) {
      decreaseOrders.increment();
    }
  }
}
