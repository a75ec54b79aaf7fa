package com.lphedge.hedge;

import com.lphedge.hedge.error.CollaboratorFailureException;
import com.lphedge.hedge.error.HedgeException;
import com.lphedge.hedge.error.NotificationFailureException;
import com.lphedge.hedge.format.SnapshotMessageFormatter;
import com.lphedge.hedge.port.AmmPositionSource;
import com.lphedge.hedge.port.FuturesOrderSink;
import com.lphedge.hedge.port.FuturesPositionSource;
import com.lphedge.hedge.port.Notifier;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs one hedge cycle: LP sync, LP block read, futures read, snapshot, decision, order, notification.
 * <p>
 * Calls are strictly sequential and the instance keeps no state between cycles. A failure while reading or
 * ordering aborts the cycle before the message is sent. A failed notification comes last, so it is raised as a
 * {@link NotificationFailureException} carrying the completed cycle. Retrying is up to the caller.
 */
@Slf4j
public class LphStrategy {

  static final String AMM_SOURCE = "amm-position-source";
  static final String FUTURES_SOURCE = "futures-position-source";
  static final String ORDER_SINK = "futures-order-sink";
  static final String NOTIFIER = "notifier";

  private final StrategyConfig config;
  private final String label;
  private final AmmPositionSource ammSource;
  private final FuturesPositionSource futuresSource;
  private final FuturesOrderSink orderSink;
  private final Notifier notifier;
  private final SnapshotBuilder snapshotBuilder;
  private final RebalanceDecisionEngine decisionEngine;
  private final SnapshotMessageFormatter formatter;

  public LphStrategy(
      StrategyConfig config,
      String label,
      AmmPositionSource ammSource,
      FuturesPositionSource futuresSource,
      FuturesOrderSink orderSink,
      Notifier notifier,
      SnapshotMessageFormatter formatter
  ) {
    this.config = Objects.requireNonNull(config, "config");
    this.label = label == null ? "" : label;
    this.ammSource = Objects.requireNonNull(ammSource, "ammSource");
    this.futuresSource = Objects.requireNonNull(futuresSource, "futuresSource");
    this.orderSink = Objects.requireNonNull(orderSink, "orderSink");
    this.notifier = Objects.requireNonNull(notifier, "notifier");
    this.formatter = Objects.requireNonNull(formatter, "formatter");
    this.snapshotBuilder = new SnapshotBuilder();
    this.decisionEngine = new RebalanceDecisionEngine();
  }

  public StrategyConfig config() {
    return config;
  }

  /**
   * Reads both venues and returns the merged snapshot without deciding or trading.
   */
  public PositionSnapshot status() {
    call(AMM_SOURCE, () -> {
      ammSource.sync(config.ownerAddress());
      return null;
    });
    Map<BigInteger, AmmPositionRecord> ammPositions = call(AMM_SOURCE, ammSource::positions);
    long blockNumber = call(AMM_SOURCE, ammSource::currentBlock);
    List<FuturesPositionRecord> futuresPositions = call(FUTURES_SOURCE, () -> futuresSource.getPosition(config.symbol()));

    return snapshotBuilder.build(ammPositions, futuresPositions, config, blockNumber);
  }

  /**
   * Places the order for {@code action}, or nothing for {@link RebalanceDirection#NONE}.
   */
  public OrderResult execute(RebalanceAction action) {
    return switch (action.direction()) {
      case NONE -> null;
      case INCREASE -> {
        log.info("lph increase hedge symbol={} quantity={}", config.symbol(), action.quantity());
        yield call(ORDER_SINK, () -> orderSink.openSell(config.symbol(), action.quantity()));
      }
      case DECREASE -> {
        log.info("lph decrease hedge symbol={} quantity={} (reduce-only)", config.symbol(), action.quantity());
        yield call(ORDER_SINK, () -> orderSink.closeSell(config.symbol(), action.quantity()));
      }
    };
  }

  public CycleResult runCycle() {
    PositionSnapshot snapshot = status();
    RebalanceAction action = decisionEngine.decide(snapshot, config);
    log.debug("lph decision symbol={} delta={} ratio={} action={}",
        config.symbol(), snapshot.baseDelta(), snapshot.baseDeltaRatio(), action);

    OrderResult order = execute(action);

    String message = formatter.format(snapshot, label);
    CycleResult result = new CycleResult(snapshot, action, order, message);
    try {
      notifier.push(message);
    } catch (RuntimeException e) {
      throw new NotificationFailureException(NOTIFIER, result, e);
    }
    return result;
  }

  private static <T> T call(String collaborator, Supplier<T> body) {
    try {
      return body.get();
    } catch (HedgeException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new CollaboratorFailureException(collaborator, e);
    }
  }
}
