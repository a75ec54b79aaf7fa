package com.lphedge.hedge;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Threshold rule for topping up or trimming the futures short.
 * <p>
 * Fires only when {@code ratio > n} and {@code |delta| > m}, both strict. The ratio test is signed: a
 * large negative ratio never fires, however large {@code |delta|} is.
 */
public final class RebalanceDecisionEngine {

  public RebalanceAction decide(PositionSnapshot snapshot, StrategyConfig cfg) {
    return decide(snapshot.baseDeltaRatio(), snapshot.baseDelta(), cfg);
  }

  public RebalanceAction decide(double ratio, double delta, StrategyConfig cfg) {
    double n = cfg.ratioThreshold();
    double m = cfg.deltaThreshold();

    if (!(ratio > n) || !(Math.abs(delta) > m)) {
      return RebalanceAction.none();
    }
    if (delta == 0.0) {
      return RebalanceAction.none();
    }

    String quantity = formatQuantity(roundToStep(Math.abs(delta), m), m);
    return delta > 0
        ? RebalanceAction.increase(quantity)
        : RebalanceAction.decrease(quantity);
  }

  /**
   * Nearest multiple of {@code step}, halves rounded away from zero. A non-positive step returns
   * {@code value} unchanged.
   */
  public static double roundToStep(double value, double step) {
    if (step <= 0) {
      return value;
    }
    double steps = value / step;
    if (!Double.isFinite(steps)) {
      return value;
    }
    double rounded = new BigDecimal(Math.abs(steps)).setScale(0, RoundingMode.HALF_UP).doubleValue();
    return Math.copySign(rounded, steps) * step;
  }

  /**
   * Decimal places implied by the step: none for {@code step >= 1}, otherwise
   * {@code ceil(log10(1 / step))}.
   */
  public static int quantityPrecision(double step) {
    if (step >= 1.0 || step <= 0) {
      return 0;
    }
    return (int) Math.max(0, Math.ceil(Math.log10(1.0 / step)));
  }

  public static String formatQuantity(double quantity, double step) {
    return String.format(Locale.ROOT, "%." + quantityPrecision(step) + "f", quantity);
  }
}
