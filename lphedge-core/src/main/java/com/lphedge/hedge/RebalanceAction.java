package com.lphedge.hedge;

import java.util.Objects;

/**
 * Outcome of the rebalance rule. {@code quantity} is a positive decimal string for
 * {@link RebalanceDirection#INCREASE} and {@link RebalanceDirection#DECREASE}, and {@code null} for
 * {@link RebalanceDirection#NONE}.
 */
public record RebalanceAction(RebalanceDirection direction, String quantity) {

  private static final RebalanceAction NONE = new RebalanceAction(RebalanceDirection.NONE, null);

  public RebalanceAction {
    Objects.requireNonNull(direction, "direction");
    if (direction == RebalanceDirection.NONE) {
      quantity = null;
    } else if (quantity == null || quantity.isBlank()) {
      throw new IllegalArgumentException("quantity is required for " + direction);
    }
  }

  public static RebalanceAction none() {
    return NONE;
  }

  public static RebalanceAction increase(String quantity) {
    return new RebalanceAction(RebalanceDirection.INCREASE, quantity);
  }

  public static RebalanceAction decrease(String quantity) {
    return new RebalanceAction(RebalanceDirection.DECREASE, quantity);
  }

  public boolean isNone() {
    return direction == RebalanceDirection.NONE;
  }
}
