package com.lphedge.events;

public final class HedgeEventTypes {

  private HedgeEventTypes() {
  }

  public static final String STRATEGY_LPH_SNAPSHOT = "strategy.lph.snapshot";
  public static final String STRATEGY_LPH_ORDER = "strategy.lph.order";
  public static final String STRATEGY_LPH_CYCLE_FAILED = "strategy.lph.cycle_failed";
}
