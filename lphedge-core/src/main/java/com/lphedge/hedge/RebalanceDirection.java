package com.lphedge.hedge;

public enum RebalanceDirection {
  /** Nothing to do this cycle. */
  NONE,
  /** LP base exposure grew: sell more futures. */
  INCREASE,
  /** LP base exposure shrank: buy back part of the short, reduce-only. */
  DECREASE,
}
