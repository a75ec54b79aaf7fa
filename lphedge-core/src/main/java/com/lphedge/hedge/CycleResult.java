package com.lphedge.hedge;

/**
 * Everything one completed cycle produced.
 *
 * @param order   exchange acknowledgement, {@code null} when the action was {@link RebalanceDirection#NONE}
 * @param message status text handed to the notifier
 */
public record CycleResult(
    PositionSnapshot snapshot,
    RebalanceAction action,
    OrderResult order,
    String message
) {
}
