package com.lphedge.hedge;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Exchange acknowledgement of a hedge order.
 *
 * @param raw venue response body, {@code null} for paper orders
 */
public record OrderResult(
    String orderId,
    String symbol,
    String side,
    String status,
    String price,
    String quantity,
    boolean reduceOnly,
    JsonNode raw
) {
}
