package com.ordergateway.exception;

import java.util.HashMap;
import java.util.Map;

/**
 * Transport failure or timeout talking to the venue.
 *
 * <p>When raised from order placement, the order is left SUBMITTED without a venue ID:
 * the venue may or may not have it, and the next reconciliation pass settles which.
 * Callers must not retry with a new client order ID.
 */
public class RoutingException extends BaseException {

    public RoutingException(String message, Throwable cause) {
        super(ErrorCode.ROUTING_ERROR, message, Map.of(), cause);
    }

    public RoutingException(String clientOrderId, String message, Throwable cause) {
        super(ErrorCode.ROUTING_ERROR, message, details(clientOrderId), cause);
    }

    private static Map<String, Object> details(String clientOrderId) {
        Map<String, Object> details = new HashMap<>();
        details.put("clientOrderId", clientOrderId);
        return details;
    }
}
