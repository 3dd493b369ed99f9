package com.ordergateway.exception;

import java.util.Map;

/**
 * Thrown when a cancel arrives for an order the venue has not acknowledged yet.
 * The order becomes cancellable once it has a venue order ID.
 */
public class OrderNotCancellableException extends BaseException {

    public OrderNotCancellableException(String clientOrderId, String reason) {
        super(
                ErrorCode.ORDER_NOT_CANCELLABLE,
                "Order " + clientOrderId + " cannot be cancelled: " + reason,
                Map.of("clientOrderId", clientOrderId));
    }
}
