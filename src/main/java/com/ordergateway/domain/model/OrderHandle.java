package com.ordergateway.domain.model;

import com.ordergateway.domain.enums.OrderStatus;
import lombok.Value;

/**
 * Caller-facing receipt for a place or cancel request.
 *
 * <p>{@code replayed} is true when the request carried a client order ID that was already
 * known, in which case nothing was sent to the venue.
 */
@Value
public class OrderHandle {

    String clientOrderId;
    String venueOrderId;
    OrderStatus status;
    boolean replayed;

    public static OrderHandle of(Order order) {
        return new OrderHandle(order.getClientOrderId(), order.getVenueOrderId(), order.getStatus(), false);
    }

    public static OrderHandle replayed(Order order) {
        return new OrderHandle(order.getClientOrderId(), order.getVenueOrderId(), order.getStatus(), true);
    }
}
