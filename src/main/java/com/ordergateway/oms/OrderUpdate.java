package com.ordergateway.oms;

import com.ordergateway.domain.enums.OrderStatus;
import com.ordergateway.domain.model.Order;
import com.ordergateway.domain.model.Trade;
import java.util.List;
import lombok.Value;

/**
 * Result of one mutation of {@link OrderStateStore}: a copy of the order after the mutation,
 * the status it had before, and the trades the mutation recorded.
 *
 * <p>{@code changed} is false when the mutation was a no-op (same state, or refused).
 */
@Value
public class OrderUpdate {

    Order order;
    OrderStatus previousStatus;
    boolean statusChanged;
    boolean changed;
    List<Trade> trades;

    static OrderUpdate unchanged(Order order) {
        return new OrderUpdate(order, order.getStatus(), false, false, List.of());
    }
}
