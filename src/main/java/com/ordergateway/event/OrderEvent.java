package com.ordergateway.event;

import com.ordergateway.domain.enums.OrderStatus;
import com.ordergateway.domain.model.Order;
import org.springframework.context.ApplicationEvent;

/**
 * Published when an order changes state, whether through place/cancel or a reconciliation merge.
 *
 * <p>The order is a copy taken when the change was applied; listeners may keep it.
 */
public class OrderEvent extends ApplicationEvent {

    private final Order order;
    private final OrderEventType eventType;
    private final OrderStatus previousStatus;

    /**
     * @param source         the component publishing this event
     * @param order          snapshot of the order after the change
     * @param eventType      what kind of change occurred
     * @param previousStatus the status before the change, null when there was none
     */
    public OrderEvent(Object source, Order order, OrderEventType eventType, OrderStatus previousStatus) {
        super(source);
        this.order = order;
        this.eventType = eventType;
        this.previousStatus = previousStatus;
    }

    public OrderEvent(Object source, Order order, OrderEventType eventType) {
        this(source, order, eventType, null);
    }

    public Order getOrder() {
        return order;
    }

    public OrderEventType getEventType() {
        return eventType;
    }

    public OrderStatus getPreviousStatus() {
        return previousStatus;
    }
}
