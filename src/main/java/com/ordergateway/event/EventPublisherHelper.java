package com.ordergateway.event;

import com.ordergateway.domain.enums.OrderStatus;
import com.ordergateway.domain.model.Order;
import com.ordergateway.domain.model.ReconciliationResult;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for the gateway's events.
 *
 * <p>Delivery is synchronous on the publishing thread unless a listener is {@code @Async}.
 * Publishers must not hold the order state lock while publishing.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Order ----

    public void publishOrderSubmitted(Object source, Order order) {
        applicationEventPublisher.publishEvent(
                new OrderEvent(source, order, OrderEventType.SUBMITTED, OrderStatus.PENDING));
    }

    public void publishOrderUnconfirmed(Object source, Order order) {
        applicationEventPublisher.publishEvent(
                new OrderEvent(source, order, OrderEventType.UNCONFIRMED, OrderStatus.PENDING));
    }

    public void publishOrderRejected(Object source, Order order, OrderStatus previousStatus) {
        applicationEventPublisher.publishEvent(
                new OrderEvent(source, order, OrderEventType.REJECTED, previousStatus));
    }

    public void publishOrderCancelled(Object source, Order order, OrderStatus previousStatus) {
        applicationEventPublisher.publishEvent(
                new OrderEvent(source, order, OrderEventType.CANCELLED, previousStatus));
    }

    public void publishDuplicateSuppressed(Object source, Order order) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.DUPLICATE_SUPPRESSED));
    }

    public void publishExternalDetected(Object source, Order order) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.EXTERNAL_DETECTED));
    }

    /**
     * Publishes the event matching a status change observed during reconciliation.
     * Changes that land on SUBMITTED (a PENDING order seen at the venue) publish SUBMITTED.
     */
    public void publishStatusChange(Object source, Order order, OrderStatus previousStatus) {
        OrderEventType eventType =
                switch (order.getStatus()) {
                    case PARTIALLY_FILLED -> OrderEventType.PARTIALLY_FILLED;
                    case FILLED -> OrderEventType.FILLED;
                    case CANCELLED -> OrderEventType.CANCELLED;
                    case REJECTED -> OrderEventType.REJECTED;
                    case PENDING, SUBMITTED -> OrderEventType.SUBMITTED;
                };
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, eventType, previousStatus));
    }

    // ---- Reconciliation ----

    public void publishReconciliation(Object source, ReconciliationResult result, boolean manual) {
        applicationEventPublisher.publishEvent(new ReconciliationEvent(source, result, manual));
    }
}
