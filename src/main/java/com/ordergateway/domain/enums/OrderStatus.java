package com.ordergateway.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of an order.
 *
 * <p>PENDING is our internal pre-submission state: the order is recorded and the venue call
 * is in flight. SUBMITTED covers every venue-side working state (new, accepted, held, ...).
 * FILLED, CANCELLED and REJECTED are terminal; a terminal order never changes again.
 *
 * <p>PENDING may jump straight to any later state because a reconciliation pass can observe
 * the venue's view of an order before the submitting thread has recorded the venue's reply.
 */
public enum OrderStatus {
    PENDING,
    SUBMITTED,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED;
    }

    /** Whether a transition from this status to {@code next} is legal. Same-status is not a transition. */
    public boolean canTransitionTo(OrderStatus next) {
        return next != null && next != this && allowedTargets().contains(next);
    }

    private Set<OrderStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(SUBMITTED, PARTIALLY_FILLED, FILLED, CANCELLED, REJECTED);
            case SUBMITTED -> EnumSet.of(PARTIALLY_FILLED, FILLED, CANCELLED, REJECTED);
            case PARTIALLY_FILLED -> EnumSet.of(FILLED, CANCELLED);
            case FILLED, CANCELLED, REJECTED -> EnumSet.noneOf(OrderStatus.class);
        };
    }
}
