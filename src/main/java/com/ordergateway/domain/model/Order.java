package com.ordergateway.domain.model;

import com.ordergateway.domain.enums.OrderSide;
import com.ordergateway.domain.enums.OrderStatus;
import com.ordergateway.domain.enums.OrderType;
import com.ordergateway.domain.enums.TimeInForce;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.Builder;
import lombok.Data;

/**
 * A venue-neutral order tracked for the lifetime of the session.
 *
 * <p>The clientOrderId is the idempotency key: it is assigned once (by the caller or the
 * router) and never changes. The venueOrderId is assigned exactly once, when the venue
 * acknowledges the order or when reconciliation finds it at the venue.
 *
 * <p>Instances held by {@link com.ordergateway.oms.OrderStateStore} are never handed out;
 * readers always receive a {@link #copy()}.
 */
@Data
@Builder(toBuilder = true)
public class Order {

    private String clientOrderId;

    /** Venue-assigned ID. Null until the venue acknowledges the order. */
    private String venueOrderId;

    private String instrument;
    private OrderSide side;
    private OrderType type;

    /** Requested size, rounded to the instrument's precision before submission. */
    private BigDecimal size;

    /** Required for LIMIT and STOP_LIMIT. */
    private BigDecimal limitPrice;

    /** Required for STOP_LIMIT. */
    private BigDecimal stopPrice;

    @Builder.Default
    private TimeInForce timeInForce = TimeInForce.DAY;

    private OrderStatus status;

    @Builder.Default
    private BigDecimal filledSize = BigDecimal.ZERO;

    /** Volume-weighted average price across all fills. Null until the first fill. */
    private BigDecimal averageFillPrice;

    /** Bracket take-profit limit price. */
    private BigDecimal takeProfitPrice;

    /** Bracket stop-loss stop price. */
    private BigDecimal stopLossPrice;

    /** Client order ID of the bracket parent, for legs created by the venue. */
    private String parentOrderId;

    /** Client order IDs of OCO/bracket siblings. */
    @Builder.Default
    private Set<String> relatedOrders = new LinkedHashSet<>();

    /** Opaque caller tag, preserved across reconciliation. */
    private String strategyTag;

    /** True for shadows of orders placed at the venue outside this gateway. */
    private boolean external;

    private String rejectionReason;

    private Instant placedAt;
    private Instant updatedAt;

    /** Signed direction: +1 buy, -1 sell, 0 when the side is unknown. */
    public int getDirection() {
        return side != null ? side.getDirection() : 0;
    }

    /** Deep enough copy for handing out: the related-order set is not shared. */
    public Order copy() {
        return toBuilder()
                .relatedOrders(relatedOrders != null ? new LinkedHashSet<>(relatedOrders) : new LinkedHashSet<>())
                .build();
    }
}
