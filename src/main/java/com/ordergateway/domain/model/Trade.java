package com.ordergateway.domain.model;

import com.ordergateway.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * One observed fill increment of an order. Created by reconciliation when the venue reports
 * a larger filled size than we last saw, never modified afterwards.
 *
 * <p>unrealizedPnl is not stored: read paths attach it with {@link #withUnrealizedPnl}
 * from the instrument's current mark, and leave it null when no mark is known.
 */
@Value
@Builder
public class Trade {

    String id;

    /** Client order ID of the originating order. */
    String orderId;

    String instrument;
    OrderSide side;
    BigDecimal size;
    BigDecimal fillPrice;
    Instant filledAt;

    @With
    BigDecimal unrealizedPnl;

    String strategyTag;

    public int getDirection() {
        return side != null ? side.getDirection() : 0;
    }
}
