package com.ordergateway.venue;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * An order as reported by the venue. Any field may be null when the venue omits it.
 * Codes (side, type, status, timeInForce) are the venue's lowercase strings.
 */
@Value
@Builder
public class VenueOrder {

    String id;
    String clientOrderId;
    String symbol;
    String side;
    String type;
    BigDecimal qty;
    BigDecimal filledQty;
    BigDecimal filledAvgPrice;
    BigDecimal limitPrice;
    BigDecimal stopPrice;
    String timeInForce;
    String status;
    String orderClass;

    /** Venue ID of the bracket parent, for bracket legs. */
    String parentOrderId;

    Instant submittedAt;
    Instant filledAt;
    Instant updatedAt;
}
