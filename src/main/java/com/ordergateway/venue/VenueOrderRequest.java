package com.ordergateway.venue;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Order submission in venue vocabulary: lowercase side/type/time-in-force codes,
 * always-positive quantity, and the client order ID for the venue to echo back.
 */
@Value
@Builder
public class VenueOrderRequest {

    public static final String ORDER_CLASS_SIMPLE = "simple";
    public static final String ORDER_CLASS_BRACKET = "bracket";

    String clientOrderId;
    String symbol;
    BigDecimal qty;

    /** "buy" or "sell". */
    String side;

    /** "market", "limit" or "stop_limit". */
    String type;

    String timeInForce;
    BigDecimal limitPrice;
    BigDecimal stopPrice;

    @Builder.Default
    String orderClass = ORDER_CLASS_SIMPLE;

    /** Bracket take-profit leg limit price. */
    BigDecimal takeProfitLimitPrice;

    /** Bracket stop-loss leg stop price. */
    BigDecimal stopLossStopPrice;
}
