package com.ordergateway.venue;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** A venue position. qty is signed (negative for short); side is "long" or "short" when reported. */
@Value
@Builder
public class VenuePosition {

    String symbol;
    BigDecimal qty;
    String side;
    BigDecimal avgEntryPrice;
    BigDecimal currentPrice;
    BigDecimal marketValue;
    BigDecimal unrealizedPl;
}
