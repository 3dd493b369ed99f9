package com.ordergateway.venue;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Tradability metadata. minTradeIncrement is only meaningful for fractionable assets and may be null. */
@Value
@Builder
public class VenueAsset {

    String symbol;
    boolean tradable;
    boolean fractionable;
    BigDecimal minTradeIncrement;
}
