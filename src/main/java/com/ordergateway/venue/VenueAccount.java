package com.ordergateway.venue;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class VenueAccount {

    BigDecimal equity;
    BigDecimal cash;
    BigDecimal portfolioValue;
    BigDecimal buyingPower;
    String currency;
}
