package com.ordergateway.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Venue account figures. buyingPower and currency are null when the venue omits them. */
@Value
@Builder
public class AccountSummary {

    BigDecimal equity;
    BigDecimal cash;
    BigDecimal portfolioValue;
    BigDecimal buyingPower;
    String currency;
}
