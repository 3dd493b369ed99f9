package com.ordergateway.domain.enums;

/** Which venue account figure {@code getBalance()} reports. */
public enum BalanceSource {
    EQUITY,
    CASH,
    BUYING_POWER
}
