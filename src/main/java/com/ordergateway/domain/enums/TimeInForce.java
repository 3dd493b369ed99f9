package com.ordergateway.domain.enums;

import com.ordergateway.exception.InvalidOrderException;

/** Order validity. Venue codes follow the common lowercase vocabulary (day, gtc, ioc, ...). */
public enum TimeInForce {
    DAY("day"),
    GTC("gtc"),
    IOC("ioc"),
    FOK("fok"),
    OPG("opg"),
    CLS("cls");

    private final String venueCode;

    TimeInForce(String venueCode) {
        this.venueCode = venueCode;
    }

    public String getVenueCode() {
        return venueCode;
    }

    /** Parses a caller or venue code. Null means DAY. */
    public static TimeInForce fromCode(String code) {
        if (code == null || code.isBlank()) {
            return DAY;
        }
        for (TimeInForce timeInForce : values()) {
            if (timeInForce.venueCode.equalsIgnoreCase(code.trim())) {
                return timeInForce;
            }
        }
        throw new InvalidOrderException("Unsupported time in force: " + code);
    }
}
