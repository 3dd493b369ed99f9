package com.ordergateway.domain.enums;

import com.ordergateway.exception.UnsupportedOrderTypeException;

/**
 * Venue-neutral order type.
 * CLOSE flattens the position on the side given by the order's direction and is sent
 * to the venue as a market order on the opposite side.
 */
public enum OrderType {
    MARKET("market"),
    LIMIT("limit"),
    STOP_LIMIT("stop-limit"),
    CLOSE("close");

    private final String code;

    OrderType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Parses a caller-supplied order type code. Accepts "stop_limit" as an alias of "stop-limit".
     *
     * @throws UnsupportedOrderTypeException for null or unrecognised codes
     */
    public static OrderType fromCode(String code) {
        if (code == null) {
            throw new UnsupportedOrderTypeException(null);
        }
        return switch (code.trim().toLowerCase()) {
            case "market" -> MARKET;
            case "limit" -> LIMIT;
            case "stop-limit", "stop_limit" -> STOP_LIMIT;
            case "close" -> CLOSE;
            default -> throw new UnsupportedOrderTypeException(code);
        };
    }
}
