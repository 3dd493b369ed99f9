package com.ordergateway.domain.enums;

import com.ordergateway.exception.InvalidOrderException;

/**
 * Buy or sell side of an order. Callers express it as a signed direction
 * (+1 = buy/long, -1 = sell/short); venues receive the lowercase side name.
 */
public enum OrderSide {
    BUY(1, "buy"),
    SELL(-1, "sell");

    private final int direction;
    private final String venueCode;

    OrderSide(int direction, String venueCode) {
        this.direction = direction;
        this.venueCode = venueCode;
    }

    public int getDirection() {
        return direction;
    }

    public String getVenueCode() {
        return venueCode;
    }

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. Used for closing orders. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /**
     * Resolves a signed direction to a side.
     *
     * @throws InvalidOrderException if direction is neither +1 nor -1
     */
    public static OrderSide fromDirection(int direction) {
        return switch (direction) {
            case 1 -> BUY;
            case -1 -> SELL;
            default -> throw new InvalidOrderException("Direction must be +1 or -1, got " + direction);
        };
    }

    /** Maps a venue side string ("buy"/"sell", any case). Returns null for null or unknown values. */
    public static OrderSide fromVenueCode(String venueCode) {
        if (venueCode == null) {
            return null;
        }
        return switch (venueCode.toLowerCase()) {
            case "buy" -> BUY;
            case "sell" -> SELL;
            default -> null;
        };
    }
}
