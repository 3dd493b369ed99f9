package com.ordergateway.domain.enums;

/** Status filter for venue order listings. */
public enum VenueOrderQuery {
    OPEN,
    CLOSED,
    ALL
}
