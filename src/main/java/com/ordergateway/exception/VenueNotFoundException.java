package com.ordergateway.exception;

/** The venue does not know the referenced order or asset. */
public class VenueNotFoundException extends VenueException {

    public VenueNotFoundException(String message) {
        super(message);
    }
}
