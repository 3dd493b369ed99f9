package com.ordergateway.exception;

/** The venue understood the request and declined it. */
public class VenueRejectedException extends VenueException {

    public VenueRejectedException(String message) {
        super(message);
    }

    public VenueRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
