package com.ordergateway.exception;

/** The request did not complete: I/O failure, venue unavailable, or an unexpected client error. */
public class VenueTransportException extends VenueException {

    public VenueTransportException(String message) {
        super(message);
    }

    public VenueTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
