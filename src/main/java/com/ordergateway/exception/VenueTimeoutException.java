package com.ordergateway.exception;

public class VenueTimeoutException extends VenueTransportException {

    public VenueTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
