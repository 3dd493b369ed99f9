package com.ordergateway.exception;

/**
 * Base of the errors a {@link com.ordergateway.venue.VenueClient} implementation may throw.
 *
 * <p>These never reach callers of the gateway directly: the router and services translate
 * them into {@link SubmissionRejectedException}, {@link RoutingException} or
 * {@link UnknownInstrumentException}.
 */
public abstract class VenueException extends RuntimeException {

    protected VenueException(String message) {
        super(message);
    }

    protected VenueException(String message, Throwable cause) {
        super(message, cause);
    }
}
