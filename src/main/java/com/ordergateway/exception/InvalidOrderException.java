package com.ordergateway.exception;

/** Local validation failure. Always raised before anything is sent to the venue. */
public class InvalidOrderException extends BaseException {

    public InvalidOrderException(String message) {
        super(ErrorCode.INVALID_ORDER, message);
    }
}
