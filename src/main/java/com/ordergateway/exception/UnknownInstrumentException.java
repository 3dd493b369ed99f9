package com.ordergateway.exception;

import java.util.Map;

/** The venue reports that the instrument does not exist. */
public class UnknownInstrumentException extends BaseException {

    public UnknownInstrumentException(String instrument) {
        super(ErrorCode.UNKNOWN_INSTRUMENT, "Unknown instrument: " + instrument, Map.of("instrument", instrument));
    }
}
