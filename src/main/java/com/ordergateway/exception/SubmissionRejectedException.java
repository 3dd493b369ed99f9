package com.ordergateway.exception;

import java.util.Map;

/** The venue declined a submission or cancellation. */
public class SubmissionRejectedException extends BaseException {

    public SubmissionRejectedException(String clientOrderId, String message, Throwable cause) {
        super(ErrorCode.SUBMISSION_REJECTED, message, Map.of("clientOrderId", clientOrderId), cause);
    }
}
