package com.ordergateway.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    INVALID_ORDER("INVALID_ORDER", 400),
    UNSUPPORTED_ORDER_TYPE("UNSUPPORTED_ORDER_TYPE", 400),
    NOT_FOUND("NOT_FOUND", 404),
    UNKNOWN_INSTRUMENT("UNKNOWN_INSTRUMENT", 404),
    ORDER_NOT_CANCELLABLE("ORDER_NOT_CANCELLABLE", 409),
    SUBMISSION_REJECTED("SUBMISSION_REJECTED", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    ROUTING_ERROR("ROUTING_ERROR", 502);

    private final String code;
    private final int httpStatus;
}
