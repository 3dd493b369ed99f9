package com.ordergateway.exception;

import java.util.Collections;

public class UnsupportedOrderTypeException extends BaseException {

    public UnsupportedOrderTypeException(String orderType) {
        super(
                ErrorCode.UNSUPPORTED_ORDER_TYPE,
                "Order type not supported: " + orderType,
                Collections.singletonMap("orderType", orderType));
    }
}
