package com.ordergateway.api.dto.response;

import com.ordergateway.domain.enums.OrderSide;
import com.ordergateway.domain.enums.OrderStatus;
import com.ordergateway.domain.enums.TimeInForce;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Order as exposed over REST. orderType carries the caller-facing code ("stop-limit"),
 * not the enum name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResponse {

    private String clientOrderId;
    private String venueOrderId;
    private String instrument;
    private int direction;
    private OrderSide side;
    private String orderType;
    private BigDecimal size;
    private BigDecimal limitPrice;
    private BigDecimal stopPrice;
    private TimeInForce timeInForce;
    private OrderStatus status;
    private BigDecimal filledSize;
    private BigDecimal averageFillPrice;
    private BigDecimal takeProfitPrice;
    private BigDecimal stopLossPrice;
    private String parentOrderId;
    private Set<String> relatedOrders;
    private String strategyTag;
    private boolean external;
    private String rejectionReason;
    private Instant placedAt;
    private Instant updatedAt;
}
