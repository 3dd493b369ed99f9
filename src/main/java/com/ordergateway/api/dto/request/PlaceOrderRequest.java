package com.ordergateway.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for placing an order.
 *
 * <p>orderType is one of market, limit, stop-limit (or stop_limit), close. A close order may
 * omit size to flatten the whole position on the side given by direction.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceOrderRequest {

    /** Idempotency key. Generated when absent. */
    @Size(max = 128, message = "Client order ID must be 128 characters or less")
    private String clientOrderId;

    @NotBlank(message = "Instrument is required")
    private String instrument;

    /** +1 buy/long, -1 sell/short. */
    @NotNull(message = "Direction is required")
    @Min(value = -1, message = "Direction must be +1 or -1")
    @Max(value = 1, message = "Direction must be +1 or -1")
    private Integer direction;

    @Positive(message = "Size must be positive")
    private BigDecimal size;

    @NotBlank(message = "Order type is required")
    private String orderType;

    @Positive(message = "Limit price must be positive")
    private BigDecimal limitPrice;

    @Positive(message = "Stop price must be positive")
    private BigDecimal stopPrice;

    /** day, gtc, ioc, fok, opg or cls. Defaults to day. */
    private String timeInForce;

    @Positive(message = "Take-profit price must be positive")
    private BigDecimal takeProfitPrice;

    @Positive(message = "Stop-loss price must be positive")
    private BigDecimal stopLossPrice;

    @Size(max = 64, message = "Strategy tag must be 64 characters or less")
    private String strategyTag;
}
