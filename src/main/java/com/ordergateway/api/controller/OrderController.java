package com.ordergateway.api.controller;

import com.ordergateway.api.dto.request.PlaceOrderRequest;
import com.ordergateway.api.dto.response.OrderResponse;
import com.ordergateway.domain.enums.OrderSide;
import com.ordergateway.domain.enums.OrderType;
import com.ordergateway.domain.enums.TimeInForce;
import com.ordergateway.domain.model.Order;
import com.ordergateway.domain.model.OrderHandle;
import com.ordergateway.mapper.OrderResponseMapper;
import com.ordergateway.service.BrokerService;
import jakarta.validation.Valid;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for order placement, lookup and cancellation.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/orders -- place an order (201, or 200 when the client order ID was already known)</li>
 *   <li>GET /api/orders?instrument=&amp;openOnly= -- list session orders</li>
 *   <li>GET /api/orders/{clientOrderId} -- one order</li>
 *   <li>DELETE /api/orders/{clientOrderId} -- cancel; a no-op for terminal orders</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/orders")
public class OrderController {

    private static final Logger log = LoggerFactory.getLogger(OrderController.class);

    private final BrokerService brokerService;
    private final OrderResponseMapper orderResponseMapper = Mappers.getMapper(OrderResponseMapper.class);

    public OrderController(BrokerService brokerService) {
        this.brokerService = brokerService;
    }

    @PostMapping
    public ResponseEntity<OrderHandle> placeOrder(@Valid @RequestBody PlaceOrderRequest request) {
        log.info(
                "Order placement: {} {} {} x{} clientOrderId={}",
                request.getDirection(),
                request.getOrderType(),
                request.getInstrument(),
                request.getSize(),
                request.getClientOrderId());

        OrderHandle handle = brokerService.placeOrder(toOrder(request));
        return ResponseEntity.status(handle.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED)
                .body(handle);
    }

    @GetMapping
    public ResponseEntity<List<OrderResponse>> listOrders(
            @RequestParam(required = false) String instrument,
            @RequestParam(defaultValue = "false") boolean openOnly) {
        List<Order> orders = openOnly
                ? brokerService.getOpenOrders().stream()
                        .filter(order -> instrument == null || instrument.equals(order.getInstrument()))
                        .toList()
                : brokerService.getOrders(instrument);
        return ResponseEntity.ok(orderResponseMapper.toResponseList(orders));
    }

    @GetMapping("/{clientOrderId}")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable String clientOrderId) {
        return ResponseEntity.ok(orderResponseMapper.toResponse(brokerService.getOrder(clientOrderId)));
    }

    @DeleteMapping("/{clientOrderId}")
    public ResponseEntity<OrderHandle> cancelOrder(@PathVariable String clientOrderId) {
        log.info("Cancelling order {}", clientOrderId);
        return ResponseEntity.ok(brokerService.cancelOrder(clientOrderId));
    }

    private Order toOrder(PlaceOrderRequest request) {
        return Order.builder()
                .clientOrderId(request.getClientOrderId())
                .instrument(request.getInstrument())
                .side(OrderSide.fromDirection(request.getDirection()))
                .type(OrderType.fromCode(request.getOrderType()))
                .size(request.getSize())
                .limitPrice(request.getLimitPrice())
                .stopPrice(request.getStopPrice())
                .timeInForce(TimeInForce.fromCode(request.getTimeInForce()))
                .takeProfitPrice(request.getTakeProfitPrice())
                .stopLossPrice(request.getStopLossPrice())
                .strategyTag(request.getStrategyTag())
                .build();
    }
}
