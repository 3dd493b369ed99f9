package com.ordergateway.venue.mapper;

import com.ordergateway.domain.enums.OrderSide;
import com.ordergateway.domain.enums.OrderStatus;
import com.ordergateway.domain.enums.OrderType;
import com.ordergateway.domain.enums.TimeInForce;
import com.ordergateway.domain.model.AccountSummary;
import com.ordergateway.domain.model.Order;
import com.ordergateway.domain.model.Position;
import com.ordergateway.exception.InvalidOrderException;
import com.ordergateway.exception.UnsupportedOrderTypeException;
import com.ordergateway.venue.VenueAccount;
import com.ordergateway.venue.VenueOrder;
import com.ordergateway.venue.VenueOrderRequest;
import com.ordergateway.venue.VenuePosition;
import java.math.BigDecimal;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps between venue-neutral domain records and the venue vocabulary.
 *
 * <p>Mapping directions:
 * <ul>
 *   <li>{@code toVenueRequest}: domain {@link Order} -> {@link VenueOrderRequest} (for submission)</li>
 *   <li>{@code toDomain}: {@link VenueOrder} -> domain {@link Order}</li>
 *   <li>{@code toPosition}: {@link VenuePosition} -> domain {@link Position}</li>
 *   <li>{@code toAccountSummary}: {@link VenueAccount} -> {@link AccountSummary}</li>
 * </ul>
 *
 * <p>Inbound mappings never invent values: a field the venue leaves out stays null.
 * Outbound mapping refuses anything it cannot express rather than dropping it.
 */
@Component
public class OrderNormalizer {

    private static final Logger log = LoggerFactory.getLogger(OrderNormalizer.class);

    static final String VENUE_TYPE_MARKET = "market";
    static final String VENUE_TYPE_LIMIT = "limit";
    static final String VENUE_TYPE_STOP_LIMIT = "stop_limit";

    /**
     * Builds the venue submission for an order whose size has already been rounded.
     *
     * @throws UnsupportedOrderTypeException if the order has no type
     * @throws InvalidOrderException if a price the type needs is missing or the size is not positive
     */
    public VenueOrderRequest toVenueRequest(Order order) {
        if (order.getType() == null) {
            throw new UnsupportedOrderTypeException(null);
        }
        if (order.getSide() == null) {
            throw new InvalidOrderException("Order " + order.getClientOrderId() + " has no direction");
        }
        if (order.getSize() == null || order.getSize().signum() <= 0) {
            throw new InvalidOrderException("Order size must be positive, got " + order.getSize());
        }

        VenueOrderRequest.VenueOrderRequestBuilder builder = VenueOrderRequest.builder()
                .clientOrderId(order.getClientOrderId())
                .symbol(order.getInstrument())
                .qty(order.getSize())
                .timeInForce(timeInForce(order).getVenueCode());

        switch (order.getType()) {
            case MARKET -> builder.type(VENUE_TYPE_MARKET).side(order.getSide().getVenueCode());
            case LIMIT -> builder.type(VENUE_TYPE_LIMIT)
                    .side(order.getSide().getVenueCode())
                    .limitPrice(require(order.getLimitPrice(), "limit price", order));
            case STOP_LIMIT -> builder.type(VENUE_TYPE_STOP_LIMIT)
                    .side(order.getSide().getVenueCode())
                    .limitPrice(require(order.getLimitPrice(), "limit price", order))
                    .stopPrice(require(order.getStopPrice(), "stop price", order));
            // The order's direction names the position being closed, so the venue trades the other way
            case CLOSE -> builder.type(VENUE_TYPE_MARKET)
                    .side(order.getSide().opposite().getVenueCode());
        }

        if (order.getType() != OrderType.CLOSE
                && (order.getTakeProfitPrice() != null || order.getStopLossPrice() != null)) {
            builder.orderClass(VenueOrderRequest.ORDER_CLASS_BRACKET)
                    .takeProfitLimitPrice(order.getTakeProfitPrice())
                    .stopLossStopPrice(order.getStopLossPrice());
        }

        return builder.build();
    }

    /**
     * Converts a venue order into a domain order. Local-only fields (strategy tag, related
     * orders, bracket prices, external flag) are left unset for the caller to fill in.
     */
    public Order toDomain(VenueOrder venueOrder) {
        if (venueOrder == null) {
            return null;
        }
        return Order.builder()
                .clientOrderId(venueOrder.getClientOrderId())
                .venueOrderId(venueOrder.getId())
                .instrument(venueOrder.getSymbol())
                .side(OrderSide.fromVenueCode(venueOrder.getSide()))
                .type(mapVenueType(venueOrder.getType()))
                .size(venueOrder.getQty())
                .limitPrice(venueOrder.getLimitPrice())
                .stopPrice(venueOrder.getStopPrice())
                .timeInForce(mapTimeInForce(venueOrder.getTimeInForce()))
                .status(mapStatus(venueOrder.getStatus()))
                .filledSize(venueOrder.getFilledQty())
                .averageFillPrice(venueOrder.getFilledAvgPrice())
                .placedAt(venueOrder.getSubmittedAt())
                .updatedAt(venueOrder.getFilledAt() != null ? venueOrder.getFilledAt() : venueOrder.getUpdatedAt())
                .build();
    }

    public List<Order> toDomainList(List<VenueOrder> venueOrders) {
        if (venueOrders == null) {
            return List.of();
        }
        return venueOrders.stream().map(this::toDomain).toList();
    }

    /**
     * Converts a venue position into long/short legs. A position with no side and no sign
     * (qty null or zero) maps to zero units on both legs.
     */
    public Position toPosition(VenuePosition venuePosition) {
        if (venuePosition == null) {
            return null;
        }
        BigDecimal qty = venuePosition.getQty();
        boolean isShort = "short".equalsIgnoreCase(venuePosition.getSide()) || (qty != null && qty.signum() < 0);
        BigDecimal units = qty != null ? qty.abs() : BigDecimal.ZERO;

        Position.PositionBuilder builder = Position.builder()
                .instrument(venuePosition.getSymbol())
                .averageEntryPrice(venuePosition.getAvgEntryPrice())
                .currentPrice(venuePosition.getCurrentPrice())
                .marketValue(venuePosition.getMarketValue());

        if (isShort) {
            builder.shortUnits(units).shortPnl(venuePosition.getUnrealizedPl());
        } else {
            builder.longUnits(units).longPnl(venuePosition.getUnrealizedPl());
        }
        return builder.build();
    }

    public AccountSummary toAccountSummary(VenueAccount account) {
        if (account == null) {
            return null;
        }
        return AccountSummary.builder()
                .equity(account.getEquity())
                .cash(account.getCash())
                .portfolioValue(account.getPortfolioValue())
                .buyingPower(account.getBuyingPower())
                .currency(account.getCurrency())
                .build();
    }

    // ---- Enum mapping helpers ----

    /**
     * Maps a venue status string to our lifecycle status.
     *
     * <p>All working states collapse into SUBMITTED; expired orders count as cancelled.
     * An unrecognised status is treated as still working and logged.
     */
    OrderStatus mapStatus(String venueStatus) {
        if (venueStatus == null) {
            return null;
        }
        return switch (venueStatus.toLowerCase()) {
            case "new",
                    "accepted",
                    "pending_new",
                    "accepted_for_bidding",
                    "calculated",
                    "held",
                    "pending_cancel",
                    "pending_replace",
                    "replaced",
                    "done_for_day",
                    "stopped",
                    "suspended" -> OrderStatus.SUBMITTED;
            case "partially_filled" -> OrderStatus.PARTIALLY_FILLED;
            case "filled" -> OrderStatus.FILLED;
            case "canceled", "cancelled", "expired" -> OrderStatus.CANCELLED;
            case "rejected" -> OrderStatus.REJECTED;
            default -> {
                log.warn("Unrecognised venue order status '{}', treating as SUBMITTED", venueStatus);
                yield OrderStatus.SUBMITTED;
            }
        };
    }

    OrderType mapVenueType(String venueType) {
        if (venueType == null) {
            return null;
        }
        return switch (venueType.toLowerCase()) {
            case VENUE_TYPE_MARKET -> OrderType.MARKET;
            case VENUE_TYPE_LIMIT -> OrderType.LIMIT;
            case VENUE_TYPE_STOP_LIMIT -> OrderType.STOP_LIMIT;
            default -> null;
        };
    }

    private TimeInForce mapTimeInForce(String venueCode) {
        if (venueCode == null) {
            return null;
        }
        try {
            return TimeInForce.fromCode(venueCode);
        } catch (InvalidOrderException e) {
            log.debug("Venue reported unknown time in force '{}'", venueCode);
            return null;
        }
    }

    private TimeInForce timeInForce(Order order) {
        return order.getTimeInForce() != null ? order.getTimeInForce() : TimeInForce.DAY;
    }

    private BigDecimal require(BigDecimal value, String field, Order order) {
        if (value == null) {
            throw new InvalidOrderException(
                    order.getType().getCode() + " order " + order.getClientOrderId() + " requires a " + field);
        }
        return value;
    }
}
