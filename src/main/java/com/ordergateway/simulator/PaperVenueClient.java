package com.ordergateway.simulator;

import com.ordergateway.config.GatewayProperties;
import com.ordergateway.domain.enums.VenueOrderQuery;
import com.ordergateway.exception.VenueNotFoundException;
import com.ordergateway.exception.VenueRejectedException;
import com.ordergateway.exception.VenueTransportException;
import com.ordergateway.venue.VenueAccount;
import com.ordergateway.venue.VenueAsset;
import com.ordergateway.venue.VenueClient;
import com.ordergateway.venue.VenueOrder;
import com.ordergateway.venue.VenueOrderRequest;
import com.ordergateway.venue.VenuePosition;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory venue for paper trading and integration tests.
 *
 * <p>Keeps its own order book, holdings and cash, and fills orders against mark prices:
 * <ul>
 *   <li>market: fills at the mark; stays working until a mark is known</li>
 *   <li>limit buy: fills at the limit price when mark &lt;= limit (sell: mark &gt;= limit)</li>
 *   <li>stop_limit buy: triggers when mark &gt;= stop (sell: mark &lt;= stop), then behaves as a limit,
 *       or fills at the mark when it has no limit price</li>
 * </ul>
 *
 * <p>Bracket orders create a take-profit limit leg and a stop-loss stop_limit leg on the opposite
 * side. Legs are held until the parent fills; when one leg fills the other is cancelled.
 *
 * <p>Test hooks: {@link #setMarkPrice} re-evaluates working orders, {@link #fillPartially}
 * forces a partial fill, {@link #setUnavailable} makes every call fail in transport, and
 * {@link #setSubmitLatency} delays submissions (outside the book's lock) to provoke timeouts.
 */
public class PaperVenueClient implements VenueClient {

    private static final Logger log = LoggerFactory.getLogger(PaperVenueClient.class);

    static final String STATUS_NEW = "new";
    static final String STATUS_HELD = "held";
    static final String STATUS_PARTIALLY_FILLED = "partially_filled";
    static final String STATUS_FILLED = "filled";
    static final String STATUS_CANCELED = "canceled";

    private static final Set<String> OPEN_STATUSES = Set.of(STATUS_NEW, STATUS_HELD, STATUS_PARTIALLY_FILLED);
    private static final Set<String> SUPPORTED_TYPES = Set.of("market", "limit", "stop_limit");

    private final Clock clock;
    private final String currency;
    private final Map<String, VenueAsset> assets = new LinkedHashMap<>();
    private final Map<String, BigDecimal> marks = new LinkedHashMap<>();
    private final Map<String, PaperOrder> orders = new LinkedHashMap<>();
    private final Map<String, String> clientOrderIndex = new LinkedHashMap<>();
    private final Map<String, Holding> holdings = new LinkedHashMap<>();

    private BigDecimal cash;
    private long orderSequence;
    private volatile boolean unavailable;
    private volatile Duration submitLatency = Duration.ZERO;

    public PaperVenueClient(GatewayProperties.Paper settings, Clock clock) {
        this.clock = clock;
        this.currency = settings.getCurrency();
        this.cash = settings.getStartingCash();
        settings.getAssets().forEach((symbol, asset) -> {
            addAsset(symbol, asset.isFractionable(), asset.getMinTradeIncrement());
            if (asset.getMarkPrice() != null) {
                marks.put(symbol, asset.getMarkPrice());
            }
        });
    }

    @Override
    public String venueName() {
        return "paper";
    }

    @Override
    public String submitOrder(VenueOrderRequest request) {
        checkAvailable();
        if (!submitLatency.isZero()) {
            try {
                Thread.sleep(submitLatency.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new VenueTransportException("submission interrupted", e);
            }
        }
        return accept(request);
    }

    private synchronized String accept(VenueOrderRequest request) {
        if (request.getClientOrderId() != null && clientOrderIndex.containsKey(request.getClientOrderId())) {
            throw new VenueRejectedException("client_order_id must be unique");
        }
        VenueAsset asset = assets.get(request.getSymbol());
        if (asset == null || !asset.isTradable()) {
            throw new VenueRejectedException("asset " + request.getSymbol() + " is not tradable");
        }
        if (request.getQty() == null || request.getQty().signum() <= 0) {
            throw new VenueRejectedException("qty must be > 0");
        }
        if (!asset.isFractionable() && request.getQty().stripTrailingZeros().scale() > 0) {
            throw new VenueRejectedException("fractional orders are not supported for " + request.getSymbol());
        }
        if (!SUPPORTED_TYPES.contains(request.getType())) {
            throw new VenueRejectedException("unsupported order type " + request.getType());
        }

        PaperOrder order = newOrder(
                request.getClientOrderId(),
                request.getSymbol(),
                request.getSide(),
                request.getType(),
                request.getQty(),
                request.getLimitPrice(),
                request.getStopPrice(),
                request.getTimeInForce());
        order.orderClass = request.getOrderClass();

        if (VenueOrderRequest.ORDER_CLASS_BRACKET.equals(request.getOrderClass())) {
            String exitSide = "buy".equals(request.getSide()) ? "sell" : "buy";
            if (request.getTakeProfitLimitPrice() != null) {
                addLeg(order, newOrder(null, order.symbol, exitSide, "limit", order.qty,
                        request.getTakeProfitLimitPrice(), null, "gtc"));
            }
            if (request.getStopLossStopPrice() != null) {
                // no limit on the stop-loss leg: once triggered it fills at the mark
                addLeg(order, newOrder(null, order.symbol, exitSide, "stop_limit", order.qty,
                        null, request.getStopLossStopPrice(), "gtc"));
            }
        }

        log.debug("Paper order {} accepted: {} {} {} {}", order.id, order.side, order.qty, order.symbol, order.type);
        evaluate(order);
        return order.id;
    }

    @Override
    public synchronized void cancelOrder(String venueOrderId) {
        checkAvailable();
        PaperOrder order = orders.get(venueOrderId);
        if (order == null) {
            throw new VenueNotFoundException("order " + venueOrderId + " not found");
        }
        if (!OPEN_STATUSES.contains(order.status)) {
            throw new VenueRejectedException("order is not cancelable");
        }
        cancel(order);
        for (String legId : order.legIds) {
            PaperOrder leg = orders.get(legId);
            if (OPEN_STATUSES.contains(leg.status)) {
                cancel(leg);
            }
        }
    }

    @Override
    public synchronized List<VenueOrder> listOrders(VenueOrderQuery status, String instrument) {
        checkAvailable();
        List<VenueOrder> result = new ArrayList<>();
        for (PaperOrder order : orders.values()) {
            boolean open = OPEN_STATUSES.contains(order.status);
            boolean statusMatches = status == VenueOrderQuery.ALL
                    || (status == VenueOrderQuery.OPEN && open)
                    || (status == VenueOrderQuery.CLOSED && !open);
            if (statusMatches && (instrument == null || instrument.equals(order.symbol))) {
                result.add(order.toVenueOrder());
            }
        }
        return result;
    }

    @Override
    public synchronized Optional<VenueOrder> getOrderByClientId(String clientOrderId) {
        checkAvailable();
        return Optional.ofNullable(clientOrderIndex.get(clientOrderId))
                .map(orders::get)
                .map(PaperOrder::toVenueOrder);
    }

    @Override
    public synchronized List<VenuePosition> listPositions(String instrument) {
        checkAvailable();
        List<VenuePosition> result = new ArrayList<>();
        holdings.forEach((symbol, holding) -> {
            if (holding.qty.signum() == 0 || (instrument != null && !instrument.equals(symbol))) {
                return;
            }
            BigDecimal current = marks.getOrDefault(symbol, holding.averageEntryPrice);
            result.add(VenuePosition.builder()
                    .symbol(symbol)
                    .qty(holding.qty)
                    .side(holding.qty.signum() > 0 ? "long" : "short")
                    .avgEntryPrice(holding.averageEntryPrice)
                    .currentPrice(current)
                    .marketValue(holding.qty.multiply(current))
                    .unrealizedPl(current.subtract(holding.averageEntryPrice).multiply(holding.qty))
                    .build());
        });
        return result;
    }

    @Override
    public synchronized VenueAccount getAccount() {
        checkAvailable();
        BigDecimal holdingsValue = BigDecimal.ZERO;
        for (Map.Entry<String, Holding> entry : holdings.entrySet()) {
            Holding holding = entry.getValue();
            BigDecimal mark = marks.getOrDefault(entry.getKey(), holding.averageEntryPrice);
            holdingsValue = holdingsValue.add(holding.qty.multiply(mark));
        }
        BigDecimal equity = cash.add(holdingsValue);
        return VenueAccount.builder()
                .equity(equity)
                .cash(cash)
                .portfolioValue(equity)
                .buyingPower(cash.max(BigDecimal.ZERO))
                .currency(currency)
                .build();
    }

    @Override
    public synchronized Optional<VenueAsset> getAsset(String instrument) {
        checkAvailable();
        return Optional.ofNullable(assets.get(instrument));
    }

    // ---- Simulation controls ----

    public synchronized void addAsset(String symbol, boolean fractionable, BigDecimal minTradeIncrement) {
        assets.put(symbol, VenueAsset.builder()
                .symbol(symbol)
                .tradable(true)
                .fractionable(fractionable)
                .minTradeIncrement(minTradeIncrement)
                .build());
    }

    /** Sets the mark for an instrument and fills every working order that became marketable. */
    public synchronized void setMarkPrice(String symbol, BigDecimal price) {
        marks.put(symbol, price);
        for (PaperOrder order : new ArrayList<>(orders.values())) {
            if (symbol.equals(order.symbol) && OPEN_STATUSES.contains(order.status)) {
                evaluate(order);
            }
        }
    }

    /** Fills part of a working order at the given price. */
    public synchronized void fillPartially(String venueOrderId, BigDecimal qty, BigDecimal price) {
        PaperOrder order = orders.get(venueOrderId);
        if (order == null) {
            throw new VenueNotFoundException("order " + venueOrderId + " not found");
        }
        if (!OPEN_STATUSES.contains(order.status) || STATUS_HELD.equals(order.status)) {
            throw new VenueRejectedException("order " + venueOrderId + " is not working");
        }
        applyFill(order, qty.min(order.qty.subtract(order.filledQty)), price);
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public void setSubmitLatency(Duration submitLatency) {
        this.submitLatency = submitLatency;
    }

    public synchronized BigDecimal getCash() {
        return cash;
    }

    // ---- Matching ----

    private void evaluate(PaperOrder order) {
        if (!OPEN_STATUSES.contains(order.status) || STATUS_HELD.equals(order.status)) {
            return;
        }
        BigDecimal mark = marks.get(order.symbol);
        if (mark == null) {
            return;
        }
        boolean buy = "buy".equals(order.side);
        BigDecimal remaining = order.qty.subtract(order.filledQty);

        switch (order.type) {
            case "market" -> applyFill(order, remaining, mark);
            case "stop_limit" -> {
                if (!order.stopTriggered) {
                    order.stopTriggered = buy ? mark.compareTo(order.stopPrice) >= 0 : mark.compareTo(order.stopPrice) <= 0;
                }
                if (order.stopTriggered && order.limitPrice == null) {
                    applyFill(order, remaining, mark);
                } else if (order.stopTriggered && limitMarketable(buy, mark, order.limitPrice)) {
                    applyFill(order, remaining, order.limitPrice);
                }
            }
            default -> {
                if (limitMarketable(buy, mark, order.limitPrice)) {
                    applyFill(order, remaining, order.limitPrice);
                }
            }
        }
    }

    private static boolean limitMarketable(boolean buy, BigDecimal mark, BigDecimal limit) {
        return buy ? mark.compareTo(limit) <= 0 : mark.compareTo(limit) >= 0;
    }

    private void applyFill(PaperOrder order, BigDecimal qty, BigDecimal price) {
        if (qty.signum() <= 0) {
            return;
        }
        Instant now = clock.instant();
        BigDecimal previousNotional =
                order.filledAvgPrice != null ? order.filledAvgPrice.multiply(order.filledQty) : BigDecimal.ZERO;
        order.filledQty = order.filledQty.add(qty);
        order.filledAvgPrice = previousNotional.add(price.multiply(qty)).divide(order.filledQty, MathContext.DECIMAL64);
        order.updatedAt = now;

        int direction = "buy".equals(order.side) ? 1 : -1;
        BigDecimal signedQty = qty.multiply(BigDecimal.valueOf(direction));
        cash = cash.subtract(signedQty.multiply(price));
        holdings.computeIfAbsent(order.symbol, symbol -> new Holding()).apply(signedQty, price);

        if (order.filledQty.compareTo(order.qty) >= 0) {
            order.status = STATUS_FILLED;
            order.filledAt = now;
            log.debug("Paper order {} filled {} @ {}", order.id, order.filledQty, order.filledAvgPrice);
            onFilled(order);
        } else {
            order.status = STATUS_PARTIALLY_FILLED;
        }
    }

    private void onFilled(PaperOrder order) {
        for (String legId : order.legIds) {
            PaperOrder leg = orders.get(legId);
            if (STATUS_HELD.equals(leg.status)) {
                leg.status = STATUS_NEW;
                leg.updatedAt = clock.instant();
            }
        }
        if (order.parentId != null) {
            // one-cancels-other between bracket legs
            for (String siblingId : orders.get(order.parentId).legIds) {
                PaperOrder sibling = orders.get(siblingId);
                if (!sibling.id.equals(order.id) && OPEN_STATUSES.contains(sibling.status)) {
                    cancel(sibling);
                }
            }
        }
        for (String legId : order.legIds) {
            evaluate(orders.get(legId));
        }
    }

    private void cancel(PaperOrder order) {
        order.status = STATUS_CANCELED;
        order.updatedAt = clock.instant();
        log.debug("Paper order {} canceled", order.id);
    }

    private PaperOrder newOrder(
            String clientOrderId,
            String symbol,
            String side,
            String type,
            BigDecimal qty,
            BigDecimal limitPrice,
            BigDecimal stopPrice,
            String timeInForce) {
        PaperOrder order = new PaperOrder();
        order.id = String.format("P%08d", ++orderSequence);
        order.clientOrderId = clientOrderId != null ? clientOrderId : "paper-" + order.id;
        order.symbol = symbol;
        order.side = side;
        order.type = type;
        order.qty = qty;
        order.limitPrice = limitPrice;
        order.stopPrice = stopPrice;
        order.timeInForce = timeInForce;
        order.status = STATUS_NEW;
        order.submittedAt = clock.instant();
        order.updatedAt = order.submittedAt;
        orders.put(order.id, order);
        clientOrderIndex.put(order.clientOrderId, order.id);
        return order;
    }

    private void addLeg(PaperOrder parent, PaperOrder leg) {
        leg.parentId = parent.id;
        leg.status = STATUS_HELD;
        parent.legIds.add(leg.id);
    }

    private void checkAvailable() {
        if (unavailable) {
            throw new VenueTransportException("paper venue unavailable");
        }
    }

    private static class PaperOrder {
        String id;
        String clientOrderId;
        String symbol;
        String side;
        String type;
        BigDecimal qty;
        BigDecimal filledQty = BigDecimal.ZERO;
        BigDecimal filledAvgPrice;
        BigDecimal limitPrice;
        BigDecimal stopPrice;
        String timeInForce;
        String status;
        String orderClass = VenueOrderRequest.ORDER_CLASS_SIMPLE;
        String parentId;
        List<String> legIds = new ArrayList<>();
        boolean stopTriggered;
        Instant submittedAt;
        Instant filledAt;
        Instant updatedAt;

        VenueOrder toVenueOrder() {
            return VenueOrder.builder()
                    .id(id)
                    .clientOrderId(clientOrderId)
                    .symbol(symbol)
                    .side(side)
                    .type(type)
                    .qty(qty)
                    .filledQty(filledQty)
                    .filledAvgPrice(filledAvgPrice)
                    .limitPrice(limitPrice)
                    .stopPrice(stopPrice)
                    .timeInForce(timeInForce)
                    .status(status)
                    .orderClass(orderClass)
                    .parentOrderId(parentId)
                    .submittedAt(submittedAt)
                    .filledAt(filledAt)
                    .updatedAt(updatedAt)
                    .build();
        }
    }

    /** Signed net holding in one symbol. */
    private static class Holding {
        BigDecimal qty = BigDecimal.ZERO;
        BigDecimal averageEntryPrice = BigDecimal.ZERO;

        void apply(BigDecimal signedQty, BigDecimal price) {
            BigDecimal newQty = qty.add(signedQty);
            if (qty.signum() == 0 || qty.signum() == signedQty.signum()) {
                // adding to the position
                averageEntryPrice = averageEntryPrice
                        .multiply(qty.abs())
                        .add(price.multiply(signedQty.abs()))
                        .divide(newQty.abs(), MathContext.DECIMAL64);
            } else if (newQty.signum() != 0 && newQty.signum() != qty.signum()) {
                // flipped through zero
                averageEntryPrice = price;
            }
            qty = newQty;
            if (qty.signum() == 0) {
                averageEntryPrice = BigDecimal.ZERO;
            }
        }
    }
}
