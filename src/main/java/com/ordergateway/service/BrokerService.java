package com.ordergateway.service;

import com.ordergateway.config.GatewayProperties;
import com.ordergateway.domain.enums.BalanceSource;
import com.ordergateway.domain.model.AccountSummary;
import com.ordergateway.domain.model.Order;
import com.ordergateway.domain.model.OrderHandle;
import com.ordergateway.domain.model.Position;
import com.ordergateway.domain.model.ReconciliationResult;
import com.ordergateway.domain.model.Trade;
import com.ordergateway.exception.ResourceNotFoundException;
import com.ordergateway.exception.RoutingException;
import com.ordergateway.exception.UnknownInstrumentException;
import com.ordergateway.exception.VenueException;
import com.ordergateway.instrument.PrecisionResolver;
import com.ordergateway.oms.OrderRouter;
import com.ordergateway.oms.OrderStateStore;
import com.ordergateway.reconciliation.OrderReconciliationService;
import com.ordergateway.venue.VenueCallExecutor;
import com.ordergateway.venue.VenueClient;
import com.ordergateway.venue.mapper.OrderNormalizer;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Caller-facing broker API over the routing core, the state store and the venue's account.
 *
 * <p>Order, trade and position reads are served from local state and reflect the last
 * reconciliation pass. Account figures are read from the venue on every call.
 */
@Service
public class BrokerService {

    private static final Logger log = LoggerFactory.getLogger(BrokerService.class);

    private final OrderRouter orderRouter;
    private final OrderStateStore orderStateStore;
    private final OrderReconciliationService orderReconciliationService;
    private final PrecisionResolver precisionResolver;
    private final VenueClient venueClient;
    private final VenueCallExecutor venueCallExecutor;
    private final OrderNormalizer orderNormalizer;
    private final BalanceSource balanceSource;

    public BrokerService(
            OrderRouter orderRouter,
            OrderStateStore orderStateStore,
            OrderReconciliationService orderReconciliationService,
            PrecisionResolver precisionResolver,
            VenueClient venueClient,
            VenueCallExecutor venueCallExecutor,
            OrderNormalizer orderNormalizer,
            GatewayProperties properties) {
        this.orderRouter = orderRouter;
        this.orderStateStore = orderStateStore;
        this.orderReconciliationService = orderReconciliationService;
        this.precisionResolver = precisionResolver;
        this.venueClient = venueClient;
        this.venueCallExecutor = venueCallExecutor;
        this.orderNormalizer = orderNormalizer;
        this.balanceSource = properties.getAccount().getBalanceSource();
    }

    // ---- Orders ----

    public OrderHandle placeOrder(Order order) {
        return orderRouter.place(order);
    }

    public OrderHandle cancelOrder(String clientOrderId) {
        return orderRouter.cancel(clientOrderId);
    }

    public Order getOrder(String clientOrderId) {
        return orderStateStore
                .find(clientOrderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", clientOrderId));
    }

    /** @param instrument optional filter, null for all */
    public List<Order> getOrders(String instrument) {
        return orderStateStore.findAll(instrument);
    }

    public List<Order> getOpenOrders() {
        return orderStateStore.findNonTerminal();
    }

    // ---- Trades ----

    /**
     * Trades with unrealised P&L attached from the instrument's current mark:
     * {@code (currentPrice - fillPrice) * size * direction}. Null when no mark is known.
     *
     * @param instrument optional filter, null for all
     */
    public List<Trade> getTrades(String instrument) {
        Map<String, Position> positions = orderStateStore.findPositions(instrument).stream()
                .collect(Collectors.toMap(Position::getInstrument, Function.identity()));
        return orderStateStore.findTrades(instrument).stream()
                .map(trade -> withUnrealizedPnl(trade, positions.get(trade.getInstrument())))
                .toList();
    }

    public Trade getTradeDetails(String tradeId) {
        Trade trade = orderStateStore
                .findTrade(tradeId)
                .orElseThrow(() -> new ResourceNotFoundException("Trade", tradeId));
        return withUnrealizedPnl(
                trade, orderStateStore.findPosition(trade.getInstrument()).orElse(null));
    }

    // ---- Positions ----

    /** @param instrument optional filter, null for all */
    public List<Position> getPositions(String instrument) {
        return orderStateStore.findPositions(instrument);
    }

    // ---- Account ----

    public AccountSummary getAccount() {
        try {
            return orderNormalizer.toAccountSummary(venueCallExecutor.call("get_account", venueClient::getAccount));
        } catch (VenueException e) {
            log.warn("Account lookup failed: {}", e.getMessage());
            throw new RoutingException("Account lookup failed", e);
        }
    }

    /** Net asset value: the venue's portfolio value. */
    public BigDecimal getNav() {
        return getAccount().getPortfolioValue();
    }

    /** The account figure selected by {@code gateway.account.balance-source}. */
    public BigDecimal getBalance() {
        AccountSummary account = getAccount();
        return switch (balanceSource) {
            case EQUITY -> account.getEquity();
            case CASH -> account.getCash();
            case BUYING_POWER -> account.getBuyingPower();
        };
    }

    public BalanceSource getBalanceSource() {
        return balanceSource;
    }

    // ---- Maintenance ----

    public ReconciliationResult reconcile() {
        return orderReconciliationService.manualReconcile();
    }

    /**
     * @throws UnknownInstrumentException if the venue does not list the instrument
     */
    public int getPrecision(String instrument) {
        try {
            return precisionResolver.precision(instrument);
        } catch (VenueException e) {
            throw new RoutingException("Precision lookup for " + instrument + " failed", e);
        }
    }

    /** @param instrument the instrument to re-resolve, or null to clear the whole cache */
    public void refreshPrecision(String instrument) {
        if (instrument == null) {
            precisionResolver.refreshAll();
        } else {
            precisionResolver.refresh(instrument);
        }
    }

    private Trade withUnrealizedPnl(Trade trade, Position position) {
        if (position == null || position.getCurrentPrice() == null || trade.getFillPrice() == null) {
            return trade;
        }
        BigDecimal pnl = position.getCurrentPrice()
                .subtract(trade.getFillPrice())
                .multiply(trade.getSize())
                .multiply(BigDecimal.valueOf(trade.getDirection()));
        return trade.withUnrealizedPnl(pnl);
    }
}
