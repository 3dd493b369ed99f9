package com.ordergateway.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ordergateway.config.GatewayProperties;
import com.ordergateway.domain.enums.BalanceSource;
import com.ordergateway.domain.enums.OrderSide;
import com.ordergateway.domain.enums.OrderStatus;
import com.ordergateway.domain.enums.OrderType;
import com.ordergateway.domain.model.Order;
import com.ordergateway.domain.model.OrderHandle;
import com.ordergateway.domain.model.Position;
import com.ordergateway.domain.model.ReconciliationResult;
import com.ordergateway.domain.model.Trade;
import com.ordergateway.exception.ResourceNotFoundException;
import com.ordergateway.exception.RoutingException;
import com.ordergateway.exception.VenueTransportException;
import com.ordergateway.instrument.PrecisionResolver;
import com.ordergateway.oms.OrderRouter;
import com.ordergateway.oms.OrderStateStore;
import com.ordergateway.reconciliation.OrderReconciliationService;
import com.ordergateway.service.BrokerService;
import com.ordergateway.support.MutableClock;
import com.ordergateway.venue.VenueAccount;
import com.ordergateway.venue.VenueCallExecutor;
import com.ordergateway.venue.VenueClient;
import com.ordergateway.venue.mapper.OrderNormalizer;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BrokerServiceTest {

    private OrderRouter orderRouter;
    private OrderReconciliationService orderReconciliationService;
    private PrecisionResolver precisionResolver;
    private VenueClient venueClient;
    private OrderStateStore orderStateStore;
    private GatewayProperties properties;

    @BeforeEach
    void setUp() {
        orderRouter = mock(OrderRouter.class);
        orderReconciliationService = mock(OrderReconciliationService.class);
        precisionResolver = mock(PrecisionResolver.class);
        venueClient = mock(VenueClient.class);
        orderStateStore = new OrderStateStore(MutableClock.startingAt("2026-03-02T14:30:00Z"));
        properties = new GatewayProperties();

        when(venueClient.getAccount()).thenReturn(VenueAccount.builder()
                .equity(new BigDecimal("101500"))
                .cash(new BigDecimal("90000"))
                .portfolioValue(new BigDecimal("101500"))
                .buyingPower(new BigDecimal("180000"))
                .currency("USD")
                .build());
    }

    private BrokerService brokerService() {
        return new BrokerService(
                orderRouter,
                orderStateStore,
                orderReconciliationService,
                precisionResolver,
                venueClient,
                new VenueCallExecutor(Runnable::run, Duration.ofSeconds(1)),
                new OrderNormalizer(),
                properties);
    }

    private void filledOrder(String clientOrderId, String fillPrice) {
        orderStateStore.reserve(Order.builder()
                .clientOrderId(clientOrderId)
                .instrument("AAPL")
                .side(OrderSide.BUY)
                .type(OrderType.MARKET)
                .size(new BigDecimal("10"))
                .build());
        orderStateStore.markSubmitted(clientOrderId, "V-" + clientOrderId);
        orderStateStore.applyVenueState(clientOrderId, Order.builder()
                .status(OrderStatus.FILLED)
                .filledSize(new BigDecimal("10"))
                .averageFillPrice(new BigDecimal(fillPrice))
                .build());
    }

    @Nested
    @DisplayName("Orders")
    class Orders {

        @Test
        @DisplayName("Place and cancel delegate to the router")
        void delegates() {
            Order order = Order.builder().clientOrderId("A").build();
            OrderHandle handle = new OrderHandle("A", "V1", OrderStatus.SUBMITTED, false);
            when(orderRouter.place(order)).thenReturn(handle);
            when(orderRouter.cancel("A")).thenReturn(handle);

            assertThat(brokerService().placeOrder(order)).isSameAs(handle);
            assertThat(brokerService().cancelOrder("A")).isSameAs(handle);
        }

        @Test
        @DisplayName("Unknown order is not found")
        void unknownOrder() {
            assertThatThrownBy(() -> brokerService().getOrder("nope"))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasMessageContaining("nope");
        }

        @Test
        @DisplayName("Open orders exclude terminal ones")
        void openOrders() {
            filledOrder("A", "100");
            orderStateStore.reserve(Order.builder()
                    .clientOrderId("B")
                    .instrument("MSFT")
                    .side(OrderSide.SELL)
                    .type(OrderType.MARKET)
                    .size(BigDecimal.ONE)
                    .build());

            assertThat(brokerService().getOpenOrders()).extracting(Order::getClientOrderId).containsExactly("B");
            assertThat(brokerService().getOrders("AAPL")).extracting(Order::getClientOrderId).containsExactly("A");
        }
    }

    @Nested
    @DisplayName("Trades")
    class Trades {

        @Test
        @DisplayName("Unrealised P&L is attached from the position's mark")
        void pnlFromMark() {
            filledOrder("A", "100");
            orderStateStore.replacePositions(List.of(Position.builder()
                    .instrument("AAPL")
                    .longUnits(new BigDecimal("10"))
                    .currentPrice(new BigDecimal("103"))
                    .build()));

            List<Trade> trades = brokerService().getTrades(null);

            assertThat(trades).hasSize(1);
            assertThat(trades.get(0).getUnrealizedPnl()).isEqualByComparingTo("30");
            assertThat(brokerService().getTradeDetails("A-F1").getUnrealizedPnl()).isEqualByComparingTo("30");
        }

        @Test
        @DisplayName("Unrealised P&L is null without a mark")
        void pnlWithoutMark() {
            filledOrder("A", "100");

            assertThat(brokerService().getTrades("AAPL").get(0).getUnrealizedPnl()).isNull();
        }

        @Test
        @DisplayName("Unknown trade is not found")
        void unknownTrade() {
            assertThatThrownBy(() -> brokerService().getTradeDetails("X-F1"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Account")
    class Account {

        @Test
        @DisplayName("NAV is the portfolio value")
        void nav() {
            assertThat(brokerService().getNav()).isEqualByComparingTo("101500");
        }

        @Test
        @DisplayName("Balance follows the configured source")
        void balanceSource() {
            assertThat(brokerService().getBalance()).isEqualByComparingTo("101500");

            properties.getAccount().setBalanceSource(BalanceSource.CASH);
            assertThat(brokerService().getBalance()).isEqualByComparingTo("90000");

            properties.getAccount().setBalanceSource(BalanceSource.BUYING_POWER);
            assertThat(brokerService().getBalance()).isEqualByComparingTo("180000");
            assertThat(brokerService().getBalanceSource()).isEqualTo(BalanceSource.BUYING_POWER);
        }

        @Test
        @DisplayName("Venue outage surfaces as a routing error")
        void outage() {
            when(venueClient.getAccount()).thenThrow(new VenueTransportException("down"));

            assertThatThrownBy(() -> brokerService().getAccount()).isInstanceOf(RoutingException.class);
        }
    }

    @Nested
    @DisplayName("Maintenance")
    class Maintenance {

        @Test
        @DisplayName("Reconcile triggers a manual pass")
        void reconcile() {
            ReconciliationResult result = ReconciliationResult.builder().trigger("MANUAL").build();
            when(orderReconciliationService.manualReconcile()).thenReturn(result);

            assertThat(brokerService().reconcile()).isSameAs(result);
        }

        @Test
        @DisplayName("Refresh of one instrument or of all")
        void refresh() {
            brokerService().refreshPrecision("AAPL");
            verify(precisionResolver).refresh("AAPL");
            verify(precisionResolver, never()).refreshAll();

            brokerService().refreshPrecision(null);
            verify(precisionResolver).refreshAll();
        }

        @Test
        @DisplayName("Precision lookup failures surface as routing errors")
        void precisionFailure() {
            when(precisionResolver.precision("AAPL")).thenThrow(new VenueTransportException("down"));

            assertThatThrownBy(() -> brokerService().getPrecision("AAPL")).isInstanceOf(RoutingException.class);
        }
    }
}
