package com.ordergateway.unit.oms;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ordergateway.domain.enums.OrderSide;
import com.ordergateway.domain.enums.OrderStatus;
import com.ordergateway.domain.enums.OrderType;
import com.ordergateway.domain.model.Order;
import com.ordergateway.domain.model.Position;
import com.ordergateway.domain.model.Trade;
import com.ordergateway.exception.ResourceNotFoundException;
import com.ordergateway.oms.OrderStateStore;
import com.ordergateway.oms.OrderUpdate;
import com.ordergateway.support.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class OrderStateStoreTest {

    private MutableClock clock;
    private OrderStateStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-02T14:30:00Z");
        store = new OrderStateStore(clock);
    }

    private Order newOrder(String clientOrderId) {
        return Order.builder()
                .clientOrderId(clientOrderId)
                .instrument("AAPL")
                .side(OrderSide.BUY)
                .type(OrderType.MARKET)
                .size(new BigDecimal("15"))
                .strategyTag("momentum")
                .build();
    }

    private Order venueView(String venueOrderId, OrderStatus status, String filled, String average) {
        return Order.builder()
                .venueOrderId(venueOrderId)
                .status(status)
                .filledSize(filled != null ? new BigDecimal(filled) : null)
                .averageFillPrice(average != null ? new BigDecimal(average) : null)
                .build();
    }

    private void submitted(String clientOrderId, String venueOrderId) {
        store.reserve(newOrder(clientOrderId));
        store.markSubmitted(clientOrderId, venueOrderId);
    }

    @Nested
    @DisplayName("Reservation")
    class Reservation {

        @Test
        @DisplayName("New order is recorded as PENDING with no venue ID")
        void recordsPending() {
            assertThat(store.reserve(newOrder("A"))).isEmpty();

            Order stored = store.find("A").orElseThrow();
            assertThat(stored.getStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(stored.getVenueOrderId()).isNull();
            assertThat(stored.getFilledSize()).isEqualByComparingTo("0");
            assertThat(stored.getPlacedAt()).isEqualTo(Instant.parse("2026-03-02T14:30:00Z"));
        }

        @Test
        @DisplayName("Second reservation of the same ID returns the existing order")
        void secondReservationReturnsExisting() {
            store.reserve(newOrder("A"));
            Order other = newOrder("A");
            other.setInstrument("MSFT");

            assertThat(store.reserve(other)).get().extracting(Order::getInstrument).isEqualTo("AAPL");
            assertThat(store.findAll(null)).hasSize(1);
        }

        @Test
        @DisplayName("Reads return copies")
        void readsReturnCopies() {
            store.reserve(newOrder("A"));

            store.find("A").orElseThrow().setStatus(OrderStatus.FILLED);

            assertThat(store.find("A").orElseThrow().getStatus()).isEqualTo(OrderStatus.PENDING);
        }
    }

    @Nested
    @DisplayName("Submission outcomes")
    class SubmissionOutcomes {

        @Test
        @DisplayName("Acknowledgement assigns the venue ID and indexes it")
        void acknowledgement() {
            store.reserve(newOrder("A"));

            OrderUpdate update = store.markSubmitted("A", "V1");

            assertThat(update.isStatusChanged()).isTrue();
            assertThat(update.getPreviousStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(update.getOrder().getVenueOrderId()).isEqualTo("V1");
            assertThat(store.findByVenueOrderId("V1")).get().extracting(Order::getClientOrderId).isEqualTo("A");
        }

        @Test
        @DisplayName("Unconfirmed submission stays SUBMITTED without venue ID")
        void unconfirmed() {
            store.reserve(newOrder("A"));

            OrderUpdate update = store.markUnconfirmed("A");

            assertThat(update.getOrder().getStatus()).isEqualTo(OrderStatus.SUBMITTED);
            assertThat(update.getOrder().getVenueOrderId()).isNull();
        }

        @Test
        @DisplayName("Unconfirmed does not override state reconciliation already applied")
        void unconfirmedAfterReconciliation() {
            store.reserve(newOrder("A"));
            store.applyVenueState("A", venueView("V1", OrderStatus.FILLED, "15", "100"));

            OrderUpdate update = store.markUnconfirmed("A");

            assertThat(update.isChanged()).isFalse();
            assertThat(update.getOrder().getStatus()).isEqualTo(OrderStatus.FILLED);
        }

        @Test
        @DisplayName("Rejection records the reason")
        void rejection() {
            store.reserve(newOrder("A"));

            OrderUpdate update = store.markRejected("A", "insufficient buying power");

            assertThat(update.getOrder().getStatus()).isEqualTo(OrderStatus.REJECTED);
            assertThat(update.getOrder().getRejectionReason()).isEqualTo("insufficient buying power");
        }

        @Test
        @DisplayName("Cancel after fill is refused")
        void cancelAfterFill() {
            submitted("A", "V1");
            store.applyVenueState("A", venueView("V1", OrderStatus.FILLED, "15", "100"));

            OrderUpdate update = store.markCancelled("A");

            assertThat(update.isStatusChanged()).isFalse();
            assertThat(update.getOrder().getStatus()).isEqualTo(OrderStatus.FILLED);
        }

        @Test
        @DisplayName("Unknown ID fails")
        void unknownId() {
            assertThatThrownBy(() -> store.markCancelled("nope")).isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Venue state merge")
    class VenueStateMerge {

        @Test
        @DisplayName("Each fill increment records one trade priced from the change in average")
        void fillIncrementsPriced() {
            submitted("A", "V1");

            OrderUpdate first = store.applyVenueState("A", venueView("V1", OrderStatus.PARTIALLY_FILLED, "5", "100"));
            OrderUpdate second = store.applyVenueState("A", venueView("V1", OrderStatus.FILLED, "15", "101"));

            assertThat(first.getTrades()).hasSize(1);
            assertThat(first.getTrades().get(0).getFillPrice()).isEqualByComparingTo("100");
            assertThat(second.getTrades()).hasSize(1);
            Trade trade = second.getTrades().get(0);
            assertThat(trade.getId()).isEqualTo("A-F2");
            assertThat(trade.getSize()).isEqualByComparingTo("10");
            assertThat(trade.getFillPrice()).isEqualByComparingTo("101.5");
            assertThat(trade.getStrategyTag()).isEqualTo("momentum");
            assertThat(store.findTrades(null)).extracting(Trade::getId).containsExactly("A-F1", "A-F2");

            Order stored = store.find("A").orElseThrow();
            assertThat(stored.getStatus()).isEqualTo(OrderStatus.FILLED);
            assertThat(stored.getFilledSize()).isEqualByComparingTo("15");
            assertThat(stored.getAverageFillPrice()).isEqualByComparingTo("101");
        }

        @Test
        @DisplayName("Re-applying the same venue state is a no-op")
        void idempotent() {
            submitted("A", "V1");
            store.applyVenueState("A", venueView("V1", OrderStatus.PARTIALLY_FILLED, "5", "100"));
            Instant updatedAt = store.find("A").orElseThrow().getUpdatedAt();
            clock.advance(Duration.ofMinutes(1));

            OrderUpdate again = store.applyVenueState("A", venueView("V1", OrderStatus.PARTIALLY_FILLED, "5", "100"));

            assertThat(again.isChanged()).isFalse();
            assertThat(again.getTrades()).isEmpty();
            assertThat(store.find("A").orElseThrow().getUpdatedAt()).isEqualTo(updatedAt);
            assertThat(store.findTrades(null)).hasSize(1);
        }

        @Test
        @DisplayName("Terminal orders are never modified")
        void terminalImmutable() {
            submitted("A", "V1");
            store.markCancelled("A");

            OrderUpdate update = store.applyVenueState("A", venueView("V1", OrderStatus.FILLED, "15", "100"));

            assertThat(update.isChanged()).isFalse();
            assertThat(store.find("A").orElseThrow().getStatus()).isEqualTo(OrderStatus.CANCELLED);
            assertThat(store.findTrades(null)).isEmpty();
        }

        @Test
        @DisplayName("Filled size reported lower than local is ignored")
        void lowerFilledIgnored() {
            submitted("A", "V1");
            store.applyVenueState("A", venueView("V1", OrderStatus.PARTIALLY_FILLED, "5", "100"));

            store.applyVenueState("A", venueView("V1", OrderStatus.PARTIALLY_FILLED, "3", "100"));

            assertThat(store.find("A").orElseThrow().getFilledSize()).isEqualByComparingTo("5");
        }

        @Test
        @DisplayName("Backwards status transition is refused")
        void backwardsRefused() {
            submitted("A", "V1");
            store.applyVenueState("A", venueView("V1", OrderStatus.PARTIALLY_FILLED, "5", "100"));

            OrderUpdate update = store.applyVenueState("A", venueView("V1", OrderStatus.SUBMITTED, "5", "100"));

            assertThat(update.isStatusChanged()).isFalse();
            assertThat(store.find("A").orElseThrow().getStatus()).isEqualTo(OrderStatus.PARTIALLY_FILLED);
        }

        @Test
        @DisplayName("Venue ID is assigned once and never replaced")
        void venueIdAssignedOnce() {
            store.reserve(newOrder("A"));
            store.markUnconfirmed("A");

            store.applyVenueState("A", venueView("V1", OrderStatus.SUBMITTED, "0", null));
            store.applyVenueState("A", venueView("V2", OrderStatus.SUBMITTED, "0", null));

            assertThat(store.find("A").orElseThrow().getVenueOrderId()).isEqualTo("V1");
            assertThat(store.findByVenueOrderId("V2")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Shadows and links")
    class ShadowsAndLinks {

        @Test
        @DisplayName("Shadow is inserted once")
        void shadowInsertedOnce() {
            Order shadow = newOrder("ext-V9");
            shadow.setExternal(true);

            assertThat(store.insertShadow(shadow)).isTrue();
            assertThat(store.insertShadow(shadow)).isFalse();
            assertThat(store.find("ext-V9").orElseThrow().isExternal()).isTrue();
        }

        @Test
        @DisplayName("Link connects both orders and the leg inherits the strategy tag")
        void link() {
            submitted("PARENT", "V1");
            Order leg = newOrder("LEG");
            leg.setStrategyTag(null);
            store.insertShadow(leg);

            assertThat(store.link("PARENT", "LEG")).isTrue();
            assertThat(store.link("PARENT", "LEG")).isFalse();

            assertThat(store.find("PARENT").orElseThrow().getRelatedOrders()).containsExactly("LEG");
            Order child = store.find("LEG").orElseThrow();
            assertThat(child.getRelatedOrders()).containsExactly("PARENT");
            assertThat(child.getParentOrderId()).isEqualTo("PARENT");
            assertThat(child.getStrategyTag()).isEqualTo("momentum");
        }

        @Test
        @DisplayName("Linking a leg adopted as external clears the flag")
        void linkClearsExternal() {
            submitted("PARENT", "V1");
            Order leg = newOrder("LEG");
            leg.setExternal(true);
            store.insertShadow(leg);

            assertThat(store.link("PARENT", "LEG")).isTrue();

            assertThat(store.find("LEG").orElseThrow().isExternal()).isFalse();
        }
    }

    @Nested
    @DisplayName("Concurrent updates")
    class ConcurrentUpdates {

        @Test
        @DisplayName("Cancel and fill racing on one order leave exactly one terminal outcome")
        void cancelRacingFill() throws Exception {
            ExecutorService threads = Executors.newFixedThreadPool(2);
            try {
                for (int i = 0; i < 50; i++) {
                    String clientOrderId = "R" + i;
                    String venueOrderId = "V" + i;
                    submitted(clientOrderId, venueOrderId);
                    CountDownLatch start = new CountDownLatch(1);

                    Future<OrderUpdate> cancel = threads.submit(() -> {
                        start.await();
                        return store.markCancelled(clientOrderId);
                    });
                    Future<OrderUpdate> fill = threads.submit(() -> {
                        start.await();
                        return store.applyVenueState(
                                clientOrderId, venueView(venueOrderId, OrderStatus.FILLED, "15", "100"));
                    });
                    start.countDown();

                    OrderUpdate cancelled = cancel.get(5, TimeUnit.SECONDS);
                    OrderUpdate filled = fill.get(5, TimeUnit.SECONDS);
                    assertThat(cancelled.isStatusChanged()).isNotEqualTo(filled.isStatusChanged());

                    boolean fillWon = filled.isStatusChanged();
                    Order settled = store.find(clientOrderId).orElseThrow();
                    assertThat(settled.getStatus()).isEqualTo(fillWon ? OrderStatus.FILLED : OrderStatus.CANCELLED);
                    assertThat(settled.getFilledSize()).isEqualByComparingTo(fillWon ? "15" : "0");
                    assertThat(store.findTrade(clientOrderId + "-F1").isPresent()).isEqualTo(fillWon);
                }
            } finally {
                threads.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Queries and positions")
    class QueriesAndPositions {

        @Test
        @DisplayName("Filters by instrument and open status")
        void filters() {
            submitted("A", "V1");
            Order msft = newOrder("B");
            msft.setInstrument("MSFT");
            store.reserve(msft);
            store.markRejected("B", "no");

            assertThat(store.findAll("AAPL")).extracting(Order::getClientOrderId).containsExactly("A");
            assertThat(store.findNonTerminal()).extracting(Order::getClientOrderId).containsExactly("A");
        }

        @Test
        @DisplayName("Replacing positions reports whether anything changed")
        void replacePositions() {
            Position aapl = Position.builder().instrument("AAPL").longUnits(new BigDecimal("5")).build();

            assertThat(store.replacePositions(List.of(aapl))).isTrue();
            assertThat(store.replacePositions(List.of(aapl))).isFalse();
            assertThat(store.findPosition("AAPL")).contains(aapl);

            assertThat(store.replacePositions(List.of())).isTrue();
            assertThat(store.findPositions(null)).isEmpty();
        }
    }
}
