package com.ordergateway.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.ordergateway.domain.enums.OrderStatus;
import com.ordergateway.domain.model.Order;
import com.ordergateway.domain.model.ReconciliationResult;
import com.ordergateway.event.OrderEvent;
import com.ordergateway.event.OrderEventType;
import com.ordergateway.event.ReconciliationEvent;
import com.ordergateway.observability.GatewayMetricsService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for GatewayMetricsService: every counter and the reconciliation timer
 * are registered at construction and driven by events.
 */
class GatewayMetricsServiceTest {

    private MeterRegistry meterRegistry;
    private GatewayMetricsService gatewayMetricsService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        gatewayMetricsService = new GatewayMetricsService(meterRegistry);
    }

    private double count(String name) {
        return meterRegistry.get(name).counter().count();
    }

    private OrderEvent event(OrderEventType type) {
        Order order = Order.builder().clientOrderId("A").status(OrderStatus.SUBMITTED).build();
        return new OrderEvent(this, order, type);
    }

    @Nested
    @DisplayName("Order counters")
    class OrderCounters {

        @Test
        @DisplayName("All counters start at zero")
        void registeredAtZero() {
            assertThat(count("gateway.orders.submitted")).isZero();
            assertThat(count("gateway.orders.rejected")).isZero();
            assertThat(count("gateway.orders.unconfirmed")).isZero();
            assertThat(count("gateway.orders.duplicates")).isZero();
            assertThat(count("gateway.orders.external")).isZero();
            assertThat(count("gateway.reconciliation.failures")).isZero();
        }

        @Test
        @DisplayName("Each event type increments its own counter")
        void incrementsByType() {
            gatewayMetricsService.onOrderEvent(event(OrderEventType.SUBMITTED));
            gatewayMetricsService.onOrderEvent(event(OrderEventType.SUBMITTED));
            gatewayMetricsService.onOrderEvent(event(OrderEventType.REJECTED));
            gatewayMetricsService.onOrderEvent(event(OrderEventType.UNCONFIRMED));
            gatewayMetricsService.onOrderEvent(event(OrderEventType.DUPLICATE_SUPPRESSED));
            gatewayMetricsService.onOrderEvent(event(OrderEventType.EXTERNAL_DETECTED));

            assertThat(count("gateway.orders.submitted")).isEqualTo(2.0);
            assertThat(count("gateway.orders.rejected")).isEqualTo(1.0);
            assertThat(count("gateway.orders.unconfirmed")).isEqualTo(1.0);
            assertThat(count("gateway.orders.duplicates")).isEqualTo(1.0);
            assertThat(count("gateway.orders.external")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Fills and cancels are not counted")
        void fillsNotCounted() {
            gatewayMetricsService.onOrderEvent(event(OrderEventType.FILLED));
            gatewayMetricsService.onOrderEvent(event(OrderEventType.CANCELLED));

            assertThat(count("gateway.orders.submitted")).isZero();
            assertThat(count("gateway.orders.rejected")).isZero();
        }
    }

    @Nested
    @DisplayName("Reconciliation metrics")
    class ReconciliationMetrics {

        @Test
        @DisplayName("Every pass is timed, only failed ones are counted")
        void timedAndCounted() {
            gatewayMetricsService.onReconciliationEvent(new ReconciliationEvent(
                    this, ReconciliationResult.builder().durationMs(40).build(), false));
            gatewayMetricsService.onReconciliationEvent(new ReconciliationEvent(
                    this,
                    ReconciliationResult.builder().durationMs(60).success(false).failureMessage("down").build(),
                    true));

            Timer timer = meterRegistry.get("gateway.reconciliation.duration").timer();
            assertThat(timer.count()).isEqualTo(2);
            assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(100.0);
            assertThat(count("gateway.reconciliation.failures")).isEqualTo(1.0);
        }
    }
}
