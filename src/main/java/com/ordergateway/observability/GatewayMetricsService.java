package com.ordergateway.observability;

import com.ordergateway.event.OrderEvent;
import com.ordergateway.event.ReconciliationEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the gateway, driven entirely by application events:
 * <ul>
 *   <li><b>gateway.orders.submitted</b>: orders acknowledged by the venue</li>
 *   <li><b>gateway.orders.rejected</b>: orders rejected at submission or by reconciliation</li>
 *   <li><b>gateway.orders.unconfirmed</b>: submissions whose outcome was unknown</li>
 *   <li><b>gateway.orders.duplicates</b>: place requests answered from local state</li>
 *   <li><b>gateway.orders.external</b>: out-of-band venue orders picked up</li>
 *   <li><b>gateway.reconciliation.failures</b>: polls that could not reach the venue</li>
 *   <li><b>gateway.reconciliation.duration</b>: wall time of each poll</li>
 * </ul>
 */
@Service
public class GatewayMetricsService {

    private static final Logger log = LoggerFactory.getLogger(GatewayMetricsService.class);

    private final Counter ordersSubmittedCounter;
    private final Counter ordersRejectedCounter;
    private final Counter ordersUnconfirmedCounter;
    private final Counter duplicateOrdersCounter;
    private final Counter externalOrdersCounter;
    private final Counter reconciliationFailureCounter;
    private final Timer reconciliationTimer;

    public GatewayMetricsService(MeterRegistry meterRegistry) {
        this.ordersSubmittedCounter = Counter.builder("gateway.orders.submitted")
                .description("Orders acknowledged by the venue")
                .register(meterRegistry);
        this.ordersRejectedCounter = Counter.builder("gateway.orders.rejected")
                .description("Orders rejected by the venue or never acknowledged")
                .register(meterRegistry);
        this.ordersUnconfirmedCounter = Counter.builder("gateway.orders.unconfirmed")
                .description("Submissions that timed out or failed in transport")
                .register(meterRegistry);
        this.duplicateOrdersCounter = Counter.builder("gateway.orders.duplicates")
                .description("Place requests with an already known client order ID")
                .register(meterRegistry);
        this.externalOrdersCounter = Counter.builder("gateway.orders.external")
                .description("Venue orders placed outside the gateway")
                .register(meterRegistry);
        this.reconciliationFailureCounter = Counter.builder("gateway.reconciliation.failures")
                .description("Reconciliation polls that failed after retries")
                .register(meterRegistry);
        this.reconciliationTimer = Timer.builder("gateway.reconciliation.duration")
                .description("Wall time of reconciliation polls")
                .register(meterRegistry);
    }

    @EventListener
    @Order(20)
    public void onOrderEvent(OrderEvent event) {
        switch (event.getEventType()) {
            case SUBMITTED -> ordersSubmittedCounter.increment();
            case REJECTED -> ordersRejectedCounter.increment();
            case UNCONFIRMED -> ordersUnconfirmedCounter.increment();
            case DUPLICATE_SUPPRESSED -> duplicateOrdersCounter.increment();
            case EXTERNAL_DETECTED -> externalOrdersCounter.increment();
            default -> {
                // fills and cancels are not counted
            }
        }
    }

    @EventListener
    @Order(20)
    public void onReconciliationEvent(ReconciliationEvent event) {
        reconciliationTimer.record(event.getResult().getDurationMs(), TimeUnit.MILLISECONDS);
        if (!event.getResult().isSuccess()) {
            reconciliationFailureCounter.increment();
            log.debug("Reconciliation failure counted: {}", event.getResult().getFailureMessage());
        }
    }
}
