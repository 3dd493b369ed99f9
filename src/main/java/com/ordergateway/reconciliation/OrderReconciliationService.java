package com.ordergateway.reconciliation;

import com.ordergateway.config.GatewayProperties;
import com.ordergateway.domain.enums.OrderStatus;
import com.ordergateway.domain.enums.VenueOrderQuery;
import com.ordergateway.domain.model.Order;
import com.ordergateway.domain.model.Position;
import com.ordergateway.domain.model.ReconciliationResult;
import com.ordergateway.event.EventPublisherHelper;
import com.ordergateway.exception.VenueException;
import com.ordergateway.exception.VenueTransportException;
import com.ordergateway.oms.OrderStateStore;
import com.ordergateway.oms.OrderUpdate;
import com.ordergateway.venue.VenueCallExecutor;
import com.ordergateway.venue.VenueClient;
import com.ordergateway.venue.VenueOrder;
import com.ordergateway.venue.VenuePosition;
import com.ordergateway.venue.mapper.OrderNormalizer;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Merges the venue's orders and positions into {@link OrderStateStore}. The venue wins for
 * status, venue ID, filled size and average fill price; local metadata survives.
 *
 * <p>Each pass:
 * <ol>
 *   <li>Fetches open orders and positions (retried with exponential backoff on transport errors)</li>
 *   <li>Fetches closed orders if any local working order is missing from the open list, so that
 *       fills and cancels completed between polls are applied</li>
 *   <li>Looks up orders whose submission outcome was unknown by client order ID and applies
 *       the ones the venue knows</li>
 *   <li>Applies every venue order to its local counterpart, matched by client order ID and then
 *       by venue order ID</li>
 *   <li>Creates shadow orders for open venue orders with no local counterpart: bracket legs of a
 *       known parent are linked to it, anything else is flagged external</li>
 *   <li>Rejects unconfirmed orders the venue still does not know after the grace period</li>
 *   <li>Replaces the position table</li>
 * </ol>
 *
 * <p>All fetching happens before any local change, so a failed poll leaves local state untouched.
 * A failed poll is logged and reported in the result, never thrown; the next cycle tries again.
 * Passes are serialized: a manual trigger waits for a running scheduled pass.
 */
@Service
public class OrderReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(OrderReconciliationService.class);

    static final String NOT_ACKNOWLEDGED = "Not acknowledged by venue";
    static final String EXTERNAL_ID_PREFIX = "ext-";

    private final VenueClient venueClient;
    private final VenueCallExecutor venueCallExecutor;
    private final OrderStateStore orderStateStore;
    private final OrderNormalizer orderNormalizer;
    private final EventPublisherHelper eventPublisherHelper;
    private final GatewayProperties.Reconciliation settings;
    private final Clock clock;
    private final Retry fetchRetry;
    private final ReentrantLock passLock = new ReentrantLock();

    public OrderReconciliationService(
            VenueClient venueClient,
            VenueCallExecutor venueCallExecutor,
            OrderStateStore orderStateStore,
            OrderNormalizer orderNormalizer,
            EventPublisherHelper eventPublisherHelper,
            GatewayProperties properties,
            Clock clock) {
        this.venueClient = venueClient;
        this.venueCallExecutor = venueCallExecutor;
        this.orderStateStore = orderStateStore;
        this.orderNormalizer = orderNormalizer;
        this.eventPublisherHelper = eventPublisherHelper;
        this.settings = properties.getReconciliation();
        this.clock = clock;
        this.fetchRetry = Retry.of(
                "reconciliation-fetch",
                RetryConfig.custom()
                        .maxAttempts(settings.getMaxAttempts())
                        .intervalFunction(IntervalFunction.ofExponentialBackoff(
                                settings.getInitialBackoff(), settings.getBackoffMultiplier()))
                        .retryExceptions(VenueTransportException.class)
                        .build());
    }

    @Scheduled(
            fixedDelayString = "${gateway.reconciliation.interval-ms:30000}",
            initialDelayString = "${gateway.reconciliation.interval-ms:30000}")
    public void scheduledReconciliation() {
        if (!settings.isEnabled()) {
            return;
        }
        reconcile("SCHEDULED");
    }

    /** Triggered on demand. Returns the result for the response body. */
    public ReconciliationResult manualReconcile() {
        return reconcile("MANUAL");
    }

    public ReconciliationResult reconcile(String trigger) {
        passLock.lock();
        try {
            return runPass(trigger);
        } finally {
            passLock.unlock();
        }
    }

    private ReconciliationResult runPass(String trigger) {
        long startTime = clock.millis();
        log.debug("Order reconciliation started: trigger={}", trigger);

        ReconciliationResult result = ReconciliationResult.builder()
                .timestamp(clock.instant())
                .trigger(trigger)
                .build();

        try {
            VenueSnapshot snapshot = fetchSnapshot();
            result.setVenueOrderCount(snapshot.openOrders().size());
            result.setVenuePositionCount(snapshot.positions().size());

            // unconfirmed parents get their venue IDs first, so their bracket legs link to them
            applyUnconfirmedLookups(snapshot, result);
            mergeOrders(snapshot, result);
            rejectStaleUnconfirmed(snapshot, result);
            mergePositions(snapshot, result);
        } catch (VenueException e) {
            log.warn("Order reconciliation failed ({}): {}", trigger, e.getMessage());
            result.setSuccess(false);
            result.setFailureMessage(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Order reconciliation failed unexpectedly ({})", trigger, e);
            result.setSuccess(false);
            result.setFailureMessage(e.getMessage());
        }

        result.setDurationMs(clock.millis() - startTime);
        if (result.hasChanges()) {
            log.info(
                    "Order reconciliation completed: trigger={}, updated={}, shadows={}, trades={}, "
                            + "unconfirmedResolved={}, positionsChanged={}",
                    trigger,
                    result.getOrdersUpdated(),
                    result.getShadowOrdersCreated(),
                    result.getTradesRecorded(),
                    result.getUnconfirmedResolved(),
                    result.isPositionsChanged());
        }
        eventPublisherHelper.publishReconciliation(this, result, !"SCHEDULED".equals(trigger));
        return result;
    }

    // ---- Fetch ----

    private VenueSnapshot fetchSnapshot() {
        List<VenueOrder> openOrders = fetch("list_orders", () -> venueClient.listOrders(VenueOrderQuery.OPEN, null));
        List<VenuePosition> positions = fetch("list_positions", () -> venueClient.listPositions(null));

        Set<String> openVenueIds = new HashSet<>();
        Set<String> openClientIds = new HashSet<>();
        for (VenueOrder venueOrder : openOrders) {
            openVenueIds.add(venueOrder.getId());
            if (venueOrder.getClientOrderId() != null) {
                openClientIds.add(venueOrder.getClientOrderId());
            }
        }

        List<Order> working = orderStateStore.findNonTerminal();
        boolean closedNeeded = working.stream()
                .anyMatch(order -> order.getVenueOrderId() != null
                        && !openVenueIds.contains(order.getVenueOrderId())
                        && !openClientIds.contains(order.getClientOrderId()));
        List<VenueOrder> closedOrders = closedNeeded
                ? fetch("list_orders", () -> venueClient.listOrders(VenueOrderQuery.CLOSED, null))
                : List.of();

        Map<String, Optional<VenueOrder>> unconfirmed = new LinkedHashMap<>();
        for (Order order : working) {
            if (isUnconfirmed(order) && !openClientIds.contains(order.getClientOrderId())) {
                String clientOrderId = order.getClientOrderId();
                unconfirmed.put(
                        clientOrderId,
                        fetch("get_order_by_client_id", () -> venueClient.getOrderByClientId(clientOrderId)));
            }
        }

        return new VenueSnapshot(openOrders, closedOrders, positions, unconfirmed);
    }

    private <T> T fetch(String operation, Supplier<T> venueCall) {
        return Retry.decorateSupplier(fetchRetry, () -> venueCallExecutor.call(operation, venueCall))
                .get();
    }

    // ---- Merge ----

    private void mergeOrders(VenueSnapshot snapshot, ReconciliationResult result) {
        Set<String> seenVenueIds = new HashSet<>();
        for (VenueOrder venueOrder : snapshot.openOrders()) {
            seenVenueIds.add(venueOrder.getId());
            mergeOrder(venueOrder, true, result);
        }
        for (VenueOrder venueOrder : snapshot.closedOrders()) {
            if (seenVenueIds.add(venueOrder.getId())) {
                mergeOrder(venueOrder, false, result);
            }
        }
    }

    private void mergeOrder(VenueOrder venueOrder, boolean open, ReconciliationResult result) {
        Order venueView = orderNormalizer.toDomain(venueOrder);
        Optional<Order> local = matchLocal(venueOrder);

        if (local.isPresent()) {
            boolean wasUnconfirmed = isUnconfirmed(local.get());
            OrderUpdate update = orderStateStore.applyVenueState(local.get().getClientOrderId(), venueView);
            record(update, result);
            if (wasUnconfirmed && update.getOrder().getVenueOrderId() != null) {
                result.setUnconfirmedResolved(result.getUnconfirmedResolved() + 1);
            }
            boolean linked = linkToParent(venueOrder, update.getOrder().getClientOrderId());
            if (linked && !update.isChanged()) {
                result.setOrdersUpdated(result.getOrdersUpdated() + 1);
            }
        } else if (open) {
            createShadow(venueOrder, venueView, result);
        }
    }

    private Optional<Order> matchLocal(VenueOrder venueOrder) {
        if (venueOrder.getClientOrderId() != null) {
            Optional<Order> byClientId = orderStateStore.find(venueOrder.getClientOrderId());
            if (byClientId.isPresent()) {
                return byClientId;
            }
        }
        return orderStateStore.findByVenueOrderId(venueOrder.getId());
    }

    private void createShadow(VenueOrder venueOrder, Order venueView, ReconciliationResult result) {
        String shadowId = venueOrder.getClientOrderId() != null
                ? venueOrder.getClientOrderId()
                : EXTERNAL_ID_PREFIX + venueOrder.getId();
        Optional<Order> parent = venueOrder.getParentOrderId() != null
                ? orderStateStore.findByVenueOrderId(venueOrder.getParentOrderId())
                : Optional.empty();

        Order shadow = venueView.toBuilder()
                .clientOrderId(shadowId)
                .external(parent.isEmpty())
                .strategyTag(parent.map(Order::getStrategyTag).orElse(null))
                .build();
        if (!orderStateStore.insertShadow(shadow)) {
            return;
        }

        OrderUpdate update = orderStateStore.applyVenueState(shadowId, venueView);
        result.setShadowOrdersCreated(result.getShadowOrdersCreated() + 1);
        result.setTradesRecorded(result.getTradesRecorded() + update.getTrades().size());

        if (parent.isPresent()) {
            orderStateStore.link(parent.get().getClientOrderId(), shadowId);
            log.info(
                    "Bracket leg {} ({} {}) linked to order {}",
                    shadowId,
                    venueOrder.getType(),
                    venueOrder.getSymbol(),
                    parent.get().getClientOrderId());
        } else {
            log.warn(
                    "External venue order detected: {} {} {} {} (venueOrderId={})",
                    shadowId,
                    venueOrder.getSide(),
                    venueOrder.getQty(),
                    venueOrder.getSymbol(),
                    venueOrder.getId());
            eventPublisherHelper.publishExternalDetected(this, update.getOrder());
        }
    }

    /**
     * Links a venue-created bracket leg to the local order whose venue ID is its parent.
     *
     * @return true if the link changed either order
     */
    private boolean linkToParent(VenueOrder venueOrder, String clientOrderId) {
        if (venueOrder.getParentOrderId() == null) {
            return false;
        }
        return orderStateStore
                .findByVenueOrderId(venueOrder.getParentOrderId())
                .filter(parent -> !parent.getClientOrderId().equals(clientOrderId))
                .map(parent -> orderStateStore.link(parent.getClientOrderId(), clientOrderId))
                .orElse(false);
    }

    private void applyUnconfirmedLookups(VenueSnapshot snapshot, ReconciliationResult result) {
        for (Map.Entry<String, Optional<VenueOrder>> entry : snapshot.unconfirmed().entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            String clientOrderId = entry.getKey();
            VenueOrder venueOrder = entry.getValue().get();
            OrderUpdate update = orderStateStore.applyVenueState(clientOrderId, orderNormalizer.toDomain(venueOrder));
            record(update, result);
            if (update.getOrder().getVenueOrderId() != null) {
                result.setUnconfirmedResolved(result.getUnconfirmedResolved() + 1);
                log.info(
                        "Unconfirmed order {} found at venue as {} ({})",
                        clientOrderId,
                        venueOrder.getId(),
                        update.getOrder().getStatus());
            }
        }
    }

    private void rejectStaleUnconfirmed(VenueSnapshot snapshot, ReconciliationResult result) {
        Instant cutoff = clock.instant().minus(settings.getUnconfirmedGrace());
        for (Map.Entry<String, Optional<VenueOrder>> entry : snapshot.unconfirmed().entrySet()) {
            if (entry.getValue().isPresent()) {
                continue;
            }
            String clientOrderId = entry.getKey();
            Optional<Order> local = orderStateStore.find(clientOrderId);
            if (local.isEmpty() || !isUnconfirmed(local.get())) {
                continue;
            }
            if (local.get().getPlacedAt() != null && local.get().getPlacedAt().isBefore(cutoff)) {
                OrderUpdate update = orderStateStore.markRejected(clientOrderId, NOT_ACKNOWLEDGED);
                if (update.isStatusChanged()) {
                    result.setUnconfirmedResolved(result.getUnconfirmedResolved() + 1);
                    result.setOrdersUpdated(result.getOrdersUpdated() + 1);
                    log.warn(
                            "Order {} not acknowledged by venue after {}, marked REJECTED",
                            clientOrderId,
                            settings.getUnconfirmedGrace());
                    eventPublisherHelper.publishOrderRejected(this, update.getOrder(), update.getPreviousStatus());
                }
            } else {
                log.debug("Order {} not yet known at venue, within grace period", clientOrderId);
            }
        }
    }

    private void mergePositions(VenueSnapshot snapshot, ReconciliationResult result) {
        List<Position> positions = new ArrayList<>();
        for (VenuePosition venuePosition : snapshot.positions()) {
            Position position = orderNormalizer.toPosition(venuePosition);
            if (position != null && position.getInstrument() != null) {
                positions.add(position);
            }
        }
        result.setPositionsChanged(orderStateStore.replacePositions(positions));
    }

    private void record(OrderUpdate update, ReconciliationResult result) {
        if (!update.isChanged()) {
            return;
        }
        result.setOrdersUpdated(result.getOrdersUpdated() + 1);
        result.setTradesRecorded(result.getTradesRecorded() + update.getTrades().size());

        // the submitting thread publishes the acknowledgement of an in-flight order
        boolean acknowledgement = update.getPreviousStatus() == OrderStatus.PENDING
                && update.getOrder().getStatus() == OrderStatus.SUBMITTED;
        if (update.isStatusChanged() && !acknowledgement) {
            log.info(
                    "Order {} {} -> {} from venue state",
                    update.getOrder().getClientOrderId(),
                    update.getPreviousStatus(),
                    update.getOrder().getStatus());
            eventPublisherHelper.publishStatusChange(this, update.getOrder(), update.getPreviousStatus());
        }
    }

    private static boolean isUnconfirmed(Order order) {
        return order.getStatus() == OrderStatus.SUBMITTED && order.getVenueOrderId() == null;
    }

    /** Everything one pass needs from the venue, fetched before any local change. */
    record VenueSnapshot(
            List<VenueOrder> openOrders,
            List<VenueOrder> closedOrders,
            List<VenuePosition> positions,
            Map<String, Optional<VenueOrder>> unconfirmed) {

        VenueSnapshot {
            Objects.requireNonNull(openOrders);
            Objects.requireNonNull(positions);
        }
    }
}
