package com.ordergateway.oms;

import com.ordergateway.domain.enums.OrderStatus;
import com.ordergateway.domain.model.Order;
import com.ordergateway.domain.model.Position;
import com.ordergateway.domain.model.Trade;
import com.ordergateway.exception.ResourceNotFoundException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Single owner of the session's order, trade and position tables.
 *
 * <p>All state sits behind one {@link ReentrantReadWriteLock}. Every mutation re-reads the
 * current record under the write lock and checks the requested status change with
 * {@link OrderStatus#canTransitionTo}, so a reconciliation merge and a direct cancel can
 * interleave without lost updates: whichever terminal status lands first wins and the other
 * is refused. Nothing here calls the venue or publishes events.
 *
 * <p>Reads always return copies; callers can never mutate stored records.
 *
 * <p>{@code updatedAt} moves only when a mutation actually changes something, which keeps
 * repeated reconciliation against unchanged venue state a true no-op.
 */
@Component
public class OrderStateStore {

    private static final Logger log = LoggerFactory.getLogger(OrderStateStore.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /** Keyed by client order ID, in insertion order. */
    private final Map<String, Order> orders = new LinkedHashMap<>();

    /** Venue order ID to client order ID. */
    private final Map<String, String> venueOrderIndex = new HashMap<>();

    private final Map<String, Trade> trades = new LinkedHashMap<>();

    /** Number of fill increments recorded per client order ID, used for trade IDs. */
    private final Map<String, Integer> fillCounts = new HashMap<>();

    private final Map<String, Position> positions = new TreeMap<>();

    private final Clock clock;

    public OrderStateStore(Clock clock) {
        this.clock = clock;
    }

    // ---- Order reads ----

    public Optional<Order> find(String clientOrderId) {
        return read(() -> Optional.ofNullable(orders.get(clientOrderId)).map(Order::copy));
    }

    public Optional<Order> findByVenueOrderId(String venueOrderId) {
        return read(() -> Optional.ofNullable(venueOrderIndex.get(venueOrderId))
                .map(orders::get)
                .map(Order::copy));
    }

    /** @param instrument optional filter, null for all */
    public List<Order> findAll(String instrument) {
        return read(() -> orders.values().stream()
                .filter(order -> instrument == null || instrument.equals(order.getInstrument()))
                .map(Order::copy)
                .toList());
    }

    public List<Order> findNonTerminal() {
        return read(() -> orders.values().stream()
                .filter(order -> !order.getStatus().isTerminal())
                .map(Order::copy)
                .toList());
    }

    // ---- Order mutations from place/cancel ----

    /**
     * Records a new order as PENDING unless its client order ID is already known.
     *
     * @return the existing order when the ID was already taken, empty when the order was recorded
     */
    public Optional<Order> reserve(Order order) {
        return write(() -> {
            Order existing = orders.get(order.getClientOrderId());
            if (existing != null) {
                return Optional.of(existing.copy());
            }
            Instant now = clock.instant();
            Order record = order.copy();
            record.setStatus(OrderStatus.PENDING);
            record.setVenueOrderId(null);
            record.setFilledSize(BigDecimal.ZERO);
            record.setAverageFillPrice(null);
            record.setPlacedAt(now);
            record.setUpdatedAt(now);
            orders.put(record.getClientOrderId(), record);
            return Optional.empty();
        });
    }

    /** Records the venue's acknowledgement of a submission. */
    public OrderUpdate markSubmitted(String clientOrderId, String venueOrderId) {
        return write(() -> {
            Order current = require(clientOrderId);
            OrderStatus previous = current.getStatus();
            boolean changed = assignVenueOrderId(current, venueOrderId);
            boolean statusChanged = transition(current, OrderStatus.SUBMITTED, "venue acknowledgement");
            return finish(current, previous, statusChanged, changed || statusChanged, List.of());
        });
    }

    /**
     * Moves a PENDING order to SUBMITTED without a venue ID after a transport failure or timeout.
     * Reconciliation settles whether the venue has it.
     */
    public OrderUpdate markUnconfirmed(String clientOrderId) {
        return write(() -> {
            Order current = require(clientOrderId);
            OrderStatus previous = current.getStatus();
            if (previous != OrderStatus.PENDING) {
                // reconciliation already observed the venue's view
                return OrderUpdate.unchanged(current.copy());
            }
            boolean statusChanged = transition(current, OrderStatus.SUBMITTED, "unconfirmed submission");
            return finish(current, previous, statusChanged, statusChanged, List.of());
        });
    }

    public OrderUpdate markRejected(String clientOrderId, String reason) {
        return write(() -> {
            Order current = require(clientOrderId);
            OrderStatus previous = current.getStatus();
            boolean statusChanged = transition(current, OrderStatus.REJECTED, reason);
            if (statusChanged) {
                current.setRejectionReason(reason);
            }
            return finish(current, previous, statusChanged, statusChanged, List.of());
        });
    }

    /** Applies a venue-confirmed cancel. Refused (and logged) if the order reached a terminal status first. */
    public OrderUpdate markCancelled(String clientOrderId) {
        return write(() -> {
            Order current = require(clientOrderId);
            OrderStatus previous = current.getStatus();
            boolean statusChanged = transition(current, OrderStatus.CANCELLED, "cancel confirmed");
            return finish(current, previous, statusChanged, statusChanged, List.of());
        });
    }

    // ---- Order mutations from reconciliation ----

    /**
     * Merges the venue's view of an order into the local record. Venue ID, filled size, average
     * fill price and status are authoritative; local metadata (strategy tag, related orders,
     * bracket prices) is untouched.
     *
     * <p>Each increase of the filled size records one {@link Trade}. Its price is the one that
     * explains the change in average fill price: {@code (newAvg*newFilled - oldAvg*oldFilled) / delta}.
     *
     * <p>Terminal orders are never modified.
     *
     * @param venueView the normalized venue order; null fields mean "not reported" and are ignored
     */
    public OrderUpdate applyVenueState(String clientOrderId, Order venueView) {
        return write(() -> {
            Order current = require(clientOrderId);
            OrderStatus previous = current.getStatus();
            if (previous.isTerminal()) {
                return OrderUpdate.unchanged(current.copy());
            }

            boolean changed = assignVenueOrderId(current, venueView.getVenueOrderId());
            List<Trade> recorded = new ArrayList<>();

            BigDecimal venueFilled = venueView.getFilledSize();
            BigDecimal localFilled = current.getFilledSize() != null ? current.getFilledSize() : BigDecimal.ZERO;
            if (venueFilled != null && venueFilled.compareTo(localFilled) > 0) {
                Trade trade = recordFill(current, localFilled, venueFilled, venueView);
                recorded.add(trade);
                current.setFilledSize(venueFilled);
                if (venueView.getAverageFillPrice() != null) {
                    current.setAverageFillPrice(venueView.getAverageFillPrice());
                }
                changed = true;
            } else if (venueFilled != null && venueFilled.compareTo(localFilled) < 0) {
                log.warn(
                        "Venue reports filled size {} below local {} for order {}, keeping local",
                        venueFilled,
                        localFilled,
                        clientOrderId);
            } else if (venueView.getAverageFillPrice() != null && current.getAverageFillPrice() == null) {
                current.setAverageFillPrice(venueView.getAverageFillPrice());
                changed = true;
            }

            boolean statusChanged = false;
            OrderStatus venueStatus = venueView.getStatus();
            if (venueStatus != null && venueStatus != current.getStatus()) {
                statusChanged = transition(current, venueStatus, "venue state");
                changed |= statusChanged;
            }

            return finish(current, previous, statusChanged, changed, recorded);
        });
    }

    /**
     * Inserts a PENDING placeholder for a venue order the gateway has no record of. The caller
     * follows up with {@link #applyVenueState} so that fills already on the venue become trades.
     *
     * @return false if a record with that client order ID already exists
     */
    public boolean insertShadow(Order shadow) {
        return write(() -> {
            if (orders.containsKey(shadow.getClientOrderId())) {
                return false;
            }
            Instant now = clock.instant();
            Order record = shadow.copy();
            record.setStatus(OrderStatus.PENDING);
            record.setVenueOrderId(null);
            record.setFilledSize(BigDecimal.ZERO);
            record.setAverageFillPrice(null);
            record.setPlacedAt(shadow.getPlacedAt() != null ? shadow.getPlacedAt() : now);
            record.setUpdatedAt(now);
            orders.put(record.getClientOrderId(), record);
            return true;
        });
    }

    /**
     * Links a bracket leg to its parent in both directions. The leg inherits the parent's strategy
     * tag when it has none and stops being external.
     *
     * @return true if anything changed
     */
    public boolean link(String parentClientOrderId, String childClientOrderId) {
        return write(() -> {
            Order parent = require(parentClientOrderId);
            Order child = require(childClientOrderId);
            boolean changed = parent.getRelatedOrders().add(childClientOrderId);
            if (changed) {
                parent.setUpdatedAt(clock.instant());
            }
            boolean childChanged = child.getRelatedOrders().add(parentClientOrderId);
            if (!parentClientOrderId.equals(child.getParentOrderId())) {
                child.setParentOrderId(parentClientOrderId);
                childChanged = true;
            }
            if (child.getStrategyTag() == null && parent.getStrategyTag() != null) {
                child.setStrategyTag(parent.getStrategyTag());
                childChanged = true;
            }
            // a leg adopted before its parent was known is no longer external
            if (child.isExternal()) {
                child.setExternal(false);
                childChanged = true;
            }
            if (childChanged) {
                child.setUpdatedAt(clock.instant());
            }
            return changed || childChanged;
        });
    }

    // ---- Trades ----

    /** @param instrument optional filter, null for all */
    public List<Trade> findTrades(String instrument) {
        return read(() -> trades.values().stream()
                .filter(trade -> instrument == null || instrument.equals(trade.getInstrument()))
                .toList());
    }

    public Optional<Trade> findTrade(String tradeId) {
        return read(() -> Optional.ofNullable(trades.get(tradeId)));
    }

    // ---- Positions ----

    /** @param instrument optional filter, null for all */
    public List<Position> findPositions(String instrument) {
        return read(() -> positions.values().stream()
                .filter(position -> instrument == null || instrument.equals(position.getInstrument()))
                .toList());
    }

    public Optional<Position> findPosition(String instrument) {
        return read(() -> Optional.ofNullable(positions.get(instrument)));
    }

    /**
     * Replaces the position table with the venue's positions.
     *
     * @return true if the table differs from before
     */
    public boolean replacePositions(List<Position> venuePositions) {
        return write(() -> {
            Map<String, Position> replacement = new TreeMap<>();
            for (Position position : venuePositions) {
                replacement.put(position.getInstrument(), position);
            }
            if (replacement.equals(positions)) {
                return false;
            }
            positions.clear();
            positions.putAll(replacement);
            return true;
        });
    }

    // ---- Internals (call with the write lock held) ----

    private Order require(String clientOrderId) {
        Order order = orders.get(clientOrderId);
        if (order == null) {
            throw new ResourceNotFoundException("Order", clientOrderId);
        }
        return order;
    }

    private boolean assignVenueOrderId(Order order, String venueOrderId) {
        if (venueOrderId == null || venueOrderId.equals(order.getVenueOrderId())) {
            return false;
        }
        if (order.getVenueOrderId() != null) {
            log.warn(
                    "Order {} already has venue ID {}, ignoring {}",
                    order.getClientOrderId(),
                    order.getVenueOrderId(),
                    venueOrderId);
            return false;
        }
        order.setVenueOrderId(venueOrderId);
        venueOrderIndex.put(venueOrderId, order.getClientOrderId());
        return true;
    }

    private boolean transition(Order order, OrderStatus target, String cause) {
        if (order.getStatus() == target) {
            return false;
        }
        if (!order.getStatus().canTransitionTo(target)) {
            log.warn(
                    "Refused transition {} -> {} for order {} ({})",
                    order.getStatus(),
                    target,
                    order.getClientOrderId(),
                    cause);
            return false;
        }
        log.debug("Order {} {} -> {} ({})", order.getClientOrderId(), order.getStatus(), target, cause);
        order.setStatus(target);
        return true;
    }

    private Trade recordFill(Order order, BigDecimal previousFilled, BigDecimal newFilled, Order venueView) {
        BigDecimal delta = newFilled.subtract(previousFilled);
        int sequence = fillCounts.merge(order.getClientOrderId(), 1, Integer::sum);
        Trade trade = Trade.builder()
                .id(order.getClientOrderId() + "-F" + sequence)
                .orderId(order.getClientOrderId())
                .instrument(order.getInstrument())
                .side(order.getSide())
                .size(delta)
                .fillPrice(incrementPrice(
                        order.getAverageFillPrice(), previousFilled, venueView.getAverageFillPrice(), newFilled))
                .filledAt(venueView.getUpdatedAt() != null ? venueView.getUpdatedAt() : clock.instant())
                .strategyTag(order.getStrategyTag())
                .build();
        trades.put(trade.getId(), trade);
        log.info(
                "Recorded fill {} of {} {} @ {} for order {}",
                trade.getId(),
                delta,
                order.getInstrument(),
                trade.getFillPrice(),
                order.getClientOrderId());
        return trade;
    }

    /** Price of the latest fill increment, recovered from the change in average fill price. */
    static BigDecimal incrementPrice(
            BigDecimal previousAverage, BigDecimal previousFilled, BigDecimal newAverage, BigDecimal newFilled) {
        if (newAverage == null) {
            return previousAverage;
        }
        if (previousAverage == null || previousFilled.signum() == 0) {
            return newAverage;
        }
        BigDecimal delta = newFilled.subtract(previousFilled);
        return newAverage
                .multiply(newFilled)
                .subtract(previousAverage.multiply(previousFilled))
                .divide(delta, MathContext.DECIMAL64);
    }

    private OrderUpdate finish(
            Order order, OrderStatus previous, boolean statusChanged, boolean changed, List<Trade> recorded) {
        if (changed) {
            order.setUpdatedAt(clock.instant());
        }
        return new OrderUpdate(order.copy(), previous, statusChanged, changed, List.copyOf(recorded));
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
