package com.ordergateway.oms;

import com.ordergateway.domain.enums.OrderStatus;
import com.ordergateway.domain.enums.OrderType;
import com.ordergateway.domain.model.Order;
import com.ordergateway.domain.model.OrderHandle;
import com.ordergateway.domain.model.Position;
import com.ordergateway.event.EventPublisherHelper;
import com.ordergateway.exception.InvalidOrderException;
import com.ordergateway.exception.OrderNotCancellableException;
import com.ordergateway.exception.ResourceNotFoundException;
import com.ordergateway.exception.RoutingException;
import com.ordergateway.exception.SubmissionRejectedException;
import com.ordergateway.exception.UnknownInstrumentException;
import com.ordergateway.exception.UnsupportedOrderTypeException;
import com.ordergateway.exception.VenueException;
import com.ordergateway.exception.VenueNotFoundException;
import com.ordergateway.exception.VenueTransportException;
import com.ordergateway.instrument.PrecisionResolver;
import com.ordergateway.venue.VenueCallExecutor;
import com.ordergateway.venue.VenueClient;
import com.ordergateway.venue.VenueOrder;
import com.ordergateway.venue.VenueOrderRequest;
import com.ordergateway.venue.mapper.OrderNormalizer;
import java.math.BigDecimal;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single entry point for placing and cancelling orders at the venue.
 *
 * <p>Placement pipeline:
 * <ol>
 *   <li>Assign a client order ID if the caller did not supply one</li>
 *   <li>Duplicate check: a known ID returns the existing handle, nothing is sent</li>
 *   <li>Validate fields and prices locally, derive the size of CLOSE orders from the local
 *       position, round the size (the only step that may query the venue)</li>
 *   <li>Normalize to a venue request</li>
 *   <li>Reserve the ID as PENDING in {@link OrderStateStore}; losing that race is a duplicate too</li>
 *   <li>Submit through {@link VenueCallExecutor}, with no lock held</li>
 *   <li>Record the outcome: SUBMITTED with the venue ID, REJECTED, or SUBMITTED without a venue ID
 *       when the outcome is unknown</li>
 * </ol>
 *
 * <p>Reserving before submitting is what makes submission at-most-once per client order ID:
 * a second caller with the same ID always finds the reservation.
 */
@Service
public class OrderRouter {

    private static final Logger log = LoggerFactory.getLogger(OrderRouter.class);

    private final OrderStateStore orderStateStore;
    private final VenueClient venueClient;
    private final VenueCallExecutor venueCallExecutor;
    private final OrderNormalizer orderNormalizer;
    private final PrecisionResolver precisionResolver;
    private final ClientOrderIdGenerator clientOrderIdGenerator;
    private final EventPublisherHelper eventPublisherHelper;

    public OrderRouter(
            OrderStateStore orderStateStore,
            VenueClient venueClient,
            VenueCallExecutor venueCallExecutor,
            OrderNormalizer orderNormalizer,
            PrecisionResolver precisionResolver,
            ClientOrderIdGenerator clientOrderIdGenerator,
            EventPublisherHelper eventPublisherHelper) {
        this.orderStateStore = orderStateStore;
        this.venueClient = venueClient;
        this.venueCallExecutor = venueCallExecutor;
        this.orderNormalizer = orderNormalizer;
        this.precisionResolver = precisionResolver;
        this.clientOrderIdGenerator = clientOrderIdGenerator;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * Places an order at the venue, at most once per client order ID.
     *
     * @return handle of the new order, or of the existing one (with {@code replayed=true}) for a known ID
     * @throws InvalidOrderException if the order fails local validation; nothing is recorded
     * @throws UnsupportedOrderTypeException if the order has no type
     * @throws UnknownInstrumentException if the venue does not list the instrument
     * @throws SubmissionRejectedException if the venue declined the order; it is recorded REJECTED
     * @throws RoutingException if the outcome is unknown; the order stays SUBMITTED until reconciled
     */
    public OrderHandle place(Order request) {
        Order order = request.copy();
        if (order.getClientOrderId() == null || order.getClientOrderId().isBlank()) {
            order.setClientOrderId(clientOrderIdGenerator.generate(order.getStrategyTag()));
        }
        String clientOrderId = order.getClientOrderId();

        Optional<Order> existing = orderStateStore.find(clientOrderId);
        if (existing.isPresent()) {
            return replay(existing.get());
        }

        Order prepared = prepare(order);
        VenueOrderRequest venueRequest = orderNormalizer.toVenueRequest(prepared);

        Optional<Order> raced = orderStateStore.reserve(prepared);
        if (raced.isPresent()) {
            return replay(raced.get());
        }

        return submit(clientOrderId, venueRequest);
    }

    /**
     * Cancels an order. Cancelling a terminal order is a successful no-op, including one the
     * venue refuses to cancel because it has already filled or been cancelled there.
     *
     * @throws ResourceNotFoundException if the client order ID is unknown
     * @throws OrderNotCancellableException if the venue has not acknowledged the order yet
     * @throws SubmissionRejectedException if the venue refused the cancel of a working order
     * @throws RoutingException if the cancel could not be delivered
     */
    public OrderHandle cancel(String clientOrderId) {
        Order order = orderStateStore
                .find(clientOrderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", clientOrderId));

        if (order.getStatus().isTerminal()) {
            log.info("Cancel of {} ignored, order already {}", clientOrderId, order.getStatus());
            return OrderHandle.of(order);
        }
        if (order.getVenueOrderId() == null) {
            throw new OrderNotCancellableException(
                    clientOrderId,
                    order.getStatus() == OrderStatus.PENDING
                            ? "submission still in flight"
                            : "not yet acknowledged by the venue");
        }

        String venueOrderId = order.getVenueOrderId();
        try {
            venueCallExecutor.run("cancel_order", () -> venueClient.cancelOrder(venueOrderId));
        } catch (VenueTransportException e) {
            log.warn("Cancel of {} not delivered: {}", clientOrderId, e.getMessage());
            throw new RoutingException(clientOrderId, "Cancel of " + clientOrderId + " not delivered", e);
        } catch (VenueException e) {
            // the order may have completed at the venue since the last reconciliation pass
            Order latest = settleFromVenue(clientOrderId).orElse(order);
            if (latest.getStatus().isTerminal()) {
                log.info("Cancel of {} refused by venue, order already {}", clientOrderId, latest.getStatus());
                return OrderHandle.of(latest);
            }
            log.warn("Venue refused cancel of {}: {}", clientOrderId, e.getMessage());
            throw new SubmissionRejectedException(
                    clientOrderId, "Venue refused cancel of " + clientOrderId + ": " + e.getMessage(), e);
        }

        OrderUpdate update = orderStateStore.markCancelled(clientOrderId);
        if (update.isStatusChanged()) {
            log.info("Order {} cancelled (was {})", clientOrderId, update.getPreviousStatus());
            eventPublisherHelper.publishOrderCancelled(this, update.getOrder(), update.getPreviousStatus());
        }
        return OrderHandle.of(update.getOrder());
    }

    /**
     * Fetches the venue's record of an order and merges it into the store, so that a fill the
     * venue completed before the next reconciliation pass is visible now.
     */
    private Optional<Order> settleFromVenue(String clientOrderId) {
        Optional<VenueOrder> venueOrder;
        try {
            venueOrder = venueCallExecutor.call(
                    "get_order_by_client_id", () -> venueClient.getOrderByClientId(clientOrderId));
        } catch (VenueException e) {
            log.warn("Could not look up {} at the venue: {}", clientOrderId, e.getMessage());
            return orderStateStore.find(clientOrderId);
        }
        if (venueOrder.isEmpty()) {
            return orderStateStore.find(clientOrderId);
        }

        OrderUpdate update =
                orderStateStore.applyVenueState(clientOrderId, orderNormalizer.toDomain(venueOrder.get()));
        if (update.isStatusChanged()) {
            log.info(
                    "Order {} {} -> {} from venue state",
                    clientOrderId,
                    update.getPreviousStatus(),
                    update.getOrder().getStatus());
            eventPublisherHelper.publishStatusChange(this, update.getOrder(), update.getPreviousStatus());
        }
        return Optional.of(update.getOrder());
    }

    private OrderHandle submit(String clientOrderId, VenueOrderRequest venueRequest) {
        try {
            String venueOrderId =
                    venueCallExecutor.call("submit_order", () -> venueClient.submitOrder(venueRequest));
            OrderUpdate update = orderStateStore.markSubmitted(clientOrderId, venueOrderId);
            log.info(
                    "Order {} submitted to {}: {} {} {} venueOrderId={}",
                    clientOrderId,
                    venueClient.venueName(),
                    venueRequest.getSide(),
                    venueRequest.getQty(),
                    venueRequest.getSymbol(),
                    venueOrderId);
            eventPublisherHelper.publishOrderSubmitted(this, update.getOrder());
            return OrderHandle.of(update.getOrder());
        } catch (VenueTransportException e) {
            OrderUpdate update = orderStateStore.markUnconfirmed(clientOrderId);
            log.warn("Submission of {} unconfirmed, leaving for reconciliation: {}", clientOrderId, e.getMessage());
            eventPublisherHelper.publishOrderUnconfirmed(this, update.getOrder());
            throw new RoutingException(clientOrderId, "Submission outcome unknown for " + clientOrderId, e);
        } catch (VenueException e) {
            OrderUpdate update = orderStateStore.markRejected(clientOrderId, e.getMessage());
            log.warn("Venue rejected order {}: {}", clientOrderId, e.getMessage());
            eventPublisherHelper.publishOrderRejected(this, update.getOrder(), update.getPreviousStatus());
            throw new SubmissionRejectedException(
                    clientOrderId, "Venue rejected order " + clientOrderId + ": " + e.getMessage(), e);
        }
    }

    private OrderHandle replay(Order existing) {
        log.info(
                "Duplicate place for {} suppressed, returning existing order ({})",
                existing.getClientOrderId(),
                existing.getStatus());
        eventPublisherHelper.publishDuplicateSuppressed(this, existing);
        return OrderHandle.replayed(existing);
    }

    /** Validates the order and returns it with its final, rounded size. */
    private Order prepare(Order order) {
        if (order.getInstrument() == null || order.getInstrument().isBlank()) {
            throw new InvalidOrderException("Order " + order.getClientOrderId() + " has no instrument");
        }
        if (order.getType() == null) {
            throw new UnsupportedOrderTypeException(null);
        }
        if (order.getSide() == null) {
            throw new InvalidOrderException("Order " + order.getClientOrderId() + " has no direction");
        }

        if ((order.getType() == OrderType.LIMIT || order.getType() == OrderType.STOP_LIMIT)
                && order.getLimitPrice() == null) {
            throw new InvalidOrderException("Order " + order.getClientOrderId() + " requires a limit price");
        }
        if (order.getType() == OrderType.STOP_LIMIT && order.getStopPrice() == null) {
            throw new InvalidOrderException("Order " + order.getClientOrderId() + " requires a stop price");
        }

        BigDecimal size = order.getSize();
        if (order.getType() == OrderType.CLOSE && size == null) {
            size = openUnits(order);
        }
        if (size == null || size.signum() <= 0) {
            throw new InvalidOrderException("Order size must be positive, got " + size);
        }

        BigDecimal rounded = roundSize(order.getInstrument(), size);
        if (rounded.signum() <= 0) {
            throw new InvalidOrderException(
                    "Order size " + size + " rounds to zero for " + order.getInstrument());
        }
        if (rounded.compareTo(size) != 0) {
            log.debug("Rounded size of {} from {} to {}", order.getClientOrderId(), size, rounded);
        }
        order.setSize(rounded);
        return order;
    }

    /** Units held on the side a CLOSE order closes: direction +1 closes the long side. */
    private BigDecimal openUnits(Order order) {
        Optional<Position> position = orderStateStore.findPosition(order.getInstrument());
        BigDecimal units = position
                .map(p -> order.getDirection() > 0 ? p.getLongUnits() : p.getShortUnits())
                .orElse(BigDecimal.ZERO);
        if (units.signum() <= 0) {
            throw new InvalidOrderException("No " + (order.getDirection() > 0 ? "long" : "short")
                    + " position in " + order.getInstrument() + " to close");
        }
        return units;
    }

    private BigDecimal roundSize(String instrument, BigDecimal size) {
        try {
            return precisionResolver.roundSize(instrument, size);
        } catch (VenueNotFoundException e) {
            throw new UnknownInstrumentException(instrument);
        } catch (VenueException e) {
            throw new RoutingException("Could not resolve precision for " + instrument, e);
        }
    }
}
