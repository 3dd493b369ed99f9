package com.ordergateway.venue;

import com.ordergateway.domain.enums.VenueOrderQuery;
import java.util.List;
import java.util.Optional;

/**
 * Capability interface over one trading venue's wire protocol. Every component that talks to
 * a venue goes through this interface, never through vendor SDK classes.
 *
 * <p>Implementations hold no order state of their own on behalf of the gateway: each call is a
 * plain request/response. They signal failures with the {@link com.ordergateway.exception.VenueException}
 * hierarchy:
 * <ul>
 *   <li>{@code VenueRejectedException}: the venue declined the request</li>
 *   <li>{@code VenueNotFoundException}: the referenced order does not exist at the venue</li>
 *   <li>{@code VenueTransportException}: the request did not complete</li>
 * </ul>
 *
 * <p>Calls may block; the gateway always invokes them through {@link VenueCallExecutor},
 * which bounds them with a timeout.
 */
public interface VenueClient {

    /** Short name used in logs and metrics, e.g. "paper". */
    String venueName();

    /**
     * Submits a new order.
     *
     * @return the venue-assigned order ID
     */
    String submitOrder(VenueOrderRequest request);

    /** Requests cancellation of a working order. Returning normally means the venue accepted the cancel. */
    void cancelOrder(String venueOrderId);

    /**
     * Lists orders by status.
     *
     * @param instrument optional symbol filter, null for all
     */
    List<VenueOrder> listOrders(VenueOrderQuery status, String instrument);

    /** Looks up an order by the client order ID it was submitted with. */
    Optional<VenueOrder> getOrderByClientId(String clientOrderId);

    /** @param instrument optional symbol filter, null for all */
    List<VenuePosition> listPositions(String instrument);

    VenueAccount getAccount();

    /** Asset metadata, or empty when the venue does not list the instrument. */
    Optional<VenueAsset> getAsset(String instrument);
}
