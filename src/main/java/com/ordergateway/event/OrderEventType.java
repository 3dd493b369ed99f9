package com.ordergateway.event;

/**
 * Classifies the order state change that triggered an {@link OrderEvent}.
 */
public enum OrderEventType {

    /** The venue acknowledged the order and assigned a venue order ID. */
    SUBMITTED,

    /** Submission outcome unknown (transport failure or timeout); left for reconciliation. */
    UNCONFIRMED,

    /** Filled size increased but the order is still working. */
    PARTIALLY_FILLED,

    FILLED,

    CANCELLED,

    /** Declined by the venue, or never acknowledged within the grace period. */
    REJECTED,

    /** Reconciliation found a venue order the gateway did not place. */
    EXTERNAL_DETECTED,

    /** A place request reused a known client order ID and was answered from local state. */
    DUPLICATE_SUPPRESSED
}
