package com.ordergateway.domain.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of one reconciliation pass.
 *
 * <p>A failed pass (venue unreachable after retries) has {@code success=false} and a
 * failureMessage; local state is left untouched in that case.
 */
@Data
@Builder
public class ReconciliationResult {

    private Instant timestamp;
    private String trigger;

    private int venueOrderCount;
    private int venuePositionCount;

    private int ordersUpdated;
    private int shadowOrdersCreated;
    private int tradesRecorded;
    private int unconfirmedResolved;
    private boolean positionsChanged;

    @Builder.Default
    private boolean success = true;

    private String failureMessage;
    private long durationMs;

    public boolean hasChanges() {
        return ordersUpdated > 0 || shadowOrdersCreated > 0 || tradesRecorded > 0 || positionsChanged;
    }
}
