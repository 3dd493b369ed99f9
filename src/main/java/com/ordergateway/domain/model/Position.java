package com.ordergateway.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Venue position in one instrument, split into long and short legs.
 *
 * <p>Positions are replaced wholesale from venue state on every reconciliation pass and
 * are never mutated locally. A venue that nets positions reports at most one non-zero side.
 */
@Value
@Builder
public class Position {

    String instrument;

    @Builder.Default
    BigDecimal longUnits = BigDecimal.ZERO;

    /** Unrealised P&L of the long side. Null when the venue does not report it. */
    BigDecimal longPnl;

    @Builder.Default
    BigDecimal shortUnits = BigDecimal.ZERO;

    /** Unrealised P&L of the short side. Null when the venue does not report it. */
    BigDecimal shortPnl;

    BigDecimal averageEntryPrice;
    BigDecimal currentPrice;
    BigDecimal marketValue;

    /** Long units minus short units. */
    public BigDecimal getNetUnits() {
        return longUnits.subtract(shortUnits);
    }
}
