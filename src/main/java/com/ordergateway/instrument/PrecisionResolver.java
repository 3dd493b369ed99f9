package com.ordergateway.instrument;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.ordergateway.config.GatewayProperties;
import com.ordergateway.exception.UnknownInstrumentException;
import com.ordergateway.venue.VenueAsset;
import com.ordergateway.venue.VenueCallExecutor;
import com.ordergateway.venue.VenueClient;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves how many decimal places an instrument's order size may carry.
 *
 * <p>The venue's asset metadata is fetched once per instrument and memoized in a Caffeine
 * cache with no time-based expiry. Entries change only through {@link #refresh(String)} or
 * {@link #refreshAll()}.
 *
 * <p>Precision rules:
 * <ul>
 *   <li>non-fractionable instrument: 0</li>
 *   <li>fractionable with a minimum increment: the increment's decimal places (0.001 gives 3,
 *       an increment coarser than 1 gives 0)</li>
 *   <li>fractionable without an increment: {@code gateway.precision.default-fractional-scale}</li>
 * </ul>
 *
 * <p>Failed lookups are not cached, so an unknown instrument is re-checked on the next call.
 */
@Service
public class PrecisionResolver {

    private static final Logger log = LoggerFactory.getLogger(PrecisionResolver.class);

    private final VenueClient venueClient;
    private final VenueCallExecutor venueCallExecutor;
    private final int defaultFractionalScale;
    private final Cache<String, Integer> precisionCache;

    public PrecisionResolver(
            VenueClient venueClient, VenueCallExecutor venueCallExecutor, GatewayProperties properties) {
        this.venueClient = venueClient;
        this.venueCallExecutor = venueCallExecutor;
        this.defaultFractionalScale = properties.getPrecision().getDefaultFractionalScale();
        this.precisionCache = Caffeine.newBuilder()
                .maximumSize(properties.getPrecision().getCacheMaximumSize())
                .build();
    }

    /**
     * Returns the instrument's precision, querying the venue on first use.
     *
     * @throws UnknownInstrumentException if the venue does not list the instrument
     */
    public int precision(String instrument) {
        return precisionCache.get(instrument, this::fetchPrecision);
    }

    /** Rounds a size to the instrument's precision, half-even. Rounding a rounded value is a no-op. */
    public BigDecimal roundSize(String instrument, BigDecimal units) {
        return units.setScale(precision(instrument), RoundingMode.HALF_EVEN);
    }

    public void refresh(String instrument) {
        precisionCache.invalidate(instrument);
        log.info("Precision cache entry invalidated for {}", instrument);
    }

    public void refreshAll() {
        precisionCache.invalidateAll();
        log.info("Precision cache cleared");
    }

    private Integer fetchPrecision(String instrument) {
        VenueAsset asset = venueCallExecutor
                .call("get_asset", () -> venueClient.getAsset(instrument))
                .orElseThrow(() -> new UnknownInstrumentException(instrument));

        int precision;
        if (!asset.isFractionable()) {
            precision = 0;
        } else if (asset.getMinTradeIncrement() == null) {
            precision = defaultFractionalScale;
        } else {
            precision = Math.max(0, asset.getMinTradeIncrement().stripTrailingZeros().scale());
        }
        log.debug("Resolved precision {} for {} (fractionable={})", precision, instrument, asset.isFractionable());
        return precision;
    }
}
