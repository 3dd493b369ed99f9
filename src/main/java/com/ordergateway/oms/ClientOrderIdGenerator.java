package com.ordergateway.oms;

import com.ordergateway.config.GatewayProperties;
import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Generates client order IDs for orders placed without one.
 *
 * <p>Format: {@code {prefix}-{strategy_3}-{session}-{seq_6}}, e.g. "GW-MOM-lq3k9z1a-000042".
 * The session token is the gateway's start time in base 36, so IDs from a restarted gateway
 * never collide with IDs a venue still remembers from an earlier session. The sequence is
 * shared across strategies and never wraps.
 */
@Component
public class ClientOrderIdGenerator {

    static final String NO_STRATEGY = "GEN";

    private final String prefix;
    private final String sessionToken;
    private final AtomicLong sequence = new AtomicLong();

    public ClientOrderIdGenerator(GatewayProperties properties, Clock clock) {
        this.prefix = properties.getOrderIdPrefix();
        this.sessionToken = Long.toString(clock.millis(), 36);
    }

    public String generate(String strategyTag) {
        return String.format(
                "%s-%s-%s-%06d", prefix, strategyPrefix(strategyTag), sessionToken, sequence.incrementAndGet());
    }

    /** First three alphanumeric characters of the tag, upper-cased, padded with X. */
    private String strategyPrefix(String strategyTag) {
        if (strategyTag == null) {
            return NO_STRATEGY;
        }
        String cleaned = strategyTag.replaceAll("[^A-Za-z0-9]", "").toUpperCase(Locale.ROOT);
        if (cleaned.isEmpty()) {
            return NO_STRATEGY;
        }
        if (cleaned.length() >= 3) {
            return cleaned.substring(0, 3);
        }
        return (cleaned + "XXX").substring(0, 3);
    }
}
