package com.ordergateway.config;

import com.ordergateway.domain.enums.BalanceSource;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the order gateway.
 *
 * <p>Binds to the {@code gateway.*} prefix in application.yml. Groups:
 * <ul>
 *   <li>{@code venue}: call timeout and the executor that runs venue calls</li>
 *   <li>{@code reconciliation}: poll interval, fetch retry and the grace period for
 *       submissions the venue never acknowledged</li>
 *   <li>{@code precision}: precision cache sizing</li>
 *   <li>{@code account}: which account figure {@code getBalance} reports</li>
 *   <li>{@code paper}: assets, marks and starting cash of the in-memory venue</li>
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "gateway")
@Getter
@Setter
public class GatewayProperties {

    /** Prefix of generated client order IDs. */
    private String orderIdPrefix = "GW";

    private Venue venue = new Venue();

    private Reconciliation reconciliation = new Reconciliation();

    private Precision precision = new Precision();

    private Account account = new Account();

    private Paper paper = new Paper();

    @Getter
    @Setter
    public static class Venue {

        /** Hard timeout of a single venue call. */
        private Duration callTimeout = Duration.ofSeconds(5);

        /** Threads available for concurrent venue calls. */
        private int executorPoolSize = 4;

        private int queueCapacity = 100;
    }

    @Getter
    @Setter
    public static class Reconciliation {

        /** Whether the scheduled poll runs. Manual reconciliation works either way. */
        private boolean enabled = true;

        /** Delay between the end of one scheduled poll and the start of the next. */
        private long intervalMs = 30000;

        /** Attempts per venue fetch, including the first. */
        private int maxAttempts = 3;

        private Duration initialBackoff = Duration.ofMillis(500);

        private double backoffMultiplier = 2.0;

        /**
         * How long an order may stay submitted without a venue ID before a poll that still
         * cannot find it at the venue marks it rejected.
         */
        private Duration unconfirmedGrace = Duration.ofMinutes(2);
    }

    @Getter
    @Setter
    public static class Precision {

        private long cacheMaximumSize = 10000;

        /** Decimal places for fractionable assets that report no minimum increment. */
        private int defaultFractionalScale = 9;
    }

    @Getter
    @Setter
    public static class Account {

        private BalanceSource balanceSource = BalanceSource.EQUITY;
    }

    @Getter
    @Setter
    public static class Paper {

        private BigDecimal startingCash = new BigDecimal("100000");

        private String currency = "USD";

        /** Tradable instruments keyed by symbol. */
        private Map<String, PaperAsset> assets = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class PaperAsset {

        private boolean fractionable = false;

        private BigDecimal minTradeIncrement;

        /** Initial mark price. Market orders stay working until a mark is known. */
        private BigDecimal markPrice;
    }
}
