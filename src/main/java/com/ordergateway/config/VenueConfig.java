package com.ordergateway.config;

import com.ordergateway.simulator.PaperVenueClient;
import com.ordergateway.venue.VenueCallExecutor;
import com.ordergateway.venue.VenueClient;
import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the venue boundary: the executor that runs venue calls, the timeout wrapper around
 * it, and the default {@link VenueClient}.
 *
 * <p>The in-memory paper venue is registered only when no other {@link VenueClient} bean
 * exists, so a real venue adapter replaces it by simply being on the classpath.
 */
@Configuration
public class VenueConfig {

    private static final Logger log = LoggerFactory.getLogger(VenueConfig.class);

    @Bean("venueExecutor")
    public ThreadPoolTaskExecutor venueExecutor(GatewayProperties properties) {
        GatewayProperties.Venue venue = properties.getVenue();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(venue.getExecutorPoolSize());
        executor.setMaxPoolSize(venue.getExecutorPoolSize());
        executor.setQueueCapacity(venue.getQueueCapacity());
        executor.setThreadNamePrefix("venue-");
        // Abort rather than run on the caller: a saturated pool must not bypass the timeout
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    @Bean
    public VenueCallExecutor venueCallExecutor(
            @Qualifier("venueExecutor") ThreadPoolTaskExecutor venueExecutor, GatewayProperties properties) {
        return new VenueCallExecutor(venueExecutor, properties.getVenue().getCallTimeout());
    }

    @Bean
    @ConditionalOnMissingBean(VenueClient.class)
    public VenueClient paperVenueClient(GatewayProperties properties, Clock clock) {
        log.info(
                "No venue adapter configured, using paper venue with {} assets",
                properties.getPaper().getAssets().size());
        return new PaperVenueClient(properties.getPaper(), clock);
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }
}
