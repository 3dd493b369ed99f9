package com.ordergateway.venue;

import com.ordergateway.exception.VenueException;
import com.ordergateway.exception.VenueRejectedException;
import com.ordergateway.exception.VenueTimeoutException;
import com.ordergateway.exception.VenueTransportException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs venue calls on a dedicated executor with a hard timeout.
 *
 * <p>Venue calls are the only blocking operations in the gateway. Callers must not hold the
 * order state lock while calling through here: build the request, release the lock, call,
 * then re-acquire to apply the result.
 *
 * <p>Error translation:
 * <ul>
 *   <li>{@link VenueException} thrown by the client passes through unchanged</li>
 *   <li>a saturated executor becomes {@link VenueRejectedException}: the call was never made</li>
 *   <li>timeout becomes {@link VenueTimeoutException}</li>
 *   <li>anything else becomes {@link VenueTransportException}, since the outcome at the venue is unknown</li>
 * </ul>
 *
 * <p>A timed-out call is abandoned, not interrupted: the underlying client call may still
 * complete at the venue, which is why the router treats a timeout as "outcome unknown".
 */
public class VenueCallExecutor {

    private static final Logger log = LoggerFactory.getLogger(VenueCallExecutor.class);

    private final Executor executor;
    private final TimeLimiter timeLimiter;
    private final Duration timeout;

    public VenueCallExecutor(Executor executor, Duration timeout) {
        this.executor = executor;
        this.timeout = timeout;
        this.timeLimiter = TimeLimiter.of(
                "venue",
                TimeLimiterConfig.custom()
                        .timeoutDuration(timeout)
                        .cancelRunningFuture(true)
                        .build());
    }

    /**
     * Executes a venue call and returns its result.
     *
     * @param operation short operation name for logs, e.g. "submit_order"
     */
    public <T> T call(String operation, Supplier<T> venueCall) {
        try {
            return timeLimiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(venueCall, executor));
        } catch (VenueException e) {
            throw e;
        } catch (RejectedExecutionException e) {
            // nothing reached the venue, so the outcome is known
            log.warn("Venue call {} not started, venue executor saturated", operation);
            throw new VenueRejectedException(operation + " not sent: venue executor saturated", e);
        } catch (TimeoutException e) {
            log.warn("Venue call {} timed out after {}ms", operation, timeout.toMillis());
            throw new VenueTimeoutException(operation + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VenueTransportException(operation + " interrupted", e);
        } catch (Exception e) {
            log.error("Venue call {} failed unexpectedly", operation, e);
            throw new VenueTransportException(operation + " failed: " + e.getMessage(), e);
        }
    }

    /** Executes a venue call that returns nothing. */
    public void run(String operation, Runnable venueCall) {
        call(operation, () -> {
            venueCall.run();
            return null;
        });
    }

    public Duration getTimeout() {
        return timeout;
    }
}
