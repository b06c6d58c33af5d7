package scrapeflow.engine.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scrapeflow.engine.error.ConfigurationException;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Pool-wide throttle on outbound requests.
 *
 * One instance is shared by every worker of a run, so the configured rate
 * bounds the aggregate request rate. Each caller reserves its grant slot
 * inside a single synchronized decision and then sleeps outside the lock, so
 * concurrent callers get consecutive, non-overlapping slots.
 */
public final class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    /** Longest interval between grants. */
    public static final Duration MAX_INTERVAL = Duration.ofDays(1);
    public static final double MIN_REQUESTS_PER_SECOND = 1.0 / MAX_INTERVAL.toSeconds();

    private final long intervalNanos;
    private final Object lock = new Object();

    /** Time of the last granted slot; guarded by {@code lock}. */
    private long lastGrantNanos;
    private boolean granted;

    private RateLimiter(long intervalNanos) {
        this.intervalNanos = intervalNanos;
    }

    /**
     * @param requestsPerSecond aggregate ceiling, must be positive
     */
    public static RateLimiter perSecond(double requestsPerSecond) {
        if (!(requestsPerSecond > 0) || Double.isInfinite(requestsPerSecond)) {
            throw new ConfigurationException("requests per second must be a positive number, got " + requestsPerSecond);
        }
        if (requestsPerSecond < MIN_REQUESTS_PER_SECOND) {
            throw new ConfigurationException("requests per second must be at least one per "
                    + MAX_INTERVAL.toHours() + " hours, got " + requestsPerSecond);
        }
        return new RateLimiter(Math.round(TimeUnit.SECONDS.toNanos(1) / requestsPerSecond));
    }

    /** A limiter that never waits. */
    public static RateLimiter unlimited() {
        return new RateLimiter(0);
    }

    /**
     * Block until at least one interval has passed since the previous grant,
     * counted across all callers.
     *
     * @throws InterruptedException if the caller is interrupted while waiting;
     *                              the reserved slot is then left unused
     */
    public void acquire() throws InterruptedException {
        if (intervalNanos == 0) {
            return;
        }
        long grantAt;
        synchronized (lock) {
            long now = System.nanoTime();
            grantAt = granted ? Math.max(now, lastGrantNanos + intervalNanos) : now;
            lastGrantNanos = grantAt;
            granted = true;
        }
        long waitNanos = grantAt - System.nanoTime();
        if (waitNanos > 0) {
            log.trace("Rate limiter waiting {} ms", TimeUnit.NANOSECONDS.toMillis(waitNanos));
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
    }

    public Duration interval() {
        return Duration.ofNanos(intervalNanos);
    }

    @Override
    public String toString() {
        return intervalNanos == 0 ? "RateLimiter{unlimited}" : "RateLimiter{interval=" + interval() + "}";
    }
}
