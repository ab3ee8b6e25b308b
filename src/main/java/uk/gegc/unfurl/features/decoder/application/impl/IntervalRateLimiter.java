package uk.gegc.unfurl.features.decoder.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import uk.gegc.unfurl.features.decoder.application.OutboundRateLimiter;
import uk.gegc.unfurl.features.decoder.config.DecoderProperties;
import uk.gegc.unfurl.features.decoder.domain.UrlDecodeException;
import uk.gegc.unfurl.features.decoder.domain.model.FailureReason;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Enforces a minimum interval between outbound requests of this process.
 *
 * <p>Each caller reserves the next free slot under the lock and sleeps outside it, so a burst is
 * smoothed to one request per interval. Slots are handed out in lock-acquisition order, which is
 * not guaranteed to match submission order. State is lost on restart.
 */
@Component
@Slf4j
public class IntervalRateLimiter implements OutboundRateLimiter {

    private final long minIntervalNanos;
    private final LongSupplier nanoTime;

    private final Object lock = new Object();
    private long nextSlotNanos;
    private boolean used;

    @Autowired
    public IntervalRateLimiter(DecoderProperties properties) {
        this(properties.getRateLimitDelayMs(), System::nanoTime);
    }

    IntervalRateLimiter(long minIntervalMs, LongSupplier nanoTime) {
        this.minIntervalNanos = TimeUnit.MILLISECONDS.toNanos(Math.max(0, minIntervalMs));
        this.nanoTime = nanoTime;
    }

    @Override
    public void acquire() {
        long waitNanos;
        synchronized (lock) {
            long now = nanoTime.getAsLong();
            if (!used || now - nextSlotNanos >= 0) {
                waitNanos = 0;
                nextSlotNanos = now + minIntervalNanos;
            } else {
                waitNanos = nextSlotNanos - now;
                nextSlotNanos = nextSlotNanos + minIntervalNanos;
            }
            used = true;
        }
        if (waitNanos > 0) {
            long waitMs = TimeUnit.NANOSECONDS.toMillis(waitNanos);
            log.debug("Rate limit: waiting {} ms before next outbound request", waitMs);
            sleep(waitMs);
        }
    }

    protected void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new UrlDecodeException(FailureReason.CONNECTION, "Interrupted while waiting for rate limit", ex);
        }
    }
}
