package com.logic.lgraph.util;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits how often a recurring failure is logged.
 *
 * <p>
 * Node evaluation errors are absorbed and recorded, so a broken node in a
 * large or repeatedly executed graph would otherwise log once per evaluation.
 * At most one message per interval gets through; the ones dropped in between
 * are counted and reported with the next message.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final Level level;
    private final long minIntervalNanos;
    private final AtomicLong lastLogTime = new AtomicLong(Long.MIN_VALUE);
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this(logger, minIntervalMillis, Level.ERROR);
    }

    public ErrorRateLimiter(Logger logger, long minIntervalMillis, Level level) {
        this.logger = logger;
        this.level = level;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    /** @return true if the message was logged, false if it was throttled. */
    public boolean log(String message, Throwable t) {
        long now = System.nanoTime();
        long last = lastLogTime.get();
        if (last == Long.MIN_VALUE || now - last > minIntervalNanos) {
            // Only one thread wins the slot for this interval
            if (lastLogTime.compareAndSet(last, now)) {
                long dropped = suppressed.getAndSet(0);
                if (dropped > 0)
                    logger.log(level, "{} ({} similar messages suppressed)", message, dropped, t);
                else
                    logger.log(level, message, t);
                return true;
            }
        }
        suppressed.incrementAndGet();
        return false;
    }

    public long suppressedCount() {
        return suppressed.get();
    }
}
