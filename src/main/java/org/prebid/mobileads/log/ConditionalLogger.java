package org.prebid.mobileads.log;

import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.Objects;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Wraps {@link Logger} to suppress repeated messages, either by count or by sampling.
 * <p>
 * Intended for messages that may appear on every inbound event or outgoing call, like stale event drops.
 */
public class ConditionalLogger {

    private static final int CACHE_MAXIMUM_SIZE = 10_000;
    private static final int EXPIRE_CACHE_DURATION = 1;

    private final Logger logger;

    private final ConcurrentMap<String, AtomicInteger> messageToCount;

    public ConditionalLogger(Logger logger) {
        this.logger = Objects.requireNonNull(logger);

        messageToCount = Caffeine.newBuilder()
                .maximumSize(CACHE_MAXIMUM_SIZE)
                .expireAfterWrite(EXPIRE_CACHE_DURATION, TimeUnit.HOURS)
                .<String, AtomicInteger>build()
                .asMap();
    }

    public void warn(String message, int limit) {
        log(message, limit, logger -> logger.warn(message));
    }

    /**
     * Same as {@link #warn(String, int)} but counts by the given key, so messages with varying details
     * share one limit.
     */
    public void warnWithKey(String key, String message, int limit) {
        log(key, limit, logger -> logger.warn(message));
    }

    public void debug(String message, double samplingRate) {
        if (samplingRate >= 1.0d || ThreadLocalRandom.current().nextDouble() < samplingRate) {
            logger.debug(message);
        }
    }

    /**
     * Calls {@link Consumer} on the first occurrence of the key and then once per {@code limit} occurrences.
     */
    private void log(String key, int limit, Consumer<Logger> consumer) {
        final AtomicInteger count = messageToCount.computeIfAbsent(key, ignored -> new AtomicInteger());
        if (count.getAndUpdate(value -> (value + 1) % limit) == 0) {
            consumer.accept(logger);
        }
    }
}
