package com.bbthechange.bridge.util;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Times puppet store operations. Slow and failed operations are logged, all of them are recorded
 * in the {@code puppet_store_duration} timer.
 */
@Component
public class StoreOperationTracker {

    private static final Logger logger = LoggerFactory.getLogger(StoreOperationTracker.class);
    private static final long SLOW_OPERATION_THRESHOLD_MS = 500L;

    private final MeterRegistry meterRegistry;

    public StoreOperationTracker(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public <T> T track(String operation, Supplier<T> storeOperation) {
        long startNanos = System.nanoTime();
        String outcome = "success";
        try {
            return storeOperation.get();
        } catch (RuntimeException e) {
            outcome = "error";
            logger.error("Puppet store operation failed: operation={}, error={}", operation, e.getMessage());
            throw e;
        } finally {
            long durationNanos = System.nanoTime() - startNanos;
            long durationMs = durationNanos / 1_000_000;
            if (durationMs > SLOW_OPERATION_THRESHOLD_MS) {
                logger.warn("Slow puppet store operation: operation={}, duration={}ms", operation, durationMs);
            } else {
                logger.debug("Puppet store operation completed: operation={}, duration={}ms", operation, durationMs);
            }
            Timer.builder("puppet_store_duration")
                    .tag("operation", operation)
                    .tag("outcome", outcome)
                    .register(meterRegistry)
                    .record(durationNanos, TimeUnit.NANOSECONDS);
        }
    }
}
