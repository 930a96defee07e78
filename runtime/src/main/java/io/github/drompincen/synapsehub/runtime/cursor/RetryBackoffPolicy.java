package io.github.drompincen.synapsehub.runtime.cursor;

import java.time.Duration;

/** Delay before a failed or timed-out command goes back on the queue. */
public final class RetryBackoffPolicy {

    public enum Strategy { FIXED, LINEAR, EXPONENTIAL }

    private final Strategy strategy;
    private final Duration initialDelay;
    private final Duration maxDelay;

    public RetryBackoffPolicy(Strategy strategy, Duration initialDelay, Duration maxDelay) {
        this.strategy = strategy;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
    }

    public static RetryBackoffPolicy from(CursorProperties.RetryBackoff config) {
        return new RetryBackoffPolicy(config.getStrategy(), config.getInitialDelay(), config.getMaxDelay());
    }

    public static RetryBackoffPolicy immediate() {
        return new RetryBackoffPolicy(Strategy.FIXED, Duration.ZERO, Duration.ZERO);
    }

    /** @param attempt 1 for the first retry */
    public Duration delayFor(int attempt) {
        int n = Math.max(1, attempt);
        Duration delay = switch (strategy) {
            case FIXED -> initialDelay;
            case LINEAR -> initialDelay.multipliedBy(n);
            case EXPONENTIAL -> initialDelay.multipliedBy(1L << Math.min(n - 1, 30));
        };
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    public Strategy strategy() { return strategy; }
}
