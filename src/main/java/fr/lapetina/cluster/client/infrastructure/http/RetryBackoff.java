package fr.lapetina.cluster.client.infrastructure.http;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff between retries, with ±10% jitter.
 */
public final class RetryBackoff {

    private static final double JITTER = 0.1;

    private final Duration initial;
    private final Duration max;
    private final double multiplier;

    public RetryBackoff(Duration initial, Duration max, double multiplier) {
        if (initial.isNegative() || max.isNegative()) {
            throw new IllegalArgumentException("Backoff durations must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be >= 1: " + multiplier);
        }
        this.initial = initial;
        this.max = max.compareTo(initial) < 0 ? initial : max;
        this.multiplier = multiplier;
    }

    public static RetryBackoff defaults() {
        return new RetryBackoff(Duration.ofMillis(100), Duration.ofSeconds(5), 2.0);
    }

    /**
     * No wait between retries.
     */
    public static RetryBackoff none() {
        return new RetryBackoff(Duration.ZERO, Duration.ZERO, 1.0);
    }

    /**
     * Delay before the given retry.
     *
     * @param retry 1 for the first retry
     */
    public Duration delayFor(int retry) {
        if (initial.isZero()) {
            return Duration.ZERO;
        }
        double base = initial.toMillis() * Math.pow(multiplier, Math.max(0, retry - 1));
        double capped = Math.min(base, max.toMillis());
        double jitter = capped * JITTER * (ThreadLocalRandom.current().nextDouble() * 2 - 1);
        return Duration.ofMillis(Math.max(0, Math.round(capped + jitter)));
    }

    public Duration getInitial() {
        return initial;
    }

    public Duration getMax() {
        return max;
    }

    public double getMultiplier() {
        return multiplier;
    }
}
