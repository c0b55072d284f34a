package com.mimecast.sharedqueue.listener;

import com.mimecast.sharedqueue.config.ConfigurationException;

import java.time.Duration;
import java.util.Random;

/**
 * Randomized exponential backoff between polls.
 * <p>After a poll with messages the interval resets to the minimum so bursts drain quickly.
 * <p>After an empty poll the interval grows as:
 * <pre>
 *     interval = minimum + random(0.8, 1.2) * 2 ^ (exponent - 1) * delta
 * </pre>
 * <p>and is capped at the maximum. Jitter spreads replicas apart.
 * <p> Example intervals for minimum 100ms, delta 100ms, maximum 1 minute (without jitter):
 * <ul>
 *     <li>Empty poll 1: 200 ms</li>
 *     <li>Empty poll 2: 300 ms</li>
 *     <li>Empty poll 3: 500 ms</li>
 *     <li>Empty poll 4: 900 ms</li>
 *     <li>Empty poll 10: ~51 seconds</li>
 *     <li>Empty poll 11: 1 minute (capped)</li>
 * </ul>
 * <p>A jitter of 20% keeps consecutive intervals non-decreasing since 0.8 * 2 exceeds 1.2.
 * <p>Not thread safe, owned by a single poll loop.
 */
public class RandomizedExponentialBackoffStrategy implements DelayStrategy {

    private static final double RANDOMIZATION_FACTOR = 0.2;

    private final Duration minimumInterval;
    private final Duration maximumInterval;
    private final Duration deltaBackoff;
    private final Random random;

    private Duration currentInterval;
    private int backoffExponent = 1;

    /**
     * Constructs a new RandomizedExponentialBackoffStrategy instance.
     * <p>The delta defaults to the minimum interval.
     *
     * @param minimumInterval Minimum interval.
     * @param maximumInterval Maximum interval.
     */
    public RandomizedExponentialBackoffStrategy(Duration minimumInterval, Duration maximumInterval) {
        this(minimumInterval, maximumInterval, minimumInterval, new Random());
    }

    /**
     * Constructs a new RandomizedExponentialBackoffStrategy instance.
     *
     * @param minimumInterval Minimum interval.
     * @param maximumInterval Maximum interval.
     * @param deltaBackoff    Base growth step.
     * @param random          Jitter source.
     */
    public RandomizedExponentialBackoffStrategy(Duration minimumInterval, Duration maximumInterval,
                                                Duration deltaBackoff, Random random) {
        requirePositive("minimumInterval", minimumInterval);
        requirePositive("maximumInterval", maximumInterval);
        requirePositive("deltaBackoff", deltaBackoff);
        if (minimumInterval.compareTo(maximumInterval) > 0) {
            throw new ConfigurationException("minimumInterval " + minimumInterval
                    + " exceeds maximumInterval " + maximumInterval);
        }
        if (random == null) {
            throw new ConfigurationException("random must not be null");
        }

        this.minimumInterval = minimumInterval;
        this.maximumInterval = maximumInterval;
        this.deltaBackoff = deltaBackoff;
        this.random = random;
        this.currentInterval = minimumInterval;
    }

    @Override
    public Duration next(boolean hadMessages) {
        if (hadMessages) {
            currentInterval = minimumInterval;
            backoffExponent = 1;

        } else if (!currentInterval.equals(maximumInterval)) {
            double jitter = 1.0 + (random.nextDouble() * 2.0 - 1.0) * RANDOMIZATION_FACTOR;
            double incrementNanos = jitter * Math.pow(2.0, backoffExponent - 1) * deltaBackoff.toNanos();
            Duration candidate = incrementNanos >= maximumInterval.toNanos()
                    ? maximumInterval
                    : minimumInterval.plusNanos((long) incrementNanos);

            if (candidate.compareTo(maximumInterval) < 0) {
                currentInterval = candidate;
                backoffExponent++;
            } else {
                currentInterval = maximumInterval;
            }
        }

        return currentInterval;
    }

    /**
     * Gets the interval last returned.
     *
     * @return Duration.
     */
    public Duration getCurrentInterval() {
        return currentInterval;
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new ConfigurationException(name + " must be positive: " + value);
        }
    }
}
