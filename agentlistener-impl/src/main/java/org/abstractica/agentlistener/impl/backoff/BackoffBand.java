package org.abstractica.agentlistener.impl.backoff;

import java.time.Duration;
import java.util.Objects;

/**
 * Closed interval a retry delay is drawn from.
 *
 * @param min the shortest delay
 * @param max the longest delay
 */
public record BackoffBand(Duration min, Duration max)
{
    public BackoffBand
    {
        Objects.requireNonNull(min, "min");
        Objects.requireNonNull(max, "max");
        if (min.isNegative())
        {
            throw new IllegalArgumentException("Minimum must not be negative: " + min);
        }
        if (max.compareTo(min) < 0)
        {
            throw new IllegalArgumentException("Maximum " + max + " is below minimum " + min);
        }
    }

    public static BackoffBand ofSeconds(long minSeconds, long maxSeconds)
    {
        return new BackoffBand(Duration.ofSeconds(minSeconds), Duration.ofSeconds(maxSeconds));
    }

    /**
     * Returns a band that always yields the same delay.
     */
    public static BackoffBand fixed(Duration delay)
    {
        return new BackoffBand(delay, delay);
    }

    public boolean contains(Duration delay)
    {
        return delay.compareTo(min) >= 0 && delay.compareTo(max) <= 0;
    }
}
