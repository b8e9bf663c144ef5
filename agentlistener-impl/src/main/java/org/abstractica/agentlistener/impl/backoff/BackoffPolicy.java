package org.abstractica.agentlistener.impl.backoff;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Picks retry delays from a {@link BackoffSchedule}.
 *
 * <p>The delay is drawn uniformly from the band of the current failure tier,
 * at millisecond granularity. Apart from the random source the result
 * depends only on its arguments; a seeded {@link Random} makes it
 * reproducible.</p>
 */
public class BackoffPolicy
{
    private final Random random;

    /**
     * Creates a policy with an unseeded random source.
     */
    public BackoffPolicy()
    {
        this(new Random());
    }

    /**
     * Creates a policy with the given random source.
     *
     * @param random the random source
     */
    public BackoffPolicy(Random random)
    {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Calculates the delay before the next attempt.
     *
     * @param schedule            the operation's schedule
     * @param consecutiveFailures failures in a row, 0 for a non-failure wait
     * @param progressiveEnabled  whether progressive backoff is on
     * @return the delay
     */
    public Duration nextInterval(BackoffSchedule schedule, int consecutiveFailures, boolean progressiveEnabled)
    {
        Objects.requireNonNull(schedule, "schedule");

        BackoffBand band = schedule.bandFor(consecutiveFailures, progressiveEnabled);
        long minMs = band.min().toMillis();
        long maxMs = band.max().toMillis();
        if (minMs == maxMs)
        {
            return band.min();
        }
        return Duration.ofMillis(random.nextLong(minMs, maxMs + 1));
    }
}
