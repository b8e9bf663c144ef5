package org.abstractica.agentlistener.impl.backoff;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Retry bands of one operation, tiered by the number of consecutive failures.
 *
 * <p>Each operation has a progressive schedule, used when the progressive
 * backoff feature is on, and a default schedule. A tier applies up to and
 * including its {@code maxFailures}; the last tier applies to every longer
 * streak.</p>
 */
public final class BackoffSchedule
{
    /**
     * Creating a session. Tolerates minutes of delay.
     */
    public static final BackoffSchedule SESSION_CREATION = new BackoffSchedule(
            "session-creation",
            List.of(
                    new Tier(2, BackoffBand.ofSeconds(15, 30)),
                    new Tier(5, BackoffBand.ofSeconds(60, 90)),
                    new Tier(Integer.MAX_VALUE, BackoffBand.ofSeconds(150, 200))),
            List.of(new Tier(Integer.MAX_VALUE, BackoffBand.fixed(Duration.ofSeconds(30)))));

    /**
     * Retrying a failed message poll.
     */
    public static final BackoffSchedule MESSAGE_POLLING = new BackoffSchedule(
            "message-polling",
            List.of(
                    new Tier(2, BackoffBand.ofSeconds(15, 30)),
                    new Tier(5, BackoffBand.ofSeconds(60, 90)),
                    new Tier(Integer.MAX_VALUE, BackoffBand.ofSeconds(150, 200))),
            List.of(
                    new Tier(5, BackoffBand.ofSeconds(15, 30)),
                    new Tier(Integer.MAX_VALUE, BackoffBand.ofSeconds(30, 60))));

    /**
     * Keep-alive retries. Kept tight so a healthy session is refreshed quickly.
     */
    public static final BackoffSchedule KEEP_ALIVE = new BackoffSchedule(
            "keep-alive",
            List.of(
                    new Tier(2, BackoffBand.ofSeconds(30, 35)),
                    new Tier(5, BackoffBand.ofSeconds(35, 40)),
                    new Tier(Integer.MAX_VALUE, BackoffBand.ofSeconds(40, 45))),
            List.of(new Tier(Integer.MAX_VALUE, BackoffBand.fixed(Duration.ofSeconds(30)))));

    /**
     * Waiting after a poll returned no message. Not a failure.
     */
    public static final BackoffSchedule IDLE_POLL = new BackoffSchedule(
            "idle-poll",
            List.of(new Tier(Integer.MAX_VALUE, BackoffBand.ofSeconds(5, 15))),
            List.of(new Tier(Integer.MAX_VALUE, BackoffBand.ofSeconds(5, 15))));

    /**
     * Applies {@code band} to streaks of at most {@code maxFailures}.
     *
     * @param maxFailures inclusive upper bound of the tier
     * @param band        the delay band
     */
    public record Tier(int maxFailures, BackoffBand band)
    {
        public Tier
        {
            Objects.requireNonNull(band, "band");
        }
    }

    private final String name;
    private final List<Tier> progressive;
    private final List<Tier> standard;

    public BackoffSchedule(String name, List<Tier> progressive, List<Tier> standard)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.progressive = validate(progressive);
        this.standard = validate(standard);
    }

    /**
     * Returns the band for a failure streak.
     *
     * @param consecutiveFailures failures in a row, at least 0
     * @param progressiveEnabled  whether the progressive schedule applies
     * @return the band
     */
    public BackoffBand bandFor(int consecutiveFailures, boolean progressiveEnabled)
    {
        if (consecutiveFailures < 0)
        {
            throw new IllegalArgumentException("Failure count must be non-negative: " + consecutiveFailures);
        }

        List<Tier> tiers = progressiveEnabled ? progressive : standard;
        for (Tier tier : tiers)
        {
            if (consecutiveFailures <= tier.maxFailures())
            {
                return tier.band();
            }
        }
        return tiers.get(tiers.size() - 1).band();
    }

    public String getName()
    {
        return name;
    }

    @Override
    public String toString()
    {
        return name;
    }

    private static List<Tier> validate(List<Tier> tiers)
    {
        Objects.requireNonNull(tiers, "tiers");
        if (tiers.isEmpty())
        {
            throw new IllegalArgumentException("At least one tier is required");
        }

        // Tiers must widen: later tiers cover longer streaks and never start lower
        for (int i = 1; i < tiers.size(); i++)
        {
            Tier previous = tiers.get(i - 1);
            Tier current = tiers.get(i);
            if (current.maxFailures() <= previous.maxFailures())
            {
                throw new IllegalArgumentException("Tier bounds must increase");
            }
            if (current.band().min().compareTo(previous.band().min()) < 0)
            {
                throw new IllegalArgumentException("Tier minimums must not decrease");
            }
        }
        return List.copyOf(tiers);
    }
}
