package org.abstractica.agentlistener.impl.failure;

import org.abstractica.agentlistener.impl.timing.Stopwatch;
import org.abstractica.agentlistener.impl.timing.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bounds how long session creation keeps retrying session conflicts and
 * clock skew.
 *
 * <p>The ceiling is measured in elapsed time, not attempts. Conflict and
 * skew are alternative explanations for a failing session creation, so
 * recording one stops and clears the other's stopwatch.</p>
 *
 * <p>Owned by the session-creation flow; not thread-safe.</p>
 */
public class SessionConflictTracker
{
    private static final Logger LOG = LoggerFactory.getLogger(SessionConflictTracker.class);

    /**
     * Default ceiling for session conflicts. Conflicts usually clear quickly.
     */
    public static final Duration DEFAULT_CONFLICT_LIMIT = Duration.ofMinutes(4);

    /**
     * Default ceiling for clock skew. Skew needs the host clock fixed.
     */
    public static final Duration DEFAULT_CLOCK_SKEW_LIMIT = Duration.ofMinutes(30);

    private final Duration conflictLimit;
    private final Duration clockSkewLimit;
    private final Stopwatch conflictStopwatch;
    private final Stopwatch clockSkewStopwatch;
    private final Map<FailureCategory, Integer> occurrences;

    public SessionConflictTracker(Ticker ticker)
    {
        this(ticker, DEFAULT_CONFLICT_LIMIT, DEFAULT_CLOCK_SKEW_LIMIT);
    }

    /**
     * Creates a tracker.
     *
     * @param ticker         monotonic time source
     * @param conflictLimit  how long conflicts may be retried
     * @param clockSkewLimit how long clock skew may be retried
     */
    public SessionConflictTracker(Ticker ticker, Duration conflictLimit, Duration clockSkewLimit)
    {
        Objects.requireNonNull(ticker, "ticker");
        this.conflictLimit = requirePositive(conflictLimit, "conflictLimit");
        this.clockSkewLimit = requirePositive(clockSkewLimit, "clockSkewLimit");
        this.conflictStopwatch = new Stopwatch(ticker);
        this.clockSkewStopwatch = new Stopwatch(ticker);
        this.occurrences = new EnumMap<>(FailureCategory.class);
    }

    /**
     * Records a session conflict.
     *
     * @return true if conflicts have now been retried for at least the conflict limit
     */
    public boolean recordConflict()
    {
        clockSkewStopwatch.reset();
        return record(FailureCategory.SESSION_CONFLICT, conflictStopwatch, conflictLimit);
    }

    /**
     * Records a clock-skew rejection.
     *
     * @return true if skew has now been retried for at least the skew limit
     */
    public boolean recordClockSkew()
    {
        conflictStopwatch.reset();
        return record(FailureCategory.CLOCK_SKEW, clockSkewStopwatch, clockSkewLimit);
    }

    /**
     * Clears both stopwatches and all counters after a session was created.
     */
    public void reset()
    {
        conflictStopwatch.reset();
        clockSkewStopwatch.reset();
        occurrences.clear();
    }

    /**
     * Returns how often a category was recorded since the last reset.
     */
    public int getOccurrences(FailureCategory category)
    {
        return occurrences.getOrDefault(category, 0);
    }

    public Duration getConflictElapsed()
    {
        return conflictStopwatch.elapsed();
    }

    public Duration getClockSkewElapsed()
    {
        return clockSkewStopwatch.elapsed();
    }

    public Duration getConflictLimit()
    {
        return conflictLimit;
    }

    public Duration getClockSkewLimit()
    {
        return clockSkewLimit;
    }

    private boolean record(FailureCategory category, Stopwatch stopwatch, Duration limit)
    {
        if (!stopwatch.isRunning())
        {
            stopwatch.restart();
        }

        int count = occurrences.merge(category, 1, Integer::sum);
        if (count == 1)
        {
            // First occurrence only starts the clock
            return false;
        }

        Duration elapsed = stopwatch.elapsed();
        if (elapsed.compareTo(limit) >= 0)
        {
            LOG.info("{} retry limit reached: elapsed={}s, limit={}s",
                    category, elapsed.toSeconds(), limit.toSeconds());
            return true;
        }

        LOG.debug("{} below retry limit: occurrences={}, elapsed={}s", category, count, elapsed.toSeconds());
        return false;
    }

    private static Duration requirePositive(Duration value, String name)
    {
        Objects.requireNonNull(value, name);
        if (value.isZero() || value.isNegative())
        {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
        return value;
    }
}
