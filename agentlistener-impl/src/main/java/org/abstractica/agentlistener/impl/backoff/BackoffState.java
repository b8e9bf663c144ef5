package org.abstractica.agentlistener.impl.backoff;

import java.time.Duration;
import java.util.Objects;

/**
 * Failure streak and current delay of one retry loop.
 *
 * <p>Owned by a single loop and not thread-safe.</p>
 */
public class BackoffState
{
    private final BackoffSchedule schedule;
    private final BackoffPolicy policy;
    private final Duration baseline;

    private int consecutiveFailures;
    private Duration currentInterval;

    /**
     * Creates a state for one loop.
     *
     * @param schedule the loop's schedule
     * @param policy   picks the delays
     * @param baseline the interval after a success
     */
    public BackoffState(BackoffSchedule schedule, BackoffPolicy policy, Duration baseline)
    {
        this.schedule = Objects.requireNonNull(schedule, "schedule");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.baseline = Objects.requireNonNull(baseline, "baseline");
        this.currentInterval = baseline;
    }

    /**
     * Records a failure and returns the delay before the next attempt.
     *
     * @param progressiveEnabled whether progressive backoff is on
     * @return the delay
     */
    public Duration recordFailure(boolean progressiveEnabled)
    {
        consecutiveFailures++;
        currentInterval = policy.nextInterval(schedule, consecutiveFailures, progressiveEnabled);
        return currentInterval;
    }

    /**
     * Computes a wait that is not caused by a failure, such as an idle poll.
     *
     * <p>The failure streak is left untouched.</p>
     *
     * @param waitSchedule the schedule of the wait
     * @return the delay
     */
    public Duration nextWait(BackoffSchedule waitSchedule)
    {
        currentInterval = policy.nextInterval(waitSchedule, 0, false);
        return currentInterval;
    }

    /**
     * Clears the failure streak after a success.
     */
    public void reset()
    {
        consecutiveFailures = 0;
        currentInterval = baseline;
    }

    public int getConsecutiveFailures()
    {
        return consecutiveFailures;
    }

    public Duration getCurrentInterval()
    {
        return currentInterval;
    }

    public boolean isFailing()
    {
        return consecutiveFailures > 0;
    }
}
