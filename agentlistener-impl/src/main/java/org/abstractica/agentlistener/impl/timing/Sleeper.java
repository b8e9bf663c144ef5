package org.abstractica.agentlistener.impl.timing;

import org.abstractica.agentlistener.CancellationToken;

import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * Waits between retries.
 */
@FunctionalInterface
public interface Sleeper
{
    /**
     * Waits for the given interval.
     *
     * @param duration the interval
     * @param token    ends the wait early
     * @throws CancellationException if cancelled before or during the wait
     */
    void sleep(Duration duration, CancellationToken token);

    /**
     * Returns a sleeper that blocks on the token, so cancellation ends the wait at once.
     */
    static Sleeper system()
    {
        return (duration, token) -> token.sleep(duration);
    }
}
