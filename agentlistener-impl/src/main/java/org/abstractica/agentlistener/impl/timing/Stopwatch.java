package org.abstractica.agentlistener.impl.timing;

import java.time.Duration;
import java.util.Objects;

/**
 * Accumulates elapsed time between start and stop.
 *
 * <p>Not thread-safe; owned by a single flow.</p>
 */
public final class Stopwatch
{
    private final Ticker ticker;
    private boolean running;
    private long startedAtNanos;
    private long accumulatedNanos;

    public Stopwatch(Ticker ticker)
    {
        this.ticker = Objects.requireNonNull(ticker, "ticker");
    }

    /**
     * Starts the stopwatch if it is not running.
     */
    public void start()
    {
        if (!running)
        {
            startedAtNanos = ticker.nanos();
            running = true;
        }
    }

    /**
     * Stops the stopwatch and clears elapsed time.
     */
    public void reset()
    {
        running = false;
        accumulatedNanos = 0;
    }

    /**
     * Clears elapsed time and starts measuring again.
     */
    public void restart()
    {
        reset();
        start();
    }

    public boolean isRunning()
    {
        return running;
    }

    /**
     * Returns the measured time including the current run.
     *
     * @return elapsed time
     */
    public Duration elapsed()
    {
        long nanos = accumulatedNanos;
        if (running)
        {
            nanos += ticker.nanos() - startedAtNanos;
        }
        return Duration.ofNanos(nanos);
    }
}
