package org.abstractica.agentlistener;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal shared between a caller and the loops
 * it starts.
 *
 * <p>Cancellation is one-way. Waiting through {@link #sleep(Duration)} ends
 * as soon as cancellation is requested instead of when the interval
 * elapses.</p>
 */
public final class CancellationToken
{
    private final CountDownLatch cancelled = new CountDownLatch(1);

    /**
     * Requests cancellation. Subsequent calls have no effect.
     */
    public void cancel()
    {
        cancelled.countDown();
    }

    /**
     * Returns true if cancellation has been requested.
     *
     * @return true if cancelled
     */
    public boolean isCancellationRequested()
    {
        return cancelled.getCount() == 0;
    }

    /**
     * Throws if cancellation has been requested.
     *
     * @throws CancellationException if cancelled
     */
    public void throwIfCancellationRequested()
    {
        if (isCancellationRequested())
        {
            throw new CancellationException("Operation cancelled");
        }
    }

    /**
     * Waits for the given interval unless cancelled first.
     *
     * <p>An interrupt of the waiting thread is treated as cancellation
     * and the interrupt flag is restored.</p>
     *
     * @param duration how long to wait
     * @throws CancellationException if cancellation is requested before or during the wait
     */
    public void sleep(Duration duration)
    {
        throwIfCancellationRequested();
        try
        {
            if (cancelled.await(duration.toNanos(), TimeUnit.NANOSECONDS))
            {
                throw new CancellationException("Operation cancelled");
            }
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            CancellationException cancellation = new CancellationException("Interrupted while waiting");
            cancellation.initCause(e);
            throw cancellation;
        }
    }

    /**
     * Blocks until cancellation is requested or the timeout elapses.
     *
     * @param timeout the maximum time to wait
     * @return true if cancelled
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitCancellation(Duration timeout) throws InterruptedException
    {
        return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
