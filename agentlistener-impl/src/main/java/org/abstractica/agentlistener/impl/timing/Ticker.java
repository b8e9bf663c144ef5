package org.abstractica.agentlistener.impl.timing;

/**
 * Source of monotonic time in nanoseconds.
 */
@FunctionalInterface
public interface Ticker
{
    /**
     * Returns the current reading. Only differences between readings are meaningful.
     *
     * @return nanoseconds from an arbitrary origin
     */
    long nanos();

    /**
     * Returns a ticker backed by {@link System#nanoTime()}.
     */
    static Ticker system()
    {
        return System::nanoTime;
    }
}
