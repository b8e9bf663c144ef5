package org.abstractica.agentlistener;

/**
 * Listener counters for monitoring.
 *
 * <p>Values are pollable snapshots, like the rest of the statistics
 * interfaces the application may push to a monitoring system.</p>
 */
public interface ListenerStats
{
    /**
     * Returns the number of sessions created, including recreations.
     *
     * @return session count
     */
    long getSessionsCreated();

    /**
     * Returns how often an expired session was recreated during polling.
     *
     * @return recovery count
     */
    long getSessionRecoveries();

    /**
     * Returns the number of messages delivered to the caller.
     *
     * @return message count
     */
    long getMessagesReceived();

    /**
     * Returns the number of retried attempts across all operations.
     *
     * @return retry count
     */
    long getRetries();
}
