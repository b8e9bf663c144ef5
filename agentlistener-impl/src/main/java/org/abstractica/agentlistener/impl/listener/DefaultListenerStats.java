package org.abstractica.agentlistener.impl.listener;

import org.abstractica.agentlistener.ListenerStats;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Default implementation of ListenerStats.
 */
public class DefaultListenerStats implements ListenerStats
{
    private final AtomicLong sessionsCreated = new AtomicLong(0);
    private final AtomicLong sessionRecoveries = new AtomicLong(0);
    private final AtomicLong messagesReceived = new AtomicLong(0);
    private final AtomicLong retries = new AtomicLong(0);

    @Override
    public long getSessionsCreated()
    {
        return sessionsCreated.get();
    }

    @Override
    public long getSessionRecoveries()
    {
        return sessionRecoveries.get();
    }

    @Override
    public long getMessagesReceived()
    {
        return messagesReceived.get();
    }

    @Override
    public long getRetries()
    {
        return retries.get();
    }

    // ========== Update Methods ==========

    public void recordSessionCreated()
    {
        sessionsCreated.incrementAndGet();
    }

    public void recordSessionRecovery()
    {
        sessionRecoveries.incrementAndGet();
    }

    public void recordMessage()
    {
        messagesReceived.incrementAndGet();
    }

    public void recordRetry()
    {
        retries.incrementAndGet();
    }
}
