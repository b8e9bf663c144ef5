package org.abstractica.agentlistener.impl.listener;

import org.abstractica.agentlistener.AgentMessage;
import org.abstractica.agentlistener.AgentSession;
import org.abstractica.agentlistener.CancellationToken;
import org.abstractica.agentlistener.CapabilitiesProvider;
import org.abstractica.agentlistener.CredentialProvider;
import org.abstractica.agentlistener.FeatureFlagProvider;
import org.abstractica.agentlistener.KeyUnwrapper;
import org.abstractica.agentlistener.ListenerOperation;
import org.abstractica.agentlistener.ListenerStats;
import org.abstractica.agentlistener.MessageListener;
import org.abstractica.agentlistener.OrchestrationService;
import org.abstractica.agentlistener.errors.OrchestrationException;
import org.abstractica.agentlistener.impl.backoff.BackoffPolicy;
import org.abstractica.agentlistener.impl.backoff.BackoffSchedule;
import org.abstractica.agentlistener.impl.backoff.BackoffState;
import org.abstractica.agentlistener.impl.crypto.MessageCipher;
import org.abstractica.agentlistener.impl.failure.ErrorClassifier;
import org.abstractica.agentlistener.impl.failure.SessionConflictTracker;
import org.abstractica.agentlistener.impl.polling.KeepAliveLoop;
import org.abstractica.agentlistener.impl.polling.MessagePoller;
import org.abstractica.agentlistener.impl.session.ConnectionEvents;
import org.abstractica.agentlistener.impl.session.ProgressiveBackoffFlag;
import org.abstractica.agentlistener.impl.session.SessionManager;
import org.abstractica.agentlistener.impl.timing.Sleeper;
import org.abstractica.agentlistener.impl.timing.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.Random;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Default implementation of MessageListener.
 *
 * <p>Wires the session manager, the poll loop and the keep-alive loop
 * around one orchestration service. The poll loop and the keep-alive loop
 * may run on different threads; each owns its own backoff state.</p>
 */
public class DefaultMessageListener implements MessageListener
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultMessageListener.class);

    private final ListenerSettings settings;
    private final OrchestrationService service;
    private final ConnectionEvents events;
    private final DefaultListenerStats stats;
    private final SessionManager sessionManager;
    private final MessagePoller poller;
    private final KeepAliveLoop keepAliveLoop;

    /**
     * Creates a listener.
     *
     * @param settings             resolved configuration
     * @param service              the remote service
     * @param credentialProvider   loads credentials for each connect
     * @param capabilitiesProvider collects capabilities for each session
     * @param featureFlagProvider  reads the progressive backoff flag, may be null
     * @param keyUnwrapper         unwraps wrapped session keys, may be null
     * @param random               source of backoff jitter
     * @param ticker               time source
     * @param sleeper              performs the backoff waits
     * @param conflictLimit        how long session conflicts are retried
     * @param clockSkewLimit       how long clock skew is retried
     */
    public DefaultMessageListener(
            ListenerSettings settings,
            OrchestrationService service,
            CredentialProvider credentialProvider,
            CapabilitiesProvider capabilitiesProvider,
            FeatureFlagProvider featureFlagProvider,
            KeyUnwrapper keyUnwrapper,
            Random random,
            Ticker ticker,
            Sleeper sleeper,
            Duration conflictLimit,
            Duration clockSkewLimit
    )
    {
        this.settings = settings;
        this.service = service;
        this.events = new ConnectionEvents();
        this.stats = new DefaultListenerStats();

        BackoffPolicy policy = new BackoffPolicy(random);
        ProgressiveBackoffFlag progressiveBackoff = new ProgressiveBackoffFlag(featureFlagProvider);
        SessionConflictTracker conflictTracker = new SessionConflictTracker(ticker, conflictLimit, clockSkewLimit);
        ErrorClassifier classifier = new ErrorClassifier(conflictTracker);

        this.sessionManager = new SessionManager(
                settings,
                service,
                credentialProvider,
                capabilitiesProvider,
                progressiveBackoff,
                classifier,
                conflictTracker,
                new BackoffState(BackoffSchedule.SESSION_CREATION, policy, Duration.ZERO),
                sleeper,
                events,
                stats
        );
        this.poller = new MessagePoller(
                sessionManager,
                service,
                new MessageCipher(keyUnwrapper),
                classifier,
                progressiveBackoff,
                new BackoffState(BackoffSchedule.MESSAGE_POLLING, policy, Duration.ZERO),
                sleeper,
                ticker,
                events,
                stats
        );
        this.keepAliveLoop = new KeepAliveLoop(
                sessionManager,
                service,
                classifier,
                progressiveBackoff,
                new BackoffState(BackoffSchedule.KEEP_ALIVE, policy, KeepAliveLoop.BASE_INTERVAL),
                sleeper
        );
    }

    // ========== Session ==========

    @Override
    public boolean createSession(CancellationToken token) throws OrchestrationException
    {
        return sessionManager.createSession(token);
    }

    @Override
    public void deleteSession()
    {
        sessionManager.deleteSession();
    }

    @Override
    public Optional<AgentSession> getSession()
    {
        return Optional.ofNullable(sessionManager.getActiveSession());
    }

    // ========== Messages ==========

    @Override
    public AgentMessage getNextMessage(CancellationToken token) throws OrchestrationException
    {
        return poller.getNextMessage(token);
    }

    @Override
    public void keepAlive(CancellationToken token)
    {
        keepAliveLoop.run(token);
    }

    @Override
    public void deleteMessage(AgentMessage message) throws OrchestrationException, IOException
    {
        if (message == null)
        {
            return;
        }

        AgentSession session = sessionManager.requireActiveSession();
        service.deleteMessage(settings.poolId(), message.messageId(), session.sessionId(),
                SessionManager.DELETE_TIMEOUT);
        LOG.debug("Message {} deleted", message.messageId());
    }

    // ========== Events ==========

    @Override
    public void onConnectionLost(BiConsumer<ListenerOperation, Throwable> handler)
    {
        events.onConnectionLost(handler);
    }

    @Override
    public void onConnectionRestored(Consumer<ListenerOperation> handler)
    {
        events.onConnectionRestored(handler);
    }

    // ========== Lifecycle ==========

    @Override
    public ListenerStats getStats()
    {
        return stats;
    }

    @Override
    public void close()
    {
        sessionManager.deleteSession();
    }

    SessionManager getSessionManager()
    {
        return sessionManager;
    }

    MessagePoller getPoller()
    {
        return poller;
    }
}
