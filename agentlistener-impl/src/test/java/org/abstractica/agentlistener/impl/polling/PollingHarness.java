package org.abstractica.agentlistener.impl.polling;

import org.abstractica.agentlistener.AgentCredentials;
import org.abstractica.agentlistener.AgentIdentity;
import org.abstractica.agentlistener.KeyUnwrapper;
import org.abstractica.agentlistener.impl.backoff.BackoffPolicy;
import org.abstractica.agentlistener.impl.backoff.BackoffSchedule;
import org.abstractica.agentlistener.impl.backoff.BackoffState;
import org.abstractica.agentlistener.impl.crypto.MessageCipher;
import org.abstractica.agentlistener.impl.failure.ErrorClassifier;
import org.abstractica.agentlistener.impl.failure.SessionConflictTracker;
import org.abstractica.agentlistener.impl.listener.DefaultListenerStats;
import org.abstractica.agentlistener.impl.listener.ListenerSettings;
import org.abstractica.agentlistener.impl.remote.SimulatedOrchestrationService;
import org.abstractica.agentlistener.impl.session.ConnectionEvents;
import org.abstractica.agentlistener.impl.session.ProgressiveBackoffFlag;
import org.abstractica.agentlistener.impl.session.SessionManager;
import org.abstractica.agentlistener.impl.timing.Sleeper;
import org.abstractica.agentlistener.impl.timing.Ticker;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Random;

/**
 * Wires a session manager, poller and keep-alive loop around a simulated service.
 */
class PollingHarness
{
    final SimulatedOrchestrationService service;
    final ConnectionEvents events = new ConnectionEvents();
    final DefaultListenerStats stats = new DefaultListenerStats();
    final SessionManager sessionManager;
    final MessagePoller poller;
    final KeepAliveLoop keepAliveLoop;

    PollingHarness(SimulatedOrchestrationService service, Ticker ticker, Sleeper sleeper,
                   boolean skipSessionRecover, KeyUnwrapper keyUnwrapper)
    {
        this.service = service;

        ListenerSettings settings = new ListenerSettings(
                URI.create("https://orchestrator.test"),
                1,
                new AgentIdentity(5, "agent-5", "1.0.0", "Linux"),
                "agent-5",
                skipSessionRecover);
        SessionConflictTracker tracker = new SessionConflictTracker(ticker);
        ErrorClassifier classifier = new ErrorClassifier(tracker);
        ProgressiveBackoffFlag flag = new ProgressiveBackoffFlag(service);
        BackoffPolicy policy = new BackoffPolicy(new Random(5));

        sessionManager = new SessionManager(
                settings,
                service,
                () -> new AgentCredentials("Bearer", "token"),
                token -> Map.of(),
                flag,
                classifier,
                tracker,
                new BackoffState(BackoffSchedule.SESSION_CREATION, policy, Duration.ZERO),
                sleeper,
                events,
                stats);
        poller = new MessagePoller(
                sessionManager,
                service,
                new MessageCipher(keyUnwrapper),
                classifier,
                flag,
                new BackoffState(BackoffSchedule.MESSAGE_POLLING, policy, Duration.ZERO),
                sleeper,
                ticker,
                events,
                stats);
        keepAliveLoop = new KeepAliveLoop(
                sessionManager,
                service,
                classifier,
                flag,
                new BackoffState(BackoffSchedule.KEEP_ALIVE, policy, KeepAliveLoop.BASE_INTERVAL),
                sleeper);
    }
}
