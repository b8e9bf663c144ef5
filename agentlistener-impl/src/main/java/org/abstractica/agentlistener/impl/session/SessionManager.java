package org.abstractica.agentlistener.impl.session;

import org.abstractica.agentlistener.AgentCredentials;
import org.abstractica.agentlistener.AgentSession;
import org.abstractica.agentlistener.CancellationToken;
import org.abstractica.agentlistener.CapabilitiesProvider;
import org.abstractica.agentlistener.CredentialProvider;
import org.abstractica.agentlistener.ListenerOperation;
import org.abstractica.agentlistener.OrchestrationService;
import org.abstractica.agentlistener.SessionDescriptor;
import org.abstractica.agentlistener.errors.OrchestrationException;
import org.abstractica.agentlistener.impl.backoff.BackoffState;
import org.abstractica.agentlistener.impl.failure.Classification;
import org.abstractica.agentlistener.impl.failure.ErrorClassifier;
import org.abstractica.agentlistener.impl.failure.SessionConflictTracker;
import org.abstractica.agentlistener.impl.listener.DefaultListenerStats;
import org.abstractica.agentlistener.impl.listener.ListenerSettings;
import org.abstractica.agentlistener.impl.timing.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Creates, recreates and deletes the listener's session.
 *
 * <p>State transitions:</p>
 * <pre>
 * IDLE -> CREATING -> ACTIVE -> DELETING -> IDLE
 *                            -> RECREATING -> CREATING
 * </pre>
 *
 * <p>The active session is published through an atomic reference, so the
 * poll loop and the keep-alive loop always see a complete session. Session
 * creation is serialized; the failure streak and the conflict/skew
 * stopwatches are only touched while holding this object's monitor.</p>
 *
 * <p>Deletion does not take the monitor, so it never waits for a creation
 * loop to finish backing off. Each delete bumps a teardown generation
 * instead; a creation loop that started before the delete discards the
 * session it gets.</p>
 */
public class SessionManager
{
    private static final Logger LOG = LoggerFactory.getLogger(SessionManager.class);

    /**
     * Upper bound for best-effort session and message deletes.
     */
    public static final Duration DELETE_TIMEOUT = Duration.ofSeconds(30);

    private final ListenerSettings settings;
    private final OrchestrationService service;
    private final CredentialProvider credentialProvider;
    private final CapabilitiesProvider capabilitiesProvider;
    private final ProgressiveBackoffFlag progressiveBackoff;
    private final ErrorClassifier classifier;
    private final SessionConflictTracker conflictTracker;
    private final BackoffState backoff;
    private final Sleeper sleeper;
    private final ConnectionEvents events;
    private final DefaultListenerStats stats;

    private final AtomicReference<AgentSession> activeSession;
    private final AtomicLong teardownGeneration;
    private volatile SessionState state;

    public SessionManager(
            ListenerSettings settings,
            OrchestrationService service,
            CredentialProvider credentialProvider,
            CapabilitiesProvider capabilitiesProvider,
            ProgressiveBackoffFlag progressiveBackoff,
            ErrorClassifier classifier,
            SessionConflictTracker conflictTracker,
            BackoffState backoff,
            Sleeper sleeper,
            ConnectionEvents events,
            DefaultListenerStats stats
    )
    {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.service = Objects.requireNonNull(service, "service");
        this.credentialProvider = Objects.requireNonNull(credentialProvider, "credentialProvider");
        this.capabilitiesProvider = Objects.requireNonNull(capabilitiesProvider, "capabilitiesProvider");
        this.progressiveBackoff = Objects.requireNonNull(progressiveBackoff, "progressiveBackoff");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.conflictTracker = Objects.requireNonNull(conflictTracker, "conflictTracker");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.events = Objects.requireNonNull(events, "events");
        this.stats = Objects.requireNonNull(stats, "stats");

        this.activeSession = new AtomicReference<>();
        this.teardownGeneration = new AtomicLong();
        this.state = SessionState.IDLE;
    }

    // ========== Session Creation ==========

    /**
     * Creates a session, retrying until it succeeds or fails permanently.
     *
     * <p>Returns at once if a session is already active.</p>
     *
     * @param token cancels the attempt loop, including a pending backoff wait
     * @return true if a session is active, false on a non-retryable failure
     *         or if the session was deleted while it was being created
     * @throws CancellationException if cancelled
     * @throws OrchestrationException if the access token was revoked
     */
    public synchronized boolean createSession(CancellationToken token) throws OrchestrationException
    {
        Objects.requireNonNull(token, "token");

        AgentSession current = activeSession.get();
        if (current != null && current.hasSessionId())
        {
            LOG.debug("Session {} is already active", current.sessionId());
            return true;
        }
        return createLoop(token, state);
    }

    /**
     * Replaces an expired session.
     *
     * <p>Called by the poll loop when the service reports the session as
     * expired. Follows the same retry rules as {@link #createSession}.</p>
     *
     * @param token cancels the attempt loop
     * @return true if a new session is active
     * @throws CancellationException if cancelled
     * @throws OrchestrationException if the access token was revoked
     */
    public synchronized boolean recreateSession(CancellationToken token) throws OrchestrationException
    {
        Objects.requireNonNull(token, "token");

        SessionState entryState = state;
        AgentSession expired = activeSession.get();
        LOG.info("Recreating session, previous session: {}", expired != null ? expired.sessionId() : null);

        state = SessionState.RECREATING;
        boolean created = createLoop(token, entryState);
        if (created)
        {
            stats.recordSessionRecovery();
        }
        else
        {
            // The old session is gone on the server; do not offer it to the loops any more
            activeSession.compareAndSet(expired, null);
            settleState();
        }
        return created;
    }

    private boolean createLoop(CancellationToken token, SessionState entryState) throws OrchestrationException
    {
        long generation = teardownGeneration.get();
        LOG.info("Connecting to {}", settings.serverUrl());

        while (true)
        {
            checkCancelled(token, entryState);
            state = SessionState.CREATING;
            LOG.debug("Attempt to create session");

            try
            {
                AgentSession session = attemptCreate(token);
                return activate(session, generation);
            }
            catch (Exception e)
            {
                LOG.debug("Exception during session creation", e);
                Classification classification = classifier.classifySessionCreationFailure(e, token);

                switch (classification.kind())
                {
                    case CANCELLED:
                        LOG.info("Session creation has been cancelled.");
                        state = entryState;
                        throw (CancellationException) e;
                    case TOKEN_REVOKED:
                        state = entryState;
                        throw (OrchestrationException) e;
                    case FATAL:
                        LOG.error("Failed to create session: {}", e.getMessage());
                        settleState();
                        return false;
                    default:
                        break;
                }

                Duration delay = backoff.recordFailure(progressiveBackoff.isEnabled());
                stats.recordRetry();

                if (backoff.getConsecutiveFailures() == 1)
                {
                    LOG.warn("Unable to connect to the orchestration service: {}. Retrying in {} seconds.",
                            e.getMessage(), delay.toSeconds());
                    events.connectionLost(ListenerOperation.CREATE_SESSION, e);
                }

                LOG.info("Unable to create session (attempt {}); progressive backoff {} (source: {})",
                        backoff.getConsecutiveFailures(), progressiveBackoff.isEnabled(),
                        progressiveBackoff.describeSource());
                LOG.info("Sleeping for {} seconds before retrying.", delay.toSeconds());

                try
                {
                    sleeper.sleep(delay, token);
                }
                catch (CancellationException ce)
                {
                    LOG.info("Session creation has been cancelled.");
                    state = entryState;
                    throw ce;
                }
            }
        }
    }

    private AgentSession attemptCreate(CancellationToken token) throws OrchestrationException, IOException
    {
        // Gathered per attempt: credentials and capabilities may change between retries
        AgentCredentials credentials = credentialProvider.loadCredentials();
        LOG.debug("Scanning capabilities");
        Map<String, String> capabilities = capabilitiesProvider.getCapabilities(token);
        SessionDescriptor descriptor = new SessionDescriptor(settings.sessionName(), settings.agent(), capabilities);

        LOG.debug("Connecting to the orchestration service");
        service.connect(settings.serverUrl(), credentials);

        progressiveBackoff.fetchIfUnknown();

        AgentSession session = service.createSession(settings.poolId(), descriptor, token);
        if (session == null || !session.hasSessionId())
        {
            throw new OrchestrationException("Service returned a session without an identifier");
        }
        return session;
    }

    private boolean activate(AgentSession session, long generation)
    {
        // Publish before checking, so a delete either sees the session or bumps the generation first
        activeSession.set(session);
        if (teardownGeneration.get() != generation)
        {
            LOG.info("Session {} was deleted while it was being created; discarding it", session.sessionId());
            if (activeSession.compareAndSet(session, null))
            {
                deleteOnServer(session);
            }
            settleState();
            return false;
        }

        state = SessionState.ACTIVE;
        conflictTracker.reset();

        if (backoff.isFailing())
        {
            LOG.info("Connected to the orchestration service again after {} failed attempts",
                    backoff.getConsecutiveFailures());
            events.connectionRestored(ListenerOperation.CREATE_SESSION);
        }
        backoff.reset();
        stats.recordSessionCreated();

        LOG.info("Session created: id={}, name={}, encrypted={}",
                session.sessionId(), session.sessionName(), session.getEncryptionKey().isPresent());
        return true;
    }

    private void settleState()
    {
        AgentSession current = activeSession.get();
        state = current != null && current.hasSessionId() ? SessionState.ACTIVE : SessionState.IDLE;
    }

    private void checkCancelled(CancellationToken token, SessionState entryState)
    {
        if (token.isCancellationRequested())
        {
            LOG.info("Session creation has been cancelled.");
            state = entryState;
            token.throwIfCancellationRequested();
        }
    }

    // ========== Session Deletion ==========

    /**
     * Deletes the active session on the server.
     *
     * <p>Best effort: a failed delete is logged and the session is
     * forgotten anyway. Does nothing without a session or with an empty
     * session id, so repeated calls are safe. A creation loop running
     * concurrently discards the session it creates.</p>
     */
    public void deleteSession()
    {
        teardownGeneration.incrementAndGet();
        AgentSession session = activeSession.getAndSet(null);
        if (session == null || !session.hasSessionId())
        {
            return;
        }
        deleteOnServer(session);
    }

    private void deleteOnServer(AgentSession session)
    {
        state = SessionState.DELETING;
        try
        {
            service.deleteSession(settings.poolId(), session.sessionId(), DELETE_TIMEOUT);
            LOG.info("Session deleted: id={}", session.sessionId());
        }
        catch (OrchestrationException | IOException | RuntimeException e)
        {
            LOG.warn("Unable to delete session {}: {}", session.sessionId(), e.getMessage());
        }
        finally
        {
            state = SessionState.IDLE;
        }
    }

    // ========== Accessors ==========

    /**
     * Returns the active session.
     *
     * @return the session, or null if none is active
     */
    public AgentSession getActiveSession()
    {
        return activeSession.get();
    }

    /**
     * Returns the active session, failing if there is none.
     *
     * @return the session
     * @throws IllegalStateException if no session with an identifier is active
     */
    public AgentSession requireActiveSession()
    {
        AgentSession session = activeSession.get();
        if (session == null || !session.hasSessionId())
        {
            throw new IllegalStateException("No active session; create a session first");
        }
        return session;
    }

    public SessionState getState()
    {
        return state;
    }

    /**
     * Returns the current run of failed creation attempts.
     */
    public int getConsecutiveFailures()
    {
        return backoff.getConsecutiveFailures();
    }

    public ListenerSettings getSettings()
    {
        return settings;
    }
}
