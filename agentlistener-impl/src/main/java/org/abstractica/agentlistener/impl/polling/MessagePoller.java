package org.abstractica.agentlistener.impl.polling;

import org.abstractica.agentlistener.AgentMessage;
import org.abstractica.agentlistener.AgentSession;
import org.abstractica.agentlistener.CancellationToken;
import org.abstractica.agentlistener.ListenerOperation;
import org.abstractica.agentlistener.OrchestrationService;
import org.abstractica.agentlistener.errors.MessageDecryptionException;
import org.abstractica.agentlistener.errors.OrchestrationException;
import org.abstractica.agentlistener.impl.backoff.BackoffSchedule;
import org.abstractica.agentlistener.impl.backoff.BackoffState;
import org.abstractica.agentlistener.impl.crypto.MessageCipher;
import org.abstractica.agentlistener.impl.failure.Classification;
import org.abstractica.agentlistener.impl.failure.ErrorClassifier;
import org.abstractica.agentlistener.impl.listener.DefaultListenerStats;
import org.abstractica.agentlistener.impl.session.ConnectionEvents;
import org.abstractica.agentlistener.impl.session.ProgressiveBackoffFlag;
import org.abstractica.agentlistener.impl.session.SessionManager;
import org.abstractica.agentlistener.impl.timing.Sleeper;
import org.abstractica.agentlistener.impl.timing.Stopwatch;
import org.abstractica.agentlistener.impl.timing.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * Long-poll loop that returns the next message of the active session.
 *
 * <p>Each call loops until a message arrives, the token is cancelled or a
 * failure needs the caller's attention. Empty polls wait a short random
 * interval before the next request. Transient failures refresh the
 * connection and back off. An expired session is recreated in place
 * unless recovery is disabled.</p>
 *
 * <p>Messages are delivered in increasing id order. A message whose id is
 * not above the last delivered id is dropped.</p>
 *
 * <p>Only one thread may poll at a time.</p>
 */
public class MessagePoller
{
    private static final Logger LOG = LoggerFactory.getLogger(MessagePoller.class);

    /**
     * Interval of the "still waiting" log line while no message arrives.
     */
    public static final Duration HEARTBEAT_INTERVAL = Duration.ofMinutes(30);

    private final SessionManager sessionManager;
    private final OrchestrationService service;
    private final MessageCipher cipher;
    private final ErrorClassifier classifier;
    private final ProgressiveBackoffFlag progressiveBackoff;
    private final BackoffState backoff;
    private final Sleeper sleeper;
    private final Ticker ticker;
    private final ConnectionEvents events;
    private final DefaultListenerStats stats;
    private final boolean recoveryEnabled;

    private Long lastMessageId;

    public MessagePoller(
            SessionManager sessionManager,
            OrchestrationService service,
            MessageCipher cipher,
            ErrorClassifier classifier,
            ProgressiveBackoffFlag progressiveBackoff,
            BackoffState backoff,
            Sleeper sleeper,
            Ticker ticker,
            ConnectionEvents events,
            DefaultListenerStats stats
    )
    {
        this.sessionManager = Objects.requireNonNull(sessionManager, "sessionManager");
        this.service = Objects.requireNonNull(service, "service");
        this.cipher = Objects.requireNonNull(cipher, "cipher");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.progressiveBackoff = Objects.requireNonNull(progressiveBackoff, "progressiveBackoff");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.events = Objects.requireNonNull(events, "events");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.recoveryEnabled = !sessionManager.getSettings().skipSessionRecover();
    }

    /**
     * Waits for the next message.
     *
     * @param token cancels the loop, including a pending wait
     * @return the next message, decrypted when the session is encrypted
     * @throws CancellationException if cancelled
     * @throws OrchestrationException on a failure that retrying cannot fix
     * @throws IllegalStateException if no session is active
     */
    public AgentMessage getNextMessage(CancellationToken token) throws OrchestrationException
    {
        Objects.requireNonNull(token, "token");

        progressiveBackoff.fetchIfUnknown();
        backoff.reset();

        Stopwatch heartbeat = new Stopwatch(ticker);
        heartbeat.start();

        while (true)
        {
            token.throwIfCancellationRequested();
            AgentSession session = sessionManager.requireActiveSession();

            AgentMessage message;
            try
            {
                message = pollOnce(session, token);

                if (backoff.isFailing())
                {
                    LOG.info("Message polling recovered after {} failed attempts",
                            backoff.getConsecutiveFailures());
                    events.connectionRestored(ListenerOperation.GET_NEXT_MESSAGE);
                    backoff.reset();
                }
            }
            catch (Exception e)
            {
                LOG.debug("Exception during message polling", e);
                Classification classification = classifier.classifyMessagePollFailure(e, token, recoveryEnabled);

                switch (classification.kind())
                {
                    case CANCELLED:
                        LOG.info("Get next message has been cancelled.");
                        throw (CancellationException) e;
                    case RECOVER_BY_SESSION_RECREATE:
                        recoverSession(token, e);
                        continue;
                    case TOKEN_REVOKED:
                    case FATAL:
                        LOG.error("Get next message failed with a non-retryable error: {}", e.getMessage());
                        throw rethrow(e);
                    default:
                        break;
                }

                retryAfterFailure(token, e);
                continue;
            }

            if (message == null)
            {
                if (heartbeat.elapsed().compareTo(HEARTBEAT_INTERVAL) >= 0)
                {
                    LOG.info("No message retrieved within the last {} minutes.", HEARTBEAT_INTERVAL.toMinutes());
                    heartbeat.restart();
                }
                else
                {
                    LOG.debug("No message retrieved.");
                }

                sleeper.sleep(backoff.nextWait(BackoffSchedule.IDLE_POLL), token);
                continue;
            }

            lastMessageId = message.messageId();
            stats.recordMessage();
            LOG.info("Message '{}' received, type {}", message.messageId(), message.messageType());
            return message;
        }
    }

    private AgentMessage pollOnce(AgentSession session, CancellationToken token)
            throws OrchestrationException, IOException
    {
        AgentMessage message = service.getNextMessage(
                sessionManager.getSettings().poolId(), session.sessionId(), lastMessageId, token);

        if (message == null)
        {
            return null;
        }
        if (lastMessageId != null && message.messageId() <= lastMessageId)
        {
            LOG.warn("Ignoring message {}; already received up to {}", message.messageId(), lastMessageId);
            return null;
        }

        try
        {
            return cipher.decrypt(message, session);
        }
        catch (MessageDecryptionException e)
        {
            // Never ask for this message again
            lastMessageId = message.messageId();
            throw e;
        }
    }

    private void recoverSession(CancellationToken token, Exception expired) throws OrchestrationException
    {
        LOG.warn("Session expired: {}. Recreating the session.", expired.getMessage());
        if (!sessionManager.recreateSession(token))
        {
            LOG.error("Unable to recreate the expired session.");
            throw rethrow(expired);
        }
        LOG.info("Session recreated; resuming message polling.");
    }

    private void retryAfterFailure(CancellationToken token, Exception e)
    {
        Duration delay = backoff.recordFailure(progressiveBackoff.isEnabled());
        stats.recordRetry();

        if (backoff.getConsecutiveFailures() == 1)
        {
            LOG.warn("Lost connection to the orchestration service: {}", e.getMessage());
            events.connectionLost(ListenerOperation.GET_NEXT_MESSAGE, e);
        }

        try
        {
            service.refreshConnection();
        }
        catch (IOException | RuntimeException refreshFailure)
        {
            LOG.warn("Unable to refresh the connection: {}", refreshFailure.getMessage());
        }

        LOG.info("Unable to get next message (attempt {}); progressive backoff {} (source: {}). Sleeping for {} seconds.",
                backoff.getConsecutiveFailures(), progressiveBackoff.isEnabled(),
                progressiveBackoff.describeSource(), delay.toSeconds());
        sleeper.sleep(delay, token);
    }

    private static OrchestrationException rethrow(Exception e)
    {
        if (e instanceof OrchestrationException)
        {
            return (OrchestrationException) e;
        }
        if (e instanceof RuntimeException)
        {
            throw (RuntimeException) e;
        }
        return new OrchestrationException(e.getMessage(), e);
    }

    /**
     * Returns the id of the last delivered or skipped message.
     *
     * @return the id, or null before the first message of a session
     */
    public Long getLastMessageId()
    {
        return lastMessageId;
    }
}
