package org.abstractica.agentlistener.impl.polling;

import org.abstractica.agentlistener.AgentSession;
import org.abstractica.agentlistener.CancellationToken;
import org.abstractica.agentlistener.OrchestrationService;
import org.abstractica.agentlistener.impl.backoff.BackoffState;
import org.abstractica.agentlistener.impl.failure.Classification;
import org.abstractica.agentlistener.impl.failure.ErrorClassifier;
import org.abstractica.agentlistener.impl.failure.ErrorKind;
import org.abstractica.agentlistener.impl.session.ProgressiveBackoffFlag;
import org.abstractica.agentlistener.impl.session.SessionManager;
import org.abstractica.agentlistener.impl.timing.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * Periodic no-op poll that keeps the session alive while a job runs.
 *
 * <p>Polls without a last message id, so it never consumes a message.
 * Failures are logged and retried with a slowly growing interval; only
 * cancellation ends the loop.</p>
 */
public class KeepAliveLoop
{
    private static final Logger LOG = LoggerFactory.getLogger(KeepAliveLoop.class);

    /**
     * Interval between keep-alive polls while they succeed.
     */
    public static final Duration BASE_INTERVAL = Duration.ofSeconds(30);

    private final SessionManager sessionManager;
    private final OrchestrationService service;
    private final ErrorClassifier classifier;
    private final ProgressiveBackoffFlag progressiveBackoff;
    private final BackoffState backoff;
    private final Sleeper sleeper;

    public KeepAliveLoop(
            SessionManager sessionManager,
            OrchestrationService service,
            ErrorClassifier classifier,
            ProgressiveBackoffFlag progressiveBackoff,
            BackoffState backoff,
            Sleeper sleeper
    )
    {
        this.sessionManager = Objects.requireNonNull(sessionManager, "sessionManager");
        this.service = Objects.requireNonNull(service, "service");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.progressiveBackoff = Objects.requireNonNull(progressiveBackoff, "progressiveBackoff");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Runs until the token is cancelled.
     *
     * @param token stops the loop
     */
    public void run(CancellationToken token)
    {
        Objects.requireNonNull(token, "token");
        LOG.debug("Keep-alive loop started");

        while (!token.isCancellationRequested())
        {
            AgentSession session = sessionManager.getActiveSession();
            if (session != null && session.hasSessionId())
            {
                if (!ping(session, token))
                {
                    break;
                }
            }

            try
            {
                sleeper.sleep(backoff.getCurrentInterval(), token);
            }
            catch (CancellationException e)
            {
                break;
            }
        }

        LOG.debug("Keep-alive loop stopped");
    }

    private boolean ping(AgentSession session, CancellationToken token)
    {
        try
        {
            service.getNextMessage(sessionManager.getSettings().poolId(), session.sessionId(), null, token);
            if (backoff.isFailing())
            {
                LOG.info("Keep-alive succeeded again after {} failures", backoff.getConsecutiveFailures());
            }
            backoff.reset();
            LOG.debug("Keep-alive poll succeeded");
            return true;
        }
        catch (Exception e)
        {
            Classification classification = classifier.classifyKeepAliveFailure(e, token);
            if (classification.kind() == ErrorKind.CANCELLED)
            {
                return false;
            }

            Duration delay = backoff.recordFailure(progressiveBackoff.isEnabled());
            LOG.info("Keep-alive failed (attempt {}): {}. Next attempt in {} seconds.",
                    backoff.getConsecutiveFailures(), e.getMessage(), delay.toSeconds());
            return true;
        }
    }

    public int getConsecutiveFailures()
    {
        return backoff.getConsecutiveFailures();
    }
}
