package org.abstractica.agentlistener.impl.failure;

import org.abstractica.agentlistener.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Decides how each loop reacts to a caught failure.
 *
 * <p>The failure is mapped to a {@link FailureCategory} once; the
 * {@link ErrorKind} then depends on the operation. Session conflicts and
 * clock skew are retryable until the {@link SessionConflictTracker} reports
 * that their time budget is spent.</p>
 */
public class ErrorClassifier
{
    private static final Logger LOG = LoggerFactory.getLogger(ErrorClassifier.class);

    private final SessionConflictTracker conflictTracker;

    /**
     * Creates a classifier.
     *
     * @param conflictTracker tracks the conflict and skew budgets
     */
    public ErrorClassifier(SessionConflictTracker conflictTracker)
    {
        this.conflictTracker = Objects.requireNonNull(conflictTracker, "conflictTracker");
    }

    /**
     * Classifies a failed session-creation attempt.
     *
     * <p>Conflict and skew failures are recorded with the tracker, so each
     * call counts as one occurrence.</p>
     *
     * @param failure the caught failure
     * @param token   the caller's cancellation token
     * @return the classification
     */
    public Classification classifySessionCreationFailure(Throwable failure, CancellationToken token)
    {
        FailureCategory category = categorize(failure, token);
        ErrorKind kind;

        switch (category)
        {
            case CANCELLED:
                kind = ErrorKind.CANCELLED;
                break;
            case TOKEN_REVOKED:
                LOG.info("Agent access token has been revoked. Session creation failed.");
                kind = ErrorKind.TOKEN_REVOKED;
                break;
            case AGENT_NOT_FOUND:
                LOG.error("The agent no longer exists on the server. Stopping the agent.");
                kind = ErrorKind.FATAL;
                break;
            case SESSION_CONFLICT:
                LOG.warn("A session for this agent already exists.");
                if (conflictTracker.recordConflict())
                {
                    LOG.error("Session conflicts persisted for {} seconds. Stop retrying.",
                            conflictTracker.getConflictLimit().toSeconds());
                    kind = ErrorKind.FATAL;
                }
                else
                {
                    kind = ErrorKind.RETRYABLE_TRANSIENT;
                }
                break;
            case CLOCK_SKEW:
                LOG.warn("Local clock might be skewed.");
                if (conflictTracker.recordClockSkew())
                {
                    LOG.error("Clock skew persisted for {} seconds. Stop retrying; check the time synchronization of this host.",
                            conflictTracker.getClockSkewLimit().toSeconds());
                    kind = ErrorKind.FATAL;
                }
                else
                {
                    kind = ErrorKind.RETRYABLE_TRANSIENT;
                }
                break;
            default:
                kind = category.isPermanent() ? ErrorKind.FATAL : ErrorKind.RETRYABLE_TRANSIENT;
                break;
        }

        log(kind, failure);
        return new Classification(kind, category, failure);
    }

    /**
     * Classifies a failed message poll.
     *
     * @param failure         the caught failure
     * @param token           the caller's cancellation token
     * @param recoveryEnabled whether an expired session may be recreated
     * @return the classification
     */
    public Classification classifyMessagePollFailure(Throwable failure, CancellationToken token, boolean recoveryEnabled)
    {
        FailureCategory category = categorize(failure, token);
        ErrorKind kind;

        switch (category)
        {
            case CANCELLED:
                kind = ErrorKind.CANCELLED;
                break;
            case TOKEN_REVOKED:
                LOG.info("Agent access token has been revoked. Unable to pull message.");
                kind = ErrorKind.TOKEN_REVOKED;
                break;
            case SESSION_EXPIRED:
                kind = recoveryEnabled ? ErrorKind.RECOVER_BY_SESSION_RECREATE : ErrorKind.FATAL;
                break;
            default:
                kind = category.isPermanent() ? ErrorKind.FATAL : ErrorKind.RETRYABLE_TRANSIENT;
                break;
        }

        log(kind, failure);
        return new Classification(kind, category, failure);
    }

    /**
     * Classifies a failed keep-alive call. Keep-alive never gives up.
     *
     * @param failure the caught failure
     * @param token   the caller's cancellation token
     * @return the classification
     */
    public Classification classifyKeepAliveFailure(Throwable failure, CancellationToken token)
    {
        FailureCategory category = categorize(failure, token);
        ErrorKind kind = category == FailureCategory.CANCELLED ? ErrorKind.CANCELLED : ErrorKind.RETRYABLE_TRANSIENT;
        return new Classification(kind, category, failure);
    }

    private static FailureCategory categorize(Throwable failure, CancellationToken token)
    {
        FailureCategory category = FailureCategory.of(failure);
        if (category == FailureCategory.CANCELLED
                && !token.isCancellationRequested()
                && !Thread.currentThread().isInterrupted())
        {
            // Cancelled by someone other than the caller, e.g. a transport timeout
            return FailureCategory.TRANSIENT;
        }
        return category;
    }

    private static void log(ErrorKind kind, Throwable failure)
    {
        if (kind == ErrorKind.RETRYABLE_TRANSIENT)
        {
            LOG.info("Retriable exception: {}", failure.getMessage());
        }
        else if (kind == ErrorKind.FATAL)
        {
            LOG.info("Non-retriable exception: {}", failure.getMessage());
        }
    }
}
