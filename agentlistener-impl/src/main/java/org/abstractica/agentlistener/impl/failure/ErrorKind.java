package org.abstractica.agentlistener.impl.failure;

/**
 * How a loop reacts to a failure.
 */
public enum ErrorKind
{
    /**
     * The caller cancelled. Propagate at once; not counted as a failure.
     */
    CANCELLED,

    /**
     * The access token was revoked. Propagate at once.
     */
    TOKEN_REVOKED,

    /**
     * Stop and report to the caller.
     */
    FATAL,

    /**
     * Back off and try the same operation again.
     */
    RETRYABLE_TRANSIENT,

    /**
     * The session expired on the server. Create a new one and resume polling.
     */
    RECOVER_BY_SESSION_RECREATE
}
