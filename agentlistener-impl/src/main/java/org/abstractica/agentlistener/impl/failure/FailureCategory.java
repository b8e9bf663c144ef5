package org.abstractica.agentlistener.impl.failure;

import org.abstractica.agentlistener.errors.AccessDeniedException;
import org.abstractica.agentlistener.errors.AccessTokenExpiredException;
import org.abstractica.agentlistener.errors.AgentNotFoundException;
import org.abstractica.agentlistener.errors.MessageDecryptionException;
import org.abstractica.agentlistener.errors.PoolNotFoundException;
import org.abstractica.agentlistener.errors.SessionConflictException;
import org.abstractica.agentlistener.errors.SessionExpiredException;
import org.abstractica.agentlistener.errors.TokenRequestException;
import org.abstractica.agentlistener.errors.UnauthorizedException;

import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * What a caught failure means, derived once from its type and message.
 */
public enum FailureCategory
{
    CANCELLED,
    TOKEN_REVOKED,
    AGENT_NOT_FOUND,
    POOL_NOT_FOUND,
    ACCESS_DENIED,
    UNAUTHORIZED,
    SESSION_CONFLICT,
    CLOCK_SKEW,
    SESSION_EXPIRED,
    DECRYPTION_FAILED,
    TRANSIENT;

    /**
     * Determines the category of a failure.
     *
     * @param failure the caught failure
     * @return its category
     */
    public static FailureCategory of(Throwable failure)
    {
        Objects.requireNonNull(failure, "failure");

        if (failure instanceof CancellationException)
        {
            return CANCELLED;
        }
        if (failure instanceof AccessTokenExpiredException)
        {
            return TOKEN_REVOKED;
        }
        if (failure instanceof AgentNotFoundException)
        {
            return AGENT_NOT_FOUND;
        }
        if (failure instanceof PoolNotFoundException)
        {
            return POOL_NOT_FOUND;
        }
        if (failure instanceof AccessDeniedException)
        {
            return ACCESS_DENIED;
        }
        if (failure instanceof UnauthorizedException)
        {
            return UNAUTHORIZED;
        }
        if (failure instanceof SessionConflictException)
        {
            return SESSION_CONFLICT;
        }
        if (failure instanceof TokenRequestException && ((TokenRequestException) failure).isClockSkew())
        {
            return CLOCK_SKEW;
        }
        if (failure instanceof SessionExpiredException)
        {
            return SESSION_EXPIRED;
        }
        if (failure instanceof MessageDecryptionException)
        {
            return DECRYPTION_FAILED;
        }
        return TRANSIENT;
    }

    /**
     * Returns true for conditions that need an operator and never go away by retrying.
     *
     * @return true if fatal for every operation
     */
    public boolean isPermanent()
    {
        switch (this)
        {
            case AGENT_NOT_FOUND:
            case POOL_NOT_FOUND:
            case ACCESS_DENIED:
            case UNAUTHORIZED:
            case DECRYPTION_FAILED:
                return true;
            default:
                return false;
        }
    }
}
