package org.abstractica.agentlistener.errors;

/**
 * The agent's access token has been revoked.
 */
public class AccessTokenExpiredException extends OrchestrationException
{
    public AccessTokenExpiredException(String message)
    {
        super(message);
    }

    public AccessTokenExpiredException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
