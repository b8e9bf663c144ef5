package org.abstractica.agentlistener.errors;

/**
 * The service rejected the agent's credentials.
 */
public class UnauthorizedException extends OrchestrationException
{
    public UnauthorizedException(String message)
    {
        super(message);
    }

    public UnauthorizedException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
