package org.abstractica.agentlistener.errors;

/**
 * Another live session already exists for this agent.
 */
public class SessionConflictException extends OrchestrationException
{
    public SessionConflictException(String message)
    {
        super(message);
    }

    public SessionConflictException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
