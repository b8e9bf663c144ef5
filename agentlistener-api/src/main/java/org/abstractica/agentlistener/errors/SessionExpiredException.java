package org.abstractica.agentlistener.errors;

/**
 * The service no longer knows the session, typically because it timed out.
 */
public class SessionExpiredException extends OrchestrationException
{
    public SessionExpiredException(String message)
    {
        super(message);
    }

    public SessionExpiredException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
