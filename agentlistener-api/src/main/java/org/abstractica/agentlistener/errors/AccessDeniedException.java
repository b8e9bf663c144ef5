package org.abstractica.agentlistener.errors;

/**
 * The agent's identity is not permitted to perform the operation.
 */
public class AccessDeniedException extends OrchestrationException
{
    public AccessDeniedException(String message)
    {
        super(message);
    }

    public AccessDeniedException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
