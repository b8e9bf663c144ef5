package org.abstractica.agentlistener.errors;

/**
 * Base class for failures reported by the orchestration service.
 */
public class OrchestrationException extends Exception
{
    public OrchestrationException(String message)
    {
        super(message);
    }

    public OrchestrationException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
