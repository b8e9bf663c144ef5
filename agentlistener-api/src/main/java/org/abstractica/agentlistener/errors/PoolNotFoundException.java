package org.abstractica.agentlistener.errors;

/**
 * The agent pool does not exist.
 */
public class PoolNotFoundException extends OrchestrationException
{
    public PoolNotFoundException(String message)
    {
        super(message);
    }

    public PoolNotFoundException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
