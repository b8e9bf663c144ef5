package org.abstractica.agentlistener.errors;

/**
 * The agent is no longer registered with the service.
 */
public class AgentNotFoundException extends OrchestrationException
{
    public AgentNotFoundException(String message)
    {
        super(message);
    }

    public AgentNotFoundException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
