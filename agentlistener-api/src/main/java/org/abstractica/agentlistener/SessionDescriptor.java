package org.abstractica.agentlistener;

import java.util.Map;
import java.util.Objects;

/**
 * Payload of the session-creation handshake.
 *
 * @param sessionName  the requested session name
 * @param agent        the agent identity
 * @param capabilities the agent's system capabilities
 */
public record SessionDescriptor(String sessionName, AgentIdentity agent, Map<String, String> capabilities)
{
    public SessionDescriptor
    {
        Objects.requireNonNull(sessionName, "sessionName");
        Objects.requireNonNull(agent, "agent");
        capabilities = Map.copyOf(Objects.requireNonNull(capabilities, "capabilities"));
    }
}
