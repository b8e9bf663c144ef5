package org.abstractica.agentlistener;

import java.util.Objects;

/**
 * Identity the agent declares when it creates a session.
 *
 * @param agentId       the agent id assigned at registration
 * @param agentName     the agent name
 * @param version       the agent version
 * @param osDescription description of the host operating system
 */
public record AgentIdentity(int agentId, String agentName, String version, String osDescription)
{
    public AgentIdentity
    {
        Objects.requireNonNull(agentName, "agentName");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(osDescription, "osDescription");
    }

    /**
     * Creates an identity describing the current host.
     *
     * @param agentId   the agent id
     * @param agentName the agent name
     * @param version   the agent version
     * @return the identity
     */
    public static AgentIdentity ofCurrentHost(int agentId, String agentName, String version)
    {
        String os = System.getProperty("os.name", "unknown") + " " + System.getProperty("os.version", "");
        return new AgentIdentity(agentId, agentName, version, os.trim());
    }
}
