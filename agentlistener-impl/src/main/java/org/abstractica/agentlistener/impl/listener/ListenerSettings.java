package org.abstractica.agentlistener.impl.listener;

import org.abstractica.agentlistener.AgentIdentity;

import java.net.URI;
import java.util.Objects;

/**
 * Resolved listener configuration.
 *
 * @param serverUrl          the orchestration service endpoint
 * @param poolId             the agent pool
 * @param agent              the agent identity
 * @param sessionName        the session name
 * @param skipSessionRecover true to surface session expiry instead of recreating the session
 */
public record ListenerSettings(
        URI serverUrl,
        int poolId,
        AgentIdentity agent,
        String sessionName,
        boolean skipSessionRecover
)
{
    public ListenerSettings
    {
        Objects.requireNonNull(serverUrl, "serverUrl");
        Objects.requireNonNull(agent, "agent");
        Objects.requireNonNull(sessionName, "sessionName");
        if (poolId <= 0)
        {
            throw new IllegalArgumentException("Pool id must be positive: " + poolId);
        }
    }
}
