package org.abstractica.agentlistener;

import java.util.Objects;

/**
 * Opaque credentials used to connect to the orchestration service.
 *
 * @param scheme the credential scheme, for example {@code OAuth}
 * @param token  the secret material
 */
public record AgentCredentials(String scheme, String token)
{
    public AgentCredentials
    {
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(token, "token");
    }

    @Override
    public String toString()
    {
        return "AgentCredentials[scheme=" + scheme + "]";
    }
}
