package org.abstractica.agentlistener;

import java.util.Map;

/**
 * Supplies the capability map sent with the session handshake.
 */
@FunctionalInterface
public interface CapabilitiesProvider
{
    /**
     * Returns the current capabilities of this agent.
     *
     * @param token cancels the scan
     * @return capability names mapped to values
     */
    Map<String, String> getCapabilities(CancellationToken token);
}
