package org.abstractica.agentlistener;

import java.util.Objects;

/**
 * State of a server-side feature flag.
 *
 * @param name           the flag name
 * @param effectiveState the effective state reported by the server
 */
public record FeatureFlag(String name, String effectiveState)
{
    /**
     * Effective state of an enabled flag.
     */
    public static final String ON = "On";

    public FeatureFlag
    {
        Objects.requireNonNull(name, "name");
    }

    public boolean isOn()
    {
        return ON.equals(effectiveState);
    }
}
