package org.abstractica.agentlistener.impl.session;

import org.abstractica.agentlistener.FeatureFlag;
import org.abstractica.agentlistener.FeatureFlagProvider;
import org.abstractica.agentlistener.errors.OrchestrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Cached state of the progressive-backoff feature flag.
 *
 * <p>The flag is fetched until one fetch succeeds and then kept for the
 * lifetime of the process. Until then progressive backoff is off. A failed
 * fetch is logged and tried again on a later cycle.</p>
 *
 * <p>Readers may race with the single write; they see either the default
 * or the fetched value.</p>
 */
public class ProgressiveBackoffFlag
{
    private static final Logger LOG = LoggerFactory.getLogger(ProgressiveBackoffFlag.class);

    /**
     * Name of the server-side feature flag.
     */
    public static final String FLAG_NAME = "DistributedTask.Agent.EnableProgressiveRetryBackoff";

    private enum State
    {
        UNKNOWN,
        DISABLED,
        ENABLED
    }

    private final FeatureFlagProvider provider;
    private volatile State state;

    /**
     * Creates the flag.
     *
     * @param provider fetches the flag, or null to keep progressive backoff off
     */
    public ProgressiveBackoffFlag(FeatureFlagProvider provider)
    {
        this.provider = provider;
        this.state = provider == null ? State.DISABLED : State.UNKNOWN;
    }

    /**
     * Fetches the flag unless an earlier fetch succeeded. Never throws.
     */
    public void fetchIfUnknown()
    {
        if (state != State.UNKNOWN)
        {
            return;
        }

        try
        {
            FeatureFlag flag = provider.getFeatureFlag(FLAG_NAME);
            boolean enabled = flag != null && flag.isOn();
            state = enabled ? State.ENABLED : State.DISABLED;
            LOG.info("Progressive backoff feature flag fetched: {}", enabled);
        }
        catch (OrchestrationException | IOException | RuntimeException e)
        {
            LOG.info("Unable to fetch progressive backoff feature flag: {}", e.getMessage());
        }
    }

    public boolean isEnabled()
    {
        return state == State.ENABLED;
    }

    public boolean isFetched()
    {
        return state != State.UNKNOWN;
    }

    /**
     * Describes where the current value comes from, for log lines.
     */
    public String describeSource()
    {
        return isFetched() ? "feature flag (cached)" : "default (not fetched)";
    }
}
