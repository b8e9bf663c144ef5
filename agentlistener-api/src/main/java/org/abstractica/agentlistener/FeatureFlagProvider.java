package org.abstractica.agentlistener;

import org.abstractica.agentlistener.errors.OrchestrationException;

import java.io.IOException;

/**
 * Reads feature flags from the service.
 */
@FunctionalInterface
public interface FeatureFlagProvider
{
    /**
     * Fetches a feature flag.
     *
     * @param name the flag name
     * @return the flag state
     */
    FeatureFlag getFeatureFlag(String name) throws OrchestrationException, IOException;
}
