package org.abstractica.agentlistener;

/**
 * Supplies the credentials used to connect to the orchestration service.
 */
@FunctionalInterface
public interface CredentialProvider
{
    /**
     * Loads the current credentials. Called on every connection attempt.
     *
     * @return the credentials
     */
    AgentCredentials loadCredentials();
}
