package org.abstractica.agentlistener;

import java.net.URI;

/**
 * Factory for creating MessageListener instances.
 *
 * <pre>{@code
 * MessageListenerFactory factory = new DefaultMessageListenerFactory();
 * MessageListener listener = factory.builder()
 *     .serverUrl(URI.create("https://orchestrator.example.com"))
 *     .poolId(1)
 *     .agent(AgentIdentity.ofCurrentHost(7, "build-01", "1.0.0"))
 *     .orchestrationService(service)
 *     .credentialProvider(credentials)
 *     .build();
 * }</pre>
 */
public interface MessageListenerFactory
{
    /**
     * Creates a new listener builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a MessageListener.
     */
    interface Builder
    {
        /**
         * Sets the orchestration service endpoint.
         *
         * @param serverUrl the endpoint
         * @return this builder
         */
        Builder serverUrl(URI serverUrl);

        /**
         * Sets the pool the agent is registered in.
         *
         * @param poolId the pool id, positive
         * @return this builder
         */
        Builder poolId(int poolId);

        /**
         * Sets the agent identity sent with the handshake.
         *
         * @param agent the identity
         * @return this builder
         */
        Builder agent(AgentIdentity agent);

        /**
         * Sets the session name.
         *
         * <p>Optional. Defaults to the host name.</p>
         *
         * @param sessionName the name
         * @return this builder
         */
        Builder sessionName(String sessionName);

        /**
         * Sets the remote service client.
         *
         * @param service the service
         * @return this builder
         */
        Builder orchestrationService(OrchestrationService service);

        /**
         * Sets the credential source.
         *
         * @param provider the provider
         * @return this builder
         */
        Builder credentialProvider(CredentialProvider provider);

        /**
         * Sets the feature-flag source.
         *
         * <p>Optional. Without one, progressive backoff stays disabled.</p>
         *
         * @param provider the provider
         * @return this builder
         */
        Builder featureFlagProvider(FeatureFlagProvider provider);

        /**
         * Sets the unwrapper for encrypted session keys.
         *
         * <p>Optional. Required only for sessions with wrapped keys.</p>
         *
         * @param unwrapper the unwrapper
         * @return this builder
         */
        Builder keyUnwrapper(KeyUnwrapper unwrapper);

        /**
         * Sets the capability source.
         *
         * <p>Optional. Defaults to an empty capability map.</p>
         *
         * @param provider the provider
         * @return this builder
         */
        Builder capabilitiesProvider(CapabilitiesProvider provider);

        /**
         * Disables transparent session recreation when the service reports
         * the session as expired.
         *
         * @param skip true to surface session expiry to the caller
         * @return this builder
         */
        Builder skipSessionRecover(boolean skip);

        /**
         * Builds the listener.
         *
         * @return the configured listener
         * @throws IllegalStateException if required parameters are missing
         */
        MessageListener build();
    }
}
