package org.abstractica.agentlistener.impl.listener;

import org.abstractica.agentlistener.AgentIdentity;
import org.abstractica.agentlistener.CapabilitiesProvider;
import org.abstractica.agentlistener.CredentialProvider;
import org.abstractica.agentlistener.FeatureFlagProvider;
import org.abstractica.agentlistener.KeyUnwrapper;
import org.abstractica.agentlistener.MessageListener;
import org.abstractica.agentlistener.MessageListenerFactory;
import org.abstractica.agentlistener.OrchestrationService;
import org.abstractica.agentlistener.impl.failure.SessionConflictTracker;
import org.abstractica.agentlistener.impl.timing.Sleeper;
import org.abstractica.agentlistener.impl.timing.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Default implementation of MessageListenerFactory.
 */
public class DefaultMessageListenerFactory implements MessageListenerFactory
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultMessageListenerFactory.class);

    /**
     * Session name used when the host name cannot be resolved.
     */
    public static final String FALLBACK_SESSION_NAME = "AGENT";

    @Override
    public Builder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private URI serverUrl;
        private int poolId;
        private AgentIdentity agent;
        private String sessionName;
        private OrchestrationService service;
        private CredentialProvider credentialProvider;
        private FeatureFlagProvider featureFlagProvider;
        private KeyUnwrapper keyUnwrapper;
        private CapabilitiesProvider capabilitiesProvider;
        private boolean skipSessionRecover;

        // Test and tuning hooks
        private Random random;
        private Ticker ticker = Ticker.system();
        private Sleeper sleeper = Sleeper.system();
        private Duration conflictLimit = SessionConflictTracker.DEFAULT_CONFLICT_LIMIT;
        private Duration clockSkewLimit = SessionConflictTracker.DEFAULT_CLOCK_SKEW_LIMIT;

        @Override
        public Builder serverUrl(URI serverUrl)
        {
            this.serverUrl = Objects.requireNonNull(serverUrl, "serverUrl");
            return this;
        }

        @Override
        public Builder poolId(int poolId)
        {
            if (poolId <= 0)
            {
                throw new IllegalArgumentException("Pool id must be positive: " + poolId);
            }
            this.poolId = poolId;
            return this;
        }

        @Override
        public Builder agent(AgentIdentity agent)
        {
            this.agent = Objects.requireNonNull(agent, "agent");
            return this;
        }

        @Override
        public Builder sessionName(String sessionName)
        {
            this.sessionName = Objects.requireNonNull(sessionName, "sessionName");
            return this;
        }

        @Override
        public Builder orchestrationService(OrchestrationService service)
        {
            this.service = Objects.requireNonNull(service, "service");
            return this;
        }

        @Override
        public Builder credentialProvider(CredentialProvider provider)
        {
            this.credentialProvider = Objects.requireNonNull(provider, "provider");
            return this;
        }

        @Override
        public Builder featureFlagProvider(FeatureFlagProvider provider)
        {
            this.featureFlagProvider = provider;
            return this;
        }

        @Override
        public Builder keyUnwrapper(KeyUnwrapper unwrapper)
        {
            this.keyUnwrapper = unwrapper;
            return this;
        }

        @Override
        public Builder capabilitiesProvider(CapabilitiesProvider provider)
        {
            this.capabilitiesProvider = provider;
            return this;
        }

        @Override
        public Builder skipSessionRecover(boolean skip)
        {
            this.skipSessionRecover = skip;
            return this;
        }

        /**
         * Sets the source of backoff jitter.
         *
         * <p>If not set, a {@link SecureRandom} is used. Pass a seeded
         * {@link Random} for reproducible tests.</p>
         *
         * @param random the random source
         * @return this builder
         */
        public DefaultBuilder random(Random random)
        {
            this.random = Objects.requireNonNull(random, "random");
            return this;
        }

        /**
         * Sets the time source used by the conflict and heartbeat stopwatches.
         *
         * @param ticker the time source
         * @return this builder
         */
        public DefaultBuilder ticker(Ticker ticker)
        {
            this.ticker = Objects.requireNonNull(ticker, "ticker");
            return this;
        }

        /**
         * Sets how backoff waits are performed.
         *
         * @param sleeper the sleeper
         * @return this builder
         */
        public DefaultBuilder sleeper(Sleeper sleeper)
        {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
            return this;
        }

        /**
         * Sets how long repeated session conflicts are retried.
         *
         * @param limit the limit, defaults to 4 minutes
         * @return this builder
         */
        public DefaultBuilder sessionConflictRetryLimit(Duration limit)
        {
            this.conflictLimit = requirePositive(limit, "limit");
            return this;
        }

        /**
         * Sets how long repeated clock-skew failures are retried.
         *
         * @param limit the limit, defaults to 30 minutes
         * @return this builder
         */
        public DefaultBuilder clockSkewRetryLimit(Duration limit)
        {
            this.clockSkewLimit = requirePositive(limit, "limit");
            return this;
        }

        @Override
        public MessageListener build()
        {
            if (serverUrl == null)
            {
                throw new IllegalStateException("Server URL must be specified");
            }
            if (poolId == 0)
            {
                throw new IllegalStateException("Pool id must be specified");
            }
            if (agent == null)
            {
                throw new IllegalStateException("Agent identity must be specified");
            }
            if (service == null)
            {
                throw new IllegalStateException("Orchestration service must be specified");
            }
            if (credentialProvider == null)
            {
                throw new IllegalStateException("Credential provider must be specified");
            }

            String name = sessionName != null ? sessionName : defaultSessionName();
            ListenerSettings settings = new ListenerSettings(serverUrl, poolId, agent, name, skipSessionRecover);

            CapabilitiesProvider capabilities = capabilitiesProvider != null
                    ? capabilitiesProvider
                    : token -> Map.of();
            Random jitter = random != null ? random : new SecureRandom();

            return new DefaultMessageListener(
                    settings,
                    service,
                    credentialProvider,
                    capabilities,
                    featureFlagProvider,
                    keyUnwrapper,
                    jitter,
                    ticker,
                    sleeper,
                    conflictLimit,
                    clockSkewLimit
            );
        }

        private static Duration requirePositive(Duration duration, String name)
        {
            Objects.requireNonNull(duration, name);
            if (duration.isNegative() || duration.isZero())
            {
                throw new IllegalArgumentException(name + " must be positive: " + duration);
            }
            return duration;
        }

        private static String defaultSessionName()
        {
            try
            {
                return InetAddress.getLocalHost().getHostName();
            }
            catch (UnknownHostException e)
            {
                LOG.warn("Unable to resolve the host name, using session name {}: {}",
                        FALLBACK_SESSION_NAME, e.getMessage());
                return FALLBACK_SESSION_NAME;
            }
        }
    }
}
