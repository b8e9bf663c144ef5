package org.abstractica.agentlistener.impl.listener;

import org.abstractica.agentlistener.AgentCredentials;
import org.abstractica.agentlistener.AgentIdentity;
import org.abstractica.agentlistener.CancellationToken;
import org.abstractica.agentlistener.MessageListener;
import org.abstractica.agentlistener.MessageListenerFactory;
import org.abstractica.agentlistener.errors.SessionConflictException;
import org.abstractica.agentlistener.impl.remote.SimulatedOrchestrationService;
import org.abstractica.agentlistener.impl.timing.ManualTicker;
import org.abstractica.agentlistener.impl.timing.RecordingSleeper;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DefaultMessageListenerFactory}.
 */
class DefaultMessageListenerFactoryTest
{
    private static final URI SERVER = URI.create("https://orchestrator.test");
    private static final AgentIdentity AGENT = new AgentIdentity(1, "agent-1", "1.0.0", "Linux");

    private final SimulatedOrchestrationService service = new SimulatedOrchestrationService();

    private MessageListenerFactory.Builder completeBuilder()
    {
        return new DefaultMessageListenerFactory().builder()
                .serverUrl(SERVER)
                .poolId(1)
                .agent(AGENT)
                .orchestrationService(service)
                .credentialProvider(() -> new AgentCredentials("Bearer", "t"));
    }

    @Test
    void build_allRequired_createsListener()
    {
        MessageListener listener = completeBuilder().build();

        assertNotNull(listener);
        assertTrue(listener.getSession().isEmpty());
        assertEquals(0, listener.getStats().getSessionsCreated());
    }

    @Test
    void build_missingServerUrl_throws()
    {
        MessageListenerFactory.Builder builder = new DefaultMessageListenerFactory().builder()
                .poolId(1)
                .agent(AGENT)
                .orchestrationService(service)
                .credentialProvider(() -> new AgentCredentials("Bearer", "t"));

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void build_missingPool_throws()
    {
        MessageListenerFactory.Builder builder = new DefaultMessageListenerFactory().builder()
                .serverUrl(SERVER)
                .agent(AGENT)
                .orchestrationService(service)
                .credentialProvider(() -> new AgentCredentials("Bearer", "t"));

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void build_missingService_throws()
    {
        MessageListenerFactory.Builder builder = new DefaultMessageListenerFactory().builder()
                .serverUrl(SERVER)
                .poolId(1)
                .agent(AGENT)
                .credentialProvider(() -> new AgentCredentials("Bearer", "t"));

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void build_missingCredentials_throws()
    {
        MessageListenerFactory.Builder builder = new DefaultMessageListenerFactory().builder()
                .serverUrl(SERVER)
                .poolId(1)
                .agent(AGENT)
                .orchestrationService(service);

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void poolId_nonPositive_throws()
    {
        MessageListenerFactory.Builder builder = new DefaultMessageListenerFactory().builder();

        assertThrows(IllegalArgumentException.class, () -> builder.poolId(0));
        assertThrows(IllegalArgumentException.class, () -> builder.poolId(-4));
    }

    @Test
    void conflictLimit_nonPositive_throws()
    {
        DefaultMessageListenerFactory.DefaultBuilder builder = new DefaultMessageListenerFactory.DefaultBuilder();

        assertThrows(IllegalArgumentException.class, () -> builder.sessionConflictRetryLimit(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> builder.clockSkewRetryLimit(Duration.ofSeconds(-1)));
    }

    @Test
    void sessionName_default_usesHostOrFallback() throws Exception
    {
        MessageListener listener = completeBuilder().build();

        assertTrue(listener.createSession(new CancellationToken()));

        String name = listener.getSession().orElseThrow().sessionName();
        assertFalse(name.isBlank());
    }

    @Test
    void sessionName_explicit_sentToService() throws Exception
    {
        MessageListener listener = completeBuilder().sessionName("custom-name").build();

        listener.createSession(new CancellationToken());

        assertEquals("custom-name", listener.getSession().orElseThrow().sessionName());
    }

    @Test
    void sessionConflictRetryLimit_custom_appliesToConflicts() throws Exception
    {
        ManualTicker ticker = new ManualTicker();
        RecordingSleeper sleeper = new RecordingSleeper(ticker);
        DefaultMessageListenerFactory.DefaultBuilder builder = new DefaultMessageListenerFactory.DefaultBuilder();
        builder.random(new Random(3))
                .ticker(ticker)
                .sleeper(sleeper)
                .sessionConflictRetryLimit(Duration.ofSeconds(60));
        MessageListener listener = builder
                .serverUrl(SERVER)
                .poolId(1)
                .agent(AGENT)
                .orchestrationService(service)
                .credentialProvider(() -> new AgentCredentials("Bearer", "t"))
                .build();
        SessionConflictException conflict = new SessionConflictException("exists");
        service.failCreateSession(conflict, conflict, conflict, conflict);

        // Attempts at 0 s, 30 s and 60 s; the third reaches the 60 second limit
        assertFalse(listener.createSession(new CancellationToken()));
        assertEquals(3, service.getCreateSessionCount());
    }
}
