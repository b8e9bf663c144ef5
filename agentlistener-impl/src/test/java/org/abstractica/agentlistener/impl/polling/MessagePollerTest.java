package org.abstractica.agentlistener.impl.polling;

import org.abstractica.agentlistener.AgentMessage;
import org.abstractica.agentlistener.AgentSession;
import org.abstractica.agentlistener.CancellationToken;
import org.abstractica.agentlistener.ListenerOperation;
import org.abstractica.agentlistener.errors.AccessDeniedException;
import org.abstractica.agentlistener.errors.AccessTokenExpiredException;
import org.abstractica.agentlistener.errors.MessageDecryptionException;
import org.abstractica.agentlistener.errors.OrchestrationException;
import org.abstractica.agentlistener.errors.SessionExpiredException;
import org.abstractica.agentlistener.impl.backoff.BackoffBand;
import org.abstractica.agentlistener.impl.crypto.RsaKeyManager;
import org.abstractica.agentlistener.impl.remote.SimulatedOrchestrationService;
import org.abstractica.agentlistener.impl.timing.ManualTicker;
import org.abstractica.agentlistener.impl.timing.RecordingSleeper;
import org.abstractica.agentlistener.impl.timing.Sleeper;
import org.abstractica.agentlistener.impl.timing.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link MessagePoller}.
 */
class MessagePollerTest
{
    private SimulatedOrchestrationService service;
    private ManualTicker ticker;
    private RecordingSleeper sleeper;
    private CancellationToken token;

    @BeforeEach
    void setUp()
    {
        service = new SimulatedOrchestrationService();
        ticker = new ManualTicker();
        sleeper = new RecordingSleeper(ticker);
        token = new CancellationToken();
    }

    private PollingHarness startSession(boolean skipSessionRecover) throws OrchestrationException
    {
        PollingHarness harness = new PollingHarness(service, ticker, sleeper, skipSessionRecover, null);
        assertTrue(harness.sessionManager.createSession(token));
        return harness;
    }

    @Test
    void getNextMessage_queuedMessage_returnedWithoutWaiting() throws Exception
    {
        PollingHarness harness = startSession(false);
        long id = service.enqueueMessage("JobRequest", "build main");

        AgentMessage message = harness.poller.getNextMessage(token);

        assertEquals(id, message.messageId());
        assertEquals("build main", message.body());
        assertEquals(0, sleeper.getSleepCount());
        assertEquals(1, harness.stats.getMessagesReceived());
    }

    @Test
    void getNextMessage_noSession_throwsIllegalState()
    {
        PollingHarness harness = new PollingHarness(service, ticker, sleeper, false, null);

        assertThrows(IllegalStateException.class, () -> harness.poller.getNextMessage(token));
    }

    @Test
    void getNextMessage_idle_waitsShortIntervalBetweenPolls() throws Exception
    {
        PollingHarness harness = startSession(false);
        AtomicInteger idleWaits = new AtomicInteger();
        sleeper.setOnSleep(slept ->
        {
            if (idleWaits.incrementAndGet() == 3)
            {
                service.enqueueMessage("JobRequest", "late");
            }
        });

        AgentMessage message = harness.poller.getNextMessage(token);

        assertEquals("late", message.body());
        assertEquals(3, sleeper.getSleepCount());
        for (Duration wait : sleeper.getSleeps())
        {
            assertTrue(BackoffBand.ofSeconds(5, 15).contains(wait), "idle wait " + wait);
        }
        assertEquals(0, harness.stats.getRetries());
    }

    @Test
    void getNextMessage_consecutiveCalls_deliverInIdOrder() throws Exception
    {
        PollingHarness harness = startSession(false);
        service.enqueueMessage("JobRequest", "first");
        service.enqueueMessage("JobRequest", "second");

        AgentMessage first = harness.poller.getNextMessage(token);
        AgentMessage second = harness.poller.getNextMessage(token);

        assertTrue(second.messageId() > first.messageId());
        assertEquals("second", second.body());
        assertEquals(second.messageId(), harness.poller.getLastMessageId());
    }

    @Test
    void getNextMessage_staleMessage_ignored() throws Exception
    {
        AtomicInteger calls = new AtomicInteger();
        service = new SimulatedOrchestrationService()
        {
            @Override
            public AgentMessage getNextMessage(int poolId, UUID sessionId, Long lastMessageId,
                                               CancellationToken token) throws OrchestrationException, IOException
            {
                if (calls.incrementAndGet() == 2)
                {
                    return AgentMessage.plain(1, "JobRequest", "replayed");
                }
                return super.getNextMessage(poolId, sessionId, lastMessageId, token);
            }
        };
        PollingHarness harness = startSession(false);
        service.enqueueMessage("JobRequest", "one");
        assertEquals(1, harness.poller.getNextMessage(token).messageId());
        service.enqueueMessage("JobRequest", "two");

        AgentMessage next = harness.poller.getNextMessage(token);

        assertEquals(2, next.messageId());
        assertEquals(1, sleeper.getSleepCount());
    }

    @Test
    void getNextMessage_sessionExpired_recreatesTransparently() throws Exception
    {
        PollingHarness harness = startSession(false);
        AgentSession original = harness.sessionManager.getActiveSession();
        service.expireSession(original.sessionId());
        service.enqueueMessage("JobRequest", "after recovery");

        AgentMessage message = harness.poller.getNextMessage(token);

        assertEquals("after recovery", message.body());
        assertNotEquals(original.sessionId(), harness.sessionManager.getActiveSession().sessionId());
        assertEquals(1, harness.stats.getSessionRecoveries());
        assertEquals(0, sleeper.getSleepCount());
    }

    @Test
    void getNextMessage_sessionExpiredWithRecoveryDisabled_propagates() throws Exception
    {
        PollingHarness harness = startSession(true);
        service.expireSession(harness.sessionManager.getActiveSession().sessionId());

        assertThrows(SessionExpiredException.class, () -> harness.poller.getNextMessage(token));
        assertEquals(1, service.getCreateSessionCount());
    }

    @Test
    void getNextMessage_accessDenied_propagatesWithoutRetry() throws Exception
    {
        PollingHarness harness = startSession(false);
        service.failGetNextMessage(new AccessDeniedException("agent removed from pool"));

        assertThrows(AccessDeniedException.class, () -> harness.poller.getNextMessage(token));

        assertEquals(1, service.getGetNextMessageCount());
        assertEquals(0, sleeper.getSleepCount());
        assertEquals(0, harness.stats.getRetries());
    }

    @Test
    void getNextMessage_tokenRevoked_propagates() throws Exception
    {
        PollingHarness harness = startSession(false);
        service.failGetNextMessage(new AccessTokenExpiredException("revoked"));

        assertThrows(AccessTokenExpiredException.class, () -> harness.poller.getNextMessage(token));
    }

    @Test
    void getNextMessage_transientFailures_refreshBackOffAndRecover() throws Exception
    {
        PollingHarness harness = startSession(false);
        List<ListenerOperation> lost = new ArrayList<>();
        List<ListenerOperation> restored = new ArrayList<>();
        harness.events.onConnectionLost((op, cause) -> lost.add(op));
        harness.events.onConnectionRestored(restored::add);
        service.failGetNextMessage(new IOException("503"), new IOException("503"));
        service.enqueueMessage("JobRequest", "eventually");

        AgentMessage message = harness.poller.getNextMessage(token);

        assertEquals("eventually", message.body());
        assertEquals(2, service.getRefreshCount());
        assertEquals(2, sleeper.getSleepCount());
        for (Duration wait : sleeper.getSleeps())
        {
            assertTrue(BackoffBand.ofSeconds(15, 30).contains(wait), "retry wait " + wait);
        }
        assertEquals(List.of(ListenerOperation.GET_NEXT_MESSAGE), lost);
        assertEquals(List.of(ListenerOperation.GET_NEXT_MESSAGE), restored);
        assertEquals(2, harness.stats.getRetries());
    }

    @Test
    void getNextMessage_longOutage_widensToSecondBand() throws Exception
    {
        PollingHarness harness = startSession(false);
        IOException down = new IOException("down");
        service.failGetNextMessage(down, down, down, down, down, down, down);
        service.enqueueMessage("JobRequest", "x");

        harness.poller.getNextMessage(token);

        List<Duration> sleeps = sleeper.getSleeps();
        assertEquals(7, sleeps.size());
        assertTrue(BackoffBand.ofSeconds(30, 60).contains(sleeps.get(5)));
        assertTrue(BackoffBand.ofSeconds(30, 60).contains(sleeps.get(6)));
    }

    @Test
    void getNextMessage_undecryptableMessage_failsOnceThenSkipsIt() throws Exception
    {
        // Keys are wrapped for an agent key pair, but the listener has no unwrapper
        service.encryptSessions(true);
        service.setAgentPublicKey(RsaKeyManager.generate().getPublicKey());
        PollingHarness harness = startSession(false);
        long badId = service.enqueueMessage("JobRequest", "secret");

        MessageDecryptionException e = assertThrows(MessageDecryptionException.class,
                () -> harness.poller.getNextMessage(token));
        assertEquals(badId, e.getMessageId());
        assertEquals(badId, harness.poller.getLastMessageId());
    }

    @Test
    void getNextMessage_encryptedSession_decrypts() throws Exception
    {
        RsaKeyManager keys = RsaKeyManager.generate();
        service.encryptSessions(true);
        service.setAgentPublicKey(keys.getPublicKey());
        PollingHarness harness = new PollingHarness(service, ticker, sleeper, false, keys);
        assertTrue(harness.sessionManager.createSession(token));
        service.enqueueMessage("JobRequest", "{\"steps\":3}");

        AgentMessage message = harness.poller.getNextMessage(token);

        assertEquals("{\"steps\":3}", message.body());
        assertFalse(message.hasIv());
    }

    @Test
    void getNextMessage_cancelledDuringIdleWait_throwsCancellation() throws Exception
    {
        PollingHarness harness = startSession(false);
        sleeper.setOnSleep(slept -> token.cancel());

        assertThrows(CancellationException.class, () -> harness.poller.getNextMessage(token));
    }

    @Test
    void getNextMessage_cancelledDuringRealBackoff_unwindsPromptly() throws Exception
    {
        PollingHarness harness = new PollingHarness(service, Ticker.system(), Sleeper.system(), false, null);
        assertTrue(harness.sessionManager.createSession(token));
        service.failGetNextMessage(new IOException("down"));

        Thread canceller = new Thread(() ->
        {
            try
            {
                TimeUnit.MILLISECONDS.sleep(200);
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
            }
            token.cancel();
        });
        canceller.start();

        long start = System.nanoTime();
        assertThrows(CancellationException.class, () -> harness.poller.getNextMessage(token));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        canceller.join();

        // The backoff wait is at least 15 seconds
        assertTrue(elapsedMs < 5_000, "Cancellation took " + elapsedMs + " ms");
    }
}
