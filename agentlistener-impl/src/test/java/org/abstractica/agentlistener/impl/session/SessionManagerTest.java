package org.abstractica.agentlistener.impl.session;

import org.abstractica.agentlistener.AgentCredentials;
import org.abstractica.agentlistener.AgentIdentity;
import org.abstractica.agentlistener.AgentSession;
import org.abstractica.agentlistener.CancellationToken;
import org.abstractica.agentlistener.ListenerOperation;
import org.abstractica.agentlistener.errors.AccessTokenExpiredException;
import org.abstractica.agentlistener.errors.AgentNotFoundException;
import org.abstractica.agentlistener.errors.SessionConflictException;
import org.abstractica.agentlistener.impl.backoff.BackoffBand;
import org.abstractica.agentlistener.impl.backoff.BackoffPolicy;
import org.abstractica.agentlistener.impl.backoff.BackoffSchedule;
import org.abstractica.agentlistener.impl.backoff.BackoffState;
import org.abstractica.agentlistener.impl.failure.ErrorClassifier;
import org.abstractica.agentlistener.impl.failure.SessionConflictTracker;
import org.abstractica.agentlistener.impl.listener.DefaultListenerStats;
import org.abstractica.agentlistener.impl.listener.ListenerSettings;
import org.abstractica.agentlistener.impl.remote.SimulatedOrchestrationService;
import org.abstractica.agentlistener.impl.timing.ManualTicker;
import org.abstractica.agentlistener.impl.timing.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SessionManager}.
 */
class SessionManagerTest
{
    private static final int POOL_ID = 3;

    private SimulatedOrchestrationService service;
    private ManualTicker ticker;
    private RecordingSleeper sleeper;
    private ConnectionEvents events;
    private DefaultListenerStats stats;
    private CancellationToken token;

    @BeforeEach
    void setUp()
    {
        service = new SimulatedOrchestrationService();
        ticker = new ManualTicker();
        sleeper = new RecordingSleeper(ticker);
        events = new ConnectionEvents();
        stats = new DefaultListenerStats();
        token = new CancellationToken();
    }

    private SessionManager createManager(boolean progressive)
    {
        if (progressive)
        {
            service.setFeatureFlag(ProgressiveBackoffFlag.FLAG_NAME, "On");
        }
        ListenerSettings settings = new ListenerSettings(
                URI.create("https://orchestrator.test"),
                POOL_ID,
                new AgentIdentity(11, "build-01", "1.0.0", "Linux"),
                "build-01",
                false);
        SessionConflictTracker tracker = new SessionConflictTracker(ticker);
        BackoffPolicy policy = new BackoffPolicy(new Random(1));

        return new SessionManager(
                settings,
                service,
                () -> new AgentCredentials("Bearer", "secret"),
                t -> Map.of("java.version", "17"),
                new ProgressiveBackoffFlag(service),
                new ErrorClassifier(tracker),
                tracker,
                new BackoffState(BackoffSchedule.SESSION_CREATION, policy, Duration.ZERO),
                sleeper,
                events,
                stats);
    }

    @Test
    void createSession_noFailures_activeWithoutSleeping() throws Exception
    {
        SessionManager manager = createManager(false);

        assertTrue(manager.createSession(token));

        assertEquals(SessionState.ACTIVE, manager.getState());
        assertNotNull(manager.getActiveSession());
        assertTrue(manager.getActiveSession().hasSessionId());
        assertEquals(0, sleeper.getSleepCount());
        assertEquals(1, stats.getSessionsCreated());
    }

    @Test
    void createSession_twoTransientFailures_succeedsOnThirdAttempt() throws Exception
    {
        SessionManager manager = createManager(false);
        service.failCreateSession(new IOException("connection refused"), new IOException("connection reset"));

        assertTrue(manager.createSession(token));

        assertEquals(3, service.getCreateSessionCount());
        assertEquals(0, manager.getConsecutiveFailures());
        assertEquals(List.of(Duration.ofSeconds(30), Duration.ofSeconds(30)), sleeper.getSleeps());
        assertEquals(2, stats.getRetries());
    }

    @Test
    void createSession_progressive_sleepsInsideTierBands() throws Exception
    {
        SessionManager manager = createManager(true);
        IOException down = new IOException("service unavailable");
        service.failCreateSession(down, down, down, down, down, down);

        assertTrue(manager.createSession(token));

        List<Duration> sleeps = sleeper.getSleeps();
        assertEquals(6, sleeps.size());
        for (int i = 0; i < 2; i++)
        {
            assertTrue(BackoffBand.ofSeconds(15, 30).contains(sleeps.get(i)), "sleep " + i + ": " + sleeps.get(i));
        }
        for (int i = 2; i < 5; i++)
        {
            assertTrue(BackoffBand.ofSeconds(60, 90).contains(sleeps.get(i)), "sleep " + i + ": " + sleeps.get(i));
        }
        assertTrue(BackoffBand.ofSeconds(150, 200).contains(sleeps.get(5)));
    }

    @Test
    void createSession_outage_reportsLostAndRestoredOnce() throws Exception
    {
        SessionManager manager = createManager(false);
        List<ListenerOperation> lost = new ArrayList<>();
        AtomicInteger restored = new AtomicInteger();
        events.onConnectionLost((op, cause) -> lost.add(op));
        events.onConnectionRestored(op -> restored.incrementAndGet());
        IOException down = new IOException("down");
        service.failCreateSession(down, down, down);

        assertTrue(manager.createSession(token));

        assertEquals(List.of(ListenerOperation.CREATE_SESSION), lost);
        assertEquals(1, restored.get());
    }

    @Test
    void createSession_agentNotFound_returnsFalseWithoutRetry() throws Exception
    {
        SessionManager manager = createManager(false);
        service.failCreateSession(new AgentNotFoundException("agent 11 was deleted"));

        assertFalse(manager.createSession(token));

        assertEquals(1, service.getCreateSessionCount());
        assertEquals(0, sleeper.getSleepCount());
        assertEquals(SessionState.IDLE, manager.getState());
        assertNull(manager.getActiveSession());
    }

    @Test
    void createSession_tokenRevoked_propagates()
    {
        SessionManager manager = createManager(false);
        service.failCreateSession(new AccessTokenExpiredException("revoked"));

        assertThrows(AccessTokenExpiredException.class, () -> manager.createSession(token));
        assertEquals(SessionState.IDLE, manager.getState());
    }

    @Test
    void createSession_persistentConflict_fatalOncePastLimit() throws Exception
    {
        SessionManager manager = createManager(false);
        SessionConflictException conflict = new SessionConflictException("session exists");
        service.failCreateSession(conflict, conflict, conflict, conflict, conflict, conflict);
        // 50 seconds between attempts: attempt 5 is at 200 s, attempt 6 at 250 s
        sleeper.setOnSleep(slept -> ticker.advance(Duration.ofSeconds(20)));

        assertFalse(manager.createSession(token));

        assertEquals(6, service.getCreateSessionCount());
        assertEquals(5, sleeper.getSleepCount());
    }

    @Test
    void createSession_cancelledDuringBackoff_restoresState()
    {
        SessionManager manager = createManager(false);
        service.failCreateSession(new IOException("down"));
        sleeper.setOnSleep(slept -> token.cancel());

        assertThrows(CancellationException.class, () -> manager.createSession(token));

        assertEquals(SessionState.IDLE, manager.getState());
        assertNull(manager.getActiveSession());
    }

    @Test
    void createSession_flagOn_firstRetryUsesProgressiveBand() throws Exception
    {
        SessionManager manager = createManager(true);
        service.failCreateSession(new IOException("down"));

        manager.createSession(token);

        assertTrue(BackoffBand.ofSeconds(15, 30).contains(sleeper.getSleeps().get(0)));
    }

    @Test
    void recreateSession_replacesSessionAndCountsRecovery() throws Exception
    {
        SessionManager manager = createManager(false);
        manager.createSession(token);
        AgentSession first = manager.getActiveSession();
        service.expireSession(first.sessionId());

        assertTrue(manager.recreateSession(token));

        assertNotEquals(first.sessionId(), manager.getActiveSession().sessionId());
        assertEquals(1, stats.getSessionRecoveries());
        assertEquals(2, stats.getSessionsCreated());
    }

    @Test
    void createSession_alreadyActive_keepsSessionWithoutServiceCall() throws Exception
    {
        SessionManager manager = createManager(false);
        assertTrue(manager.createSession(token));
        AgentSession first = manager.getActiveSession();

        assertTrue(manager.createSession(token));

        assertSame(first, manager.getActiveSession());
        assertEquals(SessionState.ACTIVE, manager.getState());
        assertEquals(1, service.getCreateSessionCount());
        assertEquals(1, service.getSessionCount());
        assertEquals(0, sleeper.getSleepCount());
    }

    @Test
    void createSession_afterDelete_createsFreshSession() throws Exception
    {
        SessionManager manager = createManager(false);
        manager.createSession(token);
        AgentSession first = manager.getActiveSession();
        manager.deleteSession();

        assertTrue(manager.createSession(token));

        assertNotEquals(first.sessionId(), manager.getActiveSession().sessionId());
        assertEquals(2, service.getCreateSessionCount());
        assertEquals(1, service.getSessionCount());
    }

    @Test
    void createSession_deletedDuringBackoff_discardsNewSession() throws Exception
    {
        SessionManager manager = createManager(false);
        service.failCreateSession(new IOException("connection refused"));
        sleeper.setOnSleep(d -> manager.deleteSession());

        assertFalse(manager.createSession(token));

        assertNull(manager.getActiveSession());
        assertEquals(SessionState.IDLE, manager.getState());
        assertEquals(2, service.getCreateSessionCount());
        assertEquals(0, service.getSessionCount());
        assertEquals(1, service.getDeleteSessionCount());
    }

    @Test
    void recreateSession_deletedDuringBackoff_leavesNoLiveSession() throws Exception
    {
        SessionManager manager = createManager(false);
        manager.createSession(token);
        service.expireSession(manager.getActiveSession().sessionId());
        service.failCreateSession(new IOException("connection reset"));
        sleeper.setOnSleep(d -> manager.deleteSession());

        assertFalse(manager.recreateSession(token));

        assertNull(manager.getActiveSession());
        assertEquals(SessionState.IDLE, manager.getState());
        assertEquals(0, service.getSessionCount());
        assertEquals(0, stats.getSessionRecoveries());
    }

    @Test
    void deleteSession_twice_deletesOnce() throws Exception
    {
        SessionManager manager = createManager(false);
        manager.createSession(token);

        manager.deleteSession();
        manager.deleteSession();

        assertEquals(1, service.getDeleteSessionCount());
        assertEquals(0, service.getSessionCount());
        assertEquals(SessionState.IDLE, manager.getState());
        assertNull(manager.getActiveSession());
    }

    @Test
    void deleteSession_withoutSession_noServiceCall()
    {
        SessionManager manager = createManager(false);

        manager.deleteSession();

        assertEquals(0, service.getDeleteSessionCount());
    }

    @Test
    void requireActiveSession_withoutSession_throws()
    {
        SessionManager manager = createManager(false);

        assertThrows(IllegalStateException.class, manager::requireActiveSession);
    }
}
