package org.abstractica.agentlistener.impl.remote;

import org.abstractica.agentlistener.AgentCredentials;
import org.abstractica.agentlistener.AgentMessage;
import org.abstractica.agentlistener.AgentSession;
import org.abstractica.agentlistener.CancellationToken;
import org.abstractica.agentlistener.FeatureFlag;
import org.abstractica.agentlistener.FeatureFlagProvider;
import org.abstractica.agentlistener.OrchestrationService;
import org.abstractica.agentlistener.SessionDescriptor;
import org.abstractica.agentlistener.SessionKey;
import org.abstractica.agentlistener.errors.OrchestrationException;
import org.abstractica.agentlistener.errors.SessionConflictException;
import org.abstractica.agentlistener.errors.SessionExpiredException;
import org.abstractica.agentlistener.impl.crypto.MessageCipher;
import org.abstractica.agentlistener.impl.crypto.RsaKeyManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An in-memory orchestration service.
 *
 * <p>Holds one message queue, hands out sessions and long-polls like the
 * real service. Supports encrypted sessions, scripted failures and
 * server-side session expiry.</p>
 *
 * <p>Usage:</p>
 * <pre>{@code
 * SimulatedOrchestrationService service = new SimulatedOrchestrationService();
 * service.setPollHoldTime(Duration.ofSeconds(5));
 * service.encryptSessions(true);
 *
 * // Queue work for the agent
 * service.enqueueMessage("JobRequest", "{\"jobId\":42}");
 *
 * // Script failures
 * service.failCreateSession(new IOException("connection refused"));
 * service.failGetNextMessage(new SessionExpiredException("expired"));
 * }</pre>
 *
 * <p>Scripted failures are consumed one per call, in order, before the
 * call does any work.</p>
 */
public class SimulatedOrchestrationService implements OrchestrationService, FeatureFlagProvider
{
    private static final Logger LOG = LoggerFactory.getLogger(SimulatedOrchestrationService.class);

    private static final long POLL_SLICE_MILLIS = 100;

    private final Object lock = new Object();
    private final TreeMap<Long, StoredMessage> messages = new TreeMap<>();
    private final Map<UUID, SessionRecord> sessions = new HashMap<>();
    private final Map<String, String> featureFlags = new ConcurrentHashMap<>();
    private final Queue<Exception> createSessionFailures = new ArrayDeque<>();
    private final Queue<Exception> getNextMessageFailures = new ArrayDeque<>();
    private final SecureRandom random = new SecureRandom();

    private long nextMessageId = 1;

    private volatile Duration pollHoldTime = Duration.ZERO;
    private volatile boolean encryptSessions;
    private volatile PublicKey agentPublicKey;
    private volatile boolean connected;

    private final AtomicInteger connectCount = new AtomicInteger();
    private final AtomicInteger createSessionCount = new AtomicInteger();
    private final AtomicInteger deleteSessionCount = new AtomicInteger();
    private final AtomicInteger getNextMessageCount = new AtomicInteger();
    private final AtomicInteger deleteMessageCount = new AtomicInteger();
    private final AtomicInteger refreshCount = new AtomicInteger();

    /**
     * Creates a service with no messages, no sessions and no failures.
     */
    public SimulatedOrchestrationService()
    {
    }

    // ========== OrchestrationService Interface ==========

    @Override
    public void connect(URI serverUrl, AgentCredentials credentials)
    {
        Objects.requireNonNull(serverUrl, "serverUrl");
        Objects.requireNonNull(credentials, "credentials");
        connected = true;
        connectCount.incrementAndGet();
        LOG.debug("Connected to {} with scheme {}", serverUrl, credentials.scheme());
    }

    @Override
    public AgentSession createSession(int poolId, SessionDescriptor descriptor, CancellationToken token)
            throws OrchestrationException, IOException
    {
        Objects.requireNonNull(descriptor, "descriptor");
        createSessionCount.incrementAndGet();
        token.throwIfCancellationRequested();

        synchronized (lock)
        {
            throwScripted(createSessionFailures.poll());
            requireConnected();

            int agentId = descriptor.agent().agentId();
            for (SessionRecord existing : sessions.values())
            {
                if (existing.agentId == agentId && existing.poolId == poolId)
                {
                    throw new SessionConflictException("A session for agent " + descriptor.agent().agentName()
                            + " already exists in pool " + poolId);
                }
            }

            UUID sessionId = UUID.randomUUID();
            byte[] rawKey = encryptSessions ? MessageCipher.generateKey(random) : null;
            sessions.put(sessionId, new SessionRecord(agentId, poolId, rawKey));

            LOG.info("Session {} created for agent {} in pool {}", sessionId, descriptor.agent().agentName(), poolId);
            return new AgentSession(sessionId, descriptor.sessionName(), poolId, describeKey(rawKey));
        }
    }

    @Override
    public void deleteSession(int poolId, UUID sessionId, Duration timeout)
    {
        deleteSessionCount.incrementAndGet();
        synchronized (lock)
        {
            if (sessions.remove(sessionId) != null)
            {
                LOG.info("Session {} deleted", sessionId);
            }
        }
    }

    @Override
    public AgentMessage getNextMessage(int poolId, UUID sessionId, Long lastMessageId, CancellationToken token)
            throws OrchestrationException, IOException
    {
        getNextMessageCount.incrementAndGet();
        long deadline = System.nanoTime() + pollHoldTime.toNanos();

        synchronized (lock)
        {
            throwScripted(getNextMessageFailures.poll());

            while (true)
            {
                token.throwIfCancellationRequested();
                SessionRecord session = requireSession(sessionId);

                long after = lastMessageId != null ? lastMessageId : 0L;
                Map.Entry<Long, StoredMessage> entry = messages.higherEntry(after);
                if (entry != null)
                {
                    return deliver(entry.getValue(), session);
                }

                long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
                if (remainingMillis <= 0)
                {
                    return null;
                }

                try
                {
                    lock.wait(Math.min(remainingMillis, POLL_SLICE_MILLIS));
                }
                catch (InterruptedException e)
                {
                    Thread.currentThread().interrupt();
                    throw new IOException("Interrupted while holding the poll", e);
                }
            }
        }
    }

    @Override
    public void deleteMessage(int poolId, long messageId, UUID sessionId, Duration timeout)
            throws OrchestrationException
    {
        deleteMessageCount.incrementAndGet();
        synchronized (lock)
        {
            requireSession(sessionId);
            if (messages.remove(messageId) != null)
            {
                LOG.debug("Message {} deleted", messageId);
            }
        }
    }

    @Override
    public void refreshConnection()
    {
        refreshCount.incrementAndGet();
        connected = true;
        LOG.debug("Connection refreshed");
    }

    // ========== FeatureFlagProvider Interface ==========

    @Override
    public FeatureFlag getFeatureFlag(String name)
    {
        return new FeatureFlag(name, featureFlags.getOrDefault(name, "Off"));
    }

    // ========== Control ==========

    /**
     * Queues a message for the agent.
     *
     * @param messageType the message type
     * @param body        the plaintext body
     * @return the id assigned to the message
     */
    public long enqueueMessage(String messageType, String body)
    {
        Objects.requireNonNull(messageType, "messageType");
        Objects.requireNonNull(body, "body");
        synchronized (lock)
        {
            long id = nextMessageId++;
            messages.put(id, new StoredMessage(id, messageType, body));
            lock.notifyAll();
            return id;
        }
    }

    /**
     * Removes a session on the server side, as if it had timed out.
     *
     * @param sessionId the session
     * @return true if the session existed
     */
    public boolean expireSession(UUID sessionId)
    {
        synchronized (lock)
        {
            boolean removed = sessions.remove(sessionId) != null;
            lock.notifyAll();
            return removed;
        }
    }

    /**
     * Scripts failures for the next createSession calls.
     *
     * @param failures OrchestrationException, IOException or RuntimeException instances
     */
    public void failCreateSession(Exception... failures)
    {
        synchronized (lock)
        {
            for (Exception failure : failures)
            {
                createSessionFailures.add(requireThrowable(failure));
            }
        }
    }

    /**
     * Scripts failures for the next getNextMessage calls.
     *
     * @param failures OrchestrationException, IOException or RuntimeException instances
     */
    public void failGetNextMessage(Exception... failures)
    {
        synchronized (lock)
        {
            for (Exception failure : failures)
            {
                getNextMessageFailures.add(requireThrowable(failure));
            }
        }
    }

    /**
     * Sets how long an empty poll is held open before returning no message.
     *
     * @param holdTime the hold time, zero to return at once
     */
    public void setPollHoldTime(Duration holdTime)
    {
        this.pollHoldTime = Objects.requireNonNull(holdTime, "holdTime");
    }

    /**
     * Enables or disables encryption for sessions created from now on.
     *
     * @param encrypt true to hand out session keys and encrypt messages
     */
    public void encryptSessions(boolean encrypt)
    {
        this.encryptSessions = encrypt;
    }

    /**
     * Wraps session keys with the agent's public key instead of sending them in the clear.
     *
     * @param publicKey the agent's RSA public key, or null to send raw keys
     */
    public void setAgentPublicKey(PublicKey publicKey)
    {
        this.agentPublicKey = publicKey;
    }

    /**
     * Sets the effective state of a feature flag.
     *
     * @param name           the flag name
     * @param effectiveState the state, for example "On"
     */
    public void setFeatureFlag(String name, String effectiveState)
    {
        featureFlags.put(name, effectiveState);
    }

    // ========== Statistics ==========

    public int getPendingMessageCount()
    {
        synchronized (lock)
        {
            return messages.size();
        }
    }

    public int getSessionCount()
    {
        synchronized (lock)
        {
            return sessions.size();
        }
    }

    public int getConnectCount()
    {
        return connectCount.get();
    }

    public int getCreateSessionCount()
    {
        return createSessionCount.get();
    }

    public int getDeleteSessionCount()
    {
        return deleteSessionCount.get();
    }

    public int getGetNextMessageCount()
    {
        return getNextMessageCount.get();
    }

    public int getDeleteMessageCount()
    {
        return deleteMessageCount.get();
    }

    public int getRefreshCount()
    {
        return refreshCount.get();
    }

    // ========== Internal ==========

    private SessionKey describeKey(byte[] rawKey)
    {
        if (rawKey == null)
        {
            return null;
        }
        PublicKey publicKey = agentPublicKey;
        if (publicKey == null)
        {
            return new SessionKey(rawKey, false);
        }
        return new SessionKey(RsaKeyManager.wrap(rawKey, publicKey), true);
    }

    private AgentMessage deliver(StoredMessage stored, SessionRecord session)
    {
        if (session.rawKey == null)
        {
            return AgentMessage.plain(stored.id, stored.type, stored.body);
        }
        return MessageCipher.encrypt(stored.id, stored.type, stored.body, session.rawKey, random);
    }

    private void requireConnected() throws IOException
    {
        if (!connected)
        {
            throw new IOException("Not connected; call connect first");
        }
    }

    private SessionRecord requireSession(UUID sessionId) throws SessionExpiredException
    {
        SessionRecord session = sessions.get(sessionId);
        if (session == null)
        {
            throw new SessionExpiredException("Session " + sessionId + " has expired or does not exist");
        }
        return session;
    }

    private static Exception requireThrowable(Exception failure)
    {
        Objects.requireNonNull(failure, "failure");
        if (!(failure instanceof OrchestrationException)
                && !(failure instanceof IOException)
                && !(failure instanceof RuntimeException))
        {
            throw new IllegalArgumentException("Unsupported failure type: " + failure.getClass().getName());
        }
        return failure;
    }

    private static void throwScripted(Exception failure) throws OrchestrationException, IOException
    {
        if (failure == null)
        {
            return;
        }
        LOG.debug("Injecting failure: {}", failure.toString());
        if (failure instanceof OrchestrationException)
        {
            throw (OrchestrationException) failure;
        }
        if (failure instanceof IOException)
        {
            throw (IOException) failure;
        }
        throw (RuntimeException) failure;
    }

    private static final class StoredMessage
    {
        final long id;
        final String type;
        final String body;

        StoredMessage(long id, String type, String body)
        {
            this.id = id;
            this.type = type;
            this.body = body;
        }
    }

    private static final class SessionRecord
    {
        final int agentId;
        final int poolId;
        final byte[] rawKey;

        SessionRecord(int agentId, int poolId, byte[] rawKey)
        {
            this.agentId = agentId;
            this.poolId = poolId;
            this.rawKey = rawKey;
        }
    }
}
