package org.abstractica.agentlistener;

import org.abstractica.agentlistener.errors.OrchestrationException;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Receives job messages for an agent from the orchestration service.
 *
 * <p>The listener owns one session at a time. Transient failures are
 * retried with backoff; only conditions that need an operator are
 * reported to the caller.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * MessageListener listener = factory.builder()
 *     .serverUrl(URI.create("https://orchestrator.example.com"))
 *     .poolId(1)
 *     .agent(identity)
 *     .orchestrationService(service)
 *     .credentialProvider(credentials)
 *     .build();
 *
 * CancellationToken token = new CancellationToken();
 * if (listener.createSession(token))
 * {
 *     new Thread(() -> listener.keepAlive(token)).start();
 *     AgentMessage message = listener.getNextMessage(token);
 *     // process
 *     listener.deleteMessage(message);
 * }
 * }</pre>
 */
public interface MessageListener extends AutoCloseable
{
    /**
     * Creates a session, retrying transient failures until it succeeds.
     *
     * @param token cancels the attempt loop
     * @return true if a session was created, false on a non-retryable failure
     * @throws CancellationException if cancelled
     * @throws OrchestrationException if the agent's access token has been revoked
     */
    boolean createSession(CancellationToken token) throws OrchestrationException;

    /**
     * Deletes the current session. Does nothing if there is none.
     */
    void deleteSession();

    /**
     * Waits for the next message on the current session.
     *
     * <p>An expired session is recreated transparently unless recovery is
     * disabled.</p>
     *
     * @param token cancels the poll loop
     * @return the next message, decrypted if the session is encrypted
     * @throws CancellationException if cancelled
     * @throws OrchestrationException on a non-retryable failure
     * @throws IllegalStateException if no session exists
     */
    AgentMessage getNextMessage(CancellationToken token) throws OrchestrationException;

    /**
     * Keeps the session alive until cancelled.
     *
     * <p>Intended to run on its own thread next to the poll loop. Returns
     * when the token is cancelled.</p>
     *
     * @param token stops the loop
     */
    void keepAlive(CancellationToken token);

    /**
     * Acknowledges a message so the service does not deliver it again.
     *
     * @param message the message to delete, may be null
     */
    void deleteMessage(AgentMessage message) throws OrchestrationException, IOException;

    /**
     * Registers a callback for the start of an outage.
     *
     * <p>Called once on the first failure of a run of consecutive failures,
     * not on every retry.</p>
     *
     * @param handler called with the failing operation and the failure
     */
    void onConnectionLost(BiConsumer<ListenerOperation, Throwable> handler);

    /**
     * Registers a callback for the end of an outage.
     *
     * @param handler called with the operation that succeeded again
     */
    void onConnectionRestored(Consumer<ListenerOperation> handler);

    /**
     * Returns the active session.
     *
     * @return the session, or empty if none is active
     */
    Optional<AgentSession> getSession();

    /**
     * Returns listener statistics.
     *
     * @return current statistics
     */
    ListenerStats getStats();

    /**
     * Deletes the session.
     *
     * <p>Equivalent to {@link #deleteSession()}.</p>
     */
    @Override
    void close();
}
