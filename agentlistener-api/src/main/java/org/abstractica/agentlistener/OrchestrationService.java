package org.abstractica.agentlistener;

import org.abstractica.agentlistener.errors.OrchestrationException;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.UUID;

/**
 * Remote orchestration service that hands out sessions and job messages.
 *
 * <p>Implementations wrap the RPC transport. Service-side rejections are
 * reported as {@link OrchestrationException} subtypes, transport failures as
 * {@link IOException}.</p>
 */
public interface OrchestrationService
{
    /**
     * Opens (or reuses) the connection to the service.
     *
     * @param serverUrl   the service endpoint
     * @param credentials the agent credentials
     */
    void connect(URI serverUrl, AgentCredentials credentials) throws OrchestrationException, IOException;

    /**
     * Creates a session for the agent.
     *
     * @param poolId     the agent pool
     * @param descriptor the handshake payload
     * @param token      cancels the call
     * @return the created session
     */
    AgentSession createSession(int poolId, SessionDescriptor descriptor, CancellationToken token)
            throws OrchestrationException, IOException;

    /**
     * Deletes a session.
     *
     * @param poolId    the agent pool
     * @param sessionId the session to delete
     * @param timeout   upper bound for the call
     */
    void deleteSession(int poolId, UUID sessionId, Duration timeout) throws OrchestrationException, IOException;

    /**
     * Fetches the next message after {@code lastMessageId}.
     *
     * <p>The service may hold the call open until a message is available.</p>
     *
     * @param poolId        the agent pool
     * @param sessionId     the session to poll
     * @param lastMessageId the last message delivered to the agent, or null
     * @param token         cancels the call
     * @return the next message, or null if none is available
     */
    AgentMessage getNextMessage(int poolId, UUID sessionId, Long lastMessageId, CancellationToken token)
            throws OrchestrationException, IOException;

    /**
     * Acknowledges a message so it is not delivered again.
     *
     * @param poolId    the agent pool
     * @param messageId the message to delete
     * @param sessionId the owning session
     * @param timeout   upper bound for the call
     */
    void deleteMessage(int poolId, long messageId, UUID sessionId, Duration timeout)
            throws OrchestrationException, IOException;

    /**
     * Drops the current connection so the next call opens a fresh one.
     */
    void refreshConnection() throws IOException;
}
