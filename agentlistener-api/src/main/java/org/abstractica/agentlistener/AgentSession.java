package org.abstractica.agentlistener;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A server-acknowledged logical channel through which the agent receives
 * job messages.
 *
 * @param sessionId     the session identifier assigned by the server
 * @param sessionName   the name the agent registered the session under
 * @param poolId        the pool the session belongs to
 * @param encryptionKey the message encryption key, or null for an unencrypted session
 */
public record AgentSession(UUID sessionId, String sessionName, int poolId, SessionKey encryptionKey)
{
    /**
     * The nil session identifier.
     */
    public static final UUID EMPTY_ID = new UUID(0L, 0L);

    public AgentSession
    {
        Objects.requireNonNull(sessionName, "sessionName");
    }

    /**
     * Returns true if the session carries a usable identifier.
     *
     * @return true if the identifier is present and not nil
     */
    public boolean hasSessionId()
    {
        return sessionId != null && !EMPTY_ID.equals(sessionId);
    }

    /**
     * Returns the encryption key if the session is encrypted.
     *
     * @return the key, or empty for an unencrypted session
     */
    public Optional<SessionKey> getEncryptionKey()
    {
        if (encryptionKey == null || encryptionKey.isEmpty())
        {
            return Optional.empty();
        }
        return Optional.of(encryptionKey);
    }
}
