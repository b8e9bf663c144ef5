package org.abstractica.agentlistener;

import java.util.Arrays;
import java.util.Objects;

/**
 * A unit of work delivered through a session.
 *
 * <p>The body is opaque. When {@code iv} is present the body is Base64
 * ciphertext produced with the session key.</p>
 *
 * @param messageId   identifier, increasing within a session
 * @param messageType the message type name
 * @param body        the message body
 * @param iv          the initialization vector, or null for a plain message
 */
public record AgentMessage(long messageId, String messageType, String body, byte[] iv)
{
    public AgentMessage
    {
        Objects.requireNonNull(messageType, "messageType");
        iv = iv == null ? null : iv.clone();
    }

    /**
     * Creates an unencrypted message.
     */
    public static AgentMessage plain(long messageId, String messageType, String body)
    {
        return new AgentMessage(messageId, messageType, body, null);
    }

    @Override
    public byte[] iv()
    {
        return iv == null ? null : iv.clone();
    }

    /**
     * Returns true if the message carries an initialization vector.
     *
     * @return true if encrypted
     */
    public boolean hasIv()
    {
        return iv != null && iv.length > 0;
    }

    /**
     * Returns a copy of this message with a different body and no IV.
     *
     * @param newBody the replacement body
     * @return the decrypted message
     */
    public AgentMessage withPlainBody(String newBody)
    {
        return new AgentMessage(messageId, messageType, newBody, null);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (!(o instanceof AgentMessage))
        {
            return false;
        }
        AgentMessage other = (AgentMessage) o;
        return messageId == other.messageId
                && messageType.equals(other.messageType)
                && Objects.equals(body, other.body)
                && Arrays.equals(iv, other.iv);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(messageId, messageType, body) * 31 + Arrays.hashCode(iv);
    }

    @Override
    public String toString()
    {
        return "AgentMessage[id=" + messageId + ", type=" + messageType + ", encrypted=" + hasIv() + "]";
    }
}
