package org.abstractica.agentlistener.errors;

/**
 * A message body could not be decrypted with the session key.
 *
 * <p>Retrying does not help: the ciphertext or the key is wrong. The
 * message id is carried so the caller can delete the message.</p>
 */
public class MessageDecryptionException extends OrchestrationException
{
    private final long messageId;

    public MessageDecryptionException(long messageId, String message, Throwable cause)
    {
        super(message, cause);
        this.messageId = messageId;
    }

    /**
     * Returns the id of the message that failed to decrypt.
     *
     * @return the message id
     */
    public long getMessageId()
    {
        return messageId;
    }
}
