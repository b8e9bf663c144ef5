package org.abstractica.agentlistener.impl.crypto;

import org.abstractica.agentlistener.AgentMessage;
import org.abstractica.agentlistener.AgentSession;
import org.abstractica.agentlistener.KeyUnwrapper;
import org.abstractica.agentlistener.SessionKey;
import org.abstractica.agentlistener.errors.MessageDecryptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;

/**
 * AES-CBC decryption of message bodies with the session key.
 *
 * <p>Message format:</p>
 * <pre>
 * body: Base64(AES-CBC-PKCS5(UTF-8 plaintext))
 * iv:   16 bytes, carried next to the body
 * </pre>
 *
 * <p>Decryption is opportunistic: a message without IV, or a session
 * without key, is returned as is.</p>
 */
public final class MessageCipher
{
    private static final Logger LOG = LoggerFactory.getLogger(MessageCipher.class);
    private static final String ALGORITHM = "AES/CBC/PKCS5Padding";
    private static final int IV_LENGTH = 16;

    private final KeyUnwrapper keyUnwrapper;

    /**
     * Creates a cipher.
     *
     * @param keyUnwrapper unwraps encrypted session keys, may be null if sessions never carry one
     */
    public MessageCipher(KeyUnwrapper keyUnwrapper)
    {
        this.keyUnwrapper = keyUnwrapper;
    }

    /**
     * Decrypts a message received on a session.
     *
     * @param message the message, may be null
     * @param session the session the message was received on
     * @return the decrypted message, or the same instance if there is nothing to decrypt
     * @throws MessageDecryptionException if the key or ciphertext is invalid
     */
    public AgentMessage decrypt(AgentMessage message, AgentSession session) throws MessageDecryptionException
    {
        if (message == null || !message.hasIv())
        {
            return message;
        }

        Optional<SessionKey> sessionKey = session.getEncryptionKey();
        if (sessionKey.isEmpty())
        {
            return message;
        }

        byte[] iv = message.iv();
        if (iv.length != IV_LENGTH)
        {
            LOG.warn("Message {} has a {}-byte IV, expected {}; passing it through undecrypted",
                    message.messageId(), iv.length, IV_LENGTH);
            return message;
        }
        if (message.body() == null)
        {
            throw new MessageDecryptionException(message.messageId(),
                    "Encrypted message " + message.messageId() + " has no body", null);
        }

        try
        {
            byte[] key = resolveKey(sessionKey.get());
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new IvParameterSpec(iv));

            byte[] ciphertext = Base64.getDecoder().decode(message.body());
            byte[] plaintext = cipher.doFinal(ciphertext);

            return message.withPlainBody(new String(plaintext, StandardCharsets.UTF_8));
        }
        catch (GeneralSecurityException | IllegalArgumentException e)
        {
            throw new MessageDecryptionException(message.messageId(),
                    "Unable to decrypt message " + message.messageId() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Encrypts a message body with a raw session key.
     *
     * <p>Counterpart of {@link #decrypt}; used by the service side.</p>
     *
     * @param messageId   the message id
     * @param messageType the message type
     * @param plaintext   the body
     * @param rawKey      the AES key
     * @param random      source of the IV
     * @return the encrypted message
     */
    public static AgentMessage encrypt(long messageId, String messageType, String plaintext, byte[] rawKey,
                                       SecureRandom random)
    {
        byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(iv);

        try
        {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(rawKey, "AES"), new IvParameterSpec(iv));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            return new AgentMessage(messageId, messageType, Base64.getEncoder().encodeToString(ciphertext), iv);
        }
        catch (GeneralSecurityException e)
        {
            throw new RuntimeException("Encryption failed", e);
        }
    }

    /**
     * Generates a random 256-bit session key.
     *
     * @param random the random source
     * @return the key bytes
     */
    public static byte[] generateKey(SecureRandom random)
    {
        byte[] key = new byte[32];
        random.nextBytes(key);
        return key;
    }

    private byte[] resolveKey(SessionKey sessionKey) throws GeneralSecurityException
    {
        if (!sessionKey.wrapped())
        {
            return sessionKey.value();
        }
        if (keyUnwrapper == null)
        {
            throw new GeneralSecurityException("Session key is wrapped but no key unwrapper is configured");
        }
        return keyUnwrapper.unwrap(sessionKey.value());
    }
}
