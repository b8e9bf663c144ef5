package org.abstractica.agentlistener.impl.crypto;

import org.abstractica.agentlistener.KeyUnwrapper;

import javax.crypto.Cipher;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Objects;

/**
 * The agent's RSA key pair, used to unwrap session keys.
 *
 * <p>The agent registers its public key with the service. The service
 * encrypts each session's AES key with it (RSA-OAEP with SHA-1) and the
 * agent recovers the key with the private half.</p>
 */
public final class RsaKeyManager implements KeyUnwrapper
{
    private static final String ALGORITHM = "RSA";
    private static final String TRANSFORMATION = "RSA/ECB/OAEPWithSHA-1AndMGF1Padding";
    private static final int KEY_SIZE = 2048;

    private final PublicKey publicKey;
    private final PrivateKey privateKey;

    /**
     * Creates a manager for an existing key pair.
     *
     * @param keyPair the agent's key pair
     */
    public RsaKeyManager(KeyPair keyPair)
    {
        Objects.requireNonNull(keyPair, "keyPair");
        this.publicKey = Objects.requireNonNull(keyPair.getPublic(), "publicKey");
        this.privateKey = Objects.requireNonNull(keyPair.getPrivate(), "privateKey");
        if (!ALGORITHM.equals(publicKey.getAlgorithm()))
        {
            throw new IllegalArgumentException("Key pair must be RSA: " + publicKey.getAlgorithm());
        }
    }

    /**
     * Generates a new 2048-bit key pair.
     *
     * @return a manager for the new key pair
     */
    public static RsaKeyManager generate()
    {
        try
        {
            KeyPairGenerator generator = KeyPairGenerator.getInstance(ALGORITHM);
            generator.initialize(KEY_SIZE);
            return new RsaKeyManager(generator.generateKeyPair());
        }
        catch (GeneralSecurityException e)
        {
            throw new RuntimeException("Failed to generate RSA key pair", e);
        }
    }

    /**
     * Restores a key pair from its encoded form.
     *
     * @param encodedPublic  X.509 encoded public key
     * @param encodedPrivate PKCS#8 encoded private key
     * @return the manager
     * @throws GeneralSecurityException if the encoding is invalid
     */
    public static RsaKeyManager fromEncoded(byte[] encodedPublic, byte[] encodedPrivate) throws GeneralSecurityException
    {
        Objects.requireNonNull(encodedPublic, "encodedPublic");
        Objects.requireNonNull(encodedPrivate, "encodedPrivate");

        KeyFactory keyFactory = KeyFactory.getInstance(ALGORITHM);
        PublicKey pub = keyFactory.generatePublic(new X509EncodedKeySpec(encodedPublic));
        PrivateKey priv = keyFactory.generatePrivate(new PKCS8EncodedKeySpec(encodedPrivate));
        return new RsaKeyManager(new KeyPair(pub, priv));
    }

    /**
     * Encrypts a session key for the holder of {@code publicKey}.
     *
     * @param rawKey    the symmetric key
     * @param publicKey the recipient's public key
     * @return the wrapped key
     */
    public static byte[] wrap(byte[] rawKey, PublicKey publicKey)
    {
        Objects.requireNonNull(rawKey, "rawKey");
        Objects.requireNonNull(publicKey, "publicKey");

        try
        {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, publicKey);
            return cipher.doFinal(rawKey);
        }
        catch (GeneralSecurityException e)
        {
            throw new RuntimeException("Key wrapping failed", e);
        }
    }

    @Override
    public byte[] unwrap(byte[] wrappedKey) throws GeneralSecurityException
    {
        Objects.requireNonNull(wrappedKey, "wrappedKey");

        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.DECRYPT_MODE, privateKey);
        return cipher.doFinal(wrappedKey);
    }

    public PublicKey getPublicKey()
    {
        return publicKey;
    }

    /**
     * Returns the X.509 encoding of the public key, as registered with the service.
     */
    public byte[] getEncodedPublicKey()
    {
        return publicKey.getEncoded();
    }

    /**
     * Returns the PKCS#8 encoding of the private key.
     */
    public byte[] getEncodedPrivateKey()
    {
        return privateKey.getEncoded();
    }
}
