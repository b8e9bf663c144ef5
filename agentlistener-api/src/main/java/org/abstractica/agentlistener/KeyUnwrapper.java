package org.abstractica.agentlistener;

import java.security.GeneralSecurityException;

/**
 * Recovers a symmetric session key that was encrypted with the agent's
 * public key.
 */
@FunctionalInterface
public interface KeyUnwrapper
{
    /**
     * Decrypts a wrapped key.
     *
     * @param wrappedKey the encrypted key bytes
     * @return the raw key bytes
     * @throws GeneralSecurityException if the key cannot be decrypted
     */
    byte[] unwrap(byte[] wrappedKey) throws GeneralSecurityException;
}
