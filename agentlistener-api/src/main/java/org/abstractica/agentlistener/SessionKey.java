package org.abstractica.agentlistener;

import java.util.Arrays;
import java.util.Objects;

/**
 * Symmetric key used to encrypt the messages of a session.
 *
 * <p>When {@code wrapped} is true the value is itself encrypted with the
 * agent's public key and has to be unwrapped before use.</p>
 *
 * @param value   the key bytes
 * @param wrapped whether the value is encrypted with the agent's public key
 */
public record SessionKey(byte[] value, boolean wrapped)
{
    public SessionKey
    {
        Objects.requireNonNull(value, "value");
        value = value.clone();
    }

    @Override
    public byte[] value()
    {
        return value.clone();
    }

    /**
     * Returns true if the key has no bytes.
     *
     * @return true if empty
     */
    public boolean isEmpty()
    {
        return value.length == 0;
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (!(o instanceof SessionKey))
        {
            return false;
        }
        SessionKey other = (SessionKey) o;
        return wrapped == other.wrapped && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode()
    {
        return 31 * Arrays.hashCode(value) + Boolean.hashCode(wrapped);
    }

    @Override
    public String toString()
    {
        return "SessionKey[length=" + value.length + ", wrapped=" + wrapped + "]";
    }
}
