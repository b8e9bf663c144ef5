package org.abstractica.agentlistener.impl.failure;

import java.util.Objects;

/**
 * Result of classifying a failure.
 *
 * @param kind     the reaction
 * @param category what the failure means
 * @param cause    the failure
 */
public record Classification(ErrorKind kind, FailureCategory category, Throwable cause)
{
    public Classification
    {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(cause, "cause");
    }

    public boolean isRetryable()
    {
        return kind == ErrorKind.RETRYABLE_TRANSIENT;
    }
}
