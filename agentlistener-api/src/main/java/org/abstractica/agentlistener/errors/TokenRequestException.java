package org.abstractica.agentlistener.errors;

/**
 * Requesting an access token failed.
 *
 * <p>When the local clock drifts too far from the server's, the service
 * rejects the token request and includes its own time in the message.</p>
 */
public class TokenRequestException extends OrchestrationException
{
    /**
     * Marker the service puts in the message of a clock-skew rejection.
     */
    public static final String SERVER_TIME_MARKER = "Current server time is";

    public TokenRequestException(String message)
    {
        super(message);
    }

    public TokenRequestException(String message, Throwable cause)
    {
        super(message, cause);
    }

    /**
     * Returns true if the rejection was caused by clock skew.
     *
     * @return true if the message reports the server time
     */
    public boolean isClockSkew()
    {
        String message = getMessage();
        return message != null && message.contains(SERVER_TIME_MARKER);
    }
}
