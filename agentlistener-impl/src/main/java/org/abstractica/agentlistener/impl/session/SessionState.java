package org.abstractica.agentlistener.impl.session;

/**
 * State of the listener's session.
 */
public enum SessionState
{
    /**
     * No session, and none being created.
     */
    IDLE,

    /**
     * Attempting to create a session.
     */
    CREATING,

    /**
     * A session exists and can be polled.
     */
    ACTIVE,

    /**
     * The session is being deleted on the server.
     */
    DELETING,

    /**
     * The session expired on the server and a replacement is being created.
     */
    RECREATING
}
