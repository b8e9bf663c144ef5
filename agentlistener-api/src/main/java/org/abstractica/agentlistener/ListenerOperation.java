package org.abstractica.agentlistener;

/**
 * Listener operations that report connection state transitions.
 */
public enum ListenerOperation
{
    CREATE_SESSION,
    GET_NEXT_MESSAGE
}
