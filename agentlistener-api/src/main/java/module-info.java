/**
 * Agent listener API module.
 *
 * <p>Provides the data types, collaborator contracts and the listener
 * interface for polling job messages from an orchestration service.</p>
 */
module agentlistener.api
{
    exports org.abstractica.agentlistener;
    exports org.abstractica.agentlistener.errors;
}
