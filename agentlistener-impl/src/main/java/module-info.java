/**
 * Agent listener implementation module.
 *
 * <p>Provides the default implementation of the agent listener API.</p>
 */
module agentlistener.impl
{
    requires agentlistener.api;
    requires org.slf4j;

    // Export factory implementations for external use
    exports org.abstractica.agentlistener.impl.listener;
    exports org.abstractica.agentlistener.impl.remote;

    // Export crypto and timing for key generation and test wiring
    exports org.abstractica.agentlistener.impl.crypto;
    exports org.abstractica.agentlistener.impl.timing;
}
