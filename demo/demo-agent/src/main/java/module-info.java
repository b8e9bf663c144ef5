/**
 * Demo agent module.
 *
 * <p>Runs a build agent against an in-memory orchestration service.</p>
 */
module demo.agent
{
    requires agentlistener.api;
    requires agentlistener.impl;
    requires org.slf4j;
}
