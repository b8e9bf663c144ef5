package org.abstractica.demo.agent;

import org.abstractica.agentlistener.AgentCredentials;
import org.abstractica.agentlistener.AgentIdentity;
import org.abstractica.agentlistener.AgentMessage;
import org.abstractica.agentlistener.CancellationToken;
import org.abstractica.agentlistener.ListenerStats;
import org.abstractica.agentlistener.MessageListener;
import org.abstractica.agentlistener.errors.OrchestrationException;
import org.abstractica.agentlistener.impl.crypto.RsaKeyManager;
import org.abstractica.agentlistener.impl.listener.DefaultMessageListenerFactory;
import org.abstractica.agentlistener.impl.remote.SimulatedOrchestrationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Demo build agent demonstrating the listener.
 *
 * <p>Features demonstrated:</p>
 * <ul>
 *   <li>Listener configuration through the factory builder</li>
 *   <li>Session creation with retries against a flaky service</li>
 *   <li>Keep-alive on a second thread while jobs are processed</li>
 *   <li>Encrypted sessions with an RSA-wrapped session key</li>
 *   <li>Connection lost and restored callbacks</li>
 *   <li>Clean shutdown through cancellation</li>
 * </ul>
 */
public class DemoAgent
{
    private static final Logger LOG = LoggerFactory.getLogger(DemoAgent.class);
    private static final URI SERVER_URL = URI.create("https://orchestrator.example.com");
    private static final int POOL_ID = 1;
    private static final int DEFAULT_JOBS = 5;

    private final SimulatedOrchestrationService service;
    private final MessageListener listener;
    private final CancellationToken token = new CancellationToken();
    private final CountDownLatch stopped = new CountDownLatch(1);

    public DemoAgent(SimulatedOrchestrationService service, RsaKeyManager agentKeys)
    {
        this.service = service;
        this.listener = new DefaultMessageListenerFactory().builder()
                .serverUrl(SERVER_URL)
                .poolId(POOL_ID)
                .agent(AgentIdentity.ofCurrentHost(1, "demo-agent", "1.0.0"))
                .orchestrationService(service)
                .credentialProvider(() -> new AgentCredentials("Bearer", "demo-token"))
                .featureFlagProvider(service)
                .keyUnwrapper(agentKeys)
                .capabilitiesProvider(t -> Map.of(
                        "java.version", System.getProperty("java.version", "unknown"),
                        "os.arch", System.getProperty("os.arch", "unknown")))
                .build();

        listener.onConnectionLost((operation, cause) ->
                System.out.println("Lost connection during " + operation + ": " + cause.getMessage()));
        listener.onConnectionRestored(operation ->
                System.out.println("Connection restored during " + operation));
    }

    /**
     * Processes jobs until {@code jobCount} jobs are done or the agent is stopped.
     *
     * @param jobCount number of jobs to process
     */
    public void run(int jobCount)
    {
        Thread keepAlive = null;
        try
        {
            System.out.println("Creating session...");
            if (!listener.createSession(token))
            {
                System.out.println("Unable to create a session; see the log for details.");
                return;
            }
            System.out.println("Session " + listener.getSession().orElseThrow().sessionId() + " ready");

            keepAlive = new Thread(() -> listener.keepAlive(token), "keep-alive");
            keepAlive.setDaemon(true);
            keepAlive.start();

            for (int done = 0; done < jobCount; done++)
            {
                AgentMessage message = listener.getNextMessage(token);
                process(message);
                listener.deleteMessage(message);
            }
            System.out.println("All " + jobCount + " jobs processed");
        }
        catch (CancellationException e)
        {
            System.out.println("Agent stopped");
        }
        catch (OrchestrationException | IOException e)
        {
            LOG.error("Agent failed", e);
        }
        finally
        {
            token.cancel();
            if (keepAlive != null)
            {
                try
                {
                    keepAlive.join(TimeUnit.SECONDS.toMillis(5));
                }
                catch (InterruptedException e)
                {
                    Thread.currentThread().interrupt();
                }
            }
            listener.close();
            printStats(listener.getStats());
            stopped.countDown();
        }
    }

    /**
     * Requests shutdown and waits for the agent to release its session.
     */
    public void stop()
    {
        token.cancel();
        try
        {
            stopped.await(10, TimeUnit.SECONDS);
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
    }

    private void process(AgentMessage message)
    {
        System.out.printf("Job %d (%s): %s%n", message.messageId(), message.messageType(), message.body());
    }

    private void printStats(ListenerStats stats)
    {
        System.out.printf("Sessions created: %d, recovered: %d, messages: %d, retries: %d%n",
                stats.getSessionsCreated(), stats.getSessionRecoveries(),
                stats.getMessagesReceived(), stats.getRetries());
        System.out.printf("Service calls: %d polls, %d refreshes%n",
                service.getGetNextMessageCount(), service.getRefreshCount());
    }

    public static void main(String[] args)
    {
        int jobs = DEFAULT_JOBS;
        boolean encrypt = false;
        boolean flaky = false;
        boolean progressive = false;

        // Parse arguments
        for (int i = 0; i < args.length; i++)
        {
            switch (args[i])
            {
                case "-n", "--jobs" ->
                {
                    if (i + 1 < args.length)
                    {
                        try
                        {
                            jobs = Integer.parseInt(args[++i]);
                        }
                        catch (NumberFormatException e)
                        {
                            System.err.println("Invalid job count");
                            System.exit(1);
                        }
                    }
                }
                case "--encrypt" -> encrypt = true;
                case "--flaky" -> flaky = true;
                case "--progressive" -> progressive = true;
                case "--help" ->
                {
                    System.out.println("Usage: demo-agent [options]");
                    System.out.println("Options:");
                    System.out.println("  -n, --jobs <count>  Jobs to process before exiting (default: 5)");
                    System.out.println("  --encrypt           Use an encrypted session with an RSA-wrapped key");
                    System.out.println("  --flaky             Fail the first session and poll attempts");
                    System.out.println("  --progressive       Enable progressive retry backoff");
                    System.exit(0);
                }
                default -> System.err.println("Ignoring unknown option: " + args[i]);
            }
        }

        RsaKeyManager agentKeys = RsaKeyManager.generate();
        SimulatedOrchestrationService service = new SimulatedOrchestrationService();
        service.setPollHoldTime(Duration.ofSeconds(5));
        if (encrypt)
        {
            service.encryptSessions(true);
            service.setAgentPublicKey(agentKeys.getPublicKey());
            System.out.println("*** ENCRYPTED SESSION ***");
        }
        if (progressive)
        {
            service.setFeatureFlag("DistributedTask.Agent.EnableProgressiveRetryBackoff", "On");
        }
        if (flaky)
        {
            service.failCreateSession(new IOException("connection refused"));
            service.failGetNextMessage(new IOException("503 Service Unavailable"));
            System.out.println("*** FLAKY MODE: first attempts fail, expect retry delays ***");
        }

        for (int i = 1; i <= jobs; i++)
        {
            service.enqueueMessage("JobRequest", "{\"job\":" + i + ",\"script\":\"mvn -B verify\"}");
        }

        DemoAgent agent = new DemoAgent(service, agentKeys);
        Runtime.getRuntime().addShutdownHook(new Thread(agent::stop, "shutdown"));
        agent.run(jobs);
    }
}
