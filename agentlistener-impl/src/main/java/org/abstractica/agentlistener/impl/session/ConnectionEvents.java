package org.abstractica.agentlistener.impl.session;

import org.abstractica.agentlistener.ListenerOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Registered outage callbacks.
 *
 * <p>Callback exceptions are logged and never reach the loops.</p>
 */
public class ConnectionEvents
{
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionEvents.class);

    private final List<BiConsumer<ListenerOperation, Throwable>> lostCallbacks = new CopyOnWriteArrayList<>();
    private final List<Consumer<ListenerOperation>> restoredCallbacks = new CopyOnWriteArrayList<>();

    public void onConnectionLost(BiConsumer<ListenerOperation, Throwable> handler)
    {
        lostCallbacks.add(Objects.requireNonNull(handler, "handler"));
    }

    public void onConnectionRestored(Consumer<ListenerOperation> handler)
    {
        restoredCallbacks.add(Objects.requireNonNull(handler, "handler"));
    }

    public void connectionLost(ListenerOperation operation, Throwable cause)
    {
        for (BiConsumer<ListenerOperation, Throwable> callback : lostCallbacks)
        {
            safeCallback(() -> callback.accept(operation, cause));
        }
    }

    public void connectionRestored(ListenerOperation operation)
    {
        for (Consumer<ListenerOperation> callback : restoredCallbacks)
        {
            safeCallback(() -> callback.accept(operation));
        }
    }

    private void safeCallback(Runnable callback)
    {
        try
        {
            callback.run();
        }
        catch (Exception e)
        {
            LOG.error("Callback error", e);
        }
    }
}
