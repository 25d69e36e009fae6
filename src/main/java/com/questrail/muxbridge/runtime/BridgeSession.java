package com.questrail.muxbridge.runtime;

import com.questrail.muxbridge.bus.InternalBus;
import com.questrail.muxbridge.channel.ChannelRegistry;
import com.questrail.muxbridge.channel.ChannelTypeRegistry;
import com.questrail.muxbridge.codec.Frame;
import com.questrail.muxbridge.config.BridgeRuntimeConfig;
import com.questrail.muxbridge.internal.events.BridgeEvent;
import com.questrail.muxbridge.internal.events.FrameEvent;
import com.questrail.muxbridge.internal.events.PeerEvent;
import com.questrail.muxbridge.internal.events.TaskEvent;
import com.questrail.muxbridge.internal.events.TransportEvent;
import com.questrail.muxbridge.internal.exec.BridgeDriver;
import com.questrail.muxbridge.internal.exec.BridgeEventHandler;
import com.questrail.muxbridge.login.LoginMessages;
import com.questrail.muxbridge.observability.BridgeErrorEvent;
import com.questrail.muxbridge.observability.BridgeObservabilitySink;
import com.questrail.muxbridge.observability.BridgeProtocolEvent;
import com.questrail.muxbridge.protocol.ControlMessages;
import com.questrail.muxbridge.protocol.ProtocolException;
import com.questrail.muxbridge.router.ControlRouter;
import com.questrail.muxbridge.superuser.PeerLauncher;
import com.questrail.muxbridge.superuser.SuperuserRule;
import com.questrail.muxbridge.transport.FrameSink;
import com.questrail.muxbridge.transport.FrameTransport;
import com.questrail.muxbridge.transport.FrameTransportListener;
import com.questrail.muxbridge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * BridgeSession
 * =============================================================================
 * Everything belonging to one front-end connection, from transport up to
 * transport down.
 *
 * <p>The session is the single context shared by the router, the channel
 * registry, the internal bus and the superuser state machine. It owns the
 * driver whose thread is the only one to touch any of them.</p>
 *
 * <h2>Ending</h2>
 * The session ends when the transport goes down or on a
 * {@link ProtocolException}. Either way nothing more is written to the front
 * end: open channels are abandoned, the superuser peer is stopped and the
 * driver loop exits.
 */
public final class BridgeSession implements BridgeEventHandler
{
    private static final Logger log = LoggerFactory.getLogger(BridgeSession.class);

    private final FrameTransport transport;
    private final BridgeObservabilitySink sink;
    private final BridgeDriver driver;
    private final SessionOutput output;
    private final InternalBus bus;
    private final ChannelRegistry registry;
    private final SuperuserRule superuser;
    private final LoginMessages loginMessages;
    private final ControlRouter router;
    private final CompletableFuture<Void> ended = new CompletableFuture<>();

    BridgeSession(BridgeRuntimeConfig config,
                  FrameTransport transport,
                  ChannelTypeRegistry types,
                  PeerLauncher launcher,
                  BridgeObservabilitySink sink)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.driver = new BridgeDriver(this, sink, "muxbridge-session");
        this.output = new SessionOutput(transport);

        this.bus = new InternalBus();
        this.registry = new ChannelRegistry(output, bus, sink);
        this.superuser = new SuperuserRule(config, launcher, output, registry, driver::submitEvent, sink);
        this.loginMessages = LoginMessages.fromEnvironment(config.environment());
        this.router = new ControlRouter(registry, types, superuser, output, sink);

        bus.export(SuperuserRule.PATH, superuser);
        bus.export(LoginMessages.PATH, loginMessages);
    }

    void start()
    {
        driver.start();
        transport.setListener(new FrameTransportListener() {
            @Override
            public void onTransportUp() {
                driver.submitEvent(new TransportEvent.TransportUp(Instant.now()));
            }

            @Override
            public void onTransportDown(Throwable cause) {
                driver.submitEvent(new TransportEvent.TransportDown(Instant.now(), cause));
            }

            @Override
            public void onFrame(Frame frame) {
                driver.submitEvent(new FrameEvent.FrameReceived(Instant.now(), frame));
            }
        });
        transport.start();
    }

    /**
     * Ends the session from outside the driver thread.
     */
    void stop()
    {
        if (driver.isRunning()) {
            driver.execute(() -> end("stopped"));
        }
    }

    CompletableFuture<Void> ended()
    {
        return ended;
    }

    BridgeDriver driver()
    {
        return driver;
    }

    public InternalBus internalBus()
    {
        return bus;
    }

    public ChannelRegistry registry()
    {
        return registry;
    }

    public SuperuserRule superuser()
    {
        return superuser;
    }

    public LoginMessages loginMessages()
    {
        return loginMessages;
    }

    public ControlRouter router()
    {
        return router;
    }

    @Override
    public void handle(BridgeEvent event)
    {
        if (ended.isDone()) {
            return;
        }
        try {
            dispatch(event);
        } catch (ProtocolException e) {
            log.warn("Protocol error, ending session: {}", e.getMessage());
            sink.onError(new BridgeErrorEvent(Instant.now(), "Protocol error: " + e.getMessage(), e));
            end("protocol error");
        }
    }

    private void dispatch(BridgeEvent event)
    {
        if (event instanceof FrameEvent.FrameReceived) {
            router.route(((FrameEvent.FrameReceived) event).frame());
        }
        else if (event instanceof PeerEvent) {
            superuser.handlePeerEvent((PeerEvent) event);
        }
        else if (event instanceof TransportEvent.TransportUp) {
            output.send(Frame.control(Jsons.toBytes(ControlMessages.init())));
        }
        else if (event instanceof TransportEvent.TransportDown) {
            Throwable cause = ((TransportEvent.TransportDown) event).cause();
            if (cause != null) {
                sink.onError(new BridgeErrorEvent(Instant.now(), "Transport failed", cause));
            }
            end(cause == null ? "transport closed" : "transport failed");
        }
        else if (event instanceof TaskEvent) {
            ((TaskEvent) event).run();
        }
    }

    private void end(String reason)
    {
        if (ended.isDone()) {
            return;
        }
        sink.onProtocolEvent(new BridgeProtocolEvent(Instant.now(), "Session ended: " + reason));
        output.close();
        registry.abandonAll();
        superuser.shutdown();
        transport.stop();
        driver.stop();
        ended.complete(null);
    }

    /**
     * Outbound side of the front-end transport; silent once closed.
     */
    private static final class SessionOutput implements FrameSink
    {
        private final FrameSink transport;
        private volatile boolean closed;

        SessionOutput(FrameSink transport)
        {
            this.transport = transport;
        }

        @Override
        public void send(Frame frame)
        {
            if (!closed) {
                transport.send(frame);
            }
        }

        void close()
        {
            closed = true;
        }
    }
}
