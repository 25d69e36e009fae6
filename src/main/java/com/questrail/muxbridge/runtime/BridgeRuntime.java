package com.questrail.muxbridge.runtime;

import com.questrail.muxbridge.channel.ChannelTypeRegistry;
import com.questrail.muxbridge.config.BridgeRuntimeConfig;
import com.questrail.muxbridge.observability.BridgeObservabilitySink;
import com.questrail.muxbridge.observability.NullObservabilitySink;
import com.questrail.muxbridge.superuser.PeerLauncher;
import com.questrail.muxbridge.superuser.ProcessPeerLauncher;
import com.questrail.muxbridge.transport.FrameTransport;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * BridgeRuntime
 * =============================================================================
 * Composition root and lifecycle owner of one bridge session.
 */
public final class BridgeRuntime {
    private final BridgeSession session;

    private BridgeRuntime(BridgeSession session) {
        this.session = session;
    }

    public void start() {
        session.start();
    }

    /**
     * Ends the session without writing anything more and waits for the
     * driver to finish.
     */
    public void stop() {
        session.stop();
        try {
            awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        session.driver().stop();
    }

    /**
     * Waits until the session has ended, by transport loss, protocol error or {@link #stop()}.
     *
     * @return {@code true} if the session ended within the timeout
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        try {
            session.ended().get(timeout, unit);
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            return true;
        }
        return session.driver().awaitTermination(timeout, unit);
    }

    public boolean isTerminated() {
        return session.ended().isDone();
    }

    /**
     * Runs {@code action} against the session on its driver thread.
     */
    public CompletableFuture<Void> execute(Consumer<BridgeSession> action) {
        return session.driver().execute(() -> action.accept(session));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BridgeRuntimeConfig config = BridgeRuntimeConfig.builder().build();
        private FrameTransport transport;
        private ChannelTypeRegistry channelTypes = ChannelTypeRegistry.defaults();
        private PeerLauncher peerLauncher = new ProcessPeerLauncher();
        private BridgeObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withConfig(BridgeRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withTransport(FrameTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder withChannelTypes(ChannelTypeRegistry channelTypes) {
            this.channelTypes = channelTypes;
            return this;
        }

        public Builder withPeerLauncher(PeerLauncher launcher) {
            this.peerLauncher = launcher;
            return this;
        }

        public Builder withObservabilitySink(BridgeObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public BridgeRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(transport, "transport");
            Objects.requireNonNull(channelTypes, "channelTypes");
            Objects.requireNonNull(peerLauncher, "peerLauncher");

            BridgeSession session = new BridgeSession(
                config,
                transport,
                channelTypes,
                peerLauncher,
                Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE)
            );
            return new BridgeRuntime(session);
        }
    }
}
