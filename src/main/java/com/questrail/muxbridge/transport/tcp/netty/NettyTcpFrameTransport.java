package com.questrail.muxbridge.transport.tcp.netty;

import com.questrail.muxbridge.codec.Frame;
import com.questrail.muxbridge.codec.impl.DefaultFrameEncoder;
import com.questrail.muxbridge.transport.FrameTransport;
import com.questrail.muxbridge.transport.FrameTransportListener;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpFrameTransport
 * =============================================================================
 * Netty-backed {@link FrameTransport} serving exactly one TCP connection.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It listens on a
 * socket, accepts the first connection, and from then on behaves like the
 * stdio transport: frames in, frames out, one up and one down notification.
 * Further connection attempts are closed immediately.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 */
public final class NettyTcpFrameTransport implements FrameTransport
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpFrameTransport.class);

    private final InetSocketAddress bindAddress;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ServerBootstrap bootstrap;

    private final AtomicBoolean accepted = new AtomicBoolean(false);
    private final AtomicBoolean down = new AtomicBoolean(false);

    private volatile FrameTransportListener listener;
    private volatile Channel serverChannel;
    private volatile Channel connection;

    public NettyTcpFrameTransport(InetSocketAddress bindAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup(1);
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        if (!accepted.compareAndSet(false, true)) {
                            log.warn("Rejecting additional connection from {}", ch.remoteAddress());
                            ch.close();
                            return;
                        }
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new FrameByteDecoder());
                        p.addLast(new FrameByteEncoder(new DefaultFrameEncoder()));
                        p.addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(FrameTransportListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Binds the listening socket. Transport up is reported once a client connects.
     */
    @Override
    public void start()
    {
        FrameTransportListener l = requireListener();

        ChannelFuture f = bootstrap.bind(bindAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                serverChannel = future.channel();
                log.info("Listening for one session on {}", serverChannel.localAddress());
            }
            else {
                reportDown(l, future.cause());
            }
        });
    }

    /**
     * Blocks until the listening socket is bound and returns its port.
     */
    public int awaitBoundPort() throws InterruptedException
    {
        while (serverChannel == null && !down.get()) {
            Thread.sleep(10);
        }
        Channel ch = serverChannel;
        if (ch == null) {
            throw new IllegalStateException("transport failed to bind " + bindAddress);
        }
        return ((InetSocketAddress) ch.localAddress()).getPort();
    }

    @Override
    public void stop()
    {
        Channel conn = connection;
        if (conn != null) {
            conn.close();
        }
        Channel server = serverChannel;
        if (server != null) {
            server.close();
        }

        workerGroup.shutdownGracefully();
        bossGroup.shutdownGracefully();

        FrameTransportListener l = listener;
        if (l != null) {
            reportDown(l, null);
        }
    }

    @Override
    public void send(Frame frame)
    {
        Objects.requireNonNull(frame, "frame");

        Channel ch = connection;
        if (ch == null || down.get()) {
            return;
        }
        ch.writeAndFlush(frame);
    }

    private void reportDown(FrameTransportListener l, Throwable cause)
    {
        if (down.compareAndSet(false, true)) {
            l.onTransportDown(cause);
        }
    }

    private FrameTransportListener requireListener()
    {
        FrameTransportListener l = listener;
        if (l == null) {
            throw new IllegalStateException("FrameTransportListener must be set before start()");
        }
        return l;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Forwards decoded frames and connection lifecycle to the port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<Frame>
    {
        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            connection = ctx.channel();
            FrameTransportListener l = listener;
            if (l != null) {
                l.onTransportUp();
            }
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Frame frame)
        {
            FrameTransportListener l = listener;
            if (l != null) {
                l.onFrame(frame);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            FrameTransportListener l = listener;
            if (l != null) {
                reportDown(l, null);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            FrameTransportListener l = listener;
            if (l != null) {
                reportDown(l, cause);
            }
            ctx.close();
        }
    }
}
