package com.questrail.debounce.transport.udp.netty;

import com.questrail.debounce.transport.DatagramEndpoint;
import com.questrail.debounce.transport.DatagramEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Receive-only UDP endpoint on a single Netty NIO event loop.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf}) stay
 * inside this class. The listener only ever sees a {@link SocketAddress} and a
 * {@code byte[]} copy of the payload, delivered on the event loop thread.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} binds asynchronously; the listener hears
 *       {@code onTransportUp} once the bind succeeds, or
 *       {@code onTransportDown(cause)} if it fails.</li>
 *   <li>{@link #stop()} closes the channel and releases the event loop. The
 *       listener hears exactly one {@code onTransportDown}, whichever of stop,
 *       channel inactivity or a pipeline exception comes first.</li>
 * </ul>
 * An endpoint is single-use: once stopped it cannot be started again.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyUdpDatagramEndpoint.class);

    /** Largest payload a single UDP datagram can carry over IPv4. */
    public static final int DEFAULT_MAX_DATAGRAM_BYTES = 65_507;

    private final InetSocketAddress bindAddress;
    private final int maxDatagramBytes;
    private final EventLoopGroup group = new NioEventLoopGroup(1);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean down = new AtomicBoolean(false);

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;

    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress)
    {
        this(bindAddress, DEFAULT_MAX_DATAGRAM_BYTES);
    }

    /**
     * @param bindAddress      local address to receive on; port 0 picks an ephemeral port
     * @param maxDatagramBytes receive buffer per datagram; longer datagrams are truncated
     */
    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress, int maxDatagramBytes)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        if (maxDatagramBytes < 1) {
            throw new IllegalArgumentException("maxDatagramBytes must be >= 1");
        }
        this.maxDatagramBytes = maxDatagramBytes;
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("DatagramEndpointListener must be set before start()");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("NettyUdpDatagramEndpoint can only be started once");
        }

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(maxDatagramBytes))
                .handler(new InboundHandler());

        bootstrap.bind(bindAddress).addListener((ChannelFutureListener) this::onBound);
    }

    private void onBound(ChannelFuture future)
    {
        if (!future.isSuccess()) {
            log.warn("UDP bind to {} failed", bindAddress, future.cause());
            notifyDown(future.cause());
            group.shutdownGracefully();
            return;
        }

        channel = future.channel();
        if (down.get()) {
            // Stopped while the bind was in flight.
            channel.close();
            return;
        }
        log.debug("UDP endpoint bound to {}", channel.localAddress());
        listener.onTransportUp();
    }

    @Override
    public void stop()
    {
        notifyDown(null);
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
        group.shutdownGracefully();
    }

    /**
     * Locally bound address, or {@code null} until the bind has completed.
     */
    public SocketAddress localAddress()
    {
        Channel ch = channel;
        return ch != null ? ch.localAddress() : null;
    }

    private void notifyDown(Throwable cause)
    {
        if (!down.compareAndSet(false, true)) {
            return;
        }
        DatagramEndpointListener l = listener;
        if (l != null) {
            l.onTransportDown(cause);
        }
    }

    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            if (down.get()) {
                return;
            }
            // SimpleChannelInboundHandler releases the packet after this returns.
            byte[] payload = ByteBufUtil.getBytes(packet.content());
            listener.onDatagram(packet.sender(), payload);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            notifyDown(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("UDP endpoint on {} failed", bindAddress, cause);
            notifyDown(cause);
            ctx.close();
        }
    }
}
