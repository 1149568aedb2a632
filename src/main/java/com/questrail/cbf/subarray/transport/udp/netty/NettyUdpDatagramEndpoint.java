package com.questrail.cbf.subarray.transport.udp.netty;

import com.questrail.cbf.subarray.transport.DatagramEndpoint;
import com.questrail.cbf.subarray.transport.DatagramEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link DatagramEndpoint} port.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf}) do not
 * escape this package. Inbound payloads are copied into {@code byte[]} before
 * reaching the listener; buffers are released by
 * {@link SimpleChannelInboundHandler}.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the UDP socket and begins receiving datagrams.
 * - {@link #stop()} closes the channel and shuts down the event loop group.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    /** Model documents for a full array exceed the default receive buffer. */
    private static final int MAX_DATAGRAM_BYTES = 65_507;

    private final InetSocketAddress bindAddress;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;

    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(MAX_DATAGRAM_BYTES))
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        DatagramEndpointListener l = requireListener();

        ChannelFuture f = bootstrap.bind(bindAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
                l.onTransportUp();
            }
            else {
                l.onTransportDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        channel = null;
        if (ch != null) {
            // channelInactive reports the transition to the listener.
            ch.close().syncUninterruptibly();
        }
        group.shutdownGracefully();
    }

    /**
     * The bound local address, once the channel is up. Useful when binding to
     * an ephemeral port.
     */
    public Optional<InetSocketAddress> localAddress()
    {
        Channel ch = channel;
        return ch == null ? Optional.empty() : Optional.of((InetSocketAddress) ch.localAddress());
    }

    private DatagramEndpointListener requireListener()
    {
        DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("DatagramEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives Netty {@link DatagramPacket}s and forwards raw payload bytes
     * to the port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            DatagramEndpointListener l = listener;
            if (l == null) {
                return;
            }

            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            SocketAddress remote = packet.sender();
            l.onDatagram(remote, bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            DatagramEndpointListener l = listener;
            if (l != null) {
                l.onTransportDown(null);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            DatagramEndpointListener l = listener;
            if (l != null) {
                l.onTransportDown(cause);
            }
            ctx.close();
        }
    }
}
