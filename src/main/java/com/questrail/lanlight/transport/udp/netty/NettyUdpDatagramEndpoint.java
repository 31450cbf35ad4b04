package com.questrail.lanlight.transport.udp.netty;

import com.questrail.lanlight.transport.DatagramEndpoint;
import com.questrail.lanlight.transport.DatagramEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramChannel;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.InternetProtocolFamily;
import io.netty.channel.socket.nio.NioDatagramChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.NetworkInterface;
import java.net.SocketAddress;
import java.net.SocketException;
import java.util.Enumeration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link DatagramEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Decode JSON payloads</li>
 *   <li>Interpret device semantics</li>
 *   <li>Schedule retries, polls, or timeouts</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <p>Inbound payloads are copied into {@code byte[]} and emitted to the port
 * listener. All reference-counted buffers are released internally.</p>
 *
 * <h2>Socket setup</h2>
 * The IPv4 socket is opened with {@code SO_BROADCAST}, {@code SO_REUSEADDR} and a
 * multicast TTL of 2. When a multicast group is given, it is joined once bound,
 * on the interface owning the bind address (or, for a wildcard bind, the first
 * usable IPv4 multicast interface), and left again on {@link #stop()}.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the UDP socket and begins receiving datagrams.
 * - {@link #stop()} closes the channel and shuts down the event loop group.
 * The listener sees {@code onTransportDown} at most once.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyUdpDatagramEndpoint.class);

    static final int MULTICAST_TTL = 2;

    private final InetSocketAddress bindAddress;
    private final InetAddress multicastGroup;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final AtomicBoolean downNotified = new AtomicBoolean(false);

    private volatile DatagramEndpointListener listener;
    private volatile DatagramChannel channel;
    private volatile NetworkInterface joinedInterface;

    /**
     * Construct a Netty UDP endpoint binding to the specified local address.
     *
     * @param multicastGroup group to join after binding, or {@code null}
     */
    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress, InetAddress multicastGroup)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.multicastGroup = multicastGroup;

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channelFactory((ChannelFactory<NioDatagramChannel>) () ->
                        new NioDatagramChannel(InternetProtocolFamily.IPv4))
                .option(ChannelOption.SO_BROADCAST, true)
                .option(ChannelOption.SO_REUSEADDR, true)
                .option(ChannelOption.IP_MULTICAST_TTL, MULTICAST_TTL)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public SocketAddress localAddress()
    {
        return bindAddress;
    }

    @Override
    public void start()
    {
        DatagramEndpointListener l = requireListener();

        // Bind asynchronously; notify listener on success/failure.
        ChannelFuture f = bootstrap.bind(bindAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                DatagramChannel ch = (DatagramChannel) future.channel();
                channel = ch;
                joinMulticastGroup(ch);
                l.onTransportUp();
            }
            else {
                notifyDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        DatagramChannel ch = channel;
        if (ch != null) {
            NetworkInterface nif = joinedInterface;
            if (nif != null) {
                ch.leaveGroup(new InetSocketAddress(multicastGroup, bindAddress.getPort()), nif);
                joinedInterface = null;
            }
            ch.close();
        }

        // Shut down the event loop group.
        group.shutdownGracefully();

        notifyDown(null);
    }

    @Override
    public void send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null) {
            // Not bound yet. Datagrams are fire-and-forget; nothing to retry here.
            log.debug("Dropping datagram to {}: endpoint {} not up", remote, bindAddress);
            return;
        }

        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        DatagramPacket pkt = new DatagramPacket(buf, (InetSocketAddress) remote);
        ch.writeAndFlush(pkt);
    }

    private void joinMulticastGroup(DatagramChannel ch)
    {
        if (multicastGroup == null) {
            return;
        }

        NetworkInterface nif;
        try {
            nif = multicastInterface();
        }
        catch (SocketException e) {
            log.warn("Cannot resolve multicast interface for {}; discovery broadcasts will not be received",
                    bindAddress, e);
            return;
        }
        if (nif == null) {
            log.warn("No multicast-capable IPv4 interface for {}; not joining {}", bindAddress, multicastGroup);
            return;
        }

        InetSocketAddress groupAddress = new InetSocketAddress(multicastGroup, bindAddress.getPort());
        ch.joinGroup(groupAddress, nif).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                joinedInterface = nif;
                log.debug("Joined {} on {}", multicastGroup, nif.getName());
            }
            else {
                log.warn("Failed to join {} on {}", multicastGroup, nif.getName(), future.cause());
            }
        });
    }

    private NetworkInterface multicastInterface() throws SocketException
    {
        InetAddress local = bindAddress.getAddress();
        if (local != null && !local.isAnyLocalAddress()) {
            return NetworkInterface.getByInetAddress(local);
        }

        Enumeration<NetworkInterface> all = NetworkInterface.getNetworkInterfaces();
        while (all != null && all.hasMoreElements()) {
            NetworkInterface nif = all.nextElement();
            if (!nif.isUp() || nif.isLoopback() || !nif.supportsMulticast()) {
                continue;
            }
            Enumeration<InetAddress> addresses = nif.getInetAddresses();
            while (addresses.hasMoreElements()) {
                if (addresses.nextElement() instanceof Inet4Address) {
                    return nif;
                }
            }
        }
        return null;
    }

    private void notifyDown(Throwable cause)
    {
        if (!downNotified.compareAndSet(false, true)) {
            return;
        }
        DatagramEndpointListener l = listener;
        if (l != null) {
            l.onTransportDown(cause);
        }
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

            // Copy the payload into a plain byte[] (Netty containment rule).
            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            l.onDatagram(packet.sender(), bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            notifyDown(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            notifyDown(cause);
            ctx.close();
        }
    }
}
