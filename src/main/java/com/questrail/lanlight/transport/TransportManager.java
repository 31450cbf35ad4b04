package com.questrail.lanlight.transport;

import com.questrail.lanlight.observability.LanObservabilitySink;
import com.questrail.lanlight.observability.TransportEvent;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TransportManager
 * =============================================================================
 * Owns one {@link DatagramEndpoint} per listening address.
 *
 * <h2>Outbound</h2>
 * {@link #broadcast(byte[])} sends on every endpoint to the discovery target;
 * {@link #sendTo(byte[], String, int)} picks a single endpoint through
 * {@link EndpointSelector}.
 *
 * <h2>Lifecycle</h2>
 * {@link #started()} completes once every endpoint is up, or exceptionally when
 * any endpoint fails to bind. {@link #closed()} completes once every endpoint
 * has reported down.
 */
public final class TransportManager
{
    /**
     * Receives every inbound datagram, on the transport thread that read it.
     */
    @FunctionalInterface
    public interface InboundHandler
    {
        void onDatagram(InetSocketAddress sender, byte[] payload);
    }

    private final List<DatagramEndpoint> endpoints = new ArrayList<>();
    private final List<String> localAddresses;
    private final EndpointSelector selector;
    private final InetSocketAddress broadcastTarget;
    private final InboundHandler inbound;
    private final LanObservabilitySink sink;

    private final CompletableFuture<Void> started = new CompletableFuture<>();
    private final CompletableFuture<Void> closed = new CompletableFuture<>();
    private final AtomicInteger upCount = new AtomicInteger();
    private final AtomicInteger downCount = new AtomicInteger();

    public TransportManager(List<String> listeningAddresses,
                            List<String> networkMasks,
                            int listeningPort,
                            InetSocketAddress broadcastTarget,
                            DatagramEndpointFactory factory,
                            InboundHandler inbound,
                            LanObservabilitySink sink)
    {
        Objects.requireNonNull(listeningAddresses, "listeningAddresses");
        Objects.requireNonNull(factory, "factory");
        this.broadcastTarget = Objects.requireNonNull(broadcastTarget, "broadcastTarget");
        this.inbound = Objects.requireNonNull(inbound, "inbound");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.localAddresses = List.copyOf(listeningAddresses);
        this.selector = new EndpointSelector(localAddresses, networkMasks);

        InetAddress target = broadcastTarget.getAddress();
        InetAddress group = target != null && target.isMulticastAddress() ? target : null;

        for (String address : localAddresses) {
            DatagramEndpoint endpoint = factory.create(new InetSocketAddress(address, listeningPort), group);
            endpoint.setListener(new EndpointListener(endpoint));
            endpoints.add(endpoint);
        }
    }

    public void start()
    {
        for (DatagramEndpoint e : endpoints) {
            e.start();
        }
    }

    public void stop()
    {
        for (DatagramEndpoint e : endpoints) {
            e.stop();
        }
    }

    public CompletableFuture<Void> started()
    {
        return started;
    }

    public CompletableFuture<Void> closed()
    {
        return closed;
    }

    /**
     * Send {@code payload} to the discovery target on every endpoint.
     */
    public void broadcast(byte[] payload)
    {
        for (DatagramEndpoint e : endpoints) {
            e.send(broadcastTarget, payload);
        }
    }

    /**
     * Send {@code payload} to {@code ip:port} through the best-suited endpoint.
     */
    public void sendTo(byte[] payload, String ip, int port)
    {
        Objects.requireNonNull(ip, "ip");
        endpointFor(ip).send(new InetSocketAddress(ip, port), payload);
    }

    DatagramEndpoint endpointFor(String ip)
    {
        return endpoints.get(selector.select(ip));
    }

    public int endpointCount()
    {
        return endpoints.size();
    }

    public List<String> localAddresses()
    {
        return localAddresses;
    }

    private final class EndpointListener implements DatagramEndpointListener
    {
        private final DatagramEndpoint endpoint;
        private final AtomicBoolean up = new AtomicBoolean();
        private final AtomicBoolean down = new AtomicBoolean();

        private EndpointListener(DatagramEndpoint endpoint)
        {
            this.endpoint = endpoint;
        }

        @Override
        public void onTransportUp()
        {
            if (down.get() || !up.compareAndSet(false, true)) {
                return;
            }
            sink.onTransportEvent(new TransportEvent(String.valueOf(endpoint.localAddress()), true, null));
            if (upCount.incrementAndGet() == endpoints.size()) {
                started.complete(null);
            }
        }

        @Override
        public void onTransportDown(Throwable cause)
        {
            if (!down.compareAndSet(false, true)) {
                return;
            }
            sink.onTransportEvent(new TransportEvent(String.valueOf(endpoint.localAddress()), false, cause));
            if (!up.get()) {
                started.completeExceptionally(cause != null
                        ? cause
                        : new IllegalStateException("endpoint " + endpoint.localAddress() + " closed before start"));
            }
            if (downCount.incrementAndGet() == endpoints.size()) {
                closed.complete(null);
            }
        }

        @Override
        public void onDatagram(SocketAddress remote, byte[] payload)
        {
            if (remote instanceof InetSocketAddress sender) {
                inbound.onDatagram(sender, payload);
            }
        }
    }
}
