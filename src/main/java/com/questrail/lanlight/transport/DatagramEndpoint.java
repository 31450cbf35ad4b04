package com.questrail.lanlight.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for one bound UDP socket.
 *
 * <p>This endpoint is intentionally small. {@link TransportManager} owns one per
 * listening address and is responsible for:</p>
 * <ul>
 *   <li>choosing which endpoint sends to a destination</li>
 *   <li>forwarding inbound datagrams to the decoder</li>
 *   <li>aggregating lifecycle signals into start/close completion</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty, java.nio, or a test harness.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Start the endpoint and begin receiving datagrams.
     *
     * <p>On successful activation, the endpoint MUST notify its listener via
     * {@link DatagramEndpointListener#onTransportUp()} exactly once. A failed bind
     * is reported through {@link DatagramEndpointListener#onTransportDown(Throwable)}
     * with a non-null cause.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     *
     * <p>The endpoint MUST notify its listener via
     * {@link DatagramEndpointListener#onTransportDown(Throwable)} at most once over
     * its lifetime, whether the shutdown is requested or error-induced.</p>
     */
    void stop();

    /**
     * Send a datagram. Fire-and-forget: sends before the endpoint is up are dropped.
     *
     * @param remote remote destination
     * @param payload datagram payload
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Register the listener that receives inbound datagrams and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(DatagramEndpointListener listener);

    /**
     * @return the configured local address, for diagnostics
     */
    SocketAddress localAddress();
}
