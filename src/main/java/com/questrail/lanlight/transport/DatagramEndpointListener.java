package com.questrail.lanlight.transport;

import java.net.SocketAddress;

/**
 * DatagramEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks may arrive on a transport thread. Implementations must hand work
 * off to the controller's scheduler rather than touch shared state directly.</p>
 */
public interface DatagramEndpointListener
{
    /**
     * Called when the transport becomes usable.
     */
    void onTransportUp();

    /**
     * Called when the transport becomes unusable.
     *
     * @param cause an exception or diagnostic cause; may be {@code null} for
     *              orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called when a datagram is received.
     *
     * <p>The payload is a full datagram, copied out of any framework buffer.</p>
     *
     * @param remote remote sender endpoint
     * @param payload raw datagram payload
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
