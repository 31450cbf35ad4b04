package com.questrail.lanlight.transport;

import java.net.InetAddress;
import java.net.InetSocketAddress;

/**
 * Creates the endpoint for one listening address.
 */
@FunctionalInterface
public interface DatagramEndpointFactory
{
    /**
     * @param bindAddress    local address and port to bind
     * @param multicastGroup group to join once bound, or {@code null} when
     *                       discovery uses plain broadcast
     */
    DatagramEndpoint create(InetSocketAddress bindAddress, InetAddress multicastGroup);
}
