/**
 * LAN Transport
 * =============================================================================
 *
 * The framework-agnostic transport boundary between a concrete networking
 * implementation (Netty UDP, or a test double) and the control plane.
 *
 * <h2>Why these ports exist</h2>
 * Netty runs the sockets in production <strong>without</strong> its types
 * leaking into discovery, polling or command execution. Everything above this
 * package sees only:
 * <ul>
 *   <li>Raw datagram payloads as {@code byte[]}</li>
 *   <li>Remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>Transport lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Endpoint implementations MUST:
 * <ul>
 *   <li>Perform transport I/O only (no JSON decoding)</li>
 *   <li>Not schedule retries, polls, or timeouts</li>
 * </ul>
 *
 * <p>{@link com.questrail.lanlight.transport.TransportManager} adds the only
 * policy that lives here: which endpoint sends to which destination.</p>
 */
package com.questrail.lanlight.transport;
