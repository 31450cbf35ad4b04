package com.questrail.lanlight.transport;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * FakeDatagramEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link DatagramEndpoint} implementation.
 *
 * <p>It contains no device semantics; it only stores outbound datagrams and
 * allows tests to inject inbound datagrams. {@link #failBindWith(Throwable)}
 * makes the next {@link #start()} report a bind failure.</p>
 */
public final class FakeDatagramEndpoint implements DatagramEndpoint {

    public record Sent(SocketAddress remote, byte[] payload) {
        public String text() {
            return new String(payload, StandardCharsets.UTF_8);
        }

        public String host() {
            return ((InetSocketAddress) remote).getAddress().getHostAddress();
        }

        public int port() {
            return ((InetSocketAddress) remote).getPort();
        }
    }

    private final InetSocketAddress localAddress;
    private final InetAddress multicastGroup;
    private DatagramEndpointListener listener;
    private Throwable bindFailure;
    private final List<Sent> sent = new ArrayList<>();

    public FakeDatagramEndpoint(InetSocketAddress localAddress, InetAddress multicastGroup) {
        this.localAddress = localAddress;
        this.multicastGroup = multicastGroup;
    }

    @Override
    public void setListener(DatagramEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public SocketAddress localAddress() {
        return localAddress;
    }

    @Override
    public void start() {
        if (listener == null) {
            return;
        }
        if (bindFailure != null) {
            listener.onTransportDown(bindFailure);
        } else {
            listener.onTransportUp();
        }
    }

    @Override
    public void stop() {
        if (listener != null) {
            listener.onTransportDown(null);
        }
    }

    @Override
    public void send(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");
        sent.add(new Sent(remote, payload));
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void failBindWith(Throwable cause) {
        this.bindFailure = cause;
    }

    public InetAddress multicastGroup() {
        return multicastGroup;
    }

    public void injectDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        listener.onDatagram(remote, payload);
    }

    public void injectJson(String fromIp, String json) {
        injectDatagram(new InetSocketAddress(fromIp, 4003), json.getBytes(StandardCharsets.UTF_8));
    }

    public List<Sent> sent() {
        return Collections.unmodifiableList(sent);
    }

    public List<Sent> sentContaining(String fragment) {
        List<Sent> matching = new ArrayList<>();
        for (Sent s : sent) {
            if (s.text().contains(fragment)) {
                matching.add(s);
            }
        }
        return matching;
    }

    public void clear() {
        sent.clear();
    }
}
