package com.questrail.lanlight;

import com.questrail.lanlight.codec.LanDecodeException;
import com.questrail.lanlight.codec.LanMessageDecoder;
import com.questrail.lanlight.codec.LanResponse;
import com.questrail.lanlight.codec.ScanResponse;
import com.questrail.lanlight.codec.StatusResponse;
import com.questrail.lanlight.transport.TransportManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;

/**
 * LanInboundDispatcher
 * =============================================================================
 * Inbound glue between the transport and the controller.
 *
 * <p>
 * Decoding happens on the transport thread that read the datagram; routing hops
 * onto the controller's scheduler. Undecodable datagrams are logged and dropped
 * and never reach the scheduler.
 * </p>
 */
final class LanInboundDispatcher implements TransportManager.InboundHandler
{
    private static final Logger log = LoggerFactory.getLogger(LanInboundDispatcher.class);

    private static final int LOGGED_PAYLOAD_BYTES = 50;

    private final LanMessageDecoder decoder;
    private final Executor loop;
    private final BiConsumer<ScanResponse, String> onScan;
    private final BiConsumer<StatusResponse, String> onStatus;

    LanInboundDispatcher(LanMessageDecoder decoder,
                         Executor loop,
                         BiConsumer<ScanResponse, String> onScan,
                         BiConsumer<StatusResponse, String> onStatus)
    {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.onScan = Objects.requireNonNull(onScan, "onScan");
        this.onStatus = Objects.requireNonNull(onStatus, "onStatus");
    }

    @Override
    public void onDatagram(InetSocketAddress sender, byte[] payload)
    {
        if (payload.length == 0) {
            return;
        }

        LanResponse response;
        try {
            response = decoder.decode(payload);
        }
        catch (LanDecodeException e) {
            if (log.isDebugEnabled()) {
                log.debug("Undecodable message from {}: {}", sender, new String(payload, StandardCharsets.UTF_8), e);
            }
            log.warn("Unknown message received from {}: {}", sender, truncated(payload));
            return;
        }

        String senderIp = senderIp(sender);
        if (response instanceof ScanResponse scan) {
            loop.execute(() -> onScan.accept(scan, senderIp));
        }
        else if (response instanceof StatusResponse status) {
            loop.execute(() -> onStatus.accept(status, senderIp));
        }
    }

    static String senderIp(InetSocketAddress sender)
    {
        return sender.getAddress() != null ? sender.getAddress().getHostAddress() : sender.getHostString();
    }

    private static String truncated(byte[] payload)
    {
        int n = Math.min(payload.length, LOGGED_PAYLOAD_BYTES);
        return new String(payload, 0, n, StandardCharsets.UTF_8);
    }
}
