package com.questrail.lanlight.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.lanlight.api.Rgb;

import java.io.IOException;
import java.util.Objects;

/**
 * LanMessageDecoder
 * ============================================================================
 * Converts an inbound datagram payload into a {@link LanResponse}.
 *
 * <p>
 * Only {@code scan} and {@code devStatus} are recognized. Anything else, and
 * anything that is not a JSON object with a {@code msg.cmd} string and a
 * {@code msg.data} object, raises {@link LanDecodeException}.
 * </p>
 *
 * <p>
 * Scan fields are passed through as found (possibly {@code null}). Missing
 * status fields read as zero.
 * </p>
 */
public final class LanMessageDecoder
{
    private final ObjectMapper mapper;

    public LanMessageDecoder()
    {
        this(new ObjectMapper());
    }

    public LanMessageDecoder(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public LanResponse decode(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");

        JsonNode root;
        try {
            root = mapper.readTree(payload);
        }
        catch (IOException e) {
            throw new LanDecodeException("Payload is not valid JSON", e);
        }

        if (root == null || !root.isObject()) {
            throw new LanDecodeException("Payload is not a JSON object");
        }

        JsonNode msg = root.get("msg");
        if (msg == null || !msg.isObject()) {
            throw new LanDecodeException("Missing msg envelope");
        }

        JsonNode cmd = msg.get("cmd");
        if (cmd == null || !cmd.isTextual()) {
            throw new LanDecodeException("Missing msg.cmd");
        }

        JsonNode data = msg.get("data");
        if (data == null || !data.isObject()) {
            throw new LanDecodeException("Missing msg.data for " + cmd.asText());
        }

        switch (cmd.asText()) {
            case ScanRequest.COMMAND:
                return new ScanResponse(text(data, "device"), text(data, "sku"), text(data, "ip"));
            case StatusRequest.COMMAND:
                JsonNode color = data.path("color");
                return new StatusResponse(
                        data.path("onOff").asInt(0) != 0,
                        new Rgb(color.path("r").asInt(0), color.path("g").asInt(0), color.path("b").asInt(0)),
                        data.path("brightness").asInt(0),
                        data.path("colorTemInKelvin").asInt(0));
            default:
                throw new LanDecodeException("Unsupported command: " + cmd.asText());
        }
    }

    private static String text(JsonNode data, String field)
    {
        JsonNode n = data.get(field);
        if (n == null || n.isNull()) {
            return null;
        }
        String s = n.asText();
        return s.isEmpty() ? null : s;
    }
}
