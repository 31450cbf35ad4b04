package com.questrail.lanlight.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Base64;
import java.util.Objects;

/**
 * LanMessageEncoder
 * ============================================================================
 * Converts a {@link LanRequest} into a compact UTF-8 JSON datagram payload:
 *
 * <pre>
 *   {"msg":{"cmd":"brightness","data":{"value":42}}}
 * </pre>
 *
 * <p>The encoder is stateless and thread-safe.</p>
 */
public final class LanMessageEncoder
{
    private final ObjectMapper mapper;

    public LanMessageEncoder()
    {
        this(new ObjectMapper());
    }

    public LanMessageEncoder(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public byte[] encode(LanRequest request)
    {
        Objects.requireNonNull(request, "request");

        ObjectNode root = mapper.createObjectNode();
        ObjectNode msg = root.putObject("msg");
        msg.put("cmd", request.command());
        msg.set("data", data(request));

        try {
            return mapper.writeValueAsBytes(root);
        }
        catch (JsonProcessingException e) {
            // A tree of plain nodes always serializes.
            throw new IllegalStateException("Failed to serialize " + request.command(), e);
        }
    }

    private ObjectNode data(LanRequest request)
    {
        ObjectNode data = mapper.createObjectNode();

        if (request instanceof ScanRequest) {
            data.put("account_topic", "reserve");
        }
        else if (request instanceof StatusRequest) {
            // empty
        }
        else if (request instanceof TurnRequest t) {
            data.put("value", t.on() ? 1 : 0);
        }
        else if (request instanceof BrightnessRequest b) {
            data.put("value", b.percent());
        }
        else if (request instanceof ColorRequest c) {
            ObjectNode color = data.putObject("color");
            color.put("r", c.color().red());
            color.put("g", c.color().green());
            color.put("b", c.color().blue());
            data.put("colorTemInKelvin", c.kelvin());
        }
        else if (request instanceof PtRealRequest p) {
            ArrayNode command = data.putArray("command");
            for (byte[] frame : p.frames()) {
                command.add(Base64.getEncoder().encodeToString(frame));
            }
        }
        else {
            throw new IllegalArgumentException("Unsupported request: " + request);
        }
        return data;
    }
}
