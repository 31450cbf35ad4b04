package com.questrail.lanlight.codec;

import com.questrail.lanlight.api.Rgb;

import java.util.HexFormat;
import java.util.Objects;

/**
 * PtRealFrames
 * ============================================================================
 * Builders for the fixed-layout binary frames carried by {@code ptReal}.
 *
 * <h2>Layout</h2>
 * <pre>
 *   segment colour:  33 05 15 01 RR GG BB 00 00 00 00 00 [selector...]
 *   scene:           33 05 04 [scene code...]
 * </pre>
 * Every frame is zero-padded to {@value #BODY_LENGTH} bytes and followed by a
 * single XOR checksum over the body, {@value #FRAME_LENGTH} bytes in total.
 * Frames parsed from raw hex are sent exactly as given.
 */
public final class PtRealFrames
{
    public static final int BODY_LENGTH = 19;
    public static final int FRAME_LENGTH = BODY_LENGTH + 1;

    private static final byte[] SEGMENT_COLOR_PREFIX = {0x33, 0x05, 0x15, 0x01};
    private static final byte[] SCENE_PREFIX = {0x33, 0x05, 0x04};

    private PtRealFrames()
    {
    }

    public static byte[] segmentColor(Rgb color, byte[] segmentSelector)
    {
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(segmentSelector, "segmentSelector");

        Rgb c = color.clamped();
        byte[] body = new byte[12 + segmentSelector.length];
        System.arraycopy(SEGMENT_COLOR_PREFIX, 0, body, 0, SEGMENT_COLOR_PREFIX.length);
        body[4] = (byte) c.red();
        body[5] = (byte) c.green();
        body[6] = (byte) c.blue();
        // bytes 7..11 stay zero
        System.arraycopy(segmentSelector, 0, body, 12, segmentSelector.length);
        return withChecksum(body);
    }

    public static byte[] scene(byte[] sceneCode)
    {
        Objects.requireNonNull(sceneCode, "sceneCode");

        byte[] body = new byte[SCENE_PREFIX.length + sceneCode.length];
        System.arraycopy(SCENE_PREFIX, 0, body, 0, SCENE_PREFIX.length);
        System.arraycopy(sceneCode, 0, body, SCENE_PREFIX.length, sceneCode.length);
        return withChecksum(body);
    }

    /**
     * Pads {@code body} to {@value #BODY_LENGTH} bytes and appends the XOR checksum.
     *
     * @throws IllegalArgumentException if the body is longer than {@value #BODY_LENGTH} bytes
     */
    public static byte[] withChecksum(byte[] body)
    {
        if (body.length > BODY_LENGTH) {
            throw new IllegalArgumentException(
                    "frame body is " + body.length + " bytes, limit " + BODY_LENGTH);
        }
        byte[] frame = new byte[FRAME_LENGTH];
        System.arraycopy(body, 0, frame, 0, body.length);
        frame[BODY_LENGTH] = xor(frame, BODY_LENGTH);
        return frame;
    }

    /**
     * Parses a raw hex frame; whitespace is ignored. No checksum is added.
     *
     * @throws IllegalArgumentException on an empty string, odd length or non-hex characters
     */
    public static byte[] fromHex(String hex)
    {
        Objects.requireNonNull(hex, "hex");
        String compact = hex.replaceAll("\\s+", "");
        if (compact.isEmpty()) {
            throw new IllegalArgumentException("empty hex frame");
        }
        return HexFormat.of().parseHex(compact);
    }

    static byte xor(byte[] bytes, int length)
    {
        byte x = 0;
        for (int i = 0; i < length; i++) {
            x ^= bytes[i];
        }
        return x;
    }
}
