package com.questrail.lanlight.codec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Pass-through binary frames ({@code ptReal}), each sent base64-encoded.
 *
 * @see PtRealFrames
 */
public record PtRealRequest(List<byte[]> frames) implements LanRequest
{
    public PtRealRequest {
        Objects.requireNonNull(frames, "frames");
        if (frames.isEmpty()) {
            throw new IllegalArgumentException("at least one frame required");
        }
        List<byte[]> copy = new ArrayList<>(frames.size());
        for (byte[] f : frames) {
            copy.add(Objects.requireNonNull(f, "frame").clone());
        }
        frames = Collections.unmodifiableList(copy);
    }

    public static PtRealRequest of(byte[] frame) {
        return new PtRealRequest(List.of(frame));
    }

    @Override
    public String command() {
        return "ptReal";
    }
}
