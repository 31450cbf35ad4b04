package com.questrail.lanlight.codec;

/**
 * Brightness percentage, clamped to {@code [0, 100]}.
 */
public record BrightnessRequest(int percent) implements LanRequest
{
    public BrightnessRequest {
        percent = Math.max(0, Math.min(percent, 100));
    }

    @Override
    public String command() {
        return "brightness";
    }
}
