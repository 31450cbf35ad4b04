package com.questrail.lanlight.codec;

/**
 * Power on/off.
 */
public record TurnRequest(boolean on) implements LanRequest
{
    @Override
    public String command() {
        return "turn";
    }
}
