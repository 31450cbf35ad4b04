package com.questrail.lanlight.codec;

/**
 * Discovery probe. Sent to the multicast group or unicast to a queued address.
 */
public record ScanRequest() implements LanRequest
{
    public static final ScanRequest INSTANCE = new ScanRequest();

    public static final String COMMAND = "scan";

    @Override
    public String command() {
        return COMMAND;
    }
}
