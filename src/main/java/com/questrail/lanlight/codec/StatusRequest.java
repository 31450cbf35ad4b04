package com.questrail.lanlight.codec;

/**
 * Request for a state snapshot. Carries an empty data object.
 */
public record StatusRequest() implements LanRequest
{
    public static final StatusRequest INSTANCE = new StatusRequest();

    public static final String COMMAND = "devStatus";

    @Override
    public String command() {
        return COMMAND;
    }
}
