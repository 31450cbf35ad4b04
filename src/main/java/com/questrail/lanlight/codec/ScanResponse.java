package com.questrail.lanlight.codec;

/**
 * Identity reported by a light answering a scan.
 *
 * <p>Any field may be {@code null} when the light omitted it; the dispatcher
 * decides what can still be used.</p>
 *
 * @param device fingerprint (hardware id)
 * @param sku    model identifier
 * @param ip     address the light reports for itself
 */
public record ScanResponse(String device, String sku, String ip) implements LanResponse
{
    public ScanResponse withIp(String ip) {
        return new ScanResponse(device, sku, ip);
    }

    @Override
    public String command() {
        return ScanRequest.COMMAND;
    }
}
