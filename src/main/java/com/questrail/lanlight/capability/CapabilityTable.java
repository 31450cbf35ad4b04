package com.questrail.lanlight.capability;

import com.questrail.lanlight.api.LightCapabilities;

import java.util.Optional;

/**
 * Read-only lookup from a model identifier (SKU) to its capabilities.
 *
 * <p>Consulted once, when a device is first seen. Implementations must be safe
 * to share between controllers.</p>
 */
@FunctionalInterface
public interface CapabilityTable
{
    /**
     * @return capabilities for the model, or empty if the model is unknown
     */
    Optional<LightCapabilities> lookup(String sku);
}
