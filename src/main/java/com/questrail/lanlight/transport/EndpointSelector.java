package com.questrail.lanlight.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * EndpointSelector
 * =============================================================================
 * Chooses which local endpoint sends to a given destination.
 *
 * <h2>Rules, in order</h2>
 * <ol>
 *   <li>A single endpoint is always chosen.</li>
 *   <li>With network masks configured: the first non-wildcard endpoint whose
 *       subnet contains the destination. An unparseable mask is logged and its
 *       endpoint skipped.</li>
 *   <li>Without masks: the first non-wildcard endpoint matching the private
 *       network heuristic (same first three octets; both in 192.168/16; both in
 *       10/8).</li>
 *   <li>The first non-wildcard endpoint.</li>
 *   <li>The first endpoint. Malformed and IPv6 destinations always end up here.</li>
 * </ol>
 *
 * <p>The heuristic is approximate and only used when no masks are configured.</p>
 */
final class EndpointSelector
{
    private static final Logger log = LoggerFactory.getLogger(EndpointSelector.class);

    private final List<String> addresses;
    private final List<String> masks;

    EndpointSelector(List<String> addresses, List<String> masks)
    {
        this.addresses = List.copyOf(Objects.requireNonNull(addresses, "addresses"));
        this.masks = List.copyOf(Objects.requireNonNull(masks, "masks"));
        if (this.addresses.isEmpty()) {
            throw new IllegalArgumentException("at least one address required");
        }
        if (!this.masks.isEmpty() && this.masks.size() != this.addresses.size()) {
            throw new IllegalArgumentException("network mask count must match address count");
        }
    }

    /**
     * @return index into the address list
     */
    int select(String destination)
    {
        if (addresses.size() == 1) {
            return 0;
        }

        OptionalInt parsed = Ipv4.parse(destination);
        if (parsed.isEmpty()) {
            return 0;
        }
        int dest = parsed.getAsInt();

        int match = masks.isEmpty() ? matchHeuristic(dest) : matchSubnet(dest);
        if (match >= 0) {
            return match;
        }

        for (int i = 0; i < addresses.size(); i++) {
            if (!Ipv4.isWildcard(addresses.get(i))) {
                return i;
            }
        }
        return 0;
    }

    private int matchSubnet(int dest)
    {
        for (int i = 0; i < addresses.size(); i++) {
            String address = addresses.get(i);
            if (Ipv4.isWildcard(address)) {
                continue;
            }
            OptionalInt local = Ipv4.parse(address);
            if (local.isEmpty()) {
                continue;
            }

            int mask;
            try {
                mask = Ipv4.parseMask(masks.get(i));
            }
            catch (IllegalArgumentException e) {
                log.warn("Invalid network mask '{}' for {}; skipping: {}", masks.get(i), address, e.getMessage());
                continue;
            }

            if ((local.getAsInt() & mask) == (dest & mask)) {
                return i;
            }
        }
        return -1;
    }

    private int matchHeuristic(int dest)
    {
        for (int i = 0; i < addresses.size(); i++) {
            String address = addresses.get(i);
            if (Ipv4.isWildcard(address)) {
                continue;
            }
            OptionalInt parsed = Ipv4.parse(address);
            if (parsed.isEmpty()) {
                continue;
            }
            int local = parsed.getAsInt();

            if ((local >>> 8) == (dest >>> 8)) {
                return i;
            }
            if (Ipv4.octet(local, 0) == 192 && Ipv4.octet(local, 1) == 168
                    && Ipv4.octet(dest, 0) == 192 && Ipv4.octet(dest, 1) == 168) {
                return i;
            }
            if (Ipv4.octet(local, 0) == 10 && Ipv4.octet(dest, 0) == 10) {
                return i;
            }
        }
        return -1;
    }
}
