package com.questrail.lanlight.transport;

import java.util.OptionalInt;

/**
 * Dotted-quad IPv4 parsing and mask handling.
 *
 * <p>Addresses are represented as the 32-bit big-endian value in an {@code int}.
 * Parsing is strict: host names, IPv6 literals and out-of-range octets are
 * rejected, never resolved.</p>
 */
final class Ipv4
{
    static final String WILDCARD = "0.0.0.0";

    private Ipv4()
    {
    }

    static OptionalInt parse(String address)
    {
        if (address == null) {
            return OptionalInt.empty();
        }
        String[] parts = address.trim().split("\\.", -1);
        if (parts.length != 4) {
            return OptionalInt.empty();
        }
        int value = 0;
        for (String p : parts) {
            if (p.isEmpty() || p.length() > 3) {
                return OptionalInt.empty();
            }
            int octet = 0;
            for (int i = 0; i < p.length(); i++) {
                char c = p.charAt(i);
                if (c < '0' || c > '9') {
                    return OptionalInt.empty();
                }
                octet = octet * 10 + (c - '0');
            }
            if (octet > 255) {
                return OptionalInt.empty();
            }
            value = (value << 8) | octet;
        }
        return OptionalInt.of(value);
    }

    static boolean isWildcard(String address)
    {
        OptionalInt v = parse(address);
        return v.isPresent() && v.getAsInt() == 0;
    }

    /**
     * Parse a network mask given as {@code /n}, {@code n} or a contiguous dotted mask.
     *
     * @return the mask bits
     * @throws IllegalArgumentException if the mask is malformed or not contiguous
     */
    static int parseMask(String mask)
    {
        if (mask == null) {
            throw new IllegalArgumentException("mask is null");
        }
        String m = mask.trim();
        if (m.startsWith("/")) {
            m = m.substring(1);
        }

        if (!m.isEmpty() && m.chars().allMatch(Character::isDigit) && m.length() <= 2) {
            int prefix = Integer.parseInt(m);
            if (prefix > 32) {
                throw new IllegalArgumentException("prefix length out of range: " + mask);
            }
            return prefix == 0 ? 0 : -1 << (32 - prefix);
        }

        OptionalInt dotted = parse(m);
        if (dotted.isEmpty()) {
            throw new IllegalArgumentException("not a network mask: " + mask);
        }
        int bits = dotted.getAsInt();
        // Contiguous: the inverted mask plus one is a power of two.
        int inverted = ~bits;
        if ((inverted & (inverted + 1)) != 0) {
            throw new IllegalArgumentException("mask is not contiguous: " + mask);
        }
        return bits;
    }

    static int octet(int address, int index)
    {
        return (address >>> (24 - 8 * index)) & 0xFF;
    }
}
