package com.questrail.lanlight.config;

import com.questrail.lanlight.internal.exec.RetryPolicy;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Configuration of a {@code LanLightController}.
 *
 * <p>
 * Validated on construction; an invalid combination (for example a network mask
 * list whose size differs from the listening address list) fails immediately.
 * </p>
 *
 * @param broadcastAddress    multicast group (or broadcast address) scan requests are sent to
 * @param broadcastPort       port of the multicast group; unicast scans use it too
 * @param listeningAddresses  local addresses to bind, one endpoint each
 * @param listeningPort       local port shared by every endpoint
 * @param commandPort         port commands and status requests are sent to
 * @param discoveryEnabled    broadcast scans periodically
 * @param discoveryInterval   delay between discovery runs
 * @param evictEnabled        evict stale devices after each scan response
 * @param evictInterval       age after which a device is stale
 * @param updateEnabled       poll every device's status periodically
 * @param updateInterval      delay between polls
 * @param networkMasks        one mask per listening address ({@code /24}, {@code 24} or
 *                            {@code 255.255.255.0}), or empty to use the address heuristic
 * @param retryPolicy         command retry timing
 */
public record LanLightConfig(
        String broadcastAddress,
        int broadcastPort,
        List<String> listeningAddresses,
        int listeningPort,
        int commandPort,
        boolean discoveryEnabled,
        Duration discoveryInterval,
        boolean evictEnabled,
        Duration evictInterval,
        boolean updateEnabled,
        Duration updateInterval,
        List<String> networkMasks,
        RetryPolicy retryPolicy
) {
    public static final String DEFAULT_BROADCAST_ADDRESS = "239.255.255.250";
    public static final int DEFAULT_BROADCAST_PORT = 4001;
    public static final String WILDCARD_ADDRESS = "0.0.0.0";
    public static final int DEFAULT_LISTENING_PORT = 4002;
    public static final int DEFAULT_COMMAND_PORT = 4003;

    public LanLightConfig {
        Objects.requireNonNull(broadcastAddress, "broadcastAddress");
        Objects.requireNonNull(listeningAddresses, "listeningAddresses");
        Objects.requireNonNull(discoveryInterval, "discoveryInterval");
        Objects.requireNonNull(evictInterval, "evictInterval");
        Objects.requireNonNull(updateInterval, "updateInterval");
        Objects.requireNonNull(networkMasks, "networkMasks");
        Objects.requireNonNull(retryPolicy, "retryPolicy");

        requirePort(broadcastPort, "broadcastPort");
        requirePort(listeningPort, "listeningPort");
        requirePort(commandPort, "commandPort");
        requirePositive(discoveryInterval, "discoveryInterval");
        requirePositive(evictInterval, "evictInterval");
        requirePositive(updateInterval, "updateInterval");

        if (listeningAddresses.isEmpty()) {
            throw new IllegalArgumentException("at least one listening address is required");
        }
        if (!networkMasks.isEmpty() && networkMasks.size() != listeningAddresses.size()) {
            throw new IllegalArgumentException(
                    "networkMasks has " + networkMasks.size() + " entries but there are "
                            + listeningAddresses.size() + " listening addresses");
        }

        listeningAddresses = List.copyOf(listeningAddresses);
        networkMasks = List.copyOf(networkMasks);
    }

    public static LanLightConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void requirePort(int port, String name) {
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException(name + " out of range: " + port);
        }
    }

    private static void requirePositive(Duration d, String name) {
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    public static final class Builder {
        private String broadcastAddress = DEFAULT_BROADCAST_ADDRESS;
        private int broadcastPort = DEFAULT_BROADCAST_PORT;
        private List<String> listeningAddresses = List.of(WILDCARD_ADDRESS);
        private int listeningPort = DEFAULT_LISTENING_PORT;
        private int commandPort = DEFAULT_COMMAND_PORT;
        private boolean discoveryEnabled = false;
        private Duration discoveryInterval = Duration.ofSeconds(10);
        private boolean evictEnabled = false;
        private Duration evictInterval = Duration.ofSeconds(30);
        private boolean updateEnabled = true;
        private Duration updateInterval = Duration.ofSeconds(5);
        private List<String> networkMasks = List.of();
        private RetryPolicy retryPolicy = RetryPolicy.defaults();

        public Builder withBroadcastAddress(String address) {
            this.broadcastAddress = address;
            return this;
        }

        public Builder withBroadcastPort(int port) {
            this.broadcastPort = port;
            return this;
        }

        public Builder withListeningAddresses(List<String> addresses) {
            this.listeningAddresses = addresses;
            return this;
        }

        public Builder withListeningAddresses(String... addresses) {
            return withListeningAddresses(List.of(addresses));
        }

        public Builder withListeningPort(int port) {
            this.listeningPort = port;
            return this;
        }

        public Builder withCommandPort(int port) {
            this.commandPort = port;
            return this;
        }

        public Builder withDiscoveryEnabled(boolean enabled) {
            this.discoveryEnabled = enabled;
            return this;
        }

        public Builder withDiscoveryInterval(Duration interval) {
            this.discoveryInterval = interval;
            return this;
        }

        public Builder withEvictEnabled(boolean enabled) {
            this.evictEnabled = enabled;
            return this;
        }

        public Builder withEvictInterval(Duration interval) {
            this.evictInterval = interval;
            return this;
        }

        public Builder withUpdateEnabled(boolean enabled) {
            this.updateEnabled = enabled;
            return this;
        }

        public Builder withUpdateInterval(Duration interval) {
            this.updateInterval = interval;
            return this;
        }

        public Builder withNetworkMasks(List<String> masks) {
            this.networkMasks = masks;
            return this;
        }

        public Builder withNetworkMasks(String... masks) {
            return withNetworkMasks(List.of(masks));
        }

        public Builder withRetryPolicy(RetryPolicy policy) {
            this.retryPolicy = policy;
            return this;
        }

        public LanLightConfig build() {
            return new LanLightConfig(
                    broadcastAddress,
                    broadcastPort,
                    listeningAddresses,
                    listeningPort,
                    commandPort,
                    discoveryEnabled,
                    discoveryInterval,
                    evictEnabled,
                    evictInterval,
                    updateEnabled,
                    updateInterval,
                    networkMasks,
                    retryPolicy);
        }
    }
}
