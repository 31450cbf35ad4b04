package com.questrail.lanlight;

import com.questrail.lanlight.api.CommandKind;
import com.questrail.lanlight.api.CommandOutcome;
import com.questrail.lanlight.api.DiscoveryHandler;
import com.questrail.lanlight.api.EvictionHandler;
import com.questrail.lanlight.api.LightFeatures;
import com.questrail.lanlight.api.Rgb;
import com.questrail.lanlight.capability.CapabilityTable;
import com.questrail.lanlight.capability.StaticCapabilityTable;
import com.questrail.lanlight.codec.BrightnessRequest;
import com.questrail.lanlight.codec.ColorRequest;
import com.questrail.lanlight.codec.LanMessageDecoder;
import com.questrail.lanlight.codec.LanMessageEncoder;
import com.questrail.lanlight.codec.PtRealFrames;
import com.questrail.lanlight.codec.PtRealRequest;
import com.questrail.lanlight.codec.ScanResponse;
import com.questrail.lanlight.codec.StatusResponse;
import com.questrail.lanlight.codec.TurnRequest;
import com.questrail.lanlight.config.LanLightConfig;
import com.questrail.lanlight.device.DeviceCommands;
import com.questrail.lanlight.device.DeviceMessageSender;
import com.questrail.lanlight.device.DeviceRegistry;
import com.questrail.lanlight.device.LightDevice;
import com.questrail.lanlight.discovery.DiscoveryEngine;
import com.questrail.lanlight.internal.exec.CommandExecutor;
import com.questrail.lanlight.internal.exec.Verifications;
import com.questrail.lanlight.internal.time.MonotonicClock;
import com.questrail.lanlight.internal.time.MonotonicScheduler;
import com.questrail.lanlight.internal.time.ScheduledExecutorScheduler;
import com.questrail.lanlight.internal.time.SystemMonotonicClock;
import com.questrail.lanlight.observability.LanErrorEvent;
import com.questrail.lanlight.observability.LanObservabilitySink;
import com.questrail.lanlight.observability.NullObservabilitySink;
import com.questrail.lanlight.poll.StatusPoller;
import com.questrail.lanlight.transport.DatagramEndpointFactory;
import com.questrail.lanlight.transport.TransportManager;
import com.questrail.lanlight.transport.udp.netty.NettyUdpDatagramEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * LanLightController
 * =============================================================================
 * Composition root and public facade of the LAN light control plane.
 *
 * <h2>Scheduling model</h2>
 * Everything that touches the registry, the discovery and polling timers or a
 * command sequence runs as a task on a single {@link MonotonicScheduler}. Public
 * methods may be called from any thread; they hop onto the scheduler and return
 * a future where a result is expected. Inbound datagrams are decoded on the
 * transport thread and routed on the scheduler.
 *
 * <h2>Commands</h2>
 * Power, brightness and colour are stateful: the device's reported state is set
 * optimistically, then the command is retried until a status response confirms
 * it. Segment colour, scenes and raw frames are sent once. Every returned future
 * completes normally with a {@link CommandOutcome}.
 *
 * <h2>Lifecycle</h2>
 * {@link #start()} binds the transport, then runs discovery and the first poll.
 * {@link #shutdown()} stops both timers, supersedes in-flight commands, closes the
 * transport and clears the registry; its future completes once every endpoint is
 * down.
 */
public final class LanLightController implements DeviceCommands
{
    private static final Logger log = LoggerFactory.getLogger(LanLightController.class);

    static final String LOOP_THREAD_NAME = "lanlight-loop";

    private final LanLightConfig config;
    private final CapabilityTable capabilities;
    private final LanObservabilitySink sink;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final ScheduledExecutorService ownedExecutor;

    private final DeviceRegistry registry;
    private final TransportManager transport;
    private final CommandExecutor executor;
    private final DiscoveryEngine discovery;
    private final StatusPoller poller;

    private final AtomicReference<DiscoveryHandler> discoveredHandler = new AtomicReference<>();
    private final AtomicReference<EvictionHandler> evictedHandler = new AtomicReference<>();
    private volatile boolean evictEnabled;

    private LanLightController(Builder b)
    {
        this.config = Objects.requireNonNull(b.config, "config");
        this.capabilities = Objects.requireNonNull(b.capabilityTable, "capabilityTable");
        this.sink = Objects.requireNonNull(b.observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(b.clock, "clock");
        Objects.requireNonNull(b.endpointFactory, "endpointFactory");

        MonotonicScheduler base = b.scheduler;
        if (base == null) {
            this.ownedExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, LOOP_THREAD_NAME);
                t.setDaemon(true);
                return t;
            });
            base = new ScheduledExecutorScheduler(ownedExecutor, clock);
        }
        else {
            this.ownedExecutor = null;
        }
        MonotonicScheduler loop = base;
        this.scheduler = (deadlineNanos, task) -> loop.scheduleAtNanos(deadlineNanos, guarded("scheduled task", task));

        this.discoveredHandler.set(b.discoveryHandler);
        this.evictedHandler.set(b.evictionHandler);
        this.evictEnabled = config.evictEnabled();

        LanMessageEncoder encoder = new LanMessageEncoder();
        LanInboundDispatcher dispatcher = new LanInboundDispatcher(
                new LanMessageDecoder(),
                task -> submit("inbound datagram", task),
                this::handleScan,
                this::handleStatus);

        this.transport = new TransportManager(
                config.listeningAddresses(),
                config.networkMasks(),
                config.listeningPort(),
                new InetSocketAddress(config.broadcastAddress(), config.broadcastPort()),
                b.endpointFactory,
                dispatcher,
                sink);

        DeviceMessageSender sender = (device, request) ->
                transport.sendTo(encoder.encode(request), device.ip(), config.commandPort());

        this.registry = new DeviceRegistry(clock, this);
        this.executor = new CommandExecutor(sender, scheduler, clock, config.retryPolicy(), sink);
        this.discovery = new DiscoveryEngine(
                transport, registry, encoder, scheduler, clock,
                config.broadcastPort(), config.discoveryEnabled(), config.discoveryInterval());
        this.poller = new StatusPoller(
                registry, sender, scheduler, clock, config.updateEnabled(), config.updateInterval());
    }

    public static Builder builder()
    {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Bind every listening address, then run discovery and the first status poll.
     *
     * @return completes once every endpoint is up; fails if any endpoint cannot bind
     */
    public CompletableFuture<Void> start()
    {
        CompletableFuture<Void> up = transport.started().thenRun(() -> submit("initial discovery", () -> {
            discovery.triggerDiscovery();
            if (poller.isEnabled()) {
                poller.pollAll();
            }
        }));
        transport.start();
        return up;
    }

    /**
     * @return completes once every endpoint has reported down
     */
    public CompletableFuture<Void> shutdown()
    {
        submit("shutdown", () -> {
            poller.stop();
            discovery.stop();
            executor.cancelAll();
            transport.stop();
            registry.clear();
        });

        CompletableFuture<Void> closed = transport.closed();
        if (ownedExecutor != null) {
            closed.whenComplete((v, e) -> ownedExecutor.shutdown());
        }
        return closed;
    }

    // ---------------------------------------------------------------------
    // Discovery queue and runtime settings
    // ---------------------------------------------------------------------

    /**
     * Queue an address to be scanned directly. The address is scanned at once
     * unless periodic discovery is enabled.
     *
     * @return {@code true} if the address was newly queued
     */
    public boolean addDeviceToDiscoveryQueue(String ip)
    {
        boolean added = registry.addToQueue(ip);
        if (added) {
            submit("queue scan", discovery::onAddressQueued);
        }
        return added;
    }

    public boolean removeDeviceFromDiscoveryQueue(String ip)
    {
        return registry.removeFromQueue(ip);
    }

    public Set<String> discoveryQueue()
    {
        return registry.queue();
    }

    /**
     * Forget a device. It is rediscovered by the next scan it answers.
     */
    public CompletableFuture<Optional<LightDevice>> removeDevice(String fingerprint)
    {
        Objects.requireNonNull(fingerprint, "fingerprint");
        return call("remove device", () -> registry.remove(fingerprint), Optional.empty());
    }

    public void setDiscoveryEnabled(boolean enabled)
    {
        submit("discovery toggle", () -> discovery.setEnabled(enabled));
    }

    public boolean isDiscoveryEnabled()
    {
        return discovery.isEnabled();
    }

    public void setDiscoveryInterval(Duration interval)
    {
        discovery.setInterval(interval);
    }

    public Duration discoveryInterval()
    {
        return discovery.interval();
    }

    public void setUpdateEnabled(boolean enabled)
    {
        submit("poll toggle", () -> poller.setEnabled(enabled));
    }

    public boolean isUpdateEnabled()
    {
        return poller.isEnabled();
    }

    public void setUpdateInterval(Duration interval)
    {
        poller.setInterval(interval);
    }

    public Duration updateInterval()
    {
        return poller.interval();
    }

    public void setEvictEnabled(boolean enabled)
    {
        this.evictEnabled = enabled;
    }

    public boolean isEvictEnabled()
    {
        return evictEnabled;
    }

    /**
     * Replace the discovery handler; {@code null} accepts every device.
     *
     * @return the previous handler, or {@code null}
     */
    public DiscoveryHandler setDiscoveredHandler(DiscoveryHandler handler)
    {
        return discoveredHandler.getAndSet(handler);
    }

    /**
     * Replace the eviction handler; {@code null} clears it.
     *
     * @return the previous handler, or {@code null}
     */
    public EvictionHandler setEvictedHandler(EvictionHandler handler)
    {
        return evictedHandler.getAndSet(handler);
    }

    // ---------------------------------------------------------------------
    // Lookups
    // ---------------------------------------------------------------------

    public Optional<LightDevice> deviceByIp(String ip)
    {
        return registry.byIp(ip);
    }

    public Optional<LightDevice> deviceBySku(String sku)
    {
        return registry.bySku(sku);
    }

    public Optional<LightDevice> deviceByFingerprint(String fingerprint)
    {
        return registry.byFingerprint(fingerprint);
    }

    public List<LightDevice> devices()
    {
        return registry.devices();
    }

    // ---------------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------------

    @Override
    public CompletableFuture<CommandOutcome> turn(LightDevice device, boolean on)
    {
        Objects.requireNonNull(device, "device");
        return onLoop("power", () -> {
            registry.applyOptimistic(device, s -> s.withOn(on));
            return executor.execute(device, CommandKind.POWER, new TurnRequest(on), Verifications.power(on));
        });
    }

    @Override
    public CompletableFuture<CommandOutcome> setBrightness(LightDevice device, int percent)
    {
        Objects.requireNonNull(device, "device");
        if (!device.capabilities().has(LightFeatures.BRIGHTNESS)) {
            return rejected(device, "brightness is not supported");
        }
        BrightnessRequest request = new BrightnessRequest(percent);
        return onLoop("brightness", () -> {
            registry.applyOptimistic(device, s -> s.withBrightness(request.percent()));
            return executor.execute(device, CommandKind.BRIGHTNESS, request, Verifications.brightness(request.percent()));
        });
    }

    @Override
    public CompletableFuture<CommandOutcome> setRgbColor(LightDevice device, Rgb color)
    {
        Objects.requireNonNull(device, "device");
        Objects.requireNonNull(color, "color");
        if (!device.capabilities().has(LightFeatures.COLOR_RGB)) {
            return rejected(device, "RGB colour is not supported");
        }
        return color(device, ColorRequest.rgb(color));
    }

    @Override
    public CompletableFuture<CommandOutcome> setTemperature(LightDevice device, int kelvin)
    {
        Objects.requireNonNull(device, "device");
        if (!device.capabilities().has(LightFeatures.COLOR_KELVIN_TEMPERATURE)) {
            return rejected(device, "colour temperature is not supported");
        }
        return color(device, ColorRequest.temperature(kelvin));
    }

    @Override
    public CompletableFuture<CommandOutcome> setSegmentRgbColor(LightDevice device, int segment, Rgb color)
    {
        Objects.requireNonNull(device, "device");
        Objects.requireNonNull(color, "color");
        if (!device.capabilities().has(LightFeatures.SEGMENT_CONTROL)) {
            return rejected(device, "segment control is not supported");
        }
        Optional<byte[]> selector = device.capabilities().segment(segment);
        if (selector.isEmpty()) {
            return rejected(device, "segment " + segment + " out of range 1.." + device.capabilities().segmentCount());
        }
        PtRealRequest request = PtRealRequest.of(PtRealFrames.segmentColor(color, selector.get()));
        return onLoop("segment colour", () -> executor.sendOnce(device, CommandKind.SEGMENT_COLOR, request));
    }

    @Override
    public CompletableFuture<CommandOutcome> setScene(LightDevice device, String scene)
    {
        Objects.requireNonNull(device, "device");
        Objects.requireNonNull(scene, "scene");
        if (!device.capabilities().has(LightFeatures.SCENES)) {
            return rejected(device, "scenes are not supported");
        }
        Optional<byte[]> code = device.capabilities().scene(scene);
        if (code.isEmpty()) {
            return rejected(device, "unknown scene '" + scene + "'");
        }
        PtRealRequest request = PtRealRequest.of(PtRealFrames.scene(code.get()));
        return onLoop("scene", () -> executor.sendOnce(device, CommandKind.SCENE, request));
    }

    @Override
    public CompletableFuture<CommandOutcome> sendRawCommand(LightDevice device, String hex)
    {
        Objects.requireNonNull(device, "device");
        Objects.requireNonNull(hex, "hex");
        byte[] frame;
        try {
            frame = PtRealFrames.fromHex(hex);
        }
        catch (IllegalArgumentException e) {
            return rejected(device, "invalid raw command: " + e.getMessage());
        }
        PtRealRequest request = PtRealRequest.of(frame);
        return onLoop("raw command", () -> executor.sendOnce(device, CommandKind.RAW, request));
    }

    private CompletableFuture<CommandOutcome> color(LightDevice device, ColorRequest request)
    {
        return onLoop("colour", () -> {
            registry.applyOptimistic(device, s -> request.isTemperature()
                    ? s.withColorTemperature(request.kelvin())
                    : s.withColor(request.color()).withColorTemperature(0));
            return executor.execute(device, CommandKind.COLOR, request, Verifications.color(request));
        });
    }

    // ---------------------------------------------------------------------
    // Inbound routing (scheduler thread)
    // ---------------------------------------------------------------------

    private void handleScan(ScanResponse response, String senderIp)
    {
        ScanResponse scan = response;
        if (scan.ip() == null && senderIp != null) {
            log.debug("No ip in scan response from device {}; using sender address {}", scan.device(), senderIp);
            scan = scan.withIp(senderIp);
        }
        if (scan.device() == null || scan.ip() == null) {
            log.debug("Dropping scan response without fingerprint or address: {}", response);
            return;
        }

        DiscoveryHandler handler = discoveredHandler.get();
        registry.upsertFromScan(scan.device(), scan.ip(), scan.sku(), capabilities,
                handler != null ? handler : DiscoveryHandler.ACCEPT_ALL);

        if (evictEnabled) {
            EvictionHandler evicted = evictedHandler.get();
            registry.evict(config.evictInterval(), evicted != null ? evicted : EvictionHandler.NONE);
        }
    }

    private void handleStatus(StatusResponse response, String senderIp)
    {
        Optional<LightDevice> device = registry.applyStatus(senderIp, response.toState());
        if (device.isPresent()) {
            executor.onStatusUpdated(device.get());
        }
        else {
            log.debug("Status from unknown address {} ignored", senderIp);
        }
    }

    // ---------------------------------------------------------------------
    // Scheduler plumbing
    // ---------------------------------------------------------------------

    private void submit(String what, Runnable task)
    {
        try {
            scheduler.scheduleNow(clock, task);
        }
        catch (RejectedExecutionException e) {
            log.debug("Controller is shut down; dropping {}", what);
        }
    }

    private Runnable guarded(String what, Runnable task)
    {
        return () -> {
            try {
                task.run();
            }
            catch (RuntimeException e) {
                log.error("{} failed", what, e);
                sink.onError(new LanErrorEvent(what + " failed", e));
            }
        };
    }

    private <T> CompletableFuture<T> call(String what, Supplier<T> action, T fallback)
    {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            scheduler.scheduleNow(clock, () -> {
                try {
                    result.complete(action.get());
                }
                catch (RuntimeException e) {
                    result.complete(fallback);
                    throw e;
                }
            });
        }
        catch (RejectedExecutionException e) {
            log.debug("Controller is shut down; dropping {}", what);
            result.complete(fallback);
        }
        return result;
    }

    private CompletableFuture<CommandOutcome> onLoop(String what, Supplier<CompletableFuture<CommandOutcome>> command)
    {
        CompletableFuture<CommandOutcome> outcome = new CompletableFuture<>();
        call(what, command, CompletableFuture.completedFuture(CommandOutcome.REJECTED))
                .thenAccept(f -> f.thenAccept(outcome::complete));
        return outcome;
    }

    private static CompletableFuture<CommandOutcome> rejected(LightDevice device, String reason)
    {
        log.warn("Command for {} ({}) rejected: {}", device.fingerprint(), device.sku(), reason);
        return CompletableFuture.completedFuture(CommandOutcome.REJECTED);
    }

    /**
     * Builder
     * -------------------------------------------------------------------------
     * Everything but the configuration has a production default: the built-in
     * capability table, a no-op observability sink, the system monotonic clock,
     * a dedicated single-threaded scheduler and Netty UDP endpoints.
     */
    public static final class Builder
    {
        private LanLightConfig config = LanLightConfig.defaults();
        private DiscoveryHandler discoveryHandler;
        private EvictionHandler evictionHandler;
        private CapabilityTable capabilityTable = StaticCapabilityTable.DEFAULT;
        private LanObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private DatagramEndpointFactory endpointFactory = NettyUdpDatagramEndpoint::new;

        public Builder withConfig(LanLightConfig config)
        {
            this.config = config;
            return this;
        }

        public Builder withDiscoveryHandler(DiscoveryHandler handler)
        {
            this.discoveryHandler = handler;
            return this;
        }

        public Builder withEvictionHandler(EvictionHandler handler)
        {
            this.evictionHandler = handler;
            return this;
        }

        public Builder withCapabilityTable(CapabilityTable table)
        {
            this.capabilityTable = table;
            return this;
        }

        public Builder withObservabilitySink(LanObservabilitySink sink)
        {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(MonotonicClock clock)
        {
            this.clock = clock;
            return this;
        }

        /**
         * Run on a caller-supplied scheduler instead of a dedicated thread. The
         * scheduler must honour the single-thread contract of {@link MonotonicScheduler}
         * and share the builder's clock.
         */
        public Builder withScheduler(MonotonicScheduler scheduler)
        {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withEndpointFactory(DatagramEndpointFactory factory)
        {
            this.endpointFactory = factory;
            return this;
        }

        public LanLightController build()
        {
            return new LanLightController(this);
        }
    }
}
