package com.questrail.lanlight;

import com.questrail.lanlight.api.CommandKind;
import com.questrail.lanlight.api.CommandOutcome;
import com.questrail.lanlight.api.DeviceState;
import com.questrail.lanlight.api.LightFeatures;
import com.questrail.lanlight.api.Rgb;
import com.questrail.lanlight.codec.PtRealFrames;
import com.questrail.lanlight.config.LanLightConfig;
import com.questrail.lanlight.device.LightDevice;
import com.questrail.lanlight.observability.CommandFinishedEvent;
import com.questrail.lanlight.observability.LanErrorEvent;
import com.questrail.lanlight.observability.RecordingObservabilitySink;
import com.questrail.lanlight.time.DeterministicScheduler;
import com.questrail.lanlight.time.ManualMonotonicClock;
import com.questrail.lanlight.transport.FakeDatagramEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.BindException;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LanLightControllerTest
 * -----------------------------------------------------------------------------
 * End-to-end behaviour of the controller over fake UDP endpoints and a
 * deterministic scheduler: JSON in, JSON out.
 */
class LanLightControllerTest {

    private static final String STRIP_SCAN =
            "{\"msg\":{\"cmd\":\"scan\",\"data\":{\"device\":\"AA:BB:CC\",\"sku\":\"H619A\",\"ip\":\"10.0.0.5\"}}}";

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private RecordingObservabilitySink sink;
    private final List<FakeDatagramEndpoint> endpoints = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        sink = new RecordingObservabilitySink();
    }

    private LanLightController.Builder builder(LanLightConfig config) {
        return LanLightController.builder()
                .withConfig(config)
                .withClock(clock)
                .withScheduler(scheduler)
                .withObservabilitySink(sink)
                .withEndpointFactory((bind, group) -> {
                    FakeDatagramEndpoint e = new FakeDatagramEndpoint(bind, group);
                    endpoints.add(e);
                    return e;
                });
    }

    private LanLightController started(LanLightConfig config) {
        LanLightController controller = builder(config).build();
        assertTrue(controller.start().isDone());
        scheduler.runDueTasks();
        return controller;
    }

    private FakeDatagramEndpoint endpoint() {
        return endpoints.get(0);
    }

    private void inject(String fromIp, String json) {
        endpoint().injectJson(fromIp, json);
        scheduler.runDueTasks();
    }

    private static String status(int onOff, int brightness, int r, int g, int b, int kelvin) {
        return "{\"msg\":{\"cmd\":\"devStatus\",\"data\":{\"onOff\":" + onOff
                + ",\"brightness\":" + brightness
                + ",\"color\":{\"r\":" + r + ",\"g\":" + g + ",\"b\":" + b + "}"
                + ",\"colorTemInKelvin\":" + kelvin + "}}}";
    }

    private LightDevice strip(LanLightController controller) {
        inject("10.0.0.5", STRIP_SCAN);
        return controller.deviceByFingerprint("AA:BB:CC").orElseThrow();
    }

    // ---------------------------------------------------------------------
    // Lifecycle and discovery
    // ---------------------------------------------------------------------

    @Test
    void startWithDiscoveryEnabledMulticastsScan() {
        started(LanLightConfig.builder().withDiscoveryEnabled(true).build());

        List<FakeDatagramEndpoint.Sent> scans = endpoint().sentContaining("\"cmd\":\"scan\"");
        assertEquals(1, scans.size());
        assertEquals(new InetSocketAddress("239.255.255.250", 4001), scans.get(0).remote());
        assertEquals(new InetSocketAddress("0.0.0.0", 4002), endpoint().localAddress());
    }

    @Test
    void bindFailureFailsStart() {
        LanLightController controller = builder(LanLightConfig.defaults()).build();
        endpoint().failBindWith(new BindException("Address already in use"));

        CompletableFuture<Void> start = controller.start();

        assertTrue(start.isCompletedExceptionally());
    }

    @Test
    void scanResponseRegistersDevice() {
        List<Boolean> isNewFlags = new ArrayList<>();
        LanLightController controller = builder(LanLightConfig.defaults())
                .withDiscoveryHandler((device, isNew) -> isNewFlags.add(isNew))
                .build();
        controller.start();

        // WHEN
        inject("10.0.0.5", STRIP_SCAN);

        // THEN
        LightDevice device = controller.deviceByIp("10.0.0.5").orElseThrow();
        assertEquals("AA:BB:CC", device.fingerprint());
        assertEquals("H619A", device.sku());
        assertTrue(device.capabilities().has(LightFeatures.SEGMENT_CONTROL));
        assertTrue(device.capabilities().has(LightFeatures.SCENES));
        assertSame(device, controller.deviceBySku("H619A").orElseThrow());
        assertEquals(List.of(true), isNewFlags);

        inject("10.0.0.5", STRIP_SCAN);
        assertEquals(List.of(true, false), isNewFlags);
        assertEquals(1, controller.devices().size());
    }

    @Test
    void scanWithoutIpUsesSenderAddress() {
        LanLightController controller = started(LanLightConfig.defaults());

        inject("10.0.0.8", "{\"msg\":{\"cmd\":\"scan\",\"data\":{\"device\":\"DD\",\"sku\":\"H6046\"}}}");

        assertEquals("10.0.0.8", controller.deviceByFingerprint("DD").orElseThrow().ip());
    }

    @Test
    void scanWithoutFingerprintIsDropped() {
        LanLightController controller = started(LanLightConfig.defaults());

        inject("10.0.0.8", "{\"msg\":{\"cmd\":\"scan\",\"data\":{\"sku\":\"H6046\",\"ip\":\"10.0.0.8\"}}}");

        assertTrue(controller.devices().isEmpty());
    }

    @Test
    void undecodableDatagramIsIgnored() {
        LanLightController controller = started(LanLightConfig.defaults());
        int before = scheduler.pendingCount();

        endpoint().injectJson("10.0.0.5", "not json");
        endpoint().injectJson("10.0.0.5", "{\"msg\":{\"cmd\":\"mystery\",\"data\":{}}}");

        assertEquals(before, scheduler.pendingCount());
        assertTrue(controller.devices().isEmpty());
    }

    @Test
    void statusResponseUpdatesStateAndNotifies() {
        LanLightController controller = started(LanLightConfig.defaults());
        LightDevice device = strip(controller);
        List<DeviceState> seen = new ArrayList<>();
        device.setUpdateHandler(d -> seen.add(d.state()));

        // WHEN
        inject("10.0.0.5", status(1, 50, 10, 20, 30, 0));

        // THEN
        DeviceState expected = new DeviceState(true, 50, new Rgb(10, 20, 30), 0);
        assertEquals(expected, device.state());
        assertEquals(List.of(expected), seen);
    }

    @Test
    void periodicPollRequestsStatusFromEveryDevice() {
        LanLightController controller = started(LanLightConfig.defaults());
        strip(controller);
        endpoint().clear();

        scheduler.advanceMillis(5_000);

        List<FakeDatagramEndpoint.Sent> polls = endpoint().sentContaining("\"cmd\":\"devStatus\"");
        assertEquals(1, polls.size());
        assertEquals("10.0.0.5", polls.get(0).host());
        assertEquals(4003, polls.get(0).port());
    }

    @Test
    void staleDevicesAreEvictedOnScan() {
        List<LightDevice> evicted = new ArrayList<>();
        LanLightController controller = builder(LanLightConfig.builder().withEvictEnabled(true).build())
                .withEvictionHandler(evicted::add)
                .build();
        controller.start();
        scheduler.runDueTasks();

        inject("10.0.0.5", STRIP_SCAN);
        inject("10.0.0.6", "{\"msg\":{\"cmd\":\"scan\",\"data\":{\"device\":\"BB\",\"sku\":\"H6046\",\"ip\":\"10.0.0.6\"}}}");

        clock.advanceMillis(30_000);

        // WHEN
        inject("10.0.0.5", STRIP_SCAN);

        // THEN
        assertEquals(1, evicted.size());
        assertEquals("BB", evicted.get(0).fingerprint());
        assertTrue(controller.deviceByFingerprint("BB").isEmpty());
        assertTrue(controller.deviceByFingerprint("AA:BB:CC").isPresent());
    }

    @Test
    void queuedAddressIsScannedAndBecomesManual() {
        LanLightController controller = started(LanLightConfig.defaults());

        // WHEN
        assertTrue(controller.addDeviceToDiscoveryQueue("10.0.0.5"));
        scheduler.runDueTasks();

        // THEN
        List<FakeDatagramEndpoint.Sent> scans = endpoint().sentContaining("\"cmd\":\"scan\"");
        assertEquals(1, scans.size());
        assertEquals("10.0.0.5", scans.get(0).host());
        assertEquals(4001, scans.get(0).port());
        assertEquals(Set.of("10.0.0.5"), controller.discoveryQueue());

        LightDevice device = strip(controller);
        assertTrue(device.isManual());
        assertTrue(controller.discoveryQueue().isEmpty());
        assertFalse(controller.addDeviceToDiscoveryQueue("10.0.0.5"));
    }

    @Test
    void removedDeviceIsForgotten() {
        LanLightController controller = started(LanLightConfig.defaults());
        LightDevice device = strip(controller);

        CompletableFuture<Optional<LightDevice>> removed = controller.removeDevice("AA:BB:CC");
        scheduler.runDueTasks();

        assertSame(device, removed.join().orElseThrow());
        assertTrue(controller.devices().isEmpty());
    }

    @Test
    void failingDiscoveryHandlerIsReportedAndLoopSurvives() {
        LanLightController controller = builder(LanLightConfig.defaults())
                .withDiscoveryHandler((device, isNew) -> {
                    throw new IllegalStateException("boom");
                })
                .build();
        controller.start();

        inject("10.0.0.5", STRIP_SCAN);

        assertTrue(sink.hasEventOfType(LanErrorEvent.class));
        assertTrue(controller.devices().isEmpty());

        controller.setDiscoveredHandler(null);
        inject("10.0.0.5", STRIP_SCAN);
        assertEquals(1, controller.devices().size());
    }

    // ---------------------------------------------------------------------
    // Commands
    // ---------------------------------------------------------------------

    @Test
    void brightnessIsConfirmedByStatusAfterFirstSend() {
        LanLightController controller = started(LanLightConfig.defaults());
        LightDevice device = strip(controller);
        endpoint().clear();

        // WHEN
        CompletableFuture<CommandOutcome> outcome = device.setBrightness(42);
        scheduler.runDueTasks();

        // THEN: sent to the command port and applied optimistically
        List<FakeDatagramEndpoint.Sent> sent = endpoint().sentContaining("\"cmd\":\"brightness\"");
        assertEquals(1, sent.size());
        assertTrue(sent.get(0).text().contains("\"value\":42"));
        assertEquals("10.0.0.5", sent.get(0).host());
        assertEquals(4003, sent.get(0).port());
        assertEquals(42, device.state().brightness());

        scheduler.advanceMillis(100);
        assertEquals(1, endpoint().sentContaining("\"cmd\":\"devStatus\"").size());

        inject("10.0.0.5", status(1, 42, 0, 0, 0, 0));

        assertEquals(CommandOutcome.VERIFIED, outcome.getNow(null));
        CommandFinishedEvent event = sink.getCommandsFinished().get(0);
        assertEquals(CommandKind.BRIGHTNESS, event.kind());
        assertEquals(1, event.sends());
        assertEquals(1, endpoint().sentContaining("\"cmd\":\"brightness\"").size());
    }

    @Test
    void newerColorSupersedesOlder() {
        LanLightController controller = started(LanLightConfig.defaults());
        LightDevice device = strip(controller);

        CompletableFuture<CommandOutcome> red = device.setRgbColor(new Rgb(255, 0, 0));
        scheduler.runDueTasks();
        CompletableFuture<CommandOutcome> warm = device.setTemperature(2700);
        scheduler.runDueTasks();

        assertEquals(CommandOutcome.SUPERSEDED, red.getNow(null));
        assertFalse(warm.isDone());
        assertEquals(2700, device.state().colorTemperatureKelvin());

        scheduler.advanceMillis(100);
        inject("10.0.0.5", status(1, 100, 0, 0, 0, 2650));
        assertEquals(CommandOutcome.VERIFIED, warm.getNow(null));
    }

    @Test
    void unconfirmedPowerCommandIsExhausted() {
        LanLightController controller = started(LanLightConfig.defaults());
        LightDevice device = strip(controller);
        endpoint().clear();

        CompletableFuture<CommandOutcome> outcome = device.turnOn();
        scheduler.runDueTasks();
        scheduler.advanceMillis(30_000);

        assertEquals(CommandOutcome.EXHAUSTED, outcome.getNow(null));
        assertEquals(11, endpoint().sentContaining("\"cmd\":\"turn\"").size());
    }

    @Test
    void sceneIsSentOnceAsPtReal() {
        LanLightController controller = started(LanLightConfig.defaults());
        LightDevice device = strip(controller);
        endpoint().clear();

        CompletableFuture<CommandOutcome> outcome = device.setScene("Sunset");
        scheduler.runDueTasks();
        scheduler.advanceMillis(30_000);

        assertEquals(CommandOutcome.SENT, outcome.getNow(null));
        List<FakeDatagramEndpoint.Sent> sent = endpoint().sentContaining("\"cmd\":\"ptReal\"");
        assertEquals(1, sent.size());
        String frame = Base64.getEncoder().encodeToString(PtRealFrames.scene(new byte[] {0x01, 0x00}));
        assertTrue(sent.get(0).text().contains(frame));
    }

    @Test
    void segmentColorIsSentOnce() {
        LanLightController controller = started(LanLightConfig.defaults());
        LightDevice device = strip(controller);
        endpoint().clear();

        CompletableFuture<CommandOutcome> outcome = device.setSegmentRgbColor(3, new Rgb(1, 2, 3));
        scheduler.runDueTasks();

        assertEquals(CommandOutcome.SENT, outcome.getNow(null));
        String frame = Base64.getEncoder().encodeToString(
                PtRealFrames.segmentColor(new Rgb(1, 2, 3), new byte[] {0x04, 0x00}));
        assertTrue(endpoint().sent().get(0).text().contains(frame));
    }

    @Test
    void unsupportedOrInvalidCommandsAreRejected() {
        LanLightController controller = started(LanLightConfig.defaults());
        LightDevice strip = strip(controller);
        inject("10.0.0.9", "{\"msg\":{\"cmd\":\"scan\",\"data\":{\"device\":\"PLUG\",\"sku\":\"H5080\",\"ip\":\"10.0.0.9\"}}}");
        LightDevice plug = controller.deviceByFingerprint("PLUG").orElseThrow();
        endpoint().clear();

        assertEquals(CommandOutcome.REJECTED, plug.setBrightness(50).getNow(null));
        assertEquals(CommandOutcome.REJECTED, plug.setRgbColor(new Rgb(1, 1, 1)).getNow(null));
        assertEquals(CommandOutcome.REJECTED, plug.setTemperature(3000).getNow(null));
        assertEquals(CommandOutcome.REJECTED, plug.setScene("sunrise").getNow(null));
        assertEquals(CommandOutcome.REJECTED, strip.setSegmentRgbColor(16, new Rgb(1, 1, 1)).getNow(null));
        assertEquals(CommandOutcome.REJECTED, strip.setScene("disco").getNow(null));
        assertEquals(CommandOutcome.REJECTED, strip.sendRawCommand("xyz").getNow(null));

        scheduler.advanceMillis(30_000);
        assertTrue(endpoint().sentContaining("\"cmd\":\"ptReal\"").isEmpty());
        assertTrue(endpoint().sentContaining("\"cmd\":\"brightness\"").isEmpty());
    }

    @Test
    void unknownModelCanStillBePowered() {
        LanLightController controller = started(LanLightConfig.defaults());
        inject("10.0.0.9", "{\"msg\":{\"cmd\":\"scan\",\"data\":{\"device\":\"PLUG\",\"sku\":\"H5080\",\"ip\":\"10.0.0.9\"}}}");
        LightDevice plug = controller.deviceByFingerprint("PLUG").orElseThrow();

        CompletableFuture<CommandOutcome> outcome = plug.turnOff();
        scheduler.runDueTasks();
        scheduler.advanceMillis(100);
        inject("10.0.0.9", status(0, 0, 0, 0, 0, 0));

        assertEquals(CommandOutcome.VERIFIED, outcome.getNow(null));
    }

    @Test
    void rawCommandIsForwardedVerbatim() {
        LanLightController controller = started(LanLightConfig.defaults());
        LightDevice device = strip(controller);
        endpoint().clear();

        CompletableFuture<CommandOutcome> outcome = device.sendRawCommand("3305 0401");
        scheduler.runDueTasks();

        assertEquals(CommandOutcome.SENT, outcome.getNow(null));
        String frame = Base64.getEncoder().encodeToString(new byte[] {0x33, 0x05, 0x04, 0x01});
        assertTrue(endpoint().sent().get(0).text().contains(frame));
    }

    // ---------------------------------------------------------------------
    // Shutdown
    // ---------------------------------------------------------------------

    @Test
    void shutdownSupersedesCommandsAndClosesTransport() {
        LanLightController controller = started(LanLightConfig.builder().withDiscoveryEnabled(true).build());
        LightDevice device = strip(controller);
        CompletableFuture<CommandOutcome> outcome = device.turnOn();
        scheduler.runDueTasks();

        // WHEN
        CompletableFuture<Void> closed = controller.shutdown();
        scheduler.runDueTasks();

        // THEN
        assertTrue(closed.isDone());
        assertEquals(CommandOutcome.SUPERSEDED, outcome.getNow(null));
        assertTrue(controller.devices().isEmpty());
        assertEquals(0, scheduler.pendingCount());
    }
}
