package com.questrail.lanlight.poll;

import com.questrail.lanlight.api.DiscoveryHandler;
import com.questrail.lanlight.capability.StaticCapabilityTable;
import com.questrail.lanlight.codec.LanRequest;
import com.questrail.lanlight.codec.StatusRequest;
import com.questrail.lanlight.device.DeviceRegistry;
import com.questrail.lanlight.device.UnsupportedDeviceCommands;
import com.questrail.lanlight.time.DeterministicScheduler;
import com.questrail.lanlight.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatusPollerTest {

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private DeviceRegistry registry;
    private final List<String> polled = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        registry = new DeviceRegistry(clock, UnsupportedDeviceCommands.INSTANCE);
        registry.upsertFromScan("AA", "10.0.0.5", "H6046", StaticCapabilityTable.DEFAULT, DiscoveryHandler.ACCEPT_ALL);
        registry.upsertFromScan("BB", "10.0.0.6", "H6046", StaticCapabilityTable.DEFAULT, DiscoveryHandler.ACCEPT_ALL);
    }

    private StatusPoller poller(boolean enabled) {
        return new StatusPoller(registry, (device, request) -> {
            assertSame(StatusRequest.INSTANCE, request);
            polled.add(device.fingerprint());
        }, scheduler, clock, enabled, Duration.ofSeconds(5));
    }

    @Test
    void pollsEveryDeviceEachInterval() {
        StatusPoller poller = poller(true);

        poller.pollAll();
        assertEquals(2, polled.size());
        assertTrue(polled.containsAll(List.of("AA", "BB")));

        scheduler.advanceMillis(5_000);
        assertEquals(4, polled.size());
    }

    @Test
    void disabledPollerPollsOnceWithoutRescheduling() {
        StatusPoller poller = poller(false);

        poller.pollAll();
        scheduler.advanceMillis(60_000);

        assertEquals(2, polled.size());
    }

    @Test
    void enablingPollsImmediately() {
        StatusPoller poller = poller(false);

        poller.setEnabled(true);
        assertEquals(2, polled.size());

        poller.setEnabled(false);
        scheduler.advanceMillis(60_000);
        assertEquals(2, polled.size());
    }

    @Test
    void stopPreventsFurtherPolls() {
        StatusPoller poller = poller(true);
        poller.pollAll();

        poller.stop();
        poller.pollAll();
        scheduler.advanceMillis(60_000);

        assertEquals(2, polled.size());
    }
}
