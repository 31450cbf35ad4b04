package com.questrail.lanlight.capability;

import com.questrail.lanlight.api.LightCapabilities;
import com.questrail.lanlight.api.LightFeatures;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * StaticCapabilityTable
 * =============================================================================
 * Immutable {@link CapabilityTable} initialized once.
 *
 * <p>{@link #DEFAULT} carries the known light models. Segmented strip models
 * additionally advertise segment control (15 segments) and the built-in scene
 * set. Segment selector codes are 16-bit little-endian masks with bit
 * {@code index - 1} set; scene codes are 16-bit little-endian scene numbers.</p>
 */
public final class StaticCapabilityTable implements CapabilityTable
{
    static final int STRIP_SEGMENTS = 15;

    private static final LightFeatures FULL_COLOR = LightFeatures.of(
            LightFeatures.COLOR_RGB,
            LightFeatures.COLOR_KELVIN_TEMPERATURE,
            LightFeatures.BRIGHTNESS);

    private static final List<String> FULL_COLOR_MODELS = List.of(
            "H6046", "H6047", "H6051", "H6052", "H6056", "H6059", "H6061", "H6062",
            "H6065", "H6066", "H6067", "H606A", "H6072", "H6073", "H6076", "H6078",
            "H6087", "H6088", "H608A", "H608B", "H610A", "H610B", "H6117", "H6159",
            "H615A", "H615E", "H6163", "H6168", "H6172", "H6173", "H618A", "H618C",
            "H618E", "H618F", "H619A", "H619B", "H619C", "H619D", "H619E", "H619Z",
            "H61A0", "H61A1", "H61A2", "H61A3", "H61A5", "H61A8", "H61B2", "H61B5",
            "H61BE", "H61C3", "H61C5", "H61D3", "H61E1", "H7020", "H7021", "H7028",
            "H7041", "H7042", "H7050", "H7051", "H7055", "H705A", "H705B", "H705C",
            "H7060", "H7061", "H7062", "H7065", "H7066", "H70C1");

    private static final List<String> BRIGHTNESS_ONLY_MODELS = List.of("H7012", "H7013");

    private static final Set<String> SEGMENTED_MODELS = Set.of(
            "H6163", "H6172", "H6173",
            "H618A", "H618C", "H618E", "H618F",
            "H619A", "H619B", "H619C", "H619D", "H619E", "H619Z",
            "H61A0", "H61A1", "H61A2", "H61A3", "H61A5", "H61A8",
            "H61B2", "H61E1");

    private static final Map<String, Integer> SCENE_NUMBERS = scenes();

    public static final StaticCapabilityTable DEFAULT = buildDefault();

    private final Map<String, LightCapabilities> bySku;

    public StaticCapabilityTable(Map<String, LightCapabilities> bySku)
    {
        Objects.requireNonNull(bySku, "bySku");
        Map<String, LightCapabilities> copy = new HashMap<>();
        bySku.forEach((sku, caps) -> copy.put(normalize(sku), Objects.requireNonNull(caps, "capabilities")));
        this.bySku = Collections.unmodifiableMap(copy);
    }

    @Override
    public Optional<LightCapabilities> lookup(String sku)
    {
        if (sku == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(bySku.get(normalize(sku)));
    }

    public int size()
    {
        return bySku.size();
    }

    /**
     * Selector code for a 1-based segment index.
     */
    public static byte[] segmentCode(int index)
    {
        if (index < 1 || index > 16) {
            throw new IllegalArgumentException("segment index out of range: " + index);
        }
        return littleEndian16(1 << (index - 1));
    }

    private static StaticCapabilityTable buildDefault()
    {
        List<byte[]> segments = new ArrayList<>();
        for (int i = 1; i <= STRIP_SEGMENTS; i++) {
            segments.add(segmentCode(i));
        }

        Map<String, byte[]> scenes = new LinkedHashMap<>();
        SCENE_NUMBERS.forEach((name, number) -> scenes.put(name, littleEndian16(number)));

        LightCapabilities plain = new LightCapabilities(FULL_COLOR, List.of(), Map.of());
        LightCapabilities strip = new LightCapabilities(
                FULL_COLOR.with(LightFeatures.SEGMENT_CONTROL).with(LightFeatures.SCENES),
                segments,
                scenes);
        LightCapabilities dimmer = new LightCapabilities(LightFeatures.BRIGHTNESS, List.of(), Map.of());

        Map<String, LightCapabilities> table = new HashMap<>();
        for (String sku : FULL_COLOR_MODELS) {
            table.put(sku, SEGMENTED_MODELS.contains(sku) ? strip : plain);
        }
        for (String sku : BRIGHTNESS_ONLY_MODELS) {
            table.put(sku, dimmer);
        }
        return new StaticCapabilityTable(table);
    }

    private static Map<String, Integer> scenes()
    {
        Map<String, Integer> m = new LinkedHashMap<>();
        m.put("sunrise", 0);
        m.put("sunset", 1);
        m.put("movie", 4);
        m.put("dating", 5);
        m.put("romantic", 7);
        m.put("blinking", 8);
        m.put("candlelight", 9);
        m.put("snowflake", 15);
        return Collections.unmodifiableMap(m);
    }

    private static byte[] littleEndian16(int value)
    {
        return new byte[] {(byte) (value & 0xFF), (byte) ((value >>> 8) & 0xFF)};
    }

    private static String normalize(String sku)
    {
        return sku.trim().toUpperCase(Locale.ROOT);
    }
}
