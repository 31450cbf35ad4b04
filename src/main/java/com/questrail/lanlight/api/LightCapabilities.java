package com.questrail.lanlight.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable capability description of a light model.
 *
 * <p>Segment selector codes and scene codes are opaque byte sequences placed
 * into ptReal frames. Accessors hand out copies.</p>
 */
public final class LightCapabilities {

    /**
     * Capabilities assumed for a model missing from the capability table.
     */
    public static final LightCapabilities ON_OFF = new LightCapabilities(LightFeatures.NONE, List.of(), Map.of());

    private final LightFeatures features;
    private final List<byte[]> segments;
    private final Map<String, byte[]> scenes;

    public LightCapabilities(LightFeatures features, List<byte[]> segments, Map<String, byte[]> scenes) {
        this.features = Objects.requireNonNull(features, "features");

        List<byte[]> segmentCopy = new ArrayList<>();
        for (byte[] s : Objects.requireNonNull(segments, "segments")) {
            segmentCopy.add(s.clone());
        }
        this.segments = Collections.unmodifiableList(segmentCopy);

        Map<String, byte[]> sceneCopy = new LinkedHashMap<>();
        Objects.requireNonNull(scenes, "scenes").forEach((name, code) ->
                sceneCopy.put(name.toLowerCase(Locale.ROOT), code.clone()));
        this.scenes = Collections.unmodifiableMap(sceneCopy);
    }

    public LightFeatures features() {
        return features;
    }

    public boolean has(LightFeatures feature) {
        return features.has(feature);
    }

    public int segmentCount() {
        return segments.size();
    }

    /**
     * Selector code for a 1-based segment index.
     */
    public Optional<byte[]> segment(int index) {
        if (index < 1 || index > segments.size()) {
            return Optional.empty();
        }
        return Optional.of(segments.get(index - 1).clone());
    }

    /**
     * Scene code by case-insensitive name.
     */
    public Optional<byte[]> scene(String name) {
        byte[] code = scenes.get(name.toLowerCase(Locale.ROOT));
        return code == null ? Optional.empty() : Optional.of(code.clone());
    }

    public List<String> sceneNames() {
        return List.copyOf(scenes.keySet());
    }

    @Override
    public String toString() {
        return "LightCapabilities[features=" + features
                + ", segments=" + segments.size()
                + ", scenes=" + scenes.keySet() + "]";
    }
}
