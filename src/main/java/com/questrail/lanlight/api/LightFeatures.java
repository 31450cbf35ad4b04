package com.questrail.lanlight.api;

/**
 * LightFeatures
 * =============================================================================
 * Fixed-width feature bitset of a light model.
 *
 * <p>Feature tests are a bitwise AND against one of the named constants:</p>
 * <pre>
 *   capabilities.features().has(LightFeatures.SEGMENT_CONTROL)
 * </pre>
 *
 * <p>Power control is implied for every light and has no bit.</p>
 */
public record LightFeatures(int bits) {

    public static final LightFeatures NONE = new LightFeatures(0);
    public static final LightFeatures COLOR_RGB = new LightFeatures(1);
    public static final LightFeatures COLOR_KELVIN_TEMPERATURE = new LightFeatures(1 << 1);
    public static final LightFeatures BRIGHTNESS = new LightFeatures(1 << 2);
    public static final LightFeatures SEGMENT_CONTROL = new LightFeatures(1 << 3);
    public static final LightFeatures SCENES = new LightFeatures(1 << 4);

    private static final int KNOWN_BITS = (1 << 5) - 1;

    public LightFeatures {
        if ((bits & ~KNOWN_BITS) != 0) {
            throw new IllegalArgumentException("Unknown feature bits: 0x" + Integer.toHexString(bits));
        }
    }

    public static LightFeatures of(LightFeatures... features) {
        int bits = 0;
        for (LightFeatures f : features) {
            bits |= f.bits;
        }
        return new LightFeatures(bits);
    }

    /**
     * @return {@code true} if every bit of {@code feature} is set here
     */
    public boolean has(LightFeatures feature) {
        return (bits & feature.bits) == feature.bits;
    }

    public LightFeatures with(LightFeatures feature) {
        return new LightFeatures(bits | feature.bits);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("LightFeatures[");
        append(sb, COLOR_RGB, "COLOR_RGB");
        append(sb, COLOR_KELVIN_TEMPERATURE, "COLOR_KELVIN_TEMPERATURE");
        append(sb, BRIGHTNESS, "BRIGHTNESS");
        append(sb, SEGMENT_CONTROL, "SEGMENT_CONTROL");
        append(sb, SCENES, "SCENES");
        return sb.append(']').toString();
    }

    private void append(StringBuilder sb, LightFeatures flag, String name) {
        if (has(flag)) {
            if (sb.charAt(sb.length() - 1) != '[') {
                sb.append('|');
            }
            sb.append(name);
        }
    }
}
