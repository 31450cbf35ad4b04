package com.questrail.lanlight.api;

/**
 * An RGB triplet as reported by, or requested from, a light.
 *
 * <p>Channel values are carried as given; {@link #clamped()} produces the
 * wire-legal form.</p>
 */
public record Rgb(int red, int green, int blue) {

    public static final Rgb BLACK = new Rgb(0, 0, 0);

    /**
     * Returns a copy with every channel clamped to {@code [0, 255]}.
     */
    public Rgb clamped() {
        return new Rgb(clamp(red), clamp(green), clamp(blue));
    }

    /**
     * @return {@code true} if every channel differs from {@code other} by at most {@code tolerance}
     */
    public boolean isWithin(Rgb other, int tolerance) {
        return Math.abs(red - other.red) <= tolerance
                && Math.abs(green - other.green) <= tolerance
                && Math.abs(blue - other.blue) <= tolerance;
    }

    private static int clamp(int channel) {
        return Math.max(0, Math.min(channel, 255));
    }
}
