package com.dcruver.promptloom.color;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

/**
 * Deterministic HSL color generation for tag and folder chips.
 *
 * Hue carries identity (cluster or folder); saturation and lightness are nudged inside narrow
 * bands by a stable hash of the name so chips of the same cluster stay related but distinguishable.
 */
public final class ColorPalette {

    static final double SATURATION_MIN = 0.78;
    static final double SATURATION_MAX = 0.92;
    static final double LIGHTNESS_MIN = 0.46;
    static final double LIGHTNESS_MAX = 0.60;

    static final double GOLDEN_ANGLE = 137.508;
    static final int MAX_HUE_CANDIDATES = 360;

    private static final int FNV_OFFSET_BASIS = 0x811C9DC5;
    private static final int FNV_PRIME = 0x01000193;

    private ColorPalette() {
    }

    /**
     * Color for a tag in cluster {@code clusterIndex} of {@code clusterCount}.
     */
    public static String tagColor(String tag, int clusterIndex, int clusterCount) {
        double hue = clusterCount <= 0 ? 0 : 360.0 * clusterIndex / clusterCount;
        return colorForHue(tag, hue);
    }

    /**
     * Color with a fixed hue, saturation and lightness derived from {@code key}.
     */
    public static String colorForHue(String key, double hue) {
        int hash = stableHash(key);
        return hslToHex(hue, saturationFor(hash), lightnessFor(hash));
    }

    /**
     * Folder color seeded from the folder path. Steps round the wheel by the golden angle until the
     * color is not in {@code usedColors}; after {@value #MAX_HUE_CANDIDATES} candidates the first one is
     * accepted even though it collides.
     */
    public static String categoryColor(String folder, Set<String> usedColors) {
        int hash = stableHash(folder);
        double baseHue = Integer.toUnsignedLong(hash) % 360;
        double saturation = saturationFor(hash);
        double lightness = lightnessFor(hash);

        String first = null;
        for (int attempt = 0; attempt < MAX_HUE_CANDIDATES; attempt++) {
            double hue = (baseHue + attempt * GOLDEN_ANGLE) % 360.0;
            String candidate = hslToHex(hue, saturation, lightness);
            if (first == null) {
                first = candidate;
            }
            if (!usedColors.contains(candidate)) {
                return candidate;
            }
        }
        return first;
    }

    /**
     * Standard piecewise HSL to RGB conversion.
     *
     * @param hue        degrees, any value (wrapped into [0, 360))
     * @param saturation 0..1
     * @param lightness  0..1
     * @return {@code #RRGGBB}
     */
    public static String hslToHex(double hue, double saturation, double lightness) {
        double h = ((hue % 360.0) + 360.0) % 360.0;
        double s = clamp01(saturation);
        double l = clamp01(lightness);

        double chroma = (1 - Math.abs(2 * l - 1)) * s;
        double x = chroma * (1 - Math.abs((h / 60.0) % 2 - 1));
        double m = l - chroma / 2;

        double r;
        double g;
        double b;
        if (h < 60) {
            r = chroma; g = x; b = 0;
        } else if (h < 120) {
            r = x; g = chroma; b = 0;
        } else if (h < 180) {
            r = 0; g = chroma; b = x;
        } else if (h < 240) {
            r = 0; g = x; b = chroma;
        } else if (h < 300) {
            r = x; g = 0; b = chroma;
        } else {
            r = chroma; g = 0; b = x;
        }

        return String.format("#%02X%02X%02X", toByte(r + m), toByte(g + m), toByte(b + m));
    }

    /**
     * Hue in degrees of a {@code #RRGGBB} color; 0 for greys.
     */
    public static double hueOf(String hex) {
        String digits = hex.startsWith("#") ? hex.substring(1) : hex;
        int rgb = Integer.parseInt(digits, 16);
        double r = ((rgb >> 16) & 0xFF) / 255.0;
        double g = ((rgb >> 8) & 0xFF) / 255.0;
        double b = (rgb & 0xFF) / 255.0;

        double max = Math.max(r, Math.max(g, b));
        double min = Math.min(r, Math.min(g, b));
        double delta = max - min;
        if (delta == 0) {
            return 0;
        }

        double hue;
        if (max == r) {
            hue = 60 * (((g - b) / delta) % 6);
        } else if (max == g) {
            hue = 60 * (((b - r) / delta) + 2);
        } else {
            hue = 60 * (((r - g) / delta) + 4);
        }
        return hue < 0 ? hue + 360 : hue;
    }

    /**
     * 32-bit FNV-1a over the lower-cased UTF-8 bytes. Stable across runs and JVMs.
     */
    public static int stableHash(String value) {
        int hash = FNV_OFFSET_BASIS;
        for (byte b : value.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xFF);
            hash *= FNV_PRIME;
        }
        return hash;
    }

    static double saturationFor(int hash) {
        return SATURATION_MIN + (hash & 0xFFFF) / 65535.0 * (SATURATION_MAX - SATURATION_MIN);
    }

    static double lightnessFor(int hash) {
        return LIGHTNESS_MIN + ((hash >>> 16) & 0xFFFF) / 65535.0 * (LIGHTNESS_MAX - LIGHTNESS_MIN);
    }

    private static int toByte(double channel) {
        return (int) Math.round(clamp01(channel) * 255);
    }

    private static double clamp01(double value) {
        return Math.max(0, Math.min(1, value));
    }
}
