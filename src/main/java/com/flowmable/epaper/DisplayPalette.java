package com.flowmable.epaper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The fixed 7-color palette of the e-paper panel.
 * <p>
 * Entry order is canonical and only matters for tie-breaking: when a color is
 * equidistant from two entries, the one listed first wins.
 */
public final class DisplayPalette {

    private static final Logger logger = LoggerFactory.getLogger(DisplayPalette.class);

    public static final PaletteEntry WHITE = new PaletteEntry("White", new RgbColor(255, 255, 255), 0xFF);
    public static final PaletteEntry YELLOW = new PaletteEntry("Yellow", new RgbColor(255, 255, 0), 0xFC);
    public static final PaletteEntry ORANGE = new PaletteEntry("Orange", new RgbColor(255, 165, 0), 0xEC);
    public static final PaletteEntry RED = new PaletteEntry("Red", new RgbColor(255, 0, 0), 0xE0);
    public static final PaletteEntry GREEN = new PaletteEntry("Green", new RgbColor(0, 128, 0), 0x35);
    public static final PaletteEntry BLUE = new PaletteEntry("Blue", new RgbColor(0, 0, 255), 0x2B);
    public static final PaletteEntry BLACK = new PaletteEntry("Black", new RgbColor(0, 0, 0), 0x00);

    private static final List<PaletteEntry> ENTRIES = List.of(WHITE, YELLOW, ORANGE, RED, GREEN, BLUE, BLACK);

    private static final AtomicLong FALLBACKS = new AtomicLong();

    private DisplayPalette() {}

    public static List<PaletteEntry> entries() {
        return ENTRIES;
    }

    public static PaletteEntry nearestColor(RgbColor color) {
        return nearestColor(color.r(), color.g(), color.b());
    }

    /**
     * Nearest entry by squared RGB distance. Channels may lie outside 0–255,
     * which happens while error diffusion is still accumulating.
     */
    public static PaletteEntry nearestColor(int r, int g, int b) {
        PaletteEntry best = ENTRIES.get(0);
        long bestDistance = Long.MAX_VALUE;
        for (PaletteEntry entry : ENTRIES) {
            RgbColor c = entry.color();
            long dr = r - c.r();
            long dg = g - c.g();
            long db = b - c.b();
            long distance = dr * dr + dg * dg + db * db;
            // Strict comparison keeps the earlier entry on ties
            if (distance < bestDistance) {
                bestDistance = distance;
                best = entry;
            }
        }
        return best;
    }

    public static boolean contains(RgbColor color) {
        return exactMatch(color.packed()) != null;
    }

    /**
     * Device code of a color that is already a palette color.
     * <p>
     * A color outside the palette maps to White's code. Dithered rasters never
     * take this path, so every hit is logged and counted as a regression signal.
     */
    public static int codeFor(RgbColor color) {
        return codeFor(color.packed());
    }

    static int codeFor(int packedRgb) {
        PaletteEntry entry = exactMatch(packedRgb);
        if (entry != null) {
            return entry.code();
        }
        long count = FALLBACKS.incrementAndGet();
        logger.warn("Pixel {} is not a palette color, encoding as White (fallback #{})",
                RgbColor.fromPacked(packedRgb), count);
        return WHITE.code();
    }

    /**
     * Number of {@link #codeFor} calls that fell back to White since startup.
     */
    public static long fallbackCount() {
        return FALLBACKS.get();
    }

    private static PaletteEntry exactMatch(int packedRgb) {
        int rgb = packedRgb & 0xFFFFFF;
        for (PaletteEntry entry : ENTRIES) {
            if (entry.color().packed() == rgb) {
                return entry;
            }
        }
        return null;
    }
}
