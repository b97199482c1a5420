package com.flowmable.epaper;

/**
 * An opaque sRGB color with 8-bit channels.
 *
 * @param r Red channel (0–255)
 * @param g Green channel (0–255)
 * @param b Blue channel (0–255)
 */
public record RgbColor(int r, int g, int b) {

    public RgbColor {
        if (r < 0 || r > 255 || g < 0 || g > 255 || b < 0 || b > 255) {
            throw new IllegalArgumentException(
                    "Channel out of range 0-255: (" + r + ", " + g + ", " + b + ")");
        }
    }

    /**
     * Unpack a {@code 0xRRGGBB} value. Any alpha byte is ignored.
     */
    public static RgbColor fromPacked(int rgb) {
        return new RgbColor((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
    }

    public int packed() {
        return (r << 16) | (g << 8) | b;
    }

    @Override
    public String toString() {
        return String.format("#%06X", packed());
    }
}
