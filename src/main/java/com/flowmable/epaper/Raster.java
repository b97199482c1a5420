package com.flowmable.epaper;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Immutable row-major grid of opaque RGB pixels.
 * <p>
 * Pixels are stored packed as {@code 0xRRGGBB}; alpha never survives into a raster.
 */
public final class Raster {

    /** Native resolution of the 5.65" 7-color panel. */
    public static final int DISPLAY_WIDTH = 600;
    public static final int DISPLAY_HEIGHT = 448;

    private final int width;
    private final int height;
    private final int[] pixels;

    private Raster(int width, int height, int[] pixels) {
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    /**
     * @param width  Width in pixels (&gt; 0)
     * @param height Height in pixels (&gt; 0)
     * @param packed Row-major {@code 0xRRGGBB} values; copied, high byte discarded
     */
    public static Raster of(int width, int height, int[] packed) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Raster dimensions must be positive: " + width + "x" + height);
        }
        if (packed.length != width * height) {
            throw new IllegalArgumentException(
                    "Expected " + (width * height) + " pixels for " + width + "x" + height + ", got " + packed.length);
        }
        int[] copy = new int[packed.length];
        for (int i = 0; i < packed.length; i++) {
            copy[i] = packed[i] & 0xFFFFFF;
        }
        return new Raster(width, height, copy);
    }

    public static Raster filled(int width, int height, RgbColor color) {
        int[] packed = new int[width * height];
        Arrays.fill(packed, color.packed());
        return of(width, height, packed);
    }

    /**
     * Copy the RGB channels of an image, dropping alpha.
     */
    public static Raster fromImage(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
        return of(w, h, argb);
    }

    /** Takes ownership of {@code packed}; callers must not touch it afterwards. */
    static Raster wrap(int width, int height, int[] packed) {
        return new Raster(width, height, packed);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int pixelCount() {
        return pixels.length;
    }

    public RgbColor pixel(int x, int y) {
        return RgbColor.fromPacked(packedAt(x, y));
    }

    public int packedAt(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("(" + x + ", " + y + ") outside " + width + "x" + height);
        }
        return pixels[y * width + x];
    }

    /**
     * Row-major copy of all pixels.
     */
    public int[] toPackedArray() {
        return pixels.clone();
    }

    int packedAtIndex(int index) {
        return pixels[index];
    }

    public BufferedImage toImage() {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        img.setRGB(0, 0, width, height, pixels, 0, width);
        return img;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Raster other)) return false;
        return width == other.width && height == other.height && Arrays.equals(pixels, other.pixels);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return "Raster[" + width + "x" + height + "]";
    }
}
