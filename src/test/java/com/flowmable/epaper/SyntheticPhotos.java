package com.flowmable.epaper;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Random;

/**
 * Synthetic inputs shared by the tests.
 */
final class SyntheticPhotos {

    private SyntheticPhotos() {}

    static BufferedImage solidColor(int w, int h, int r, int g, int b) {
        BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        int rgb = (r << 16) | (g << 8) | b;
        for (int y = 0; y < h; y++)
            for (int x = 0; x < w; x++)
                img.setRGB(x, y, rgb);
        return img;
    }

    /** Horizontal gradient from color A to color B. */
    static BufferedImage gradient(int w, int h, int r1, int g1, int b1, int r2, int g2, int b2) {
        BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        for (int x = 0; x < w; x++) {
            double t = w == 1 ? 0 : x / (double) (w - 1);
            int r = (int) (r1 + t * (r2 - r1));
            int g = (int) (g1 + t * (g2 - g1));
            int b = (int) (b1 + t * (b2 - b1));
            int rgb = (r << 16) | (g << 8) | b;
            for (int y = 0; y < h; y++)
                img.setRGB(x, y, rgb);
        }
        return img;
    }

    /** Seeded noise: same seed, same pixels. */
    static Raster noise(int w, int h, long seed) {
        Random random = new Random(seed);
        int[] packed = new int[w * h];
        for (int i = 0; i < packed.length; i++) {
            packed[i] = random.nextInt(0x1000000);
        }
        return Raster.of(w, h, packed);
    }

    static byte[] png(BufferedImage image) {
        return encode(image, "png");
    }

    static byte[] jpeg(BufferedImage image) {
        return encode(image, "jpg");
    }

    private static byte[] encode(BufferedImage image, String format) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image, format, out)) {
                throw new IllegalStateException("No ImageIO writer for " + format);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }
}
