package com.flowmable.epaper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Floyd-Steinberg error diffusion onto the {@link DisplayPalette}.
 * <p>
 * Error distribution pattern:
 * <pre>
 *         X   7/16
 *     3/16  5/16  1/16
 * </pre>
 * Each share is computed with integer division (truncating toward zero) before
 * it is added to the neighbour. The working buffer is not clamped while the scan
 * runs, so a pixel is quantized from its full accumulated value.
 * <p>
 * The scan is inherently sequential: every pixel depends on error pushed from
 * earlier pixels. Separate rasters may be dithered on separate threads; this
 * class keeps no state between calls.
 */
public class FloydSteinbergDitherer {

    private static final Logger logger = LoggerFactory.getLogger(FloydSteinbergDitherer.class);

    /**
     * Dither a raster so that every output pixel is a palette color.
     *
     * @param source Raster to approximate; not modified
     * @return A new raster of the same size
     */
    public Raster dither(Raster source) {
        int width = source.width();
        int height = source.height();
        int total = width * height;
        long t0 = System.nanoTime();

        // Working buffer, one signed plane per channel
        int[] red = new int[total];
        int[] green = new int[total];
        int[] blue = new int[total];
        for (int i = 0; i < total; i++) {
            int rgb = source.packedAtIndex(i);
            red[i] = (rgb >> 16) & 0xFF;
            green[i] = (rgb >> 8) & 0xFF;
            blue[i] = rgb & 0xFF;
        }

        for (int y = 0; y < height; y++) {
            boolean hasNextRow = y + 1 < height;
            for (int x = 0; x < width; x++) {
                int idx = y * width + x;
                int oldR = red[idx];
                int oldG = green[idx];
                int oldB = blue[idx];

                RgbColor quantized = DisplayPalette.nearestColor(oldR, oldG, oldB).color();
                red[idx] = quantized.r();
                green[idx] = quantized.g();
                blue[idx] = quantized.b();

                int errR = oldR - quantized.r();
                int errG = oldG - quantized.g();
                int errB = oldB - quantized.b();
                if (errR == 0 && errG == 0 && errB == 0) {
                    continue;
                }

                if (x + 1 < width) {
                    diffuse(red, green, blue, idx + 1, errR, errG, errB, 7);
                }
                if (hasNextRow) {
                    int below = idx + width;
                    if (x - 1 >= 0) {
                        diffuse(red, green, blue, below - 1, errR, errG, errB, 3);
                    }
                    diffuse(red, green, blue, below, errR, errG, errB, 5);
                    if (x + 1 < width) {
                        diffuse(red, green, blue, below + 1, errR, errG, errB, 1);
                    }
                }
            }
        }

        int[] out = new int[total];
        for (int i = 0; i < total; i++) {
            out[i] = (clamp(red[i]) << 16) | (clamp(green[i]) << 8) | clamp(blue[i]);
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Dithered {}x{} in {} ms", width, height, (System.nanoTime() - t0) / 1_000_000);
        }
        return Raster.wrap(width, height, out);
    }

    private static void diffuse(int[] red, int[] green, int[] blue, int idx,
                                int errR, int errG, int errB, int sixteenths) {
        red[idx] += errR * sixteenths / 16;
        green[idx] += errG * sixteenths / 16;
        blue[idx] += errB * sixteenths / 16;
    }

    private static int clamp(int value) {
        if (value < 0) return 0;
        if (value > 255) return 255;
        return value;
    }
}
