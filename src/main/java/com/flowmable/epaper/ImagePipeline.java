package com.flowmable.epaper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Photo-to-frame conversion: decode, resize, dither, encode.
 * <p>
 * Decoding and resizing run on a bounded internal worker pool so that a pathological
 * input cannot hold the caller past the configured timeout. Dithering and
 * encoding run on the calling thread. Instances are safe to share between
 * threads.
 */
public class ImagePipeline implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ImagePipeline.class);

    public static final String DEFAULT_NAME = "untitled";

    private final int width;
    private final int height;
    private final Duration decodeTimeout;
    private final Clock clock;
    private final FloydSteinbergDitherer ditherer = new FloydSteinbergDitherer();
    private final DisplayEncoder encoder = new DisplayEncoder();
    private final ExecutorService decodePool;

    public ImagePipeline() {
        this(FrameSettings.DEFAULT, Clock.systemUTC());
    }

    public ImagePipeline(FrameSettings settings, Clock clock) {
        this.width = settings.frameWidth();
        this.height = settings.frameHeight();
        this.decodeTimeout = settings.decodeTimeout();
        this.clock = Objects.requireNonNull(clock, "clock");
        AtomicInteger threadIds = new AtomicInteger();
        // Bounded: a timed-out ImageIO.read keeps its thread until it returns
        this.decodePool = Executors.newFixedThreadPool(settings.workerThreads(), r -> {
            Thread t = new Thread(r, "image-decode-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /**
     * Convert raw image file bytes (PNG, JPEG, GIF, BMP...) into a frame.
     *
     * @param rawImageBytes Encoded image file contents
     * @param name          Display name; {@value #DEFAULT_NAME} when null or blank
     * @throws ImageDecodeException     if the bytes are not a readable image
     * @throws ImageProcessingException if resizing, dithering or encoding fails or times out
     */
    public EncodedImage process(byte[] rawImageBytes, String name) throws ImageProcessingException {
        Objects.requireNonNull(rawImageBytes, "rawImageBytes");
        long t0 = System.nanoTime();

        Future<Raster> pending = decodePool.submit(() -> resize(decode(rawImageBytes)));
        Raster resized;
        try {
            resized = pending.get(decodeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new ImageProcessingException("Decoding took longer than " + decodeTimeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new ImageProcessingException("Interrupted while decoding", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ImageProcessingException ipe) {
                throw ipe;
            }
            throw new ImageProcessingException("Failed to resize image: " + cause, cause);
        }

        long tDecode = System.nanoTime() - t0;
        EncodedImage result = ditherAndEncode(resized, name);
        logger.debug("Processed '{}' (decode+resize {} ms, total {} ms)", result.name(),
                tDecode / 1_000_000, (System.nanoTime() - t0) / 1_000_000);
        return result;
    }

    /**
     * Convert an already decoded image.
     */
    public EncodedImage process(BufferedImage image, String name) throws ImageProcessingException {
        Objects.requireNonNull(image, "image");
        Raster resized;
        try {
            resized = resize(image);
        } catch (RuntimeException e) {
            throw new ImageProcessingException("Failed to resize image: " + e, e);
        }
        return ditherAndEncode(resized, name);
    }

    /**
     * Resize and dither only, without encoding. Used for previews.
     */
    public Raster dither(BufferedImage image) {
        return ditherer.dither(resize(image));
    }

    private EncodedImage ditherAndEncode(Raster resized, String name) throws ImageProcessingException {
        try {
            Raster dithered = ditherer.dither(resized);
            byte[] codes = encoder.encode(dithered);
            String text = encoder.toText(codes);
            return new EncodedImage(UUID.randomUUID(), dithered.width(), dithered.height(), codes, text,
                    clock.instant(), name == null || name.isBlank() ? DEFAULT_NAME : name);
        } catch (RuntimeException e) {
            throw new ImageProcessingException("Failed to convert image: " + e, e);
        }
    }

    private static BufferedImage decode(byte[] raw) throws ImageDecodeException {
        if (raw.length == 0) {
            throw new ImageDecodeException("Empty image payload");
        }
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(raw));
        } catch (IOException e) {
            throw new ImageDecodeException("Failed to decode image: " + e.getMessage(), e);
        }
        if (image == null) {
            throw new ImageDecodeException("Unsupported or corrupt image (" + raw.length + " bytes)");
        }
        return image;
    }

    /**
     * Stretch to the frame size (aspect ratio is not preserved) and drop alpha.
     */
    private Raster resize(BufferedImage src) {
        BufferedImage dst = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g2 = dst.createGraphics();
        try {
            g2.setComposite(AlphaComposite.Src);
            g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2.drawImage(src, 0, 0, width, height, null);
        } finally {
            g2.dispose();
        }
        return Raster.fromImage(dst);
    }

    @Override
    public void close() {
        decodePool.shutdownNow();
    }
}
