package com.flowmable.epaper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Runtime settings for the frame server and conversion pipeline.
 *
 * @param port               HTTP listen port
 * @param frameWidth         Output width in pixels
 * @param frameHeight        Output height in pixels
 * @param decodeTimeout      Upper bound for decoding plus resizing one upload
 * @param workerThreads      Threads serving HTTP requests (and so concurrent conversions)
 * @param maxUploadBytes     Largest accepted request body
 * @param dayStartHour       First hour (0–23) of the daytime polling window
 * @param dayEndHour         Hour (1–24) the daytime window ends, exclusive
 * @param dayIntervalSeconds Wake-up interval handed out during the daytime window
 */
public record FrameSettings(
        int port,
        int frameWidth,
        int frameHeight,
        Duration decodeTimeout,
        int workerThreads,
        int maxUploadBytes,
        int dayStartHour,
        int dayEndHour,
        int dayIntervalSeconds
) {
    private static final Logger logger = LoggerFactory.getLogger(FrameSettings.class);

    public static final FrameSettings DEFAULT = new FrameSettings(
            5000,                      // port
            Raster.DISPLAY_WIDTH,      // frameWidth
            Raster.DISPLAY_HEIGHT,     // frameHeight
            Duration.ofSeconds(30),    // decodeTimeout
            4,                         // workerThreads
            20 * 1024 * 1024,          // maxUploadBytes
            8,                         // dayStartHour (8 AM)
            20,                        // dayEndHour (8 PM)
            3600                       // dayIntervalSeconds
    );

    public FrameSettings {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range 0-65535: " + port);
        }
        if (frameWidth <= 0 || frameHeight <= 0) {
            throw new IllegalArgumentException("Frame size must be positive: " + frameWidth + "x" + frameHeight);
        }
        if (decodeTimeout == null || decodeTimeout.isNegative() || decodeTimeout.isZero()) {
            throw new IllegalArgumentException("Decode timeout must be positive: " + decodeTimeout);
        }
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("Worker threads must be positive: " + workerThreads);
        }
        if (maxUploadBytes <= 0) {
            throw new IllegalArgumentException("Max upload size must be positive: " + maxUploadBytes);
        }
        if (dayStartHour < 0 || dayStartHour > 23 || dayEndHour <= dayStartHour || dayEndHour > 24) {
            throw new IllegalArgumentException("Invalid daytime window: " + dayStartHour + "-" + dayEndHour);
        }
        if (dayIntervalSeconds <= 0) {
            throw new IllegalArgumentException("Day interval must be positive: " + dayIntervalSeconds);
        }
    }

    /**
     * Overlay environment variables on {@link #DEFAULT}. Unparseable or
     * out-of-range values are logged and the default is kept.
     */
    public static FrameSettings fromEnvironment(Map<String, String> env) {
        FrameSettings d = DEFAULT;
        int port = intVar(env, "PORT", d.port(), 0, 65535);
        int width = intVar(env, "FRAME_WIDTH", d.frameWidth(), 1, 10_000);
        int height = intVar(env, "FRAME_HEIGHT", d.frameHeight(), 1, 10_000);
        int timeout = intVar(env, "DECODE_TIMEOUT_SECONDS", (int) d.decodeTimeout().toSeconds(), 1, 3600);
        int workers = intVar(env, "WORKER_THREADS", d.workerThreads(), 1, 256);
        int maxUpload = intVar(env, "MAX_UPLOAD_BYTES", d.maxUploadBytes(), 1, Integer.MAX_VALUE);
        int dayStart = intVar(env, "DAY_START_HOUR", d.dayStartHour(), 0, 23);
        int dayEnd = intVar(env, "DAY_END_HOUR", d.dayEndHour(), 1, 24);
        int interval = intVar(env, "DAY_INTERVAL_SECONDS", d.dayIntervalSeconds(), 1, 86_400);
        if (dayEnd <= dayStart) {
            logger.warn("DAY_END_HOUR {} is not after DAY_START_HOUR {}, using default window {}-{}",
                    dayEnd, dayStart, d.dayStartHour(), d.dayEndHour());
            dayStart = d.dayStartHour();
            dayEnd = d.dayEndHour();
        }
        return new FrameSettings(port, width, height, Duration.ofSeconds(timeout), workers, maxUpload,
                dayStart, dayEnd, interval);
    }

    public FrameSettings withPort(int newPort) {
        return new FrameSettings(newPort, frameWidth, frameHeight, decodeTimeout, workerThreads, maxUploadBytes,
                dayStartHour, dayEndHour, dayIntervalSeconds);
    }

    private static int intVar(Map<String, String> env, String name, int defaultValue, int min, int max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < min || value > max) {
                logger.warn("{}={} outside {}-{}, using default {}", name, value, min, max, defaultValue);
                return defaultValue;
            }
            return value;
        } catch (NumberFormatException e) {
            logger.warn("Invalid {}, using default {}: {}", name, defaultValue, raw);
            return defaultValue;
        }
    }
}
