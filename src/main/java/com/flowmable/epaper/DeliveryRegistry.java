package com.flowmable.epaper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.IntFunction;

/**
 * In-memory round-robin queue of converted frames.
 * <p>
 * Frames are never removed by polling: {@link #next()} hands out the frame under
 * the cursor and moves the cursor on, wrapping at the end. Every operation holds
 * the registry monitor for its whole (short) body, so a poll always computes the
 * wrap against the same size it reads from.
 */
public class DeliveryRegistry {

    private static final Logger logger = LoggerFactory.getLogger(DeliveryRegistry.class);

    private final List<EncodedImage> images = new ArrayList<>();
    private final Set<UUID> delivered = new HashSet<>();
    private int cursor;

    public synchronized void store(EncodedImage image) {
        Objects.requireNonNull(image, "image");
        images.add(image);
        logger.debug("Stored {} ({} total)", image, images.size());
    }

    /**
     * Append the frame built for the 1-based position it will occupy. Building
     * and appending happen under the same lock, so concurrent callers get
     * distinct positions.
     */
    public synchronized EncodedImage storeAt(IntFunction<EncodedImage> atPosition) {
        EncodedImage image = atPosition.apply(images.size() + 1);
        store(image);
        return image;
    }

    /**
     * The frame under the cursor, or empty if nothing has been stored.
     */
    public synchronized Optional<EncodedImage> next() {
        if (images.isEmpty()) {
            return Optional.empty();
        }
        EncodedImage image = images.get(cursor % images.size());
        cursor = (cursor + 1) % images.size();
        delivered.add(image.id());
        return Optional.of(image);
    }

    public synchronized RegistryStatus status() {
        return new RegistryStatus(images.size(), delivered.size(), cursor);
    }

    public synchronized void clear() {
        int dropped = images.size();
        images.clear();
        delivered.clear();
        cursor = 0;
        logger.debug("Cleared {} frames", dropped);
    }

    /**
     * Stored frames in insertion order.
     */
    public synchronized List<EncodedImage> snapshot() {
        return List.copyOf(images);
    }
}
