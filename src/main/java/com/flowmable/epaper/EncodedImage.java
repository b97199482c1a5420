package com.flowmable.epaper;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * A converted frame, ready to be served to the panel.
 *
 * @param id        Unique per conversion; two uploads of the same photo get different ids
 * @param width     Frame width in pixels
 * @param height    Frame height in pixels
 * @param codes     One device code per pixel, row-major
 * @param text      Wire form of {@code codes}, see {@link DisplayEncoder#toText(byte[])}
 * @param timestamp When the pipeline produced the frame
 * @param name      Display name supplied by the uploader
 */
public record EncodedImage(
        UUID id,
        int width,
        int height,
        byte[] codes,
        String text,
        Instant timestamp,
        String name
) {
    public EncodedImage {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(codes, "codes");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(name, "name");
        if (codes.length != width * height) {
            throw new IllegalArgumentException(
                    "Expected " + (width * height) + " codes, got " + codes.length);
        }
        codes = codes.clone();
    }

    @Override
    public byte[] codes() {
        return codes.clone();
    }

    /**
     * Same frame (same id) under another display name.
     */
    public EncodedImage withName(String newName) {
        return new EncodedImage(id, width, height, codes, text, timestamp, newName);
    }

    public int codeAt(int x, int y) {
        return codes[y * width + x] & 0xFF;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EncodedImage other && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "EncodedImage[" + name + ", " + width + "x" + height + ", " + timestamp + ", id=" + id + "]";
    }
}
