package com.flowmable.epaper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Upload and poll operations behind the HTTP surface: converts uploads through
 * the {@link ImagePipeline} and keeps the results in a {@link DeliveryRegistry}.
 */
public class FrameService {

    private static final Logger logger = LoggerFactory.getLogger(FrameService.class);

    private final ImagePipeline pipeline;
    private final DeliveryRegistry registry;

    public FrameService(ImagePipeline pipeline, DeliveryRegistry registry) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Convert and store one upload. On failure nothing is stored.
     *
     * @param name Display name; {@code image_<n>} when null or blank, n being the
     *             registry size after this upload
     */
    public EncodedImage upload(byte[] rawImageBytes, String name) throws ImageProcessingException {
        EncodedImage image;
        if (name == null || name.isBlank()) {
            EncodedImage processed = pipeline.process(rawImageBytes, null);
            image = registry.storeAt(position -> processed.withName("image_" + position));
        } else {
            image = pipeline.process(rawImageBytes, name);
            registry.store(image);
        }
        logger.info("Stored frame '{}' ({} bytes in), {} frames queued",
                image.name(), rawImageBytes.length, registry.status().total());
        return image;
    }

    public Optional<EncodedImage> nextFrame() {
        return registry.next();
    }

    public RegistryStatus status() {
        return registry.status();
    }

    public void clear() {
        registry.clear();
        logger.info("Cleared all frames");
    }
}
