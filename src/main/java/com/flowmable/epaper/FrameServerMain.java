package com.flowmable.epaper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;

/**
 * Entry point for the frame server.
 * <p>
 * Usage: settings come from environment variables (see {@link FrameSettings#fromEnvironment}).
 * An optional first argument overrides {@code PORT}.
 */
public final class FrameServerMain {

    private static final Logger logger = LoggerFactory.getLogger(FrameServerMain.class);

    private FrameServerMain() {}

    public static void main(String[] args) throws Exception {
        FrameSettings settings = FrameSettings.fromEnvironment(System.getenv());
        if (args.length > 0 && args[0] != null && !args[0].isEmpty()) {
            try {
                int port = Integer.parseInt(args[0].trim());
                if (port > 0 && port <= 65535) {
                    settings = settings.withPort(port);
                } else {
                    logger.warn("Port argument out of range 1-65535, using {}", settings.port());
                }
            } catch (NumberFormatException e) {
                logger.warn("Invalid port argument, using {}: {}", settings.port(), args[0]);
            }
        }

        Clock clock = Clock.systemDefaultZone();
        ImagePipeline pipeline = new ImagePipeline(settings, clock);
        FrameService service = new FrameService(pipeline, new DeliveryRegistry());
        FrameServer server = new FrameServer(settings, service, WakeupSchedule.from(settings), clock);

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.close();
            pipeline.close();
            stopped.countDown();
        }, "frame-shutdown"));

        server.start();
        logger.info("Frame size {}x{}, {} workers, decode timeout {}s",
                settings.frameWidth(), settings.frameHeight(), settings.workerThreads(),
                settings.decodeTimeout().toSeconds());
        stopped.await();
    }
}
