package com.flowmable.epaper;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP endpoints polled by the panel and used by the upload page.
 * <pre>
 * POST /upload           {"image": base64, "name": optional}  convert and queue
 * GET  /get-img-data     next frame as text/plain wire data
 * GET  /status           queue counters
 * GET  /wakeup-interval  seconds the panel should sleep
 * POST /clear-images     drop all frames
 * </pre>
 * Requests are served by a fixed pool, so several uploads convert in parallel.
 */
public class FrameServer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FrameServer.class);

    private static final String JSON = "application/json; charset=utf-8";
    private static final String TEXT = "text/plain; charset=utf-8";

    private final FrameService service;
    private final WakeupSchedule schedule;
    private final Clock clock;
    private final int maxUploadBytes;
    private final Gson gson = new Gson();
    private final HttpServer server;
    private final ExecutorService workers;

    public FrameServer(FrameSettings settings, FrameService service, WakeupSchedule schedule, Clock clock)
            throws IOException {
        this.service = service;
        this.schedule = schedule;
        this.clock = clock;
        this.maxUploadBytes = settings.maxUploadBytes();
        this.server = HttpServer.create(new InetSocketAddress(settings.port()), 0);

        AtomicInteger threadIds = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(settings.workerThreads(), r -> {
            Thread t = new Thread(r, "frame-http-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(workers);

        server.createContext("/upload", route("POST", this::handleUpload));
        server.createContext("/get-img-data", route("GET", this::handleNextImage));
        server.createContext("/status", route("GET", this::handleStatus));
        server.createContext("/wakeup-interval", route("GET", this::handleWakeup));
        server.createContext("/clear-images", route("POST", this::handleClear));
    }

    public void start() {
        server.start();
        logger.info("Frame server listening on port {}", port());
    }

    /**
     * Bound port; differs from the configured one when that was 0.
     */
    public int port() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Frame server stopped");
    }

    // --- Handlers ---

    private void handleUpload(HttpExchange exchange) throws IOException {
        byte[] body = readBody(exchange.getRequestBody(), maxUploadBytes);
        if (body == null) {
            sendJson(exchange, 413, error("Upload exceeds " + maxUploadBytes + " bytes"));
            return;
        }

        JsonObject request;
        try {
            JsonElement parsed = JsonParser.parseString(new String(body, StandardCharsets.UTF_8));
            request = parsed.isJsonObject() ? parsed.getAsJsonObject() : null;
        } catch (JsonParseException e) {
            request = null;
        }
        if (request == null || !request.has("image") || !request.get("image").isJsonPrimitive()) {
            sendJson(exchange, 400, error("No image data provided"));
            return;
        }

        byte[] imageBytes;
        try {
            String encoded = stripDataUrlPrefix(request.get("image").getAsString()).replaceAll("\\s", "");
            imageBytes = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            sendJson(exchange, 400, error("Image data is not valid base64"));
            return;
        }
        String name = request.has("name") && request.get("name").isJsonPrimitive()
                ? request.get("name").getAsString()
                : null;

        try {
            service.upload(imageBytes, name);
        } catch (ImageDecodeException e) {
            logger.warn("Rejected upload: {}", e.getMessage());
            sendJson(exchange, 400, error("Failed to decode image: " + e.getMessage()));
            return;
        } catch (ImageProcessingException e) {
            logger.error("Failed to process upload", e);
            sendJson(exchange, 500, error("Failed to process image"));
            return;
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", "Image uploaded and processed successfully");
        response.put("total_images", service.status().total());
        sendJson(exchange, 200, response);
    }

    private void handleNextImage(HttpExchange exchange) throws IOException {
        Optional<EncodedImage> next = service.nextFrame();
        if (next.isEmpty()) {
            sendJson(exchange, 404, error("No images available"));
            return;
        }
        logger.debug("Serving {}", next.get());
        send(exchange, 200, TEXT, next.get().text().getBytes(StandardCharsets.US_ASCII));
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        RegistryStatus status = service.status();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("total_images", status.total());
        response.put("sent_images", status.delivered());
        response.put("current_index", status.cursor());
        response.put("uptime", "running");
        sendJson(exchange, 200, response);
    }

    private void handleWakeup(HttpExchange exchange) throws IOException {
        long interval = schedule.secondsUntilNextWakeup(LocalDateTime.now(clock));
        sendJson(exchange, 200, Map.of("interval", interval));
    }

    private void handleClear(HttpExchange exchange) throws IOException {
        service.clear();
        sendJson(exchange, 200, Map.of("message", "All images cleared"));
    }

    // --- Plumbing ---

    private interface ExchangeHandler {
        void handle(HttpExchange exchange) throws IOException;
    }

    private HttpHandler route(String method, ExchangeHandler handler) {
        return exchange -> {
            try {
                if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
                    exchange.getResponseHeaders().set("Allow", method);
                    sendJson(exchange, 405, error("Method not allowed"));
                    return;
                }
                handler.handle(exchange);
            } catch (IOException e) {
                logger.warn("I/O error on {} {}: {}", exchange.getRequestMethod(),
                        exchange.getRequestURI(), e.getMessage());
            } catch (RuntimeException e) {
                logger.error("Unhandled error on {} {}", exchange.getRequestMethod(), exchange.getRequestURI(), e);
                if (exchange.getResponseCode() == -1) {
                    try {
                        sendJson(exchange, 500, error("Internal server error"));
                    } catch (IOException sendFailure) {
                        logger.warn("Could not send error response: {}", sendFailure.getMessage());
                    }
                }
            } finally {
                exchange.close();
            }
        };
    }

    private static Map<String, Object> error(String message) {
        return Map.of("error", message);
    }

    private void sendJson(HttpExchange exchange, int status, Map<String, Object> body) throws IOException {
        send(exchange, status, JSON, gson.toJson(body).getBytes(StandardCharsets.UTF_8));
    }

    private static void send(HttpExchange exchange, int status, String contentType, byte[] body)
            throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    /**
     * Reads the whole body so the connection stays usable.
     *
     * @return the body, or null if it is longer than {@code limit}
     */
    private static byte[] readBody(InputStream in, int limit) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] chunk = new byte[8192];
        boolean tooLarge = false;
        int n;
        while ((n = in.read(chunk)) != -1) {
            if (tooLarge || buffer.size() + n > limit) {
                tooLarge = true;
                continue;
            }
            buffer.write(chunk, 0, n);
        }
        return tooLarge ? null : buffer.toByteArray();
    }

    private static String stripDataUrlPrefix(String data) {
        // Browsers hand FileReader results over as "data:image/png;base64,...."
        int comma = data.indexOf(',');
        return data.startsWith("data:") && comma >= 0 ? data.substring(comma + 1) : data;
    }
}
