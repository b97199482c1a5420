package com.flowmable.epaper;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * CLI driver that converts photos offline and writes the frame data next to a preview.
 * <p>
 * Usage: {@code ConverterDriver [-o outDir] file-or-dir...}. With no inputs, every
 * PNG/JPEG under {@code src/main/resources/photos} is converted.
 * For each photo it writes {@code <name>.txt} (wire data) and {@code <name>.preview.png}
 * (dithered result) and prints how much of the frame each panel color covers.
 */
public class ConverterDriver {

    private static final String PHOTOS_DIR = "photos";
    private static final Path DEFAULT_OUT = Path.of("frames");

    public static void main(String[] args) throws Exception {
        Path outDir = DEFAULT_OUT;
        List<String> inputs = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            if ("-o".equals(args[i]) && i + 1 < args.length) {
                outDir = Path.of(args[++i]);
            } else {
                inputs.add(args[i]);
            }
        }

        List<Path> photos = findPhotos(inputs);
        if (photos.isEmpty()) {
            System.out.println("No photos found. Pass files or place them in src/main/resources/photos/");
            return;
        }
        Files.createDirectories(outDir);

        System.out.println("═══════════════════════════════════════════════════════════");
        System.out.println("  E-PAPER FRAME CONVERTER");
        System.out.println("═══════════════════════════════════════════════════════════");

        try (ImagePipeline pipeline = new ImagePipeline()) {
            System.out.println("Frame: " + pipeline.width() + "x" + pipeline.height()
                    + ", palette: " + DisplayPalette.entries().size() + " colors");

            auditDeterminism(pipeline, photos.get(0));

            int converted = 0;
            for (Path photo : photos) {
                if (convert(pipeline, photo, outDir)) {
                    converted++;
                }
            }

            System.out.println("═══════════════════════════════════════════════════════════");
            System.out.printf("  Converted %d/%d photos into %s%n", converted, photos.size(), outDir.toAbsolutePath());
            System.out.printf("  Palette fallbacks: %d%n", DisplayPalette.fallbackCount());
            System.out.println("═══════════════════════════════════════════════════════════");
        }
    }

    private static void auditDeterminism(ImagePipeline pipeline, Path photo) {
        System.out.println("\n[Audit] Checking determinism on " + photo.getFileName() + "...");
        try {
            byte[] raw = Files.readAllBytes(photo);
            EncodedImage run1 = pipeline.process(raw, "audit-1");
            EncodedImage run2 = pipeline.process(raw, "audit-2");
            if (Arrays.equals(run1.codes(), run2.codes()) && run1.text().equals(run2.text())) {
                System.out.println("  ✅ Determinism Check PASSED");
            } else {
                System.out.println("  ❌ Determinism Check FAILED");
            }
        } catch (IOException | ImageProcessingException e) {
            System.out.println("  ❌ Audit skipped: " + e.getMessage());
        }
    }

    private static boolean convert(ImagePipeline pipeline, Path photo, Path outDir) {
        String fileName = photo.getFileName().toString();
        String baseName = fileName.contains(".") ? fileName.substring(0, fileName.lastIndexOf('.')) : fileName;
        System.out.printf("%n━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━%n");
        System.out.printf("Photo: %s%n", fileName);

        try {
            long t0 = System.nanoTime();
            EncodedImage frame = pipeline.process(Files.readAllBytes(photo), baseName);
            long elapsed = (System.nanoTime() - t0) / 1_000_000;

            Files.writeString(outDir.resolve(baseName + ".txt"), frame.text(), StandardCharsets.US_ASCII);
            ImageIO.write(preview(frame), "png", outDir.resolve(baseName + ".preview.png").toFile());

            System.out.printf("  Converted in %d ms (%d pixels)%n", elapsed, frame.codes().length);
            printCoverage(frame);
            return true;
        } catch (ImageDecodeException e) {
            System.out.println("  Not a readable image: " + e.getMessage());
        } catch (ImageProcessingException | IOException e) {
            System.out.println("  Error: " + e.getMessage());
        }
        return false;
    }

    private static void printCoverage(EncodedImage frame) {
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        for (PaletteEntry entry : DisplayPalette.entries()) {
            counts.put(entry.code(), 0);
        }
        for (byte code : frame.codes()) {
            counts.merge(code & 0xFF, 1, Integer::sum);
        }
        int total = frame.width() * frame.height();
        for (PaletteEntry entry : DisplayPalette.entries()) {
            int n = counts.get(entry.code());
            System.out.printf("  %-7s %s  %6.2f%%%n", entry.name(), entry.hexCode(), 100.0 * n / total);
        }
    }

    /**
     * Render encoded codes back to their palette colors.
     */
    static BufferedImage preview(EncodedImage frame) {
        Map<Integer, Integer> rgbByCode = new LinkedHashMap<>();
        for (PaletteEntry entry : DisplayPalette.entries()) {
            rgbByCode.put(entry.code(), entry.color().packed());
        }
        byte[] codes = frame.codes();
        int[] packed = new int[codes.length];
        for (int i = 0; i < codes.length; i++) {
            packed[i] = rgbByCode.getOrDefault(codes[i] & 0xFF, DisplayPalette.WHITE.color().packed());
        }
        return Raster.of(frame.width(), frame.height(), packed).toImage();
    }

    private static List<Path> findPhotos(List<String> inputs) throws IOException {
        List<Path> roots = new ArrayList<>();
        if (inputs.isEmpty()) {
            roots.add(Path.of("src", "main", "resources", PHOTOS_DIR));
        } else {
            inputs.forEach(s -> roots.add(Path.of(s)));
        }
        List<Path> photos = new ArrayList<>();
        for (Path root : roots) {
            if (Files.isRegularFile(root)) {
                photos.add(root);
            } else if (Files.isDirectory(root)) {
                try (Stream<Path> stream = Files.list(root)) {
                    stream.filter(ConverterDriver::isPhoto).sorted().forEach(photos::add);
                }
            }
        }
        return photos;
    }

    private static boolean isPhoto(Path p) {
        String n = p.getFileName().toString().toLowerCase();
        return n.endsWith(".png") || n.endsWith(".jpg") || n.endsWith(".jpeg");
    }
}
