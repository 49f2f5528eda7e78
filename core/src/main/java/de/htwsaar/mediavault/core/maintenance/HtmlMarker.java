package de.htwsaar.mediavault.core.maintenance;

import de.htwsaar.mediavault.core.fetch.FailureSidecar;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Findet Dateien, die in Wahrheit HTML-Seiten sind (Block-/Login-Seiten aus älteren Läufen), und
 * legt für sie einen Sidecar an.
 */
public final class HtmlMarker {

    private static final Logger log = LoggerFactory.getLogger(HtmlMarker.class);

    static final int SAMPLE_BYTES = 2048;
    static final int SIDECAR_SAMPLE_CHARS = 2000;
    static final String REASON = "Detected HTML content.";
    private static final List<String> MARKERS = List.of("<!doctype html", "<html", "<script");

    private HtmlMarker() {}

    /**
     * Durchsucht {@code dir} rekursiv.
     *
     * @param dir Download-Verzeichnis
     * @return Dateien, für die ein Sidecar geschrieben wurde
     * @throws IOException wenn das Verzeichnis nicht gelesen werden kann
     */
    public static List<Path> scan(Path dir) throws IOException {
        Objects.requireNonNull(dir, "dir");
        List<Path> candidates;
        try (Stream<Path> walk = Files.walk(dir)) {
            candidates = walk.filter(Files::isRegularFile).filter(HtmlMarker::isMediaCandidate).sorted().toList();
        }

        List<Path> marked = new ArrayList<>();
        for (Path file : candidates) {
            String sample;
            try {
                sample = readSample(file);
            } catch (IOException e) {
                log.warn("Could not read {}: {}", file, e.getMessage());
                continue;
            }
            if (!looksLikeHtml(sample)) continue;

            String cut = sample.length() > SIDECAR_SAMPLE_CHARS ? sample.substring(0, SIDECAR_SAMPLE_CHARS) : sample;
            FailureSidecar.write(file, file.toString(), REASON, "---sample---\n" + cut);
            log.info("Marked HTML file as failed: {}", file);
            marked.add(file);
        }
        return marked;
    }

    static boolean looksLikeHtml(String sample) {
        String lower = sample.toLowerCase(Locale.ROOT);
        return MARKERS.stream().anyMatch(lower::contains);
    }

    private static boolean isMediaCandidate(Path file) {
        String name = file.getFileName().toString();
        return !FailureSidecar.isSidecar(file)
                && !name.endsWith(".part")
                && !name.startsWith(".mediavault-index")
                && !name.endsWith(".log");
    }

    private static String readSample(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return new String(in.readNBytes(SAMPLE_BYTES), StandardCharsets.UTF_8);
        }
    }
}
