package de.htwsaar.mediavault.core.fetch;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * {@code <ziel>.failed}-Dateien: Zeile 1 die URL, Zeile 2 der Fehler, danach optionale Diagnose.
 * Ein späterer Retry-Pass liest die URL und lädt erneut nach {@code <ziel>}.
 */
public final class FailureSidecar {

    public static final String SUFFIX = ".failed";

    /** Inhalt eines Sidecars. */
    public record Entry(String url, String error) {}

    private FailureSidecar() {}

    public static Path sidecarFor(Path destination) {
        return destination.resolveSibling(destination.getFileName().toString() + SUFFIX);
    }

    public static boolean isSidecar(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().endsWith(SUFFIX);
    }

    /**
     * Ziel, zu dem ein Sidecar gehört (Pfad ohne {@code .failed}).
     *
     * @param sidecar Sidecar-Pfad
     * @return Zielpfad
     */
    public static Path destinationOf(Path sidecar) {
        String name = sidecar.getFileName().toString();
        if (!name.endsWith(SUFFIX)) {
            throw new IllegalArgumentException("not a sidecar: " + sidecar);
        }
        return sidecar.resolveSibling(name.substring(0, name.length() - SUFFIX.length()));
    }

    public static Path write(Path destination, String url, String error, String diagnostics) throws IOException {
        Path sidecar = sidecarFor(destination);
        Path parent = sidecar.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        StringBuilder sb = new StringBuilder();
        sb.append(oneLine(url)).append('\n');
        sb.append(oneLine(error)).append('\n');
        if (diagnostics != null && !diagnostics.isEmpty()) {
            sb.append(diagnostics);
            if (!diagnostics.endsWith("\n")) sb.append('\n');
        }
        Files.writeString(sidecar, sb.toString(), StandardCharsets.UTF_8);
        return sidecar;
    }

    /**
     * Liest URL und Fehlertext.
     *
     * @param sidecar Sidecar-Datei
     * @return Eintrag oder leer, wenn die erste Zeile fehlt
     * @throws IOException bei Lesefehlern
     */
    public static Optional<Entry> read(Path sidecar) throws IOException {
        try (BufferedReader r = Files.newBufferedReader(sidecar, StandardCharsets.UTF_8)) {
            String url = r.readLine();
            if (url == null || url.isBlank()) return Optional.empty();
            String error = r.readLine();
            return Optional.of(new Entry(url.trim(), error == null ? "" : error.trim()));
        }
    }

    public static boolean deleteFor(Path destination) throws IOException {
        return Files.deleteIfExists(sidecarFor(destination));
    }

    private static String oneLine(String s) {
        if (s == null) return "";
        return s.replace('\r', ' ').replace('\n', ' ');
    }
}
