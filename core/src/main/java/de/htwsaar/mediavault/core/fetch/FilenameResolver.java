package de.htwsaar.mediavault.core.fetch;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Leitet Dateinamen für Downloads ab.
 *
 * <p>Erlaubt sind nur {@code [A-Za-z0-9._-]}; alles andere wird zu {@code _}.</p>
 */
public final class FilenameResolver {

    static final String FALLBACK_NAME = "file";

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9._-]");
    private static final Pattern EXTENDED_FILENAME = Pattern.compile("filename\\*=[Uu][Tt][Ff]-8''([^;\\n]+)");
    private static final Pattern PLAIN_FILENAME = Pattern.compile("filename=\"?([^\";]+)\"?");

    private FilenameResolver() {}

    public static String sanitize(String name) {
        return UNSAFE.matcher(name).replaceAll("_");
    }

    /**
     * Ziel vor dem Request: expliziter Zielpfad, sonst vorgeschlagener Name + Endung aus der URL,
     * sonst der (dekodierte) letzte Pfadteil der URL.
     *
     * @param request Download-Anfrage
     * @param uri     geparste URL oder {@code null}
     * @return beabsichtigter Zielpfad
     */
    public static Path intendedDestination(FetchRequest request, URI uri) {
        if (request.targetPath() != null) {
            return request.targetPath();
        }
        String basename = uri == null ? "" : basename(uri.getPath());
        if (request.suggestedName() != null) {
            return request.folder().resolve(safeName(sanitize(request.suggestedName()) + extensionOf(basename)));
        }
        return request.folder().resolve(safeName(sanitize(basename)));
    }

    /**
     * Dateiname aus {@code Content-Disposition}; {@code filename*=UTF-8''} hat Vorrang vor {@code filename=}.
     *
     * @param header Header-Wert oder {@code null}
     * @return bereinigter Name oder leer
     */
    public static Optional<String> fromContentDisposition(String header) {
        if (header == null || header.isBlank()) return Optional.empty();

        Matcher ext = EXTENDED_FILENAME.matcher(header);
        String raw = null;
        if (ext.find()) {
            raw = ext.group(1).trim();
        } else {
            Matcher plain = PLAIN_FILENAME.matcher(header);
            if (plain.find()) {
                raw = plain.group(1).trim();
            }
        }
        if (raw == null || raw.isEmpty()) return Optional.empty();

        String name = sanitize(percentDecode(raw));
        if (isReserved(name)) return Optional.empty();
        return Optional.of(name);
    }

    /**
     * Erster freie Pfad aus {@code dest}, {@code base_1.ext}, {@code base_2.ext}, ...
     *
     * @param dest gewünschter Pfad
     * @return existiert noch nicht (zum Zeitpunkt des Aufrufs)
     */
    public static Path unique(Path dest) {
        Path candidate = dest;
        for (int i = 1; Files.exists(candidate); i++) {
            candidate = withSuffix(dest, i);
        }
        return candidate;
    }

    /**
     * {@code base_<index>.ext} neben {@code dest}.
     *
     * @param dest  Ausgangspfad
     * @param index Zähler ab 1
     * @return Pfad mit Zähler vor der Endung
     */
    public static Path withSuffix(Path dest, int index) {
        String name = dest.getFileName().toString();
        String ext = extensionOf(name);
        String base = name.substring(0, name.length() - ext.length());
        return dest.resolveSibling(base + "_" + index + ext);
    }

    /**
     * Endung inklusive Punkt; führende Punkte (versteckte Dateien) zählen nicht.
     *
     * @param name Dateiname
     * @return z. B. {@code .jpg} oder leer
     */
    public static String extensionOf(String name) {
        if (name == null) return "";
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) return "";
        String base = name.substring(0, dot);
        if (base.chars().allMatch(c -> c == '.')) return "";
        return sanitize(name.substring(dot));
    }

    private static String basename(String path) {
        if (path == null || path.isEmpty()) return "";
        String p = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        return p.substring(p.lastIndexOf('/') + 1);
    }

    private static String percentDecode(String raw) {
        try {
            return URLDecoder.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return raw;
        }
    }

    private static String safeName(String name) {
        return isReserved(name) ? FALLBACK_NAME : name;
    }

    private static boolean isReserved(String name) {
        return name.isEmpty() || name.equals(".") || name.equals("..");
    }
}
