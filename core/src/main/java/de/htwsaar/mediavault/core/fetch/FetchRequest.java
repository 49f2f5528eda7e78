package de.htwsaar.mediavault.core.fetch;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Eingabe für einen Download.
 *
 * @param url           Quell-URL (roh, ggf. mit {@code &amp;})
 * @param folder        Zielordner
 * @param suggestedName Basisname ohne Endung (z. B. Post-ID) oder {@code null}
 * @param targetPath    exakter Zielpfad (Retry-Pass) oder {@code null}
 */
public record FetchRequest(String url, Path folder, String suggestedName, Path targetPath) {

    public FetchRequest {
        Objects.requireNonNull(url, "url must not be null");
        if (folder == null && targetPath != null) {
            folder = targetPath.toAbsolutePath().getParent();
        }
        Objects.requireNonNull(folder, "folder must not be null");
        if (suggestedName != null && suggestedName.isBlank()) {
            suggestedName = null;
        }
    }

    public static FetchRequest of(String url, Path folder, String suggestedName) {
        return new FetchRequest(url, folder, suggestedName, null);
    }

    public static FetchRequest forTarget(String url, Path targetPath) {
        Objects.requireNonNull(targetPath, "targetPath must not be null");
        return new FetchRequest(url, null, null, targetPath);
    }
}
