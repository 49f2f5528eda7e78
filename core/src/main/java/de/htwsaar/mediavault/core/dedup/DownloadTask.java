package de.htwsaar.mediavault.core.dedup;

import de.htwsaar.mediavault.core.fetch.FetchRequest;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Eine Arbeitseinheit: Medien-URL plus Ziel.
 *
 * @param url        rohe Medien-URL aus dem Collector
 * @param folder     Zielordner
 * @param name       vorgeschlagener Basisname (z. B. Post-ID) oder {@code null}
 * @param targetPath exakter Zielpfad (nur Retry-Pass) oder {@code null}
 */
public record DownloadTask(String url, Path folder, String name, Path targetPath) {

    public DownloadTask {
        Objects.requireNonNull(url, "url must not be null");
        if (url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        if (folder == null && targetPath != null) {
            folder = targetPath.toAbsolutePath().getParent();
        }
        Objects.requireNonNull(folder, "folder must not be null");
        if (name != null && name.isBlank()) {
            name = null;
        }
    }

    public static DownloadTask of(String url, Path folder, String name) {
        return new DownloadTask(url, folder, name, null);
    }

    public static DownloadTask retry(String url, Path targetPath) {
        Objects.requireNonNull(targetPath, "targetPath must not be null");
        return new DownloadTask(url, null, null, targetPath);
    }

    public boolean isRetry() {
        return targetPath != null;
    }

    /**
     * Kennung für Logs: Name, sonst Dateiname des Ziels, sonst die URL.
     *
     * @return Kennung
     */
    public String id() {
        if (name != null) return name;
        if (targetPath != null && targetPath.getFileName() != null) return targetPath.getFileName().toString();
        return url;
    }

    public FetchRequest toFetchRequest() {
        return new FetchRequest(url, folder, name, targetPath);
    }
}
