package de.htwsaar.mediavault.core.dedup;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Ergebnis eines Tasks.
 *
 * @param task      der verarbeitete Task
 * @param url       normalisierte URL
 * @param finalPath Datei, die den Inhalt jetzt hält, oder {@code null}
 * @param outcome   Endzustand
 * @param tier      entscheidende Stufe ({@code null} bei Fehlern vor der ersten Stufe)
 * @param bytes     übertragene Bytes (nur bei {@link Outcome#DOWNLOADED})
 * @param error     Fehlertext (nur bei {@link Outcome#FAILED})
 */
public record TaskResult(
        DownloadTask task, String url, Path finalPath, Outcome outcome, MatchTier tier, long bytes, String error) {

    public TaskResult {
        Objects.requireNonNull(task, "task must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
    }

    public static TaskResult downloaded(DownloadTask task, String url, Path path, MatchTier tier, long bytes) {
        return new TaskResult(task, url, path, Outcome.DOWNLOADED, tier, bytes, null);
    }

    public static TaskResult skipped(DownloadTask task, String url, Path path, MatchTier tier) {
        return new TaskResult(task, url, path, Outcome.SKIPPED, tier, 0L, null);
    }

    public static TaskResult failed(DownloadTask task, String url, Path sidecar, String error) {
        return new TaskResult(task, url, sidecar, Outcome.FAILED, null, 0L, error == null ? "unknown error" : error);
    }
}
