package de.htwsaar.mediavault.core.fetch;

import java.nio.file.Path;

/**
 * Ergebnis eines Downloads: genau eine Datei oder genau ein Sidecar.
 *
 * @param success  {@code true} wenn die Datei geschrieben wurde
 * @param path     endgültiger Pfad der Datei (nur bei Erfolg)
 * @param sidecar  geschriebener {@code .failed}-Sidecar (nur bei Fehler, {@code null} wenn nicht schreibbar)
 * @param bytes    geschriebene Bytes
 * @param etag     ETag der Antwort oder {@code null}
 * @param attempts Anzahl der HTTP-Versuche
 * @param error    Fehlertext (nur bei Fehler)
 */
public record FetchResult(boolean success, Path path, Path sidecar, long bytes, String etag, int attempts, String error) {

    public static FetchResult downloaded(Path path, long bytes, String etag, int attempts) {
        return new FetchResult(true, path, null, bytes, etag, attempts, null);
    }

    public static FetchResult failed(Path sidecar, String error, int attempts) {
        return new FetchResult(false, null, sidecar, 0L, null, attempts, error == null ? "unknown error" : error);
    }
}
