package de.htwsaar.mediavault.core.index;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Alle Kennungen, die in einem Schritt mit einem Content-Hash verknüpft werden.
 *
 * @param hash        Content-Hash (MD5-Hex), Pflicht
 * @param path        Pfad einer Datei mit genau diesem Inhalt oder {@code null} (nur Kennungen verknüpfen)
 * @param url         normalisierte URL oder {@code null}
 * @param etag        Remote-ETag oder {@code null}
 * @param fingerprint Teil-Fingerprint der ersten N Bytes oder {@code null}
 */
public record IndexRecord(String hash, Path path, String url, String etag, String fingerprint) {

    public IndexRecord {
        Objects.requireNonNull(hash, "hash must not be null");
        if (hash.isBlank()) {
            throw new IllegalArgumentException("hash must not be blank");
        }
        url = blankToNull(url);
        etag = blankToNull(etag);
        fingerprint = blankToNull(fingerprint);
    }

    public static IndexRecord of(String hash, Path path) {
        return new IndexRecord(hash, path, null, null, null);
    }

    /**
     * Nur Kennungen ohne Dateipfad, z. B. wenn ein ETag-Treffer keine Datei mehr hat.
     *
     * @param hash Content-Hash
     * @return Record ohne Pfad
     */
    public static IndexRecord identifiersOnly(String hash) {
        return new IndexRecord(hash, null, null, null, null);
    }

    public IndexRecord withUrl(String newUrl) {
        return new IndexRecord(hash, path, newUrl, etag, fingerprint);
    }

    public IndexRecord withEtag(String newEtag) {
        return new IndexRecord(hash, path, url, newEtag, fingerprint);
    }

    public IndexRecord withFingerprint(String newFingerprint) {
        return new IndexRecord(hash, path, url, etag, newFingerprint);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
