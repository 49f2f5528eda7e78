package de.htwsaar.mediavault.core.probe;

/**
 * Metadaten aus einer HEAD-Anfrage. Beide Felder sind optional.
 *
 * @param contentLength Größe laut {@code Content-Length} oder {@code null}
 * @param etag          {@code ETag}-Header oder {@code null}
 */
public record ProbeResult(Long contentLength, String etag) {

    private static final ProbeResult EMPTY = new ProbeResult(null, null);

    public ProbeResult {
        if (contentLength != null && contentLength < 0) {
            contentLength = null;
        }
        if (etag != null && etag.isBlank()) {
            etag = null;
        }
    }

    public static ProbeResult empty() {
        return EMPTY;
    }

    public boolean hasContentLength() {
        return contentLength != null;
    }

    public boolean hasEtag() {
        return etag != null;
    }
}
