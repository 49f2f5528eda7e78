package de.htwsaar.mediavault.core.dedup;

/**
 * Schalter der Entscheidungsstufen.
 *
 * @param probe            HEAD-Probe (ETag- und Größen-Stufe)
 * @param fingerprint      Teil-Fingerprint per Range-Request
 * @param fingerprintBytes Länge des Fingerprint-Präfixes
 * @param force            Stufen 1-5 überspringen und immer laden
 */
public record DedupOptions(boolean probe, boolean fingerprint, int fingerprintBytes, boolean force) {

    public static final int DEFAULT_FINGERPRINT_BYTES = 65_536;

    public DedupOptions {
        if (fingerprintBytes < 1) {
            throw new IllegalArgumentException("fingerprintBytes must be >= 1: " + fingerprintBytes);
        }
    }

    public static DedupOptions defaults() {
        return new DedupOptions(true, false, DEFAULT_FINGERPRINT_BYTES, false);
    }
}
