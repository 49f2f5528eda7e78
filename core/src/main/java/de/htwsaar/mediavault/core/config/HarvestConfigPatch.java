package de.htwsaar.mediavault.core.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Teilweise Konfiguration aus einer Quelle (JSON-Datei, Umgebung, Kommandozeile).
 * {@code null} bedeutet "nicht gesetzt".
 */
public record HarvestConfigPatch(
        Path outputDir,
        Path indexPath,
        Integer workers,
        Double rate,
        Boolean probe,
        Boolean fingerprint,
        Integer fingerprintBytes,
        Integer retryAttempts,
        Duration backoffBase,
        Duration probeTimeout,
        Duration headersTimeout,
        Duration readTimeout,
        String userAgent,
        List<String> stripQueryHosts,
        Boolean force) {

    public static HarvestConfigPatch empty() {
        return new HarvestConfigPatch(
                null, null, null, null, null, null, null, null, null, null, null, null, null, null, null);
    }
}
