package de.htwsaar.mediavault.cli.command.options;

import de.htwsaar.mediavault.core.config.HarvestConfig;
import de.htwsaar.mediavault.core.config.HarvestConfigLoader;
import de.htwsaar.mediavault.core.config.HarvestConfigPatch;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import picocli.CommandLine.Option;

/**
 * Gemeinsame Konfigurations-Optionen (Picocli-Mixin).
 *
 * <p>Nicht angegebene Optionen bleiben {@code null} und überschreiben damit weder Datei noch
 * Umgebung.
 */
public final class ConfigOptions {

    @Option(names = "--config", paramLabel = "FILE", description = "JSON config file")
    Path configFile;

    @Option(
            names = {"-o", "--output"},
            paramLabel = "DIR",
            description = "Download root; relative task folders resolve against it (default: downloads)")
    Path outputDir;

    @Option(names = "--index", paramLabel = "FILE", description = "Index file (default: <output>/.mediavault-index.sqlite)")
    Path indexPath;

    @Option(names = {"-w", "--workers"}, paramLabel = "N", description = "Parallel workers (default: 4)")
    Integer workers;

    @Option(names = "--rate", paramLabel = "RPS", description = "Requests per second across all workers (default: 4)")
    Double rate;

    @Option(names = "--probe", negatable = true, description = "HEAD probe for ETag/size matches (default: on)")
    Boolean probe;

    @Option(names = "--fingerprint", negatable = true, description = "Partial fingerprint via range request (default: off)")
    Boolean fingerprint;

    @Option(names = "--fingerprint-bytes", paramLabel = "BYTES", description = "Prefix length for fingerprints")
    Integer fingerprintBytes;

    @Option(names = "--retries", paramLabel = "N", description = "Attempts per download (default: 3)")
    Integer retryAttempts;

    @Option(names = "--backoff-ms", paramLabel = "MS", description = "Wait before the second attempt, doubled per retry")
    Long backoffMillis;

    @Option(names = "--read-timeout-sec", paramLabel = "SEC", description = "Abort a download after this long without data")
    Long readTimeoutSeconds;

    @Option(names = "--user-agent", paramLabel = "UA", description = "User-Agent header for all requests")
    String userAgent;

    @Option(
            names = "--strip-query-host",
            paramLabel = "HOST",
            description = "Drop the whole query for this host (repeatable; '.host' includes subdomains)")
    List<String> stripQueryHosts;

    @Option(names = "--force", description = "Skip all dedup checks and always download")
    Boolean force;

    /**
     * Baut die effektive Konfiguration: Defaults, Datei, Umgebung, dann diese Optionen.
     *
     * @param loader Loader aus dem {@code CliContext}
     * @return geprüfte Konfiguration
     * @throws IllegalArgumentException bei ungültigen Werten
     */
    public HarvestConfig load(HarvestConfigLoader loader) {
        return loader.load(configFile, toPatch());
    }

    HarvestConfigPatch toPatch() {
        return new HarvestConfigPatch(
                outputDir,
                indexPath,
                workers,
                rate,
                probe,
                fingerprint,
                fingerprintBytes,
                retryAttempts,
                backoffMillis == null ? null : Duration.ofMillis(backoffMillis),
                null,
                null,
                readTimeoutSeconds == null ? null : Duration.ofSeconds(readTimeoutSeconds),
                userAgent,
                stripQueryHosts == null || stripQueryHosts.isEmpty() ? null : List.copyOf(stripQueryHosts),
                force);
    }
}
