package de.htwsaar.mediavault.core.config;

import de.htwsaar.mediavault.core.dedup.DedupOptions;
import de.htwsaar.mediavault.core.fetch.HttpFetcher;
import de.htwsaar.mediavault.core.fetch.RetryPolicy;
import de.htwsaar.mediavault.core.http.HeaderPolicy;
import de.htwsaar.mediavault.core.normalize.HostRule;
import de.htwsaar.mediavault.core.normalize.UrlNormalizer;
import de.htwsaar.mediavault.core.probe.HttpProber;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Konfiguration eines Laufs. Unveränderlich; Werte werden im Konstruktor geprüft.
 *
 * @param outputDir        Wurzel der Downloads
 * @param indexPath        SQLite-Datei des Index ({@code null}: {@code <outputDir>/.mediavault-index.sqlite})
 * @param workers          parallele Worker
 * @param rate             Requests pro Sekunde über alle Worker
 * @param probe            HEAD-Probe (ETag- und Größen-Stufe)
 * @param fingerprint      Teil-Fingerprint per Range-Request
 * @param fingerprintBytes Länge des Fingerprint-Präfixes
 * @param retryAttempts    Versuche pro Download
 * @param backoffBase      Wartezeit vor dem zweiten Versuch
 * @param probeTimeout     Timeout für HEAD und Range-Read
 * @param headersTimeout   Timeout bis zu den Response-Headern eines Downloads
 * @param readTimeout      maximale Zeit ohne Datenfluss im Body
 * @param userAgent        User-Agent aller Requests
 * @param stripQueryHosts  zusätzliche Host-Regeln ({@code host} exakt, {@code .host} inkl. Subdomains)
 * @param force            Dedup-Stufen 1-5 überspringen
 */
public record HarvestConfig(
        Path outputDir,
        Path indexPath,
        int workers,
        double rate,
        boolean probe,
        boolean fingerprint,
        int fingerprintBytes,
        int retryAttempts,
        Duration backoffBase,
        Duration probeTimeout,
        Duration headersTimeout,
        Duration readTimeout,
        String userAgent,
        List<String> stripQueryHosts,
        boolean force) {

    public static final String INDEX_FILE_NAME = ".mediavault-index.sqlite";

    public HarvestConfig {
        Objects.requireNonNull(outputDir, "outputDir must not be null");
        Objects.requireNonNull(backoffBase, "backoffBase must not be null");
        Objects.requireNonNull(probeTimeout, "probeTimeout must not be null");
        Objects.requireNonNull(headersTimeout, "headersTimeout must not be null");
        Objects.requireNonNull(readTimeout, "readTimeout must not be null");
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1: " + workers);
        }
        if (!(rate > 0) || Double.isInfinite(rate)) {
            throw new IllegalArgumentException("rate must be a positive number: " + rate);
        }
        if (fingerprintBytes < 1) {
            throw new IllegalArgumentException("fingerprintBytes must be >= 1: " + fingerprintBytes);
        }
        if (retryAttempts < 1) {
            throw new IllegalArgumentException("retryAttempts must be >= 1: " + retryAttempts);
        }
        requirePositive("probeTimeout", probeTimeout);
        requirePositive("headersTimeout", headersTimeout);
        requirePositive("readTimeout", readTimeout);
        if (backoffBase.isNegative()) {
            throw new IllegalArgumentException("backoffBase must not be negative: " + backoffBase);
        }
        if (userAgent == null || userAgent.isBlank()) {
            userAgent = HeaderPolicy.DEFAULT_USER_AGENT;
        }
        stripQueryHosts = stripQueryHosts == null ? List.of() : List.copyOf(stripQueryHosts);
        stripQueryHosts.forEach(HostRule::parse);
    }

    public static HarvestConfig defaults() {
        return new HarvestConfig(
                Path.of("downloads"),
                null,
                4,
                4.0,
                true,
                false,
                DedupOptions.DEFAULT_FINGERPRINT_BYTES,
                RetryPolicy.DEFAULT_ATTEMPTS,
                RetryPolicy.DEFAULT_BACKOFF,
                HttpProber.DEFAULT_TIMEOUT,
                HttpFetcher.DEFAULT_HEADERS_TIMEOUT,
                HttpFetcher.DEFAULT_READ_TIMEOUT,
                HeaderPolicy.DEFAULT_USER_AGENT,
                List.of(),
                false);
    }

    public Path effectiveIndexPath() {
        return indexPath != null ? indexPath : outputDir.resolve(INDEX_FILE_NAME);
    }

    public DedupOptions dedupOptions() {
        return new DedupOptions(probe, fingerprint, fingerprintBytes, force);
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(retryAttempts, backoffBase);
    }

    /**
     * Standard-Regeln plus die konfigurierten Zusatz-Hosts.
     *
     * @return Normalizer
     */
    public UrlNormalizer normalizer() {
        List<HostRule> rules = new ArrayList<>(UrlNormalizer.defaultRules());
        stripQueryHosts.stream().map(HostRule::parse).forEach(rules::add);
        return new UrlNormalizer(rules);
    }

    /**
     * Übernimmt alle gesetzten Felder des Patches.
     *
     * @param p Patch (nur nicht-{@code null}-Felder zählen)
     * @return neue Konfiguration
     */
    public HarvestConfig merge(HarvestConfigPatch p) {
        if (p == null) return this;
        return new HarvestConfig(
                p.outputDir() != null ? p.outputDir() : outputDir,
                p.indexPath() != null ? p.indexPath() : indexPath,
                p.workers() != null ? p.workers() : workers,
                p.rate() != null ? p.rate() : rate,
                p.probe() != null ? p.probe() : probe,
                p.fingerprint() != null ? p.fingerprint() : fingerprint,
                p.fingerprintBytes() != null ? p.fingerprintBytes() : fingerprintBytes,
                p.retryAttempts() != null ? p.retryAttempts() : retryAttempts,
                p.backoffBase() != null ? p.backoffBase() : backoffBase,
                p.probeTimeout() != null ? p.probeTimeout() : probeTimeout,
                p.headersTimeout() != null ? p.headersTimeout() : headersTimeout,
                p.readTimeout() != null ? p.readTimeout() : readTimeout,
                p.userAgent() != null ? p.userAgent() : userAgent,
                p.stripQueryHosts() != null ? p.stripQueryHosts() : stripQueryHosts,
                p.force() != null ? p.force() : force);
    }

    private static void requirePositive(String name, Duration d) {
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive: " + d);
        }
    }
}
