package de.htwsaar.mediavault.core.dedup;

import de.htwsaar.mediavault.common.util.DigestUtil;
import de.htwsaar.mediavault.core.fetch.FailureSidecar;
import de.htwsaar.mediavault.core.fetch.FetchResult;
import de.htwsaar.mediavault.core.fetch.Fetcher;
import de.htwsaar.mediavault.core.fetch.FilenameResolver;
import de.htwsaar.mediavault.core.http.HttpSupport;
import de.htwsaar.mediavault.core.index.DedupIndex;
import de.htwsaar.mediavault.core.index.IndexAccessException;
import de.htwsaar.mediavault.core.index.IndexRecord;
import de.htwsaar.mediavault.core.index.PathEntry;
import de.htwsaar.mediavault.core.index.RecordOutcome;
import de.htwsaar.mediavault.core.normalize.UrlNormalizer;
import de.htwsaar.mediavault.core.probe.ProbeResult;
import de.htwsaar.mediavault.core.probe.Prober;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entscheidet pro Task: überspringen, vorhandene Datei verlinken oder herunterladen.
 *
 * <p>Stufen in dieser Reihenfolge, die erste passende gewinnt:
 * <ol>
 *   <li>normalisierte URL bekannt und Datei vorhanden: verlinken</li>
 *   <li>URL bekannt, aber keine Datei mehr: überspringen ohne Datei</li>
 *   <li>ETag aus der HEAD-Probe bekannt</li>
 *   <li>Content-Length gleich einer indexierten Datei (Heuristik)</li>
 *   <li>Teil-Fingerprint der ersten N Bytes bekannt</li>
 *   <li>vollständiger Download, danach Duplikat-Prüfung über den MD5-Hash</li>
 * </ol>
 *
 * <p>Fehler des Index führen nie zum Abbruch: sie werden geloggt und wie "keine Information"
 * behandelt, im Zweifel wird also geladen.</p>
 */
public final class DedupEngine {

    private static final Logger log = LoggerFactory.getLogger(DedupEngine.class);
    private static final Logger fileLog = LoggerFactory.getLogger("mediavault.file");

    private final DedupIndex index;
    private final UrlNormalizer normalizer;
    private final Prober prober;
    private final Fetcher fetcher;
    private final DedupOptions options;
    private final RunStats stats;
    private final FingerprintCache fingerprintCache;

    public DedupEngine(
            DedupIndex index,
            UrlNormalizer normalizer,
            Prober prober,
            Fetcher fetcher,
            DedupOptions options,
            RunStats stats) {
        this.index = Objects.requireNonNull(index, "index");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.prober = Objects.requireNonNull(prober, "prober");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.options = Objects.requireNonNull(options, "options");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.fingerprintCache = new FingerprintCache(options.fingerprintBytes());
    }

    public RunStats stats() {
        return stats;
    }

    public FingerprintCache fingerprintCache() {
        return fingerprintCache;
    }

    /**
     * Verarbeitet einen Task vollständig und zählt das Ergebnis.
     *
     * @param task Task
     * @return Ergebnis; Fehler werden als {@link Outcome#FAILED} gemeldet
     */
    public TaskResult process(DownloadTask task) {
        Objects.requireNonNull(task, "task");
        stats.recordAttempt();
        TaskResult result = decide(task);
        finish(result);
        return result;
    }

    /**
     * Meldet einen unerwarteten Abbruch der Verarbeitung als Fehlschlag: Sidecar am
     * beabsichtigten Ziel, Eintrag in der Fehlerliste, Zähler.
     *
     * @param task  betroffener Task
     * @param cause Ursache
     * @return Fehler-Ergebnis
     */
    public TaskResult crashed(DownloadTask task, Throwable cause) {
        String norm = normalizer.normalize(task.url());
        String error = "unexpected error: " + cause;
        Path intended = FilenameResolver.intendedDestination(
                task.toFetchRequest(), HttpSupport.parseHttpUri(task.url()).orElse(null));
        Path sidecar = null;
        try {
            sidecar = FailureSidecar.write(intended, task.url(), error, null);
        } catch (IOException e) {
            log.warn("[{}] Could not write sidecar {}: {}", task.id(), intended, e.getMessage());
        }
        quietly("markFailed", () -> {
            index.markFailed(norm, error);
            return null;
        });
        TaskResult result = TaskResult.failed(task, norm, sidecar, error);
        finish(result);
        return result;
    }

    private void finish(TaskResult result) {
        stats.record(result);
        DownloadTask task = result.task();
        if (task.isRetry() && result.outcome() != Outcome.FAILED) {
            stats.recordRecovered();
            try {
                FailureSidecar.deleteFor(task.targetPath());
            } catch (IOException e) {
                log.warn("[{}] Could not remove sidecar of {}: {}", task.id(), task.targetPath(), e.getMessage());
            }
        }

        String label = HostLabel.of(task.url());
        String file = result.finalPath() == null || result.finalPath().getFileName() == null
                ? "-"
                : result.finalPath().getFileName().toString();
        switch (result.outcome()) {
            case DOWNLOADED -> log.info("[{}] [{}] Downloaded {}", task.id(), label, file);
            case SKIPPED -> log.info("[{}] [{}] Skipped {} ({})", task.id(), label, file, result.tier());
            case FAILED -> log.warn("[{}] [{}] Failed: {}", task.id(), label, result.error());
        }
        fileLog.info(
                "{} {} -> {} tier={} bytes={}{}",
                result.outcome(),
                task.url(),
                result.finalPath() == null ? "-" : result.finalPath(),
                result.tier(),
                result.bytes(),
                result.error() == null ? "" : " error=" + result.error());
    }

    private TaskResult decide(DownloadTask task) {
        String norm = normalizer.normalize(task.url());
        if (options.force()) {
            return fetchFresh(task, norm, null, true);
        }

        // Stufe 1 und 2: URL
        Optional<String> byUrl = quietly("lookupByUrl", () -> index.lookupByUrl(norm)).flatMap(o -> o);
        if (byUrl.isPresent()) {
            Optional<Path> existing = existingPath(byUrl.get());
            if (existing.isPresent()) {
                Path linked = linkInto(task, byUrl.get(), existing.get(), IndexRecord.identifiersOnly(byUrl.get()));
                return TaskResult.skipped(task, norm, linked, MatchTier.URL);
            }
            // Retry-Tasks brauchen eine Datei am Ziel: ohne vorhandene Kopie neu laden
            if (!task.isRetry()) {
                return TaskResult.skipped(task, norm, null, MatchTier.URL_WITHOUT_FILE);
            }
        }

        // Stufe 3 und 4: HEAD-Probe
        ProbeResult probe = ProbeResult.empty();
        if (options.probe()) {
            probe = prober.probe(task.url());
            if (probe.hasEtag()) {
                String etag = probe.etag();
                Optional<String> byEtag = quietly("lookupByEtag", () -> index.lookupByEtag(etag)).flatMap(o -> o);
                if (byEtag.isPresent()) {
                    IndexRecord link = IndexRecord.identifiersOnly(byEtag.get()).withUrl(norm);
                    Optional<Path> existing = existingPath(byEtag.get());
                    if (existing.isPresent()) {
                        return TaskResult.skipped(task, norm, linkInto(task, byEtag.get(), existing.get(), link), MatchTier.ETAG);
                    }
                    recordQuietly(link);
                    if (!task.isRetry()) {
                        return TaskResult.skipped(task, norm, null, MatchTier.ETAG_WITHOUT_FILE);
                    }
                }
            }
            if (probe.hasContentLength()) {
                Optional<PathEntry> sameSize = findBySize(probe.contentLength());
                if (sameSize.isPresent()) {
                    PathEntry e = sameSize.get();
                    IndexRecord link = IndexRecord.identifiersOnly(e.hash()).withUrl(norm).withEtag(probe.etag());
                    return TaskResult.skipped(task, norm, linkInto(task, e.hash(), e.path(), link), MatchTier.CONTENT_LENGTH);
                }
            }
        }

        // Stufe 5: Teil-Fingerprint
        if (options.fingerprint()) {
            Optional<byte[]> prefix = prober.fetchPrefix(task.url(), options.fingerprintBytes());
            if (prefix.isPresent() && prefix.get().length > 0) {
                String remoteFp = DigestUtil.sha256Hex(prefix.get());
                Optional<PathEntry> match = findByFingerprint(remoteFp);
                if (match.isPresent()) {
                    PathEntry e = match.get();
                    IndexRecord link = IndexRecord.identifiersOnly(e.hash()).withUrl(norm).withFingerprint(remoteFp);
                    return TaskResult.skipped(task, norm, linkInto(task, e.hash(), e.path(), link), MatchTier.FINGERPRINT);
                }
            }
        }

        // Stufe 6: laden
        return fetchFresh(task, norm, probe.etag(), false);
    }

    private TaskResult fetchFresh(DownloadTask task, String norm, String probedEtag, boolean forced) {
        FetchResult fetched = fetcher.fetch(task.toFetchRequest());
        if (!fetched.success()) {
            quietly("markFailed", () -> {
                index.markFailed(norm, fetched.error());
                return null;
            });
            return TaskResult.failed(task, norm, fetched.sidecar(), fetched.error());
        }

        Path file = fetched.path();
        MatchTier tier = forced ? MatchTier.FORCED : MatchTier.FETCH;
        String md5;
        try {
            md5 = DigestUtil.md5Hex(file);
        } catch (IOException e) {
            log.warn("[{}] Could not hash {}: {}", task.id(), file, e.getMessage());
            return TaskResult.downloaded(task, norm, file, tier, fetched.bytes());
        }

        IndexRecord record = IndexRecord.of(md5, file)
                .withUrl(norm)
                .withEtag(fetched.etag() != null ? fetched.etag() : probedEtag)
                .withFingerprint(options.fingerprint() ? localFingerprint(file) : null);

        RecordOutcome outcome = RecordOutcome.stored(file);
        if (forced) {
            recordQuietly(record);
        } else {
            Optional<RecordOutcome> recorded = quietly("recordDownload", () -> index.recordDownload(record));
            if (recorded.isPresent()) {
                outcome = recorded.get();
            }
        }
        quietly("clearFailed", () -> {
            index.clearFailed(norm);
            return null;
        });

        if (outcome.duplicate()) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                log.warn("[{}] Could not delete duplicate {}: {}", task.id(), file, e.getMessage());
            }
            log.debug("[{}] {} duplicates {}", task.id(), file, outcome.path());
            return TaskResult.skipped(task, norm, outcome.path(), MatchTier.DUPLICATE);
        }
        return TaskResult.downloaded(task, norm, file, tier, fetched.bytes());
    }

    /**
     * Stellt die Datei {@code existing} am Ziel des Tasks bereit (Hardlink, sonst Kopie) und
     * registriert den neuen Pfad samt {@code identifiers}.
     *
     * @return Pfad, der den Inhalt für diesen Task hält
     */
    private Path linkInto(DownloadTask task, String hash, Path existing, IndexRecord identifiers) {
        Path target = linkTarget(task, existing);
        boolean created = false;
        if (!sameFile(target, existing)) {
            try {
                if (Files.exists(target) && !holdsContent(target, existing, hash)) {
                    Path free = freeOrSameContent(target, existing, hash);
                    log.info("[{}] {} holds other content, linking to {}", task.id(), target, free);
                    target = free;
                }
                if (!Files.exists(target)) {
                    created = materialize(existing, target);
                    if (!created && !holdsContent(target, existing, hash)) {
                        // zwischenzeitlich von anderem Inhalt belegt
                        log.warn("[{}] {} was taken concurrently, keeping {}", task.id(), target, existing);
                        recordQuietly(identifiers);
                        return existing;
                    }
                }
            } catch (IOException e) {
                log.warn("[{}] Could not link {} to {}: {}", task.id(), existing, target, e.getMessage());
                recordQuietly(identifiers);
                return existing;
            }
        }
        if (created && !task.isRetry()) {
            stats.recordRecovered();
        }
        recordQuietly(new IndexRecord(hash, target, identifiers.url(), identifiers.etag(), identifiers.fingerprint()));
        return target;
    }

    /** Erster Kandidat {@code base_n.ext}, der frei ist oder den Inhalt schon hält. */
    private static Path freeOrSameContent(Path target, Path existing, String hash) throws IOException {
        for (int i = 1; ; i++) {
            Path candidate = FilenameResolver.withSuffix(target, i);
            if (!Files.exists(candidate) || holdsContent(candidate, existing, hash)) {
                return candidate;
            }
        }
    }

    /** {@code true}, wenn {@code target} dieselbe Datei wie {@code existing} ist oder denselben MD5-Hash hat. */
    private static boolean holdsContent(Path target, Path existing, String hash) throws IOException {
        if (!Files.isRegularFile(target)) {
            return false;
        }
        if (Files.isSameFile(target, existing)) {
            return true;
        }
        return hash.equalsIgnoreCase(DigestUtil.md5Hex(target));
    }

    private static Path linkTarget(DownloadTask task, Path existing) {
        if (task.targetPath() != null) {
            return task.targetPath();
        }
        String existingName = existing.getFileName().toString();
        if (task.name() != null) {
            return task.folder().resolve(FilenameResolver.sanitize(task.name()) + FilenameResolver.extensionOf(existingName));
        }
        return task.folder().resolve(existingName);
    }

    private static boolean materialize(Path existing, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try {
            Files.createLink(target, existing);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        } catch (IOException | UnsupportedOperationException e) {
            // Hardlinks über Dateisystemgrenzen hinweg nicht möglich
            try {
                Files.copy(existing, target, StandardCopyOption.COPY_ATTRIBUTES);
                return true;
            } catch (FileAlreadyExistsException exists) {
                return false;
            }
        }
    }

    private static boolean sameFile(Path a, Path b) {
        return a.toAbsolutePath().normalize().equals(b.toAbsolutePath().normalize());
    }

    private Optional<Path> existingPath(String hash) {
        return quietly("pathsFor", () -> index.existingPathFor(hash)).flatMap(o -> o);
    }

    private Optional<PathEntry> findBySize(long contentLength) {
        List<PathEntry> entries = quietly("entries", index::entries).orElse(List.of());
        for (PathEntry e : entries) {
            try {
                if (Files.isRegularFile(e.path()) && Files.size(e.path()) == contentLength) {
                    return Optional.of(e);
                }
            } catch (IOException ex) {
                log.debug("Could not stat {}: {}", e.path(), ex.getMessage());
            }
        }
        return Optional.empty();
    }

    private Optional<PathEntry> findByFingerprint(String remoteFp) {
        Optional<String> known = quietly("lookupByFingerprint", () -> index.lookupByFingerprint(remoteFp))
                .flatMap(o -> o);
        if (known.isPresent()) {
            Optional<Path> existing = existingPath(known.get());
            if (existing.isPresent()) {
                return Optional.of(new PathEntry(known.get(), existing.get()));
            }
        }
        List<PathEntry> entries = quietly("entries", index::entries).orElse(List.of());
        return fingerprintCache.findMatch(remoteFp, entries);
    }

    private String localFingerprint(Path file) {
        try {
            return DigestUtil.sha256PrefixHex(file, options.fingerprintBytes());
        } catch (IOException e) {
            log.debug("Could not fingerprint {}: {}", file, e.getMessage());
            return null;
        }
    }

    private void recordQuietly(IndexRecord record) {
        quietly("record", () -> {
            index.record(record);
            return null;
        });
    }

    /**
     * Führt einen Index-Aufruf aus; Fehler werden geloggt und als "keine Information" geliefert.
     */
    private static <T> Optional<T> quietly(String operation, Supplier<T> call) {
        try {
            return Optional.ofNullable(call.get());
        } catch (IndexAccessException e) {
            log.warn("Index {} failed, continuing without: {}", operation, e.getMessage());
            return Optional.empty();
        }
    }
}
