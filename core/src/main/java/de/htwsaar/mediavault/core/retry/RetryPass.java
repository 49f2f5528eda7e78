package de.htwsaar.mediavault.core.retry;

import de.htwsaar.mediavault.core.dedup.DownloadTask;
import de.htwsaar.mediavault.core.dedup.RunStats;
import de.htwsaar.mediavault.core.fetch.FailureSidecar;
import de.htwsaar.mediavault.core.http.HttpSupport;
import de.htwsaar.mediavault.core.pool.RunReport;
import de.htwsaar.mediavault.core.pool.WorkerPool;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sucht {@code .failed}-Sidecars unterhalb eines Verzeichnisses und lädt die Ziele erneut.
 *
 * <p>Existiert das Ziel bereits, ist der Sidecar veraltet: er wird gelöscht und als
 * wiederhergestellt gezählt. Sidecars ohne http(s)-URL in Zeile 1 (z. B. vom HTML-Marker) bleiben
 * unangetastet.</p>
 */
public final class RetryPass {

    private static final Logger log = LoggerFactory.getLogger(RetryPass.class);

    private final WorkerPool pool;
    private final RunStats stats;

    public RetryPass(WorkerPool pool, RunStats stats) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    /**
     * Ergebnis des Scans.
     *
     * @param tasks        erneut zu ladende Ziele
     * @param stale        gelöschte Sidecars, deren Ziel schon existierte
     * @param notRetryable Sidecars ohne verwertbare URL
     */
    public record Scan(List<DownloadTask> tasks, List<Path> stale, List<Path> notRetryable) {

        public Scan {
            tasks = List.copyOf(tasks);
            stale = List.copyOf(stale);
            notRetryable = List.copyOf(notRetryable);
        }
    }

    /**
     * Ergebnis eines Retry-Laufs.
     *
     * @param scan Scan-Ergebnis
     * @param run  Ergebnis der erneuten Downloads
     */
    public record Report(Scan scan, RunReport run) {}

    /**
     * Durchsucht {@code root} rekursiv nach Sidecars.
     *
     * @param root Wurzelverzeichnis
     * @return Scan; veraltete Sidecars sind bereits gelöscht
     * @throws IOException wenn das Verzeichnis nicht gelesen werden kann
     */
    public static Scan scan(Path root) throws IOException {
        Objects.requireNonNull(root, "root");
        List<Path> sidecars;
        try (Stream<Path> walk = Files.walk(root)) {
            sidecars = walk.filter(Files::isRegularFile).filter(FailureSidecar::isSidecar).sorted().toList();
        }

        List<DownloadTask> tasks = new ArrayList<>();
        List<Path> stale = new ArrayList<>();
        List<Path> notRetryable = new ArrayList<>();
        for (Path sidecar : sidecars) {
            Optional<FailureSidecar.Entry> entry = readQuietly(sidecar);
            if (entry.isEmpty() || HttpSupport.parseHttpUri(entry.get().url()).isEmpty()) {
                notRetryable.add(sidecar);
                continue;
            }
            Path destination = FailureSidecar.destinationOf(sidecar);
            if (Files.exists(destination)) {
                Files.deleteIfExists(sidecar);
                stale.add(sidecar);
                log.debug("Removed stale sidecar {}", sidecar);
                continue;
            }
            tasks.add(DownloadTask.retry(entry.get().url(), destination));
        }
        return new Scan(tasks, stale, notRetryable);
    }

    /**
     * Scan und erneuter Download aller gefundenen Ziele.
     *
     * @param root Wurzelverzeichnis
     * @return Bericht
     * @throws IOException wenn das Verzeichnis nicht gelesen werden kann
     */
    public Report run(Path root) throws IOException {
        Scan scan = scan(root);
        scan.stale().forEach(s -> stats.recordRecovered());
        log.info(
                "Retry pass: {} sidecar(s) to retry, {} already recovered, {} not retryable",
                scan.tasks().size(),
                scan.stale().size(),
                scan.notRetryable().size());
        return new Report(scan, pool.run(scan.tasks()));
    }

    private static Optional<FailureSidecar.Entry> readQuietly(Path sidecar) {
        try {
            return FailureSidecar.read(sidecar);
        } catch (IOException e) {
            log.warn("Could not read sidecar {}: {}", sidecar, e.getMessage());
            return Optional.empty();
        }
    }
}
