package de.htwsaar.mediavault.core;

import de.htwsaar.mediavault.core.config.HarvestConfig;
import de.htwsaar.mediavault.core.dedup.DedupEngine;
import de.htwsaar.mediavault.core.dedup.DownloadTask;
import de.htwsaar.mediavault.core.dedup.RunStats;
import de.htwsaar.mediavault.core.dedup.TaskResult;
import de.htwsaar.mediavault.core.fetch.HttpFetcher;
import de.htwsaar.mediavault.core.http.HeaderPolicy;
import de.htwsaar.mediavault.core.http.HttpSupport;
import de.htwsaar.mediavault.core.index.DedupIndex;
import de.htwsaar.mediavault.core.index.IndexAccessException;
import de.htwsaar.mediavault.core.index.SqliteDedupIndex;
import de.htwsaar.mediavault.core.pool.RunReport;
import de.htwsaar.mediavault.core.pool.WorkerPool;
import de.htwsaar.mediavault.core.probe.HttpProber;
import de.htwsaar.mediavault.core.ratelimit.TokenBucket;
import de.htwsaar.mediavault.core.retry.RetryPass;
import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verdrahtet alle Komponenten eines Laufs: ein Index, ein Rate-Limiter, ein HTTP-Client für
 * Prober und Fetcher, eine Engine mit ihren Zählern.
 *
 * <p>{@link #close()} schreibt den Index per Checkpoint zurück und schließt ihn.</p>
 */
public final class HarvestSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HarvestSession.class);

    private final HarvestConfig config;
    private final DedupIndex index;
    private final HttpProber prober;
    private final HttpFetcher fetcher;
    private final RunStats stats;
    private final WorkerPool pool;

    private HarvestSession(HarvestConfig config, DedupIndex index) {
        this.config = config;
        this.index = index;

        HttpClient http = HttpSupport.newClient(Duration.ofSeconds(10));
        TokenBucket limiter = new TokenBucket(config.rate());
        HeaderPolicy headers = new HeaderPolicy(config.userAgent());
        this.prober = new HttpProber(http, limiter, headers, config.probeTimeout());
        this.fetcher = new HttpFetcher(
                http, limiter, headers, config.retryPolicy(), config.headersTimeout(), config.readTimeout());
        this.stats = new RunStats();
        DedupEngine engine = new DedupEngine(index, config.normalizer(), prober, fetcher, config.dedupOptions(), stats);
        this.pool = new WorkerPool(engine, config.workers());
    }

    /**
     * Öffnet den Index aus der Konfiguration und baut die Session.
     *
     * @param config Konfiguration
     * @return Session
     * @throws IndexAccessException wenn der Index nicht geöffnet werden kann
     */
    public static HarvestSession open(HarvestConfig config) {
        Objects.requireNonNull(config, "config");
        SqliteDedupIndex index = SqliteDedupIndex.open(config.effectiveIndexPath());
        log.info(
                "Session: index={} workers={} rate={}/s probe={} fingerprint={} force={}",
                index.location(),
                config.workers(),
                config.rate(),
                config.probe(),
                config.fingerprint(),
                config.force());
        return new HarvestSession(config, index);
    }

    public HarvestConfig config() {
        return config;
    }

    public DedupIndex index() {
        return index;
    }

    public RunStats stats() {
        return stats;
    }

    public RunReport harvest(List<DownloadTask> tasks, Consumer<TaskResult> listener) {
        RunReport report = pool.run(tasks, listener);
        checkpointQuietly();
        return report;
    }

    public RetryPass.Report retry(Path root) throws IOException {
        RetryPass.Report report = new RetryPass(pool, stats).run(root);
        checkpointQuietly();
        return report;
    }

    private void checkpointQuietly() {
        try {
            index.checkpoint();
        } catch (IndexAccessException e) {
            log.warn("Index checkpoint failed: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        try {
            prober.close();
            fetcher.close();
        } finally {
            index.close();
        }
    }
}
