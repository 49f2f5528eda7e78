package de.htwsaar.mediavault.core.retry;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.mediavault.core.dedup.DedupEngine;
import de.htwsaar.mediavault.core.dedup.DedupOptions;
import de.htwsaar.mediavault.core.dedup.DownloadTask;
import de.htwsaar.mediavault.core.dedup.Outcome;
import de.htwsaar.mediavault.core.dedup.RunStats;
import de.htwsaar.mediavault.core.dedup.TaskResult;
import de.htwsaar.mediavault.core.fetch.FailureSidecar;
import de.htwsaar.mediavault.core.fetch.HttpFetcher;
import de.htwsaar.mediavault.core.fetch.RetryPolicy;
import de.htwsaar.mediavault.core.http.HeaderPolicy;
import de.htwsaar.mediavault.core.http.HttpSupport;
import de.htwsaar.mediavault.core.index.SqliteDedupIndex;
import de.htwsaar.mediavault.core.normalize.UrlNormalizer;
import de.htwsaar.mediavault.core.pool.WorkerPool;
import de.htwsaar.mediavault.core.probe.HttpProber;
import de.htwsaar.mediavault.core.ratelimit.RateLimiter;
import de.htwsaar.mediavault.core.testutil.StubMediaServer;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RetryPassTest {

    @TempDir
    Path tmp;

    private StubMediaServer server;
    private SqliteDedupIndex index;
    private HttpFetcher fetcher;
    private RunStats stats;
    private DedupEngine engine;
    private RetryPass retryPass;

    @BeforeEach
    void setUp() throws Exception {
        server = StubMediaServer.start();
        index = SqliteDedupIndex.open(tmp.resolve("index.sqlite"));
        HttpClient client = HttpSupport.newClient(Duration.ofSeconds(2));
        fetcher = new HttpFetcher(client, RateLimiter.unlimited(), HeaderPolicy.defaults(),
                new RetryPolicy(3, Duration.ofMillis(5)), Duration.ofSeconds(5), Duration.ofSeconds(5));
        HttpProber prober = new HttpProber(client, RateLimiter.unlimited(), HeaderPolicy.defaults(), Duration.ofSeconds(3));
        stats = new RunStats();
        engine = new DedupEngine(index, UrlNormalizer.withDefaults(), prober, fetcher, DedupOptions.defaults(), stats);
        retryPass = new RetryPass(new WorkerPool(engine, 2), stats);
    }

    @AfterEach
    void tearDown() {
        fetcher.close();
        index.close();
        server.close();
    }

    @Test
    void failedDownloadIsRecoveredByRetryPass() throws Exception {
        Path folder = tmp.resolve("media").resolve("sub");
        server.serve("/e.jpg", "recovered-bytes").failFirst(3);

        TaskResult failed = engine.process(DownloadTask.of(server.url("/e.jpg?token=t1"), folder, "p5"));
        assertEquals(Outcome.FAILED, failed.outcome());
        Path sidecar = folder.resolve("p5.jpg.failed");
        assertEquals(server.url("/e.jpg?token=t1"), FailureSidecar.read(sidecar).orElseThrow().url());

        RetryPass.Report report = retryPass.run(tmp.resolve("media"));

        assertEquals(1, report.scan().tasks().size());
        assertEquals(Outcome.DOWNLOADED, report.run().results().get(0).outcome());
        assertEquals("recovered-bytes", Files.readString(folder.resolve("p5.jpg")));
        assertFalse(Files.exists(sidecar), "Sidecar muss nach Erfolg entfernt sein");
        assertEquals(1, report.run().stats().recovered());
        assertFalse(index.isFailed(server.url("/e.jpg")));
    }

    @Test
    void retryKeepsSidecarWhenStillFailing() throws Exception {
        Path dest = tmp.resolve("a.jpg");
        server.serve("/a.jpg", "x").status(410);
        FailureSidecar.write(dest, server.url("/a.jpg"), "HTTP 410", null);

        RetryPass.Report report = retryPass.run(tmp);

        assertTrue(report.run().hasFailures());
        assertTrue(Files.exists(FailureSidecar.sidecarFor(dest)));
        assertEquals(0, report.run().stats().recovered());
    }

    @Test
    void scan_staleSidecarIsDeletedAndCountedAsRecovered() throws Exception {
        Path dest = tmp.resolve("there.jpg");
        Files.writeString(dest, "already here");
        FailureSidecar.write(dest, "https://cdn.example/there.jpg", "timeout", null);

        RetryPass.Report report = retryPass.run(tmp);

        assertEquals(List.of(FailureSidecar.sidecarFor(dest)), report.scan().stale());
        assertTrue(report.scan().tasks().isEmpty());
        assertFalse(Files.exists(FailureSidecar.sidecarFor(dest)));
        assertEquals(1, stats.snapshot().recovered());
        assertEquals(0, server.gets(), "nichts darf geladen werden");
    }

    @Test
    void scan_leavesSidecarsWithoutUrlAlone() throws Exception {
        Path marker = tmp.resolve("page.jpg.failed");
        Files.writeString(marker, tmp.resolve("page.jpg") + "\nDetected HTML content.\n---sample---\n<html>\n");
        Files.writeString(tmp.resolve("empty.gif.failed"), "");

        RetryPass.Scan scan = RetryPass.scan(tmp);

        assertEquals(2, scan.notRetryable().size());
        assertTrue(scan.tasks().isEmpty());
        assertTrue(Files.exists(marker));
    }

    @Test
    void scan_buildsRetryTaskForExactTarget() throws Exception {
        Path dest = tmp.resolve("x").resolve("clip.mp4");
        FailureSidecar.write(dest, "https://cdn.example/v/other-name.mp4?sig=1", "HTTP 503", null);

        RetryPass.Scan scan = RetryPass.scan(tmp);

        DownloadTask task = scan.tasks().get(0);
        assertTrue(task.isRetry());
        assertEquals(dest, task.targetPath());
        assertEquals("https://cdn.example/v/other-name.mp4?sig=1", task.url());
    }
}
