package de.htwsaar.mediavault.core.fetch;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.mediavault.core.http.HeaderPolicy;
import de.htwsaar.mediavault.core.http.HttpSupport;
import de.htwsaar.mediavault.core.ratelimit.RateLimiter;
import de.htwsaar.mediavault.core.testutil.StubMediaServer;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HttpFetcherTest {

    @TempDir
    Path tmp;

    private StubMediaServer server;
    private HttpClient client;
    private HttpFetcher fetcher;
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        server = StubMediaServer.start();
        client = HttpSupport.newClient(Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        if (fetcher != null) fetcher.close();
        server.close();
    }

    private HttpFetcher fetcher(RetryPolicy policy, Duration headersTimeout, Duration readTimeout, AlternateUrlStrategy alt) {
        fetcher = new HttpFetcher(
                client, RateLimiter.unlimited(), HeaderPolicy.defaults(), policy, headersTimeout, readTimeout, alt, sleeps::add);
        return fetcher;
    }

    private HttpFetcher fetcher(RetryPolicy policy) {
        return fetcher(policy, Duration.ofSeconds(5), Duration.ofSeconds(5), AlternateUrlStrategy.none());
    }

    @Test
    void fetch_writesFileUnderUrlBasename() throws Exception {
        server.serve("/img/a.jpg", "jpeg-bytes").etag("\"e1\"");

        FetchResult r = fetcher(RetryPolicy.defaults()).fetch(FetchRequest.of(server.url("/img/a.jpg?sig=x"), tmp, null));

        assertTrue(r.success(), () -> "Download muss gelingen: " + r.error());
        assertEquals(tmp.resolve("a.jpg"), r.path());
        assertEquals("jpeg-bytes", Files.readString(r.path()));
        assertEquals(10, r.bytes());
        assertEquals("\"e1\"", r.etag());
        assertEquals(1, r.attempts());
        assertTrue(sleeps.isEmpty(), "ohne Retry darf nicht gewartet werden");
    }

    @Test
    void fetch_usesSuggestedNameWithUrlExtension() throws Exception {
        server.serve("/media/clip.mp4", "video");

        FetchResult r = fetcher(RetryPolicy.defaults())
                .fetch(FetchRequest.of(server.url("/media/clip.mp4"), tmp, "post 42"));

        assertTrue(r.success());
        assertEquals(tmp.resolve("post_42.mp4"), r.path());
    }

    @Test
    void fetch_appendsCounterOnNameCollision() throws Exception {
        server.serve("/a.jpg", "new");
        Files.writeString(tmp.resolve("a.jpg"), "old-0");
        Files.writeString(tmp.resolve("a_1.jpg"), "old-1");

        FetchResult r = fetcher(RetryPolicy.defaults()).fetch(FetchRequest.of(server.url("/a.jpg"), tmp, null));

        assertEquals(tmp.resolve("a_2.jpg"), r.path());
        assertEquals("old-0", Files.readString(tmp.resolve("a.jpg")), "vorhandene Dateien dürfen nicht überschrieben werden");
        assertEquals("new", Files.readString(r.path()));
    }

    @Test
    void fetch_prefersContentDispositionFilename() throws Exception {
        server.serve("/dl", "payload").contentDisposition("attachment; filename=\"x.bin\"; filename*=UTF-8''caf%C3%A9%20photo.jpg");

        FetchResult r = fetcher(RetryPolicy.defaults()).fetch(FetchRequest.of(server.url("/dl"), tmp, null));

        assertTrue(r.success());
        assertEquals(tmp.resolve("caf__photo.jpg"), r.path());
    }

    @Test
    void fetch_fixedTargetIgnoresContentDisposition() throws Exception {
        server.serve("/dl", "payload").contentDisposition("attachment; filename=\"server.jpg\"");
        Path target = tmp.resolve("R").resolve("p1.jpg");

        FetchResult r = fetcher(RetryPolicy.defaults()).fetch(FetchRequest.forTarget(server.url("/dl"), target));

        assertTrue(r.success());
        assertEquals(target, r.path());
        assertTrue(Files.exists(target), "Retry muss genau das Sidecar-Ziel schreiben");
        assertFalse(Files.exists(target.resolveSibling("server.jpg")));
    }

    @Test
    void fetch_htmlResponseWritesOnlySidecar() throws Exception {
        server.serve("/page.jpg", "<html><body>please log in</body></html>").contentType("text/html; charset=utf-8");

        FetchResult r = fetcher(new RetryPolicy(2, Duration.ofMillis(5))).fetch(FetchRequest.of(server.url("/page.jpg"), tmp, null));

        assertFalse(r.success());
        assertFalse(Files.exists(tmp.resolve("page.jpg")), "HTML darf nicht als Medium gespeichert werden");
        assertEquals(tmp.resolve("page.jpg.failed"), r.sidecar());
        assertEquals(2, server.gets("/page.jpg"));

        List<String> lines = Files.readAllLines(r.sidecar(), StandardCharsets.UTF_8);
        assertEquals(server.url("/page.jpg"), lines.get(0));
        assertTrue(lines.get(1).startsWith("HTML response detected"), lines.get(1));
        assertEquals("HTTP 200", lines.get(2));
        assertTrue(lines.get(3).startsWith("Content-Type: text/html"));
        assertTrue(lines.get(4).contains("please log in"));
        assertEquals(List.of("page.jpg.failed"), listNames(tmp), "keine .part-Reste");
    }

    @Test
    void fetch_retriesTimeoutsWithExponentialBackoff() throws Exception {
        server.serve("/slow.jpg", "finally").timeOutFirst(2, 1500);

        FetchResult r = fetcher(RetryPolicy.defaults(), Duration.ofMillis(300), Duration.ofSeconds(5), AlternateUrlStrategy.none())
                .fetch(FetchRequest.of(server.url("/slow.jpg"), tmp, null));

        assertTrue(r.success(), () -> "dritter Versuch muss gelingen: " + r.error());
        assertEquals(3, r.attempts());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
        assertFalse(Files.exists(FailureSidecar.sidecarFor(r.path())));
    }

    @Test
    void fetch_exhaustedRetriesWriteSidecarWithUrlAndError() throws Exception {
        server.serve("/gone.jpg", "nope").status(404);

        FetchResult r = fetcher(new RetryPolicy(3, Duration.ofMillis(10))).fetch(FetchRequest.of(server.url("/gone.jpg?a=1"), tmp, null));

        assertFalse(r.success());
        assertEquals(3, r.attempts());
        assertEquals("HTTP 404", r.error());
        assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(20)), sleeps);

        Optional<FailureSidecar.Entry> entry = FailureSidecar.read(tmp.resolve("gone.jpg.failed"));
        assertEquals(server.url("/gone.jpg?a=1"), entry.orElseThrow().url());
        assertEquals("HTTP 404", entry.get().error());
        assertFalse(Files.exists(tmp.resolve("gone.jpg")));
    }

    @Test
    void fetch_recoversAfterServerError() throws Exception {
        server.serve("/flaky.png", "png").failFirst(1);

        FetchResult r = fetcher(RetryPolicy.defaults()).fetch(FetchRequest.of(server.url("/flaky.png"), tmp, null));

        assertTrue(r.success());
        assertEquals(2, r.attempts());
        assertEquals(List.of(Duration.ofSeconds(1)), sleeps);
    }

    @Test
    void fetch_successRemovesStaleSidecar() throws Exception {
        server.serve("/a.jpg", "data");
        Path target = tmp.resolve("sub").resolve("a.jpg");
        FailureSidecar.write(target, server.url("/a.jpg"), "HTTP 500", null);

        FetchResult r = fetcher(RetryPolicy.defaults()).fetch(FetchRequest.forTarget(server.url("/a.jpg"), target));

        assertTrue(r.success());
        assertEquals(target, r.path());
        assertFalse(Files.exists(FailureSidecar.sidecarFor(target)), "Sidecar muss nach Erfolg entfernt sein");
    }

    @Test
    void fetch_abortsStalledBody() throws Exception {
        byte[] body = new byte[64 * 1024];
        server.serve("/stall.mp4", body).stallAfter(1024);

        long start = System.nanoTime();
        FetchResult r = fetcher(new RetryPolicy(1, Duration.ZERO), Duration.ofSeconds(5), Duration.ofMillis(400), AlternateUrlStrategy.none())
                .fetch(FetchRequest.of(server.url("/stall.mp4"), tmp, null));
        Duration took = Duration.ofNanos(System.nanoTime() - start);

        assertFalse(r.success());
        assertTrue(r.error().contains("read timed out"), r.error());
        assertTrue(took.compareTo(Duration.ofSeconds(10)) < 0, "Stillstand muss vor dem Server-Timeout erkannt werden: " + took);
        assertFalse(Thread.currentThread().isInterrupted(), "Watchdog-Interrupt darf nicht durchsickern");
        assertEquals(List.of("stall.mp4.failed"), listNames(tmp));
    }

    @Test
    void fetch_triesAlternateUrlAfterLastAttempt() throws Exception {
        server.serve("/clip.mp4", "").status(404);
        server.serve("/clip-mobile.mp4", "mobile");
        AlternateUrlStrategy alt = uri -> Optional.of(URI.create(server.url("/clip-mobile.mp4")));

        FetchResult r = fetcher(new RetryPolicy(2, Duration.ofMillis(1)), Duration.ofSeconds(5), Duration.ofSeconds(5), alt)
                .fetch(FetchRequest.of(server.url("/clip.mp4"), tmp, null));

        assertTrue(r.success());
        assertEquals(tmp.resolve("clip.mp4"), r.path(), "Ziel bleibt das der ursprünglichen URL");
        assertEquals("mobile", Files.readString(r.path()));
        assertEquals(2, server.gets("/clip.mp4"));
        assertEquals(1, server.gets("/clip-mobile.mp4"));
    }

    @Test
    void fetch_malformedUrlFailsWithoutRequest() throws Exception {
        FetchResult r = fetcher(RetryPolicy.defaults()).fetch(FetchRequest.of("ftp://example.org/y.jpg", tmp, null));

        assertFalse(r.success());
        assertEquals(0, r.attempts());
        assertTrue(Files.exists(tmp.resolve("y.jpg.failed")));
        assertEquals(0, server.gets());
    }

    @Test
    void fetch_consumesOneTokenPerAttempt() throws Exception {
        server.serve("/x.jpg", "x").failFirst(2);
        CountingLimiter limiter = new CountingLimiter();
        fetcher = new HttpFetcher(client, limiter, HeaderPolicy.defaults(), RetryPolicy.defaults(),
                Duration.ofSeconds(5), Duration.ofSeconds(5), AlternateUrlStrategy.none(), sleeps::add);

        assertTrue(fetcher.fetch(FetchRequest.of(server.url("/x.jpg"), tmp, null)).success());
        assertEquals(3, limiter.acquired);
    }

    private static List<String> listNames(Path dir) throws Exception {
        try (Stream<Path> s = Files.list(dir)) {
            return s.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }

    private static final class CountingLimiter implements RateLimiter {
        private volatile int acquired;

        @Override
        public synchronized void acquire(int permits) {
            acquired += permits;
        }

        @Override
        public boolean tryAcquire(int permits) {
            acquire(permits);
            return true;
        }
    }
}
