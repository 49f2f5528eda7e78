package de.htwsaar.mediavault.core.fetch;

import de.htwsaar.mediavault.core.http.HeaderPolicy;
import de.htwsaar.mediavault.core.http.HttpSupport;
import de.htwsaar.mediavault.core.http.StallWatchdog;
import de.htwsaar.mediavault.core.ratelimit.RateLimitInterruptedException;
import de.htwsaar.mediavault.core.ratelimit.RateLimiter;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streamt Medien auf die Platte, mit Retry/Backoff und Failure-Sidecars.
 *
 * <p>Ablauf pro Versuch:
 * <ol>
 *   <li>Rate-Limiter-Token holen, GET senden (Timeout bis zu den Headern)</li>
 *   <li>Nicht-2xx oder HTML-Content-Type: Fehlschlag, nichts wird geschrieben</li>
 *   <li>Zielname bestimmen (Content-Disposition, sonst beabsichtigtes Ziel; Kollisionen mit _1, _2, ...)</li>
 *   <li>Body in eine {@code .part}-Datei streamen (Stall-Watchdog), dann verschieben</li>
 * </ol>
 *
 * <p>Nach dem letzten erfolglosen Versuch wird einmal die alternative URL probiert, danach der
 * Sidecar {@code <ziel>.failed} geschrieben. Ein Erfolg entfernt einen vorhandenen Sidecar.</p>
 */
public final class HttpFetcher implements Fetcher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpFetcher.class);

    public static final Duration DEFAULT_HEADERS_TIMEOUT = Duration.ofSeconds(25);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(25);

    static final int DIAGNOSTIC_BODY_CHARS = 2000;
    private static final int BUFFER_SIZE = 8 * 1024;

    private final HttpClient httpClient;
    private final RateLimiter rateLimiter;
    private final HeaderPolicy headers;
    private final RetryPolicy retryPolicy;
    private final Duration headersTimeout;
    private final AlternateUrlStrategy alternates;
    private final Sleeper sleeper;
    private final StallWatchdog watchdog;

    public HttpFetcher(
            HttpClient httpClient,
            RateLimiter rateLimiter,
            HeaderPolicy headers,
            RetryPolicy retryPolicy,
            Duration headersTimeout,
            Duration readTimeout) {
        this(
                httpClient,
                rateLimiter,
                headers,
                retryPolicy,
                headersTimeout,
                readTimeout,
                AlternateUrlStrategy.redgifsMobile(),
                d -> TimeUnit.MILLISECONDS.sleep(d.toMillis()));
    }

    HttpFetcher(
            HttpClient httpClient,
            RateLimiter rateLimiter,
            HeaderPolicy headers,
            RetryPolicy retryPolicy,
            Duration headersTimeout,
            Duration readTimeout,
            AlternateUrlStrategy alternates,
            Sleeper sleeper) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.headers = Objects.requireNonNull(headers, "headers");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.headersTimeout = Objects.requireNonNull(headersTimeout, "headersTimeout");
        this.alternates = Objects.requireNonNull(alternates, "alternates");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.watchdog = new StallWatchdog(Objects.requireNonNull(readTimeout, "readTimeout").toMillis());
    }

    @Override
    public FetchResult fetch(FetchRequest request) {
        Objects.requireNonNull(request, "request");
        Optional<URI> parsed = HttpSupport.parseHttpUri(request.url());
        Path intended = FilenameResolver.intendedDestination(request, parsed.orElse(null));

        if (parsed.isEmpty()) {
            return fail(request, intended, new Attempt("unsupported or malformed URL: " + request.url()), 0);
        }

        URI uri = parsed.get();
        Attempt last = null;
        int attempt = 1;
        for (; attempt <= retryPolicy.attempts(); attempt++) {
            if (attempt > 1) {
                Duration delay = retryPolicy.delayBefore(attempt);
                log.debug("Retry {}/{} for {} in {} ms", attempt, retryPolicy.attempts(), uri, delay.toMillis());
                if (!pause(delay)) {
                    last = new Attempt("interrupted");
                    break;
                }
            }

            last = attemptOnce(uri, intended, request.targetPath() != null);
            if (last.ok()) {
                return succeed(intended, last, attempt);
            }
            log.debug("Attempt {}/{} for {} failed: {}", attempt, retryPolicy.attempts(), uri, last.error());
            if (last.interrupted()) break;

            if (attempt == retryPolicy.attempts()) {
                Optional<URI> alternate = alternates.alternateFor(uri);
                if (alternate.isPresent()) {
                    Attempt alt = attemptOnce(alternate.get(), intended, request.targetPath() != null);
                    if (alt.ok()) {
                        log.info("Fetched alternate {} for {}", alternate.get(), uri);
                        return succeed(intended, alt, attempt);
                    }
                    log.debug("Alternate {} failed: {}", alternate.get(), alt.error());
                }
            }
        }
        return fail(request, intended, last, Math.min(attempt, retryPolicy.attempts()));
    }

    private FetchResult succeed(Path intended, Attempt a, int attempts) {
        try {
            if (FailureSidecar.deleteFor(intended)) {
                log.debug("Removed stale sidecar for {}", intended);
            }
        } catch (IOException e) {
            log.warn("Could not remove sidecar for {}: {}", intended, e.getMessage());
        }
        return FetchResult.downloaded(a.path(), a.bytes(), a.etag(), attempts);
    }

    private FetchResult fail(FetchRequest request, Path intended, Attempt a, int attempts) {
        Path sidecar = null;
        try {
            sidecar = FailureSidecar.write(intended, request.url(), a.error(), a.diagnostics());
        } catch (IOException e) {
            log.warn("Could not write sidecar for {}: {}", intended, e.getMessage());
        }
        return FetchResult.failed(sidecar, a.error(), attempts);
    }

    private Attempt attemptOnce(URI uri, Path intended, boolean fixedTarget) {
        HttpRequest req = headers.apply(HttpRequest.newBuilder(uri), uri)
                .timeout(headersTimeout)
                .GET()
                .build();

        HttpResponse<InputStream> resp;
        try {
            rateLimiter.acquire();
            resp = httpClient.send(req, HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Attempt.interruptedAttempt();
        } catch (RateLimitInterruptedException e) {
            return Attempt.interruptedAttempt();
        } catch (IOException e) {
            return new Attempt(describe(e));
        }

        int sc = resp.statusCode();
        String contentType = resp.headers().firstValue("Content-Type").orElse("");
        try (InputStream body = resp.body()) {
            if (!HttpSupport.isSuccess(sc)) {
                String sample = readSample(body);
                return new Attempt("HTTP " + sc, diagnostics(sc, contentType, sample));
            }
            if (HttpSupport.isHtml(contentType)) {
                String sample = readSample(body);
                return new Attempt(
                        "HTML response detected (content-type: " + contentType + ")",
                        diagnostics(sc, contentType, sample));
            }

            // fester Zielpfad (Retry) geht dem Server-Namen vor
            Path dest = fixedTarget
                    ? intended
                    : FilenameResolver.fromContentDisposition(
                                    resp.headers().firstValue("Content-Disposition").orElse(null))
                            .map(intended::resolveSibling)
                            .orElse(intended);

            Written w = writeAtomically(body, dest);
            String etag = resp.headers().firstValue("ETag").orElse(null);
            return Attempt.success(w.path(), w.bytes(), etag);
        } catch (IOException e) {
            return new Attempt(describe(e));
        }
    }

    private Written writeAtomically(InputStream in, Path dest) throws IOException {
        Path parent = dest.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        String baseName = dest.getFileName() == null ? "download" : dest.getFileName().toString();
        Path tmp = Files.createTempFile(parent != null ? parent : Path.of("."), baseName, ".part");
        try {
            long bytes = copyGuarded(in, tmp);
            Path target = FilenameResolver.unique(dest);
            for (int i = 1; ; i++) {
                try {
                    Files.move(tmp, target);
                    return new Written(target, bytes);
                } catch (FileAlreadyExistsException e) {
                    // paralleler Worker war schneller
                    target = FilenameResolver.unique(FilenameResolver.withSuffix(dest, i));
                }
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private long copyGuarded(InputStream in, Path tmp) throws IOException {
        StallWatchdog.Guard guard = watchdog.watch(in);
        try (OutputStream out = Files.newOutputStream(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            byte[] buf = new byte[BUFFER_SIZE];
            long total = 0;
            int r;
            while ((r = in.read(buf)) != -1) {
                out.write(buf, 0, r);
                total += r;
                guard.progress();
            }
            if (guard.stalled()) {
                throw new IOException("read stalled");
            }
            return total;
        } catch (IOException e) {
            if (guard.stalled()) {
                throw new IOException("read timed out: no data received within the read timeout", e);
            }
            throw e;
        } finally {
            guard.close();
        }
    }

    private String readSample(InputStream body) {
        StallWatchdog.Guard guard = watchdog.watch(body);
        try {
            byte[] bytes = body.readNBytes(DIAGNOSTIC_BODY_CHARS * 4);
            String text = new String(bytes, StandardCharsets.UTF_8);
            return text.length() > DIAGNOSTIC_BODY_CHARS ? text.substring(0, DIAGNOSTIC_BODY_CHARS) : text;
        } catch (IOException e) {
            return "(unable to read response body: " + e.getMessage() + ")";
        } finally {
            guard.close();
        }
    }

    private static String diagnostics(int statusCode, String contentType, String sample) {
        StringBuilder sb = new StringBuilder();
        sb.append("HTTP ").append(statusCode).append('\n');
        if (contentType != null && !contentType.isEmpty()) {
            sb.append("Content-Type: ").append(contentType).append('\n');
        }
        if (sample != null && !sample.isEmpty()) {
            sb.append(sample);
        }
        return sb.toString();
    }

    private boolean pause(Duration delay) {
        if (delay.isZero()) return true;
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String describe(IOException e) {
        if (e instanceof HttpTimeoutException) {
            return "timeout: " + e.getMessage();
        }
        String msg = e.getMessage();
        return e.getClass().getSimpleName() + (msg == null ? "" : ": " + msg);
    }

    @Override
    public void close() {
        watchdog.close();
    }

    /** Wartestrategie zwischen zwei Versuchen. */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private record Written(Path path, long bytes) {}

    private record Attempt(boolean ok, Path path, long bytes, String etag, String error, String diagnostics, boolean interrupted) {

        Attempt(String error) {
            this(false, null, 0L, null, error, null, false);
        }

        Attempt(String error, String diagnostics) {
            this(false, null, 0L, null, error, diagnostics, false);
        }

        static Attempt success(Path path, long bytes, String etag) {
            return new Attempt(true, path, bytes, etag, null, null, false);
        }

        static Attempt interruptedAttempt() {
            return new Attempt(false, null, 0L, null, "interrupted", null, true);
        }
    }
}
