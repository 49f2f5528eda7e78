package de.htwsaar.mediavault.core.probe;

import de.htwsaar.mediavault.core.http.HeaderPolicy;
import de.htwsaar.mediavault.core.http.HttpSupport;
import de.htwsaar.mediavault.core.http.StallWatchdog;
import de.htwsaar.mediavault.core.ratelimit.RateLimitInterruptedException;
import de.htwsaar.mediavault.core.ratelimit.RateLimiter;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Prober} auf Basis von {@link HttpClient}. Jede Anfrage verbraucht ein Token des
 * gemeinsamen Rate-Limiters.
 *
 * <p>Der Timeout gilt für die Header und zusätzlich als Frist für das Lesen des Range-Bodys.
 * {@link #close()} beendet den Watchdog-Thread.</p>
 */
public final class HttpProber implements Prober, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpProber.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final RateLimiter rateLimiter;
    private final HeaderPolicy headers;
    private final Duration timeout;
    private final StallWatchdog watchdog;

    public HttpProber(HttpClient httpClient, RateLimiter rateLimiter, HeaderPolicy headers, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.headers = Objects.requireNonNull(headers, "headers");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.watchdog = new StallWatchdog(Math.max(1, timeout.toMillis()));
    }

    @Override
    public ProbeResult probe(String url) {
        Optional<URI> uri = HttpSupport.parseHttpUri(url);
        if (uri.isEmpty()) return ProbeResult.empty();

        HttpRequest req = headers.apply(HttpRequest.newBuilder(uri.get()), uri.get())
                .timeout(timeout)
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .build();
        try {
            rateLimiter.acquire();
            HttpResponse<Void> resp = httpClient.send(req, HttpResponse.BodyHandlers.discarding());
            if (!HttpSupport.isSuccess(resp.statusCode())) {
                log.debug("HEAD {} -> HTTP {}", url, resp.statusCode());
                return ProbeResult.empty();
            }
            OptionalLong length = resp.headers().firstValueAsLong("Content-Length");
            String etag = resp.headers().firstValue("ETag").orElse(null);
            return new ProbeResult(length.isPresent() ? length.getAsLong() : null, etag);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.empty();
        } catch (RateLimitInterruptedException e) {
            return ProbeResult.empty();
        } catch (IOException | RuntimeException e) {
            log.debug("HEAD {} failed: {}", url, e.toString());
            return ProbeResult.empty();
        }
    }

    @Override
    public Optional<byte[]> fetchPrefix(String url, int n) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be >= 1: " + n);
        }
        Optional<URI> uri = HttpSupport.parseHttpUri(url);
        if (uri.isEmpty()) return Optional.empty();

        HttpRequest req = headers.apply(HttpRequest.newBuilder(uri.get()), uri.get())
                .timeout(timeout)
                .header("Range", "bytes=0-" + (n - 1))
                .GET()
                .build();
        try {
            rateLimiter.acquire();
            HttpResponse<InputStream> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofInputStream());
            try (InputStream body = resp.body()) {
                int sc = resp.statusCode();
                if (sc != 200 && sc != 206) {
                    log.debug("Range GET {} -> HTTP {}", url, sc);
                    return Optional.empty();
                }
                return readPrefix(url, body, n);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (RateLimitInterruptedException e) {
            return Optional.empty();
        } catch (IOException | RuntimeException e) {
            log.debug("Range GET {} failed: {}", url, e.toString());
            return Optional.empty();
        }
    }

    private Optional<byte[]> readPrefix(String url, InputStream body, int n) {
        StallWatchdog.Guard guard = watchdog.watch(body);
        try {
            // Server ohne Range-Support liefern 200 mit vollem Body: nach n Bytes abbrechen
            byte[] prefix = body.readNBytes(n);
            if (guard.stalled()) {
                log.debug("Range GET {} exceeded {} ms", url, timeout.toMillis());
                return Optional.empty();
            }
            return Optional.of(prefix);
        } catch (IOException e) {
            if (guard.stalled()) {
                log.debug("Range GET {} exceeded {} ms", url, timeout.toMillis());
            } else {
                log.debug("Range GET {} body failed: {}", url, e.toString());
            }
            return Optional.empty();
        } finally {
            guard.close();
        }
    }

    @Override
    public void close() {
        watchdog.close();
    }
}
