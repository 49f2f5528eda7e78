package de.htwsaar.mediavault.core.testutil;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-Process-HTTP-Server für Medien-Downloads. Ressourcen werden über den Pfad (ohne Query)
 * gefunden, sodass wechselnde Signatur-Parameter auf dieselbe Ressource zeigen.
 */
public final class StubMediaServer implements AutoCloseable {

    private static final Pattern RANGE = Pattern.compile("bytes=0-(\\d+)");

    private final HttpServer server;
    private final ExecutorService executor;
    private final Map<String, Resource> resources = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> getsByPath = new ConcurrentHashMap<>();
    private final AtomicInteger heads = new AtomicInteger();
    private final AtomicInteger gets = new AtomicInteger();
    private final AtomicLong bodyBytesSent = new AtomicLong();

    private StubMediaServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.createContext("/", this::handle);
        server.start();
    }

    public static StubMediaServer start() throws IOException {
        return new StubMediaServer();
    }

    public String url(String pathAndQuery) {
        return "http://localhost:" + server.getAddress().getPort() + pathAndQuery;
    }

    public Resource serve(String path, byte[] body) {
        Resource r = new Resource(body);
        resources.put(path, r);
        return r;
    }

    public Resource serve(String path, String body) {
        return serve(path, body.getBytes(StandardCharsets.UTF_8));
    }

    public int heads() {
        return heads.get();
    }

    public int gets() {
        return gets.get();
    }

    public int gets(String path) {
        AtomicInteger n = getsByPath.get(path);
        return n == null ? 0 : n.get();
    }

    /** Summe der Body-Bytes aller GET-Antworten (inkl. Range-Antworten). */
    public long bodyBytesSent() {
        return bodyBytesSent.get();
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    private void handle(HttpExchange ex) throws IOException {
        try {
            String path = ex.getRequestURI().getPath();
            Resource r = resources.get(path);
            boolean head = "HEAD".equalsIgnoreCase(ex.getRequestMethod());
            if (head) {
                heads.incrementAndGet();
            } else {
                gets.incrementAndGet();
                getsByPath.computeIfAbsent(path, p -> new AtomicInteger()).incrementAndGet();
            }

            if (r == null) {
                send(ex, head, 404, "text/plain", "not found".getBytes(StandardCharsets.UTF_8));
                return;
            }

            if (!head && r.failuresRemaining.getAndDecrement() > 0) {
                if (r.failureDelayMillis > 0) {
                    sleep(r.failureDelayMillis);
                    return;
                }
                send(ex, false, 503, "text/plain", "try again later".getBytes(StandardCharsets.UTF_8));
                return;
            }

            if (r.contentType != null) ex.getResponseHeaders().set("Content-Type", r.contentType);
            if (r.etag != null) ex.getResponseHeaders().set("ETag", r.etag);
            if (r.contentDisposition != null) ex.getResponseHeaders().set("Content-Disposition", r.contentDisposition);

            if (head) {
                if (r.headStatus != 200) {
                    ex.sendResponseHeaders(r.headStatus, -1);
                    return;
                }
                ex.getResponseHeaders().set("Content-Length", String.valueOf(r.body.length));
                ex.sendResponseHeaders(200, -1);
                return;
            }

            byte[] payload = r.body;
            int status = r.status;
            String range = ex.getRequestHeaders().getFirst("Range");
            if (range != null && r.supportsRange && status == 200) {
                Matcher m = RANGE.matcher(range);
                if (m.matches()) {
                    int end = (int) Math.min(Long.parseLong(m.group(1)) + 1, payload.length);
                    payload = Arrays.copyOf(payload, end);
                    ex.getResponseHeaders().set("Content-Range", "bytes 0-" + (end - 1) + "/" + r.body.length);
                    status = 206;
                }
            }

            if (r.stallAfterBytes >= 0) {
                ex.sendResponseHeaders(status, payload.length);
                OutputStream os = ex.getResponseBody();
                os.write(payload, 0, Math.min(r.stallAfterBytes, payload.length));
                os.flush();
                bodyBytesSent.addAndGet(Math.min(r.stallAfterBytes, payload.length));
                sleep(30_000);
                return;
            }
            send(ex, false, status, null, payload);
        } catch (IOException e) {
            // Client hat die Verbindung bereits geschlossen (Timeout-Tests)
        } finally {
            ex.close();
        }
    }

    private void send(HttpExchange ex, boolean head, int status, String contentType, byte[] payload)
            throws IOException {
        if (contentType != null) ex.getResponseHeaders().set("Content-Type", contentType);
        if (head || payload.length == 0) {
            ex.sendResponseHeaders(status, -1);
            return;
        }
        ex.sendResponseHeaders(status, payload.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(payload);
        }
        bodyBytesSent.addAndGet(payload.length);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Verhalten einer Ressource; alle Setter liefern {@code this}. */
    public static final class Resource {
        private volatile byte[] body;
        private volatile String contentType = "application/octet-stream";
        private volatile String etag;
        private volatile String contentDisposition;
        private volatile int status = 200;
        private volatile int headStatus = 200;
        private volatile boolean supportsRange = true;
        private volatile int stallAfterBytes = -1;
        private volatile long failureDelayMillis;
        private final AtomicInteger failuresRemaining = new AtomicInteger();

        private Resource(byte[] body) {
            this.body = body;
        }

        public Resource body(byte[] newBody) {
            this.body = newBody;
            return this;
        }

        public Resource contentType(String value) {
            this.contentType = value;
            return this;
        }

        public Resource etag(String value) {
            this.etag = value;
            return this;
        }

        public Resource contentDisposition(String value) {
            this.contentDisposition = value;
            return this;
        }

        public Resource status(int value) {
            this.status = value;
            return this;
        }

        public Resource headStatus(int value) {
            this.headStatus = value;
            return this;
        }

        public Resource noRangeSupport() {
            this.supportsRange = false;
            return this;
        }

        /** Header und die ersten {@code bytes} Bytes senden, dann hängen bleiben. */
        public Resource stallAfter(int bytes) {
            this.stallAfterBytes = bytes;
            return this;
        }

        /** Die nächsten {@code n} GETs mit 503 beantworten. */
        public Resource failFirst(int n) {
            this.failuresRemaining.set(n);
            this.failureDelayMillis = 0;
            return this;
        }

        /** Die nächsten {@code n} GETs erst nach {@code delayMillis} ohne Antwort schließen. */
        public Resource timeOutFirst(int n, long delayMillis) {
            this.failuresRemaining.set(n);
            this.failureDelayMillis = delayMillis;
            return this;
        }
    }
}
