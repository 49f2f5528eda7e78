package de.htwsaar.mediavault.core.http;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/** Gemeinsame HTTP-Hilfen für Prober und Fetcher. */
public final class HttpSupport {

    private HttpSupport() {}

    /**
     * Standard-Client: folgt Redirects, kurzer Connect-Timeout. Request-Timeouts setzen die Aufrufer.
     *
     * @param connectTimeout Timeout für den Verbindungsaufbau
     * @return Client
     */
    public static HttpClient newClient(Duration connectTimeout) {
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(connectTimeout)
                .build();
    }

    /**
     * Parst eine http(s)-URL; HTML-escaped {@code &amp;} wird vorher aufgelöst.
     *
     * @param raw rohe URL
     * @return URI oder leer, wenn die URL nicht http/https ist oder nicht parsebar
     */
    public static Optional<URI> parseHttpUri(String raw) {
        if (raw == null) return Optional.empty();
        String trimmed = unescapeAmp(raw.trim());
        try {
            URI u = new URI(trimmed);
            String scheme = u.getScheme();
            if (scheme == null || u.getHost() == null) return Optional.empty();
            String s = scheme.toLowerCase(Locale.ROOT);
            if (!s.equals("http") && !s.equals("https")) return Optional.empty();
            return Optional.of(u);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    public static String unescapeAmp(String url) {
        return url == null ? null : url.replace("&amp;", "&");
    }

    public static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * Prüft auf HTML-Antworten (Block- oder Login-Seiten statt Medien).
     *
     * @param contentType Content-Type-Header (darf {@code null} sein)
     * @return {@code true} für {@code text/html} und {@code application/xhtml+xml}
     */
    public static boolean isHtml(String contentType) {
        if (contentType == null) return false;
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.contains("text/html") || ct.contains("application/xhtml+xml");
    }
}
