package de.htwsaar.mediavault.core.http;

import java.net.URI;
import java.net.http.HttpRequest;
import java.util.Locale;
import java.util.Objects;

/**
 * Request-Header, die jede ausgehende Anfrage (Probe, Teil-Read, Download) erhält.
 *
 * <p>Bilder von {@code *.redd.it} werden ohne Referer häufig abgelehnt; für diese Hosts wird
 * {@code Referer: https://www.reddit.com/} gesetzt.</p>
 */
public final class HeaderPolicy {

    public static final String DEFAULT_USER_AGENT = "mediavault/1.0";
    static final String REDDIT_REFERER = "https://www.reddit.com/";

    private final String userAgent;

    public HeaderPolicy(String userAgent) {
        Objects.requireNonNull(userAgent, "userAgent must not be null");
        if (userAgent.isBlank()) {
            throw new IllegalArgumentException("userAgent must not be blank");
        }
        this.userAgent = userAgent.trim();
    }

    public static HeaderPolicy defaults() {
        return new HeaderPolicy(DEFAULT_USER_AGENT);
    }

    public String userAgent() {
        return userAgent;
    }

    /**
     * Setzt die Header für {@code uri} auf dem Builder.
     *
     * @param builder Request-Builder
     * @param uri     Ziel der Anfrage
     * @return derselbe Builder
     */
    public HttpRequest.Builder apply(HttpRequest.Builder builder, URI uri) {
        builder.header("User-Agent", userAgent);
        if (needsReferer(uri.getHost())) {
            builder.header("Referer", REDDIT_REFERER);
        }
        return builder;
    }

    static boolean needsReferer(String host) {
        if (host == null) return false;
        String h = host.toLowerCase(Locale.ROOT);
        return h.equals("redd.it") || h.endsWith(".redd.it");
    }
}
