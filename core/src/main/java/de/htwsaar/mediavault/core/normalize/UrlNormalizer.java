package de.htwsaar.mediavault.core.normalize;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Kanonisiert Medien-URLs zu stabilen Dedup-Schlüsseln.
 *
 * <p>Regeln:
 * <ul>
 *   <li>{@code &amp;} aus HTML-escaped Collector-Ausgaben wird zu {@code &}.</li>
 *   <li>Hosts mit signierten Einmal-URLs (Host-Regeln): Query und Fragment fallen komplett weg.</li>
 *   <li>Sonst: flüchtige Parameter (Signaturen, Tokens, Ablaufzeiten) und {@code utm_*}-Parameter
 *       werden entfernt, alle anderen bleiben in Originalreihenfolge und Originalschreibweise.</li>
 * </ul>
 *
 * <p>Die Funktion ist rein und wirft nie: bei Parse-Fehlern wird die Eingabe unverändert geliefert.
 */
public final class UrlNormalizer {

    /** Parameternamen (kleingeschrieben), die pro Abruf neu signiert werden. */
    public static final Set<String> EPHEMERAL_PARAMS =
            Set.of("s", "sig", "signature", "token", "expires", "ttl", "key", "st", "se");

    /** Präfix von Tracking-Parametern. */
    public static final String TRACKING_PREFIX = "utm_";

    private static final String HTML_AMP = "&amp;";

    private final List<HostRule> stripQueryHosts;

    public UrlNormalizer(Collection<HostRule> stripQueryHosts) {
        this.stripQueryHosts = List.copyOf(Objects.requireNonNull(stripQueryHosts, "stripQueryHosts must not be null"));
    }

    /**
     * Normalizer mit den Standard-Regeln für bekannte Medien-CDNs.
     *
     * @return Normalizer
     */
    public static UrlNormalizer withDefaults() {
        return new UrlNormalizer(defaultRules());
    }

    public static List<HostRule> defaultRules() {
        return List.of(HostRule.exact("i.redd.it"), HostRule.suffix("preview.redd.it"), HostRule.suffix("redgifs.com"));
    }

    public List<HostRule> rules() {
        return stripQueryHosts;
    }

    /**
     * Liefert die kanonische Form einer URL.
     *
     * @param url rohe URL (darf {@code null} sein)
     * @return normalisierte URL; bei nicht parsebaren Eingaben die Eingabe selbst
     */
    public String normalize(String url) {
        if (url == null) return null;

        String raw = decodeHtmlAmp(url);
        URI uri;
        try {
            uri = new URI(raw);
        } catch (URISyntaxException e) {
            return url;
        }
        if (uri.isOpaque() || uri.getScheme() == null || uri.getRawAuthority() == null) {
            return url;
        }

        String base = uri.getScheme() + "://" + uri.getRawAuthority() + nullToEmpty(uri.getRawPath());
        if (isStripQueryHost(uri.getHost() != null ? uri.getHost() : uri.getRawAuthority())) {
            return base;
        }

        StringBuilder out = new StringBuilder(base);
        String query = filterQuery(uri.getRawQuery());
        if (!query.isEmpty()) {
            out.append('?').append(query);
        }
        if (uri.getRawFragment() != null) {
            out.append('#').append(uri.getRawFragment());
        }
        return out.toString();
    }

    /**
     * Prüft, ob für einen Host die komplette Query verworfen wird.
     *
     * @param host Hostname
     * @return {@code true} wenn eine Host-Regel passt
     */
    public boolean isStripQueryHost(String host) {
        return stripQueryHosts.stream().anyMatch(r -> r.matches(host));
    }

    static boolean isEphemeralParam(String name) {
        String lk = name.toLowerCase(Locale.ROOT);
        return lk.startsWith(TRACKING_PREFIX) || EPHEMERAL_PARAMS.contains(lk);
    }

    private static String filterQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) return "";
        List<String> kept = new ArrayList<>();
        for (String segment : rawQuery.split("&")) {
            if (segment.isEmpty()) continue;
            int eq = segment.indexOf('=');
            String name = eq >= 0 ? segment.substring(0, eq) : segment;
            if (!isEphemeralParam(name)) {
                kept.add(segment);
            }
        }
        return String.join("&", kept);
    }

    private static String decodeHtmlAmp(String s) {
        String cur = s;
        // mehrfach escaped (&amp;amp;) kommt in Collector-Ausgaben vor
        while (cur.contains(HTML_AMP)) {
            cur = cur.replace(HTML_AMP, "&");
        }
        return cur;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
