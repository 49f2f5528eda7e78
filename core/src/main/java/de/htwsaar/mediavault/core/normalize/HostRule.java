package de.htwsaar.mediavault.core.normalize;

import java.util.Locale;
import java.util.Objects;

/**
 * Host-Regel für Hosts, deren URLs mit flüchtigen Tokens signiert werden.
 *
 * @param host   Hostname in Kleinbuchstaben (z. B. {@code i.redd.it})
 * @param suffix {@code true}: Regel gilt auch für alle Subdomains
 */
public record HostRule(String host, boolean suffix) {

    public HostRule {
        Objects.requireNonNull(host, "host must not be null");
        host = host.trim().toLowerCase(Locale.ROOT);
        if (host.isEmpty()) {
            throw new IllegalArgumentException("host must not be blank");
        }
    }

    public static HostRule exact(String host) {
        return new HostRule(host, false);
    }

    public static HostRule suffix(String host) {
        return new HostRule(host, true);
    }

    /**
     * Parst die Konfigurationsschreibweise: {@code .example.com} = Suffix-Regel, sonst exakt.
     *
     * @param spec Regel-Text
     * @return Regel
     */
    public static HostRule parse(String spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        String s = spec.trim();
        return s.startsWith(".") ? suffix(s.substring(1)) : exact(s);
    }

    /**
     * Prüft, ob die Regel auf einen Host passt. Suffix-Regeln greifen nur an einer Punkt-Grenze.
     *
     * @param candidate Hostname (beliebige Schreibweise)
     * @return {@code true} bei Treffer
     */
    public boolean matches(String candidate) {
        if (candidate == null || candidate.isBlank()) return false;
        String h = candidate.toLowerCase(Locale.ROOT);
        if (h.equals(host)) return true;
        return suffix && h.endsWith("." + host);
    }
}
