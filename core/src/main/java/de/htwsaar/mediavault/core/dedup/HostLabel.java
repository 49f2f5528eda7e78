package de.htwsaar.mediavault.core.dedup;

import java.net.URI;
import java.util.Locale;

/**
 * Kurzer Host-Name für Logzeilen, z. B. {@code Redgifs}, {@code Redd.it}, {@code Imgur}.
 */
final class HostLabel {

    private HostLabel() {}

    static String of(String url) {
        String host;
        try {
            host = url == null ? null : URI.create(url.replace("&amp;", "&")).getHost();
        } catch (IllegalArgumentException e) {
            host = null;
        }
        if (host == null || host.isBlank()) return "Unknown";

        String h = host.toLowerCase(Locale.ROOT);
        if (h.contains("redgifs")) return "Redgifs";
        if (h.contains("reddit") || h.contains("redd.it")) return "Redd.it";

        String[] parts = h.split("\\.");
        if (parts.length < 2) return capitalize(h);
        String sld = parts[parts.length - 2];
        String tld = parts[parts.length - 1];
        return tld.equals("it") ? capitalize(sld) + "." + tld : capitalize(sld);
    }

    private static String capitalize(String s) {
        if (s.isEmpty()) return s;
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
