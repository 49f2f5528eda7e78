package de.htwsaar.mediavault.core.fetch;

import java.net.URI;
import java.util.Locale;
import java.util.Optional;

/**
 * Liefert für den letzten Versuch eine alternative URL derselben Ressource.
 */
@FunctionalInterface
public interface AlternateUrlStrategy {

    Optional<URI> alternateFor(URI uri);

    static AlternateUrlStrategy none() {
        return uri -> Optional.empty();
    }

    /**
     * {@code media.redgifs.com/<id>.mp4} → {@code media.redgifs.com/<id>-mobile.mp4}; die
     * Mobil-Variante ist oft noch verfügbar, wenn die HD-Datei nicht ausgeliefert wird.
     *
     * @return Strategie
     */
    static AlternateUrlStrategy redgifsMobile() {
        return uri -> {
            String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
            String path = uri.getRawPath();
            if (!host.endsWith("media.redgifs.com") || path == null || !path.endsWith(".mp4") || path.endsWith("-mobile.mp4")) {
                return Optional.empty();
            }
            String name = path.substring(path.lastIndexOf('/') + 1);
            String base = name.substring(0, name.length() - ".mp4".length());
            return Optional.of(URI.create(uri.getScheme() + "://" + uri.getRawAuthority() + "/" + base + "-mobile.mp4"));
        };
    }
}
