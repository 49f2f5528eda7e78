package de.htwsaar.mediavault.core.probe;

import java.util.Optional;

/**
 * Günstige Identitäts-Abfragen vor einem vollständigen Download.
 * Implementierungen werfen nie; jeder Fehler liefert ein leeres Ergebnis.
 */
public interface Prober {

    /**
     * HEAD-Anfrage auf {@code url}.
     *
     * @param url Medien-URL
     * @return Größe/ETag; leer bei Fehlern und Nicht-2xx-Status
     */
    ProbeResult probe(String url);

    /**
     * Liest höchstens die ersten {@code n} Bytes per Range-Request.
     *
     * @param url Medien-URL
     * @param n   Byte-Budget (mindestens 1)
     * @return gelesene Bytes (ggf. weniger als {@code n}) oder leer bei Fehlern
     */
    Optional<byte[]> fetchPrefix(String url, int n);
}
