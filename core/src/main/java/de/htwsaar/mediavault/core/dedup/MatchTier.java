package de.htwsaar.mediavault.core.dedup;

/** Stufe, auf der die Entscheidung für einen Task gefallen ist. */
public enum MatchTier {
    /** normalisierte URL bekannt, Datei vorhanden */
    URL,
    /** normalisierte URL bekannt, aber keine Datei mehr */
    URL_WITHOUT_FILE,
    ETAG,
    ETAG_WITHOUT_FILE,
    /** gleiche Content-Length wie eine indexierte Datei (Heuristik) */
    CONTENT_LENGTH,
    FINGERPRINT,
    /** frisch geladen */
    FETCH,
    /** frisch geladen, aber Inhalt lag schon vor */
    DUPLICATE,
    /** Force-Modus: Stufen 1-5 übersprungen */
    FORCED
}
