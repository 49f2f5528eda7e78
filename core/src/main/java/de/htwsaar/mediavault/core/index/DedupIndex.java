package de.htwsaar.mediavault.core.index;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dauerhafter, inhaltsadressierter Dedup-Index.
 *
 * <p>Verknüpft normalisierte URLs, ETags und Teil-Fingerprints mit Content-Hashes und
 * Content-Hashes mit Dateipfaden; führt zusätzlich eine Liste fehlgeschlagener URLs.
 *
 * <p>Vertrag:
 * <ul>
 *   <li>Thread-sicher; Schreibzugriffe werden intern serialisiert.</li>
 *   <li>Jeder schreibende Aufruf ist beim Return committed.</li>
 *   <li>{@link #record(IndexRecord)} ist atomar: alle Kennungen oder keine.</li>
 *   <li>Bei Schlüsselkollisionen gewinnt der zuerst gesehene Hash.</li>
 *   <li>Fehler werden als {@link IndexAccessException} gemeldet.</li>
 * </ul>
 */
public interface DedupIndex extends AutoCloseable {

    Optional<String> lookupByUrl(String normalizedUrl);

    Optional<String> lookupByEtag(String etag);

    Optional<String> lookupByFingerprint(String fingerprint);

    /**
     * Liefert alle noch existierenden Pfade eines Hashes.
     * Einträge auf gelöschte Dateien werden dabei aus dem Index entfernt.
     *
     * @param hash Content-Hash
     * @return existierende Pfade (ggf. leer)
     */
    List<Path> pathsFor(String hash);

    /**
     * Erster noch existierender Pfad eines Hashes (bereinigt wie {@link #pathsFor(String)}).
     *
     * @param hash Content-Hash
     * @return Pfad oder leer
     */
    default Optional<Path> existingPathFor(String hash) {
        return pathsFor(hash).stream().findFirst();
    }

    /**
     * Verknüpft alle angegebenen Kennungen atomar mit dem Hash.
     *
     * @param record Hash, optionaler Pfad und optionale URL/ETag/Fingerprint
     */
    void record(IndexRecord record);

    /**
     * Registriert eine frisch heruntergeladene Datei.
     *
     * <p>In einer Transaktion: hält bereits eine andere existierende Datei denselben Hash, werden nur
     * URL/ETag/Fingerprint verknüpft und das Duplikat gemeldet; sonst wird alles verknüpft.
     *
     * @param record Daten der neuen Datei
     * @return {@link RecordOutcome#stored(Path)} oder {@link RecordOutcome#duplicateOf(Path)}
     */
    RecordOutcome recordDownload(IndexRecord record);

    /**
     * Momentaufnahme aller Hash/Pfad-Zeilen, sortiert nach Hash.
     *
     * @return Liste (ggf. mit Einträgen auf inzwischen gelöschte Dateien)
     */
    List<PathEntry> entries();

    /**
     * Alle Zuordnungen einer Kennungsart, sortiert nach Kennung (Export, Berichte).
     *
     * @param kind Kennungsart
     * @return Kennung → Hash
     */
    Map<String, String> mappings(IdentifierKind kind);

    void markFailed(String url, String reason);

    boolean isFailed(String url);

    void clearFailed(String url);

    /**
     * Leert die Fehlerliste.
     *
     * @return Anzahl entfernter Einträge
     */
    int clearAllFailed();

    List<FailedUrl> failedUrls();

    long failedCount();

    IndexStats stats();

    /** Schreibt das WAL in die Hauptdatei zurück. */
    void checkpoint();

    /** Checkpoint und Schließen; weitere Aufrufe schlagen mit {@link IndexAccessException} fehl. */
    @Override
    void close();
}
