package de.htwsaar.mediavault.core.maintenance;

import de.htwsaar.mediavault.common.serialization.JacksonCodec;
import de.htwsaar.mediavault.core.index.DedupIndex;
import de.htwsaar.mediavault.core.index.IndexRecord;
import de.htwsaar.mediavault.core.index.IndexStats;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Übernimmt einen Alt-Index im JSON-Format ({@code .md5_index.json}) in einen leeren Index.
 *
 * <p>Erwartet ein Objekt mit {@code url_to_md5}, {@code md5_to_paths} und {@code etag_to_md5}.
 * Fehlende Tabellen gelten als leer, Einträge mit falschem Typ werden übersprungen.</p>
 */
public final class IndexImporter {

    private static final Logger log = LoggerFactory.getLogger(IndexImporter.class);

    /** Dateiname des Alt-Index im Ausgabeverzeichnis. */
    public static final String LEGACY_FILE_NAME = ".md5_index.json";

    static final String URL_TO_MD5 = "url_to_md5";
    static final String MD5_TO_PATHS = "md5_to_paths";
    static final String ETAG_TO_MD5 = "etag_to_md5";

    private final DedupIndex index;

    public IndexImporter(DedupIndex index) {
        this.index = Objects.requireNonNull(index, "index");
    }

    /**
     * Ergebnis eines Imports.
     *
     * @param performed {@code false}, wenn die Datei fehlt oder der Index schon Einträge hat
     * @param urls      übernommene URL-Zuordnungen
     * @param paths     übernommene Pfade
     * @param etags     übernommene ETag-Zuordnungen
     * @param skipped   unbrauchbare Einträge
     */
    public record ImportSummary(boolean performed, int urls, int paths, int etags, int skipped) {

        static ImportSummary notPerformed() {
            return new ImportSummary(false, 0, 0, 0, 0);
        }
    }

    /**
     * Liest {@code file} und trägt alle Zuordnungen ein. Hat der Index bereits URL-, ETag- oder
     * Pfad-Einträge, passiert nichts.
     *
     * @param file Alt-Index
     * @return Zähler des Imports
     * @throws de.htwsaar.mediavault.common.serialization.MediaVaultSerializationException wenn die Datei kein JSON ist
     * @throws de.htwsaar.mediavault.core.index.IndexAccessException bei Datenbankfehlern
     */
    public ImportSummary importJson(Path file) {
        if (!Files.isRegularFile(file)) {
            log.info("No legacy index at {}", file);
            return ImportSummary.notPerformed();
        }
        IndexStats stats = index.stats();
        if (stats.urls() > 0 || stats.etags() > 0 || stats.paths() > 0) {
            log.info("Index already populated, not importing {}", file);
            return ImportSummary.notPerformed();
        }

        Object raw = JacksonCodec.readFile(file, Object.class);
        if (!(raw instanceof Map<?, ?> root)) {
            log.warn("Legacy index {} is not a JSON object", file);
            return new ImportSummary(true, 0, 0, 0, 0);
        }

        int skipped = 0;
        int urls = 0;
        for (Map.Entry<?, ?> e : table(root, URL_TO_MD5).entrySet()) {
            if (isHash(e.getValue()) && e.getKey() instanceof String url && !url.isBlank()) {
                index.record(new IndexRecord((String) e.getValue(), null, url, null, null));
                urls++;
            } else {
                skipped++;
            }
        }

        int paths = 0;
        for (Map.Entry<?, ?> e : table(root, MD5_TO_PATHS).entrySet()) {
            if (!isHash(e.getKey()) || !(e.getValue() instanceof List<?> list)) {
                skipped++;
                continue;
            }
            for (Object p : list) {
                Path path = toPath(p);
                if (path == null) {
                    skipped++;
                    continue;
                }
                index.record(IndexRecord.of((String) e.getKey(), path));
                paths++;
            }
        }

        int etags = 0;
        for (Map.Entry<?, ?> e : table(root, ETAG_TO_MD5).entrySet()) {
            if (isHash(e.getValue()) && e.getKey() instanceof String etag && !etag.isBlank()) {
                index.record(new IndexRecord((String) e.getValue(), null, null, etag, null));
                etags++;
            } else {
                skipped++;
            }
        }

        index.checkpoint();
        log.info("Imported {}: {} url(s), {} path(s), {} etag(s), {} skipped", file, urls, paths, etags, skipped);
        return new ImportSummary(true, urls, paths, etags, skipped);
    }

    private static Map<?, ?> table(Map<?, ?> root, String name) {
        Object t = root.get(name);
        return t instanceof Map<?, ?> m ? m : Map.of();
    }

    private static boolean isHash(Object value) {
        return value instanceof String s && !s.isBlank();
    }

    private static Path toPath(Object value) {
        if (!(value instanceof String s) || s.isBlank()) {
            return null;
        }
        try {
            return Path.of(s);
        } catch (InvalidPathException e) {
            log.debug("Skipping invalid path {}: {}", s, e.getMessage());
            return null;
        }
    }
}
