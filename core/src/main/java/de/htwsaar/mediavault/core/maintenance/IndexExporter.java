package de.htwsaar.mediavault.core.maintenance;

import de.htwsaar.mediavault.common.serialization.JacksonCodec;
import de.htwsaar.mediavault.core.index.DedupIndex;
import de.htwsaar.mediavault.core.index.FailedUrl;
import de.htwsaar.mediavault.core.index.IdentifierKind;
import de.htwsaar.mediavault.core.index.PathEntry;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Exportiert den Index zur Inspektion als JSON oder CSV.
 */
public final class IndexExporter {

    static final String URL_TO_HASH = "url_to_hash";
    static final String HASH_TO_PATHS = "hash_to_paths";
    static final String ETAG_TO_HASH = "etag_to_hash";
    static final String FAILED_URLS = "failed_urls";

    private final DedupIndex index;

    public IndexExporter(DedupIndex index) {
        this.index = Objects.requireNonNull(index, "index");
    }

    /**
     * Schreibt {@code url_to_hash.json}, {@code hash_to_paths.json}, {@code etag_to_hash.json} und
     * {@code failed_urls.json}.
     *
     * @param outDir Zielverzeichnis (wird angelegt)
     * @return geschriebene Dateien
     */
    public List<Path> exportJson(Path outDir) {
        List<Path> written = new ArrayList<>();
        written.add(json(outDir, URL_TO_HASH, index.mappings(IdentifierKind.URL)));
        written.add(json(outDir, HASH_TO_PATHS, hashToPaths()));
        written.add(json(outDir, ETAG_TO_HASH, index.mappings(IdentifierKind.ETAG)));
        written.add(json(outDir, FAILED_URLS, index.failedUrls()));
        return written;
    }

    /**
     * Dieselben Tabellen als CSV mit Kopfzeile.
     *
     * @param outDir Zielverzeichnis (wird angelegt)
     * @return geschriebene Dateien
     * @throws IOException bei Schreibfehlern
     */
    public List<Path> exportCsv(Path outDir) throws IOException {
        Files.createDirectories(outDir);
        List<Path> written = new ArrayList<>();

        written.add(csv(outDir, URL_TO_HASH, List.of("url", "hash"), pairs(index.mappings(IdentifierKind.URL))));

        List<List<String>> paths = new ArrayList<>();
        for (PathEntry e : index.entries()) {
            paths.add(List.of(e.hash(), e.path().toString()));
        }
        written.add(csv(outDir, HASH_TO_PATHS, List.of("hash", "path"), paths));

        written.add(csv(outDir, ETAG_TO_HASH, List.of("etag", "hash"), pairs(index.mappings(IdentifierKind.ETAG))));

        List<List<String>> failed = new ArrayList<>();
        for (FailedUrl f : index.failedUrls()) {
            failed.add(List.of(
                    f.url(),
                    f.reason() == null ? "" : f.reason(),
                    String.valueOf(f.attempts()),
                    f.lastFailedAt() == null ? "" : f.lastFailedAt().toString()));
        }
        written.add(csv(outDir, FAILED_URLS, List.of("url", "reason", "attempts", "last_failed_at"), failed));
        return written;
    }

    private Map<String, List<String>> hashToPaths() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (PathEntry e : index.entries()) {
            out.computeIfAbsent(e.hash(), h -> new ArrayList<>()).add(e.path().toString());
        }
        return out;
    }

    private static Path json(Path outDir, String name, Object value) {
        Path file = outDir.resolve(name + ".json");
        JacksonCodec.writeFile(file, value);
        return file;
    }

    private static List<List<String>> pairs(Map<String, String> map) {
        List<List<String>> rows = new ArrayList<>(map.size());
        map.forEach((k, v) -> rows.add(List.of(k, v)));
        return rows;
    }

    private static Path csv(Path outDir, String name, List<String> header, List<List<String>> rows) throws IOException {
        Path file = outDir.resolve(name + ".csv");
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeRow(w, header);
            for (List<String> row : rows) {
                writeRow(w, row);
            }
        }
        return file;
    }

    private static void writeRow(BufferedWriter w, List<String> cells) throws IOException {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) w.write(',');
            w.write(escape(cells.get(i)));
        }
        w.write("\r\n");
    }

    /** RFC 4180: Felder mit Komma, Anführungszeichen oder Zeilenumbruch werden gequotet. */
    static String escape(String cell) {
        if (cell.indexOf(',') < 0 && cell.indexOf('"') < 0 && cell.indexOf('\n') < 0 && cell.indexOf('\r') < 0) {
            return cell;
        }
        return '"' + cell.replace("\"", "\"\"") + '"';
    }
}
