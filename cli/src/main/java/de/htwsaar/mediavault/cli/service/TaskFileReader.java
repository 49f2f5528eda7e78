package de.htwsaar.mediavault.cli.service;

import de.htwsaar.mediavault.common.serialization.JacksonCodec;
import de.htwsaar.mediavault.common.serialization.MediaVaultSerializationException;
import de.htwsaar.mediavault.core.dedup.DownloadTask;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Liest Collector-Ausgabe im JSON-Lines-Format: eine Zeile pro Task,
 * {@code {"url": "...", "folder": "...", "name": "..."}}.
 *
 * <p>Leere Zeilen und Zeilen mit {@code #} am Anfang werden übersprungen. Relative Ordner werden
 * gegen das Ausgabeverzeichnis aufgelöst, ein fehlender Ordner bedeutet das Ausgabeverzeichnis
 * selbst.
 */
public final class TaskFileReader {

    private final Path baseDir;

    public TaskFileReader(Path baseDir) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
    }

    /**
     * Liest alle Tasks einer Datei.
     *
     * @param file Task-Datei (UTF-8)
     * @return Tasks in Dateireihenfolge
     * @throws IOException wenn die Datei nicht lesbar ist
     * @throws IllegalArgumentException bei einer ungültigen Zeile (Meldung enthält die Zeilennummer)
     */
    public List<DownloadTask> read(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        List<DownloadTask> tasks = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            tasks.add(parseLine(line, i + 1));
        }
        return tasks;
    }

    DownloadTask parseLine(String line, int lineNo) {
        TaskLine t;
        try {
            t = JacksonCodec.fromJson(line, TaskLine.class);
        } catch (MediaVaultSerializationException e) {
            throw new IllegalArgumentException("line " + lineNo + ": not a task object", e);
        }
        if (t == null || t.url() == null || t.url().isBlank()) {
            throw new IllegalArgumentException("line " + lineNo + ": missing url");
        }
        return DownloadTask.of(t.url().strip(), resolveFolder(t.folder()), t.name());
    }

    /**
     * Zielordner eines Tasks.
     *
     * @param folder Ordnerangabe oder {@code null}
     * @return absoluter Ordner oder Ordner unterhalb des Ausgabeverzeichnisses
     */
    public Path resolveFolder(String folder) {
        if (folder == null || folder.isBlank()) {
            return baseDir;
        }
        Path p = Path.of(folder.strip());
        return p.isAbsolute() ? p : baseDir.resolve(p);
    }

    record TaskLine(String url, String folder, String name) {}
}
