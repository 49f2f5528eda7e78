package de.htwsaar.mediavault.core.index;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Ergebnis von {@link DedupIndex#recordDownload(IndexRecord)}.
 *
 * @param duplicate {@code true} wenn bereits eine andere, existierende Datei denselben Hash hält
 * @param path      der überlebende Pfad (bei Duplikat die bereits vorhandene Datei)
 */
public record RecordOutcome(boolean duplicate, Path path) {

    public RecordOutcome {
        Objects.requireNonNull(path, "path must not be null");
    }

    public static RecordOutcome stored(Path path) {
        return new RecordOutcome(false, path);
    }

    public static RecordOutcome duplicateOf(Path existing) {
        return new RecordOutcome(true, existing);
    }
}
