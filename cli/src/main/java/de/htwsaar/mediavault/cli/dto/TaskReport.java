package de.htwsaar.mediavault.cli.dto;

import de.htwsaar.mediavault.core.dedup.MatchTier;
import de.htwsaar.mediavault.core.dedup.Outcome;
import de.htwsaar.mediavault.core.dedup.TaskResult;

/**
 * JSON-Form eines Task-Ergebnisses.
 *
 * @param task    Task-Kennung (Name, Dateiname oder URL)
 * @param url     normalisierte URL
 * @param outcome Endzustand
 * @param tier    entscheidende Dedup-Stufe oder {@code null}
 * @param path    Datei mit dem Inhalt, bei Fehlern das Sidecar
 * @param bytes   übertragene Bytes
 * @param error   Fehlertext oder {@code null}
 */
public record TaskReport(String task, String url, Outcome outcome, MatchTier tier, String path, long bytes, String error) {

    public static TaskReport from(TaskResult r) {
        return new TaskReport(
                r.task().id(),
                r.url() != null ? r.url() : r.task().url(),
                r.outcome(),
                r.tier(),
                r.finalPath() == null ? null : r.finalPath().toString(),
                r.bytes(),
                r.error());
    }
}
