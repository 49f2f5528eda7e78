package de.htwsaar.mediavault.cli.dto;

import de.htwsaar.mediavault.core.dedup.RunStats;
import de.htwsaar.mediavault.core.pool.RunReport;
import java.util.List;

/**
 * Zusammenfassung eines Laufs für Text- und JSON-Ausgabe.
 *
 * @param attempted       verarbeitete Tasks
 * @param downloaded      frisch geladene Dateien
 * @param skipped         Dedup-Treffer
 * @param failed          endgültig fehlgeschlagene Tasks
 * @param recovered       wiederhergestellte Dateien
 * @param bytesDownloaded geladene Bytes
 * @param elapsedMillis   Laufzeit in Millisekunden
 * @param results         Einzelergebnisse
 */
public record RunSummary(
        long attempted,
        long downloaded,
        long skipped,
        long failed,
        long recovered,
        long bytesDownloaded,
        long elapsedMillis,
        List<TaskReport> results) {

    public static RunSummary from(RunReport report) {
        RunStats.Snapshot s = report.stats();
        return new RunSummary(
                s.attempted(),
                s.downloaded(),
                s.skipped(),
                s.failed(),
                s.recovered(),
                s.bytesDownloaded(),
                s.elapsed().toMillis(),
                report.results().stream().map(TaskReport::from).toList());
    }

    public List<TaskReport> failures() {
        return results.stream().filter(r -> r.error() != null).toList();
    }
}
