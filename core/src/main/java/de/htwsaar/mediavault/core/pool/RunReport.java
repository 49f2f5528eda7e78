package de.htwsaar.mediavault.core.pool;

import de.htwsaar.mediavault.core.dedup.Outcome;
import de.htwsaar.mediavault.core.dedup.RunStats;
import de.htwsaar.mediavault.core.dedup.TaskResult;
import java.util.List;
import java.util.Objects;

/**
 * Ergebnis eines Laufs.
 *
 * @param results Task-Ergebnisse in Abschlussreihenfolge
 * @param stats   Zählerstände nach dem Lauf
 */
public record RunReport(List<TaskResult> results, RunStats.Snapshot stats) {

    public RunReport {
        results = List.copyOf(Objects.requireNonNull(results, "results must not be null"));
        Objects.requireNonNull(stats, "stats must not be null");
    }

    public List<TaskResult> failures() {
        return results.stream().filter(r -> r.outcome() == Outcome.FAILED).toList();
    }

    public boolean hasFailures() {
        return results.stream().anyMatch(r -> r.outcome() == Outcome.FAILED);
    }
}
