package de.htwsaar.mediavault.cli.dto;

import de.htwsaar.mediavault.core.retry.RetryPass;

/**
 * Ergebnis eines Retry-Laufs.
 *
 * @param queued         erneut eingereihte Sidecars
 * @param alreadyPresent Sidecars, deren Zieldatei schon existierte (entfernt)
 * @param notRetryable   Sidecars ohne URL in Zeile 1 (unverändert)
 * @param run            Zusammenfassung des Pool-Laufs
 */
public record RetrySummary(int queued, int alreadyPresent, int notRetryable, RunSummary run) {

    public static RetrySummary from(RetryPass.Report report) {
        return new RetrySummary(
                report.scan().tasks().size(),
                report.scan().stale().size(),
                report.scan().notRetryable().size(),
                RunSummary.from(report.run()));
    }
}
