package de.htwsaar.mediavault.cli.service;

import de.htwsaar.mediavault.cli.dto.RunSummary;
import de.htwsaar.mediavault.cli.dto.TaskReport;
import de.htwsaar.mediavault.cli.util.ConsoleUtils;
import java.io.PrintWriter;
import java.time.Duration;

/** Textausgabe der Lauf-Zusammenfassung. */
public final class SummaryPrinter {

    private SummaryPrinter() {}

    public static void print(PrintWriter out, String tag, RunSummary s) {
        out.printf("[%s] attempted=%d downloaded=%d skipped=%d failed=%d recovered=%d%n",
                tag, s.attempted(), s.downloaded(), s.skipped(), s.failed(), s.recovered());
        out.printf("[%s] %s in %s%n",
                tag, ConsoleUtils.humanBytes(s.bytesDownloaded()), ConsoleUtils.humanDuration(Duration.ofMillis(s.elapsedMillis())));
        for (TaskReport f : s.failures()) {
            out.printf("  FAILED %s: %s%n", f.url(), f.error());
        }
        out.flush();
    }
}
