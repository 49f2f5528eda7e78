package de.htwsaar.mediavault.core.dedup;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Zähler eines Laufs. Wird von allen Workern parallel aktualisiert.
 */
public final class RunStats {

    private final AtomicLong attempted = new AtomicLong();
    private final AtomicLong downloaded = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong recovered = new AtomicLong();
    private final AtomicLong bytesDownloaded = new AtomicLong();
    private final Clock clock;
    private final Instant startedAt;

    public RunStats() {
        this(Clock.systemUTC());
    }

    /**
     * Erstellt die Zähler mit einer expliziten Uhr (nützlich für Tests).
     *
     * @param clock Zeitquelle für die Laufzeit
     */
    public RunStats(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.startedAt = clock.instant();
    }

    public void recordAttempt() {
        attempted.incrementAndGet();
    }

    public void recordDownloaded(long bytes) {
        downloaded.incrementAndGet();
        bytesDownloaded.addAndGet(Math.max(0, bytes));
    }

    public void recordSkipped() {
        skipped.incrementAndGet();
    }

    public void recordFailed() {
        failed.incrementAndGet();
    }

    public void recordRecovered() {
        recovered.incrementAndGet();
    }

    /**
     * Zählt das Ergebnis eines Tasks.
     *
     * @param result Task-Ergebnis
     */
    public void record(TaskResult result) {
        switch (result.outcome()) {
            case DOWNLOADED -> recordDownloaded(result.bytes());
            case SKIPPED -> recordSkipped();
            case FAILED -> recordFailed();
        }
    }

    public Snapshot snapshot() {
        return new Snapshot(
                attempted.get(),
                downloaded.get(),
                skipped.get(),
                failed.get(),
                recovered.get(),
                bytesDownloaded.get(),
                Duration.between(startedAt, clock.instant()));
    }

    /**
     * Unveränderliche Momentaufnahme der Zähler.
     *
     * @param attempted       verarbeitete Tasks
     * @param downloaded      frisch geladene Dateien
     * @param skipped         übersprungene Tasks (Dedup-Treffer)
     * @param failed          endgültig fehlgeschlagene Tasks
     * @param recovered       wiederhergestellte Dateien (Retry-Pass, Kopie aus dem Index)
     * @param bytesDownloaded Summe der geladenen Bytes
     * @param elapsed         Laufzeit seit Erzeugung der Zähler
     */
    public record Snapshot(
            long attempted,
            long downloaded,
            long skipped,
            long failed,
            long recovered,
            long bytesDownloaded,
            Duration elapsed) {}
}
