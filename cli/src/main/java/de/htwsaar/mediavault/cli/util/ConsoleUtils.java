package de.htwsaar.mediavault.cli.util;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Konsolenausgabe der Commands: Meldungen mit automatischem Flush sowie Formatierung von
 * Byte-Mengen und Laufzeiten für die Zusammenfassungen.
 */
public final class ConsoleUtils {
    private static final String[] UNITS = {"B", "KiB", "MiB", "GiB", "TiB"};

    private ConsoleUtils() {}

    public static void info(PrintWriter out, String fmt, Object... args) {
        Objects.requireNonNull(out, "out");
        out.printf(fmt + "%n", args);
        out.flush();
    }

    public static void error(PrintWriter err, String fmt, Object... args) {
        Objects.requireNonNull(err, "err");
        err.printf(fmt + "%n", args);
        err.flush();
    }

    /**
     * Formatiert eine Byte-Menge mit binären Einheiten, z. B. {@code 1.5 MiB}.
     *
     * @param bytes nicht-negative Anzahl
     * @return lesbare Darstellung
     */
    public static String humanBytes(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        double value = bytes;
        int unit = 0;
        while (value >= 1024 && unit < UNITS.length - 1) {
            value /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f %s", value, UNITS[unit]);
    }

    /**
     * Formatiert eine Laufzeit als Sekunden mit einer Nachkommastelle, ab einer Minute als {@code 2m 05s}.
     *
     * @param d Laufzeit
     * @return lesbare Darstellung
     */
    public static String humanDuration(Duration d) {
        long millis = Math.max(0, d.toMillis());
        if (millis < 60_000) {
            return String.format(Locale.ROOT, "%.1f s", millis / 1000.0);
        }
        long seconds = millis / 1000;
        return String.format(Locale.ROOT, "%dm %02ds", seconds / 60, seconds % 60);
    }
}
