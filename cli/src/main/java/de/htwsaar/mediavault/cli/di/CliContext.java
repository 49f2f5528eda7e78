package de.htwsaar.mediavault.cli.di;

import de.htwsaar.mediavault.core.config.HarvestConfigLoader;
import java.io.PrintWriter;
import java.util.Objects;

/**
 * Gemeinsamer Laufzeit-Kontext für CLI-Commands.
 *
 * <p>Aufgaben:
 * - Bündelt die Ausgabekanäle (stdout/stderr).
 * - Stellt den {@link HarvestConfigLoader} bereit, über den jeder Command seine Konfiguration baut.
 * - Ermöglicht testbare Commands durch Constructor Injection statt statischer Globals.
 *
 * <p>Konvention:
 * - Hier gehören nur generische Abhängigkeiten hinein (I/O, Konfigurationsquellen),
 *   keine Sessions oder offenen Indizes.
 */
public final class CliContext {
    private final PrintWriter out;
    private final PrintWriter err;
    private final HarvestConfigLoader configLoader;

    /**
     * Erzeugt einen neuen CLI-Kontext.
     *
     * @param out Writer für normale Ausgaben
     * @param err Writer für Fehlermeldungen
     * @param configLoader Loader für Datei- und Umgebungskonfiguration
     */
    public CliContext(PrintWriter out, PrintWriter err, HarvestConfigLoader configLoader) {
        this.out = Objects.requireNonNull(out);
        this.err = Objects.requireNonNull(err);
        this.configLoader = Objects.requireNonNull(configLoader);
    }

    public PrintWriter out() {
        return out;
    }

    public PrintWriter err() {
        return err;
    }

    public HarvestConfigLoader configLoader() {
        return configLoader;
    }
}
