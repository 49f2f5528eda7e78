package de.htwsaar.mediavault.cli.app;

import de.htwsaar.mediavault.cli.command.root.MediaVaultRootCommand;
import de.htwsaar.mediavault.cli.di.CliContext;
import de.htwsaar.mediavault.cli.di.ContextFactory;
import de.htwsaar.mediavault.core.config.HarvestConfigLoader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import picocli.CommandLine;

/**
 * Einstiegspunkt der MediaVault-CLI.
 *
 * <p>Aufgaben:
 * - Initialisiert die Ausgabekanäle und den Konfigurations-Loader (Umgebung des Prozesses).
 * - Baut die Picocli-Command-Struktur inkl. {@link ContextFactory} für Constructor Injection.
 * - Führt den Befehl aus und beendet den Prozess mit dessen Exit-Code.
 */
public final class MediaVaultCliMain {

    private MediaVaultCliMain() {}

    public static void main(String[] args) {
        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
        PrintWriter err = new PrintWriter(new OutputStreamWriter(System.err, StandardCharsets.UTF_8), true);
        CliContext ctx = new CliContext(out, err, new HarvestConfigLoader());

        System.exit(commandLine(ctx).execute(args));
    }

    /**
     * Baut den Kommandobaum für einen Kontext (auch von Tests genutzt).
     *
     * @param ctx CLI-Kontext
     * @return ausführbare Kommandozeile
     */
    public static CommandLine commandLine(CliContext ctx) {
        CommandLine cmd = new CommandLine(MediaVaultRootCommand.class, new ContextFactory(ctx));
        cmd.setOut(ctx.out());
        cmd.setErr(ctx.err());
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        return cmd;
    }
}
