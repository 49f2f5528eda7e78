package de.htwsaar.mediavault.cli.command.root;

import de.htwsaar.mediavault.cli.command.ExitCodes;
import de.htwsaar.mediavault.cli.command.harvest.HarvestCommand;
import de.htwsaar.mediavault.cli.command.harvest.RetryCommand;
import de.htwsaar.mediavault.cli.command.index.IndexCommand;
import de.htwsaar.mediavault.cli.command.maintenance.MarkHtmlCommand;
import de.htwsaar.mediavault.cli.di.CliContext;
import java.util.Objects;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root-Command des CLI-Kommandobaums.
 *
 * <p>Aufgaben:
 * - Definiert Name, Beschreibung und globale Help-Optionen der CLI.
 * - Registriert die Top-Level-Subcommands {@code harvest}, {@code retry}, {@code index} und {@code mark-html}.
 * - Zeigt ohne Subcommand die Usage.
 */
@Command(
        name = "mediavault",
        description = "Deduplicating media downloader",
        version = "mediavault 1.0.0",
        mixinStandardHelpOptions = true,
        exitCodeOnInvalidInput = ExitCodes.INVALID_INPUT,
        subcommands = {
            HarvestCommand.class,
            RetryCommand.class,
            IndexCommand.class,
            MarkHtmlCommand.class,
            HelpCommand.class
        })
public final class MediaVaultRootCommand implements Runnable {

    private final CliContext ctx;

    @Spec
    private CommandSpec spec;

    public MediaVaultRootCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().println();
        ctx.out().println("Tipp: Verwende `mediavault help <command>` für Details zu einem Befehl.");
        ctx.out().flush();
    }
}
