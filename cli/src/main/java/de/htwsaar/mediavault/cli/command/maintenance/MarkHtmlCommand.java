package de.htwsaar.mediavault.cli.command.maintenance;

import de.htwsaar.mediavault.cli.command.ExitCodes;
import de.htwsaar.mediavault.cli.di.CliContext;
import de.htwsaar.mediavault.cli.util.ConsoleUtils;
import de.htwsaar.mediavault.core.maintenance.HtmlMarker;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Markiert bereits gespeicherte Dateien, die in Wahrheit HTML sind, mit einem Sidecar.
 * Die Dateien selbst bleiben liegen.
 */
@Command(
        name = "mark-html",
        description = "Write *.failed markers next to saved files that contain HTML",
        mixinStandardHelpOptions = true,
        exitCodeOnInvalidInput = ExitCodes.INVALID_INPUT,
        footerHeading = "%nBeispiele:%n",
        footer = {"  mediavault mark-html ./media"})
public final class MarkHtmlCommand implements Callable<Integer> {

    private final CliContext ctx;

    @Parameters(index = "0", paramLabel = "DIR", description = "Directory to scan (recursive)")
    private Path dir;

    public MarkHtmlCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public Integer call() {
        if (!Files.isDirectory(dir)) {
            ConsoleUtils.error(ctx.err(), "[MARK] Not a directory: %s", dir);
            return ExitCodes.INVALID_INPUT;
        }
        try {
            List<Path> marked = HtmlMarker.scan(dir);
            for (Path p : marked) {
                ctx.out().printf("  %s%n", p);
            }
            ConsoleUtils.info(ctx.out(), "[MARK] %d HTML file(s) marked", marked.size());
            return ExitCodes.OK;
        } catch (IOException e) {
            ConsoleUtils.error(ctx.err(), "[MARK] Scan failed: %s", e.getMessage());
            return ExitCodes.ERROR;
        }
    }
}
