package de.htwsaar.mediavault.cli.command.harvest;

import de.htwsaar.mediavault.cli.command.ExitCodes;
import de.htwsaar.mediavault.cli.command.options.ConfigOptions;
import de.htwsaar.mediavault.cli.di.CliContext;
import de.htwsaar.mediavault.cli.dto.RetrySummary;
import de.htwsaar.mediavault.cli.service.SummaryPrinter;
import de.htwsaar.mediavault.cli.util.ConsoleUtils;
import de.htwsaar.mediavault.cli.util.FileLogSetup;
import de.htwsaar.mediavault.common.serialization.JacksonCodec;
import de.htwsaar.mediavault.common.serialization.MediaVaultSerializationException;
import de.htwsaar.mediavault.core.HarvestSession;
import de.htwsaar.mediavault.core.config.HarvestConfig;
import de.htwsaar.mediavault.core.index.IndexAccessException;
import de.htwsaar.mediavault.core.retry.RetryPass;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Sucht {@code *.failed}-Sidecars unterhalb eines Verzeichnisses und lädt die Dateien erneut.
 *
 * <p>Existiert die Zieldatei bereits, wird nur das Sidecar entfernt. Marker-Sidecars ohne URL
 * bleiben unangetastet.
 */
@Command(
        name = "retry",
        description = "Retry downloads recorded in *.failed sidecars",
        mixinStandardHelpOptions = true,
        exitCodeOnInvalidInput = ExitCodes.INVALID_INPUT,
        footerHeading = "%nBeispiele:%n",
        footer = {
            "  mediavault retry -o ./media",
            "  mediavault retry -o ./media ./media/pics --retries 5 --json"
        })
public final class RetryCommand implements Callable<Integer> {

    private final CliContext ctx;

    @Mixin
    private ConfigOptions config;

    @Parameters(index = "0", arity = "0..1", paramLabel = "DIR", description = "Directory to scan (default: --output)")
    private Path root;

    @Option(names = "--json", defaultValue = "false", description = "Print the result as JSON")
    private boolean json;

    public RetryCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public Integer call() {
        HarvestConfig cfg;
        try {
            cfg = config.load(ctx.configLoader());
        } catch (IllegalArgumentException | MediaVaultSerializationException e) {
            ConsoleUtils.error(ctx.err(), "[RETRY] Invalid configuration: %s", e.getMessage());
            return ExitCodes.INVALID_INPUT;
        }
        Path scanRoot = root != null ? root : cfg.outputDir();
        if (!Files.isDirectory(scanRoot)) {
            ConsoleUtils.error(ctx.err(), "[RETRY] Not a directory: %s", scanRoot);
            return ExitCodes.INVALID_INPUT;
        }

        try {
            Files.createDirectories(cfg.outputDir());
            FileLogSetup.attach(cfg.outputDir());
            try (HarvestSession session = HarvestSession.open(cfg)) {
                RetryPass.Report report = session.retry(scanRoot);
                RetrySummary summary = RetrySummary.from(report);
                if (json) {
                    ConsoleUtils.info(ctx.out(), "%s", JacksonCodec.toPrettyJson(summary));
                } else {
                    ConsoleUtils.info(ctx.out(), "[RETRY] sidecars: queued=%d already-present=%d not-retryable=%d",
                            summary.queued(), summary.alreadyPresent(), summary.notRetryable());
                    SummaryPrinter.print(ctx.out(), "RETRY", summary.run());
                }
                return report.run().hasFailures() ? ExitCodes.TASKS_FAILED : ExitCodes.OK;
            }
        } catch (IndexAccessException e) {
            ConsoleUtils.error(ctx.err(), "[RETRY] Cannot open index %s: %s", cfg.effectiveIndexPath(), e.getMessage());
            return ExitCodes.ERROR;
        } catch (IOException e) {
            ConsoleUtils.error(ctx.err(), "[RETRY] Scan failed: %s", e.getMessage());
            return ExitCodes.ERROR;
        } finally {
            FileLogSetup.detach();
        }
    }
}
