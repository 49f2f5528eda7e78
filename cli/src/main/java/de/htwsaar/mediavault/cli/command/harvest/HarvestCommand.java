package de.htwsaar.mediavault.cli.command.harvest;

import de.htwsaar.mediavault.cli.command.ExitCodes;
import de.htwsaar.mediavault.cli.command.options.ConfigOptions;
import de.htwsaar.mediavault.cli.di.CliContext;
import de.htwsaar.mediavault.cli.dto.RunSummary;
import de.htwsaar.mediavault.cli.service.SummaryPrinter;
import de.htwsaar.mediavault.cli.service.TaskFileReader;
import de.htwsaar.mediavault.cli.util.ConsoleUtils;
import de.htwsaar.mediavault.cli.util.FileLogSetup;
import de.htwsaar.mediavault.common.serialization.JacksonCodec;
import de.htwsaar.mediavault.common.serialization.MediaVaultSerializationException;
import de.htwsaar.mediavault.core.HarvestSession;
import de.htwsaar.mediavault.core.config.HarvestConfig;
import de.htwsaar.mediavault.core.dedup.DownloadTask;
import de.htwsaar.mediavault.core.index.IndexAccessException;
import de.htwsaar.mediavault.core.pool.RunReport;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Lädt Medien-URLs mit Deduplizierung herunter.
 *
 * <p>Tasks kommen aus einer JSON-Lines-Datei ({@code --tasks}) und/oder als Positionsargumente
 * (Ordner über {@code --folder}). Exit-Codes siehe {@link ExitCodes}; 2 bedeutet, dass der Lauf
 * vollständig war, aber mindestens ein Task fehlgeschlagen ist.
 */
@Command(
        name = "harvest",
        description = "Download media URLs, skipping content that is already on disk",
        mixinStandardHelpOptions = true,
        exitCodeOnInvalidInput = ExitCodes.INVALID_INPUT,
        footerHeading = "%nBeispiele:%n",
        footer = {
            "  mediavault harvest -o ./media --tasks collector.jsonl",
            "  mediavault harvest -o ./media --folder pics https://i.redd.it/abc.jpg https://i.redd.it/def.png",
            "  mediavault harvest -o ./media --tasks collector.jsonl -w 8 --rate 10 --fingerprint --json"
        })
public final class HarvestCommand implements Callable<Integer> {

    private final CliContext ctx;

    @Mixin
    private ConfigOptions config;

    @Option(names = {"-t", "--tasks"}, paramLabel = "FILE", description = "JSON-lines task file ({\"url\",\"folder\",\"name\"})")
    private Path taskFile;

    @Option(names = {"-f", "--folder"}, paramLabel = "DIR", description = "Folder for positional URLs (relative to --output)")
    private String folder;

    @Option(names = "--name", paramLabel = "NAME", description = "Suggested file name for a single positional URL")
    private String name;

    @Option(names = "--json", defaultValue = "false", description = "Print the full report as JSON")
    private boolean json;

    @Option(names = {"-q", "--quiet"}, defaultValue = "false", description = "No per-task progress lines on stderr")
    private boolean quiet;

    @Parameters(paramLabel = "URL", arity = "0..*", description = "Media URLs")
    private List<String> urls = new ArrayList<>();

    public HarvestCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public Integer call() {
        if (taskFile == null && urls.isEmpty()) {
            ConsoleUtils.error(ctx.err(), "[HARVEST] Nothing to do: pass --tasks FILE or at least one URL");
            return ExitCodes.INVALID_INPUT;
        }
        if (name != null && urls.size() != 1) {
            ConsoleUtils.error(ctx.err(), "[HARVEST] --name needs exactly one positional URL");
            return ExitCodes.INVALID_INPUT;
        }

        HarvestConfig cfg;
        try {
            cfg = config.load(ctx.configLoader());
        } catch (IllegalArgumentException | MediaVaultSerializationException e) {
            ConsoleUtils.error(ctx.err(), "[HARVEST] Invalid configuration: %s", e.getMessage());
            return ExitCodes.INVALID_INPUT;
        }

        List<DownloadTask> tasks;
        try {
            tasks = collectTasks(cfg.outputDir());
        } catch (IllegalArgumentException e) {
            ConsoleUtils.error(ctx.err(), "[HARVEST] Invalid task: %s", e.getMessage());
            return ExitCodes.INVALID_INPUT;
        } catch (IOException e) {
            ConsoleUtils.error(ctx.err(), "[HARVEST] Cannot read task file: %s", e.getMessage());
            return ExitCodes.ERROR;
        }

        try {
            Files.createDirectories(cfg.outputDir());
            FileLogSetup.attach(cfg.outputDir());
            try (HarvestSession session = HarvestSession.open(cfg)) {
                int total = tasks.size();
                AtomicInteger done = new AtomicInteger();
                RunReport report = session.harvest(tasks, r -> {
                    if (!quiet) {
                        ConsoleUtils.error(ctx.err(), "[HARVEST] %d/%d %s %s",
                                done.incrementAndGet(), total, r.outcome(), r.task().id());
                    }
                });
                RunSummary summary = RunSummary.from(report);
                if (json) {
                    ConsoleUtils.info(ctx.out(), "%s", JacksonCodec.toPrettyJson(summary));
                } else {
                    SummaryPrinter.print(ctx.out(), "HARVEST", summary);
                }
                return report.hasFailures() ? ExitCodes.TASKS_FAILED : ExitCodes.OK;
            }
        } catch (IndexAccessException e) {
            ConsoleUtils.error(ctx.err(), "[HARVEST] Cannot open index %s: %s", cfg.effectiveIndexPath(), e.getMessage());
            return ExitCodes.ERROR;
        } catch (IOException e) {
            ConsoleUtils.error(ctx.err(), "[HARVEST] Cannot create output directory: %s", e.getMessage());
            return ExitCodes.ERROR;
        } finally {
            FileLogSetup.detach();
        }
    }

    private List<DownloadTask> collectTasks(Path outputDir) throws IOException {
        TaskFileReader reader = new TaskFileReader(outputDir);
        List<DownloadTask> tasks = new ArrayList<>();
        if (taskFile != null) {
            tasks.addAll(reader.read(taskFile));
        }
        Path target = reader.resolveFolder(folder);
        for (String url : urls) {
            tasks.add(DownloadTask.of(url, target, name));
        }
        return tasks;
    }
}
