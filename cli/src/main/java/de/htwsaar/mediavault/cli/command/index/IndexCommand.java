package de.htwsaar.mediavault.cli.command.index;

import de.htwsaar.mediavault.cli.command.ExitCodes;
import de.htwsaar.mediavault.cli.command.options.ConfigOptions;
import de.htwsaar.mediavault.cli.di.CliContext;
import de.htwsaar.mediavault.cli.util.ConsoleUtils;
import de.htwsaar.mediavault.common.serialization.JacksonCodec;
import de.htwsaar.mediavault.common.serialization.MediaVaultSerializationException;
import de.htwsaar.mediavault.core.config.HarvestConfig;
import de.htwsaar.mediavault.core.index.DedupIndex;
import de.htwsaar.mediavault.core.index.FailedUrl;
import de.htwsaar.mediavault.core.index.IdentifierKind;
import de.htwsaar.mediavault.core.index.IndexAccessException;
import de.htwsaar.mediavault.core.index.IndexStats;
import de.htwsaar.mediavault.core.index.SqliteDedupIndex;
import de.htwsaar.mediavault.core.maintenance.IndexExporter;
import de.htwsaar.mediavault.core.maintenance.IndexImporter;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Wartung des Dedup-Index: Statistik, Export, Import und Fehlerliste.
 *
 * <p>Ohne Subcommand wird die Usage angezeigt. Bis auf {@code import} öffnen alle Subcommands einen
 * bestehenden Index; fehlt die Datei, endet der Aufruf mit Exit-Code 1.
 */
@Command(
        name = "index",
        description = "Inspect and export the dedup index",
        mixinStandardHelpOptions = true,
        exitCodeOnInvalidInput = ExitCodes.INVALID_INPUT,
        footerHeading = "%nBeispiele:%n",
        footer = {
            "  mediavault index stats -o ./media",
            "  mediavault index export -o ./media -d ./export --format csv",
            "  mediavault index failed -o ./media --clear",
            "  mediavault index import -o ./media"
        },
        subcommands = {
            IndexCommand.StatsCommand.class,
            IndexCommand.ExportCommand.class,
            IndexCommand.ImportCommand.class,
            IndexCommand.FailedCommand.class
        })
public final class IndexCommand implements Runnable {

    private final CliContext ctx;

    @Spec
    private CommandSpec spec;

    public IndexCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().flush();
    }

    @FunctionalInterface
    interface IndexAction {
        int apply(DedupIndex index) throws IOException;
    }

    /**
     * Lädt die Konfiguration, öffnet den Index und führt {@code action} aus.
     *
     * @return Exit-Code der Aktion oder 1/3 bei Fehlern davor
     */
    int withIndex(ConfigOptions options, String tag, IndexAction action) {
        HarvestConfig cfg = loadConfig(options, tag);
        if (cfg == null) {
            return ExitCodes.INVALID_INPUT;
        }
        return withIndex(cfg, tag, false, action);
    }

    /** Konfiguration oder {@code null}, wenn sie ungültig ist (Meldung steht dann schon auf stderr). */
    HarvestConfig loadConfig(ConfigOptions options, String tag) {
        try {
            return options.load(ctx.configLoader());
        } catch (IllegalArgumentException | MediaVaultSerializationException e) {
            ConsoleUtils.error(ctx.err(), "[%s] Invalid configuration: %s", tag, e.getMessage());
            return null;
        }
    }

    /**
     * Öffnet den Index aus {@code cfg}; mit {@code create} wird ein fehlender Index angelegt.
     */
    int withIndex(HarvestConfig cfg, String tag, boolean create, IndexAction action) {
        Path file = cfg.effectiveIndexPath();
        if (!create && !Files.isRegularFile(file)) {
            ConsoleUtils.error(ctx.err(), "[%s] No index at %s", tag, file);
            return ExitCodes.ERROR;
        }
        try (SqliteDedupIndex index = SqliteDedupIndex.open(file)) {
            return action.apply(index);
        } catch (IndexAccessException | MediaVaultSerializationException e) {
            ConsoleUtils.error(ctx.err(), "[%s] Index error: %s", tag, e.getMessage());
            return ExitCodes.ERROR;
        } catch (IOException e) {
            ConsoleUtils.error(ctx.err(), "[%s] I/O error: %s", tag, e.getMessage());
            return ExitCodes.ERROR;
        }
    }

    /** Zählerstände des Index, optional mit einer Stichprobe der URL-Zuordnungen. */
    @Command(
            name = "stats",
            description = "Show index counters",
            mixinStandardHelpOptions = true,
            exitCodeOnInvalidInput = ExitCodes.INVALID_INPUT,
            footerHeading = "%nBeispiele:%n",
            footer = {
                "  mediavault index stats -o ./media",
                "  mediavault index stats --index ./media/.mediavault-index.sqlite --sample 5",
                "  mediavault index stats -o ./media --json"
            })
    public static final class StatsCommand implements Callable<Integer> {

        @ParentCommand
        private IndexCommand parent;

        @Mixin
        private ConfigOptions config;

        @Option(names = "--sample", paramLabel = "N", defaultValue = "0", description = "Also print N url -> hash entries")
        private int sample;

        @Option(names = "--json", defaultValue = "false", description = "Print counters as JSON")
        private boolean json;

        @Override
        public Integer call() {
            if (sample < 0) {
                ConsoleUtils.error(parent.ctx.err(), "[STATS] --sample must not be negative");
                return ExitCodes.INVALID_INPUT;
            }
            return parent.withIndex(config, "STATS", index -> {
                IndexStats s = index.stats();
                PrintWriter out = parent.ctx.out();
                if (json) {
                    ConsoleUtils.info(out, "%s", JacksonCodec.toPrettyJson(s));
                    return ExitCodes.OK;
                }
                out.printf("hashes       : %d%n", s.hashes());
                out.printf("paths        : %d%n", s.paths());
                out.printf("urls         : %d%n", s.urls());
                out.printf("etags        : %d%n", s.etags());
                out.printf("fingerprints : %d%n", s.fingerprints());
                out.printf("failed urls  : %d%n", s.failedUrls());
                if (sample > 0) {
                    out.println("sample:");
                    index.mappings(IdentifierKind.URL).entrySet().stream()
                            .limit(sample)
                            .forEach(e -> out.printf("  %s -> %s%n", e.getKey(), e.getValue()));
                }
                out.flush();
                return ExitCodes.OK;
            });
        }
    }

    /** Export-Formate. */
    public enum Format {
        JSON,
        CSV
    }

    /** Schreibt die Index-Tabellen als JSON- oder CSV-Dateien. */
    @Command(
            name = "export",
            description = "Export url/etag/hash/path tables and the failure list",
            mixinStandardHelpOptions = true,
            exitCodeOnInvalidInput = ExitCodes.INVALID_INPUT,
            footerHeading = "%nBeispiele:%n",
            footer = {
                "  mediavault index export -o ./media -d ./export",
                "  mediavault index export -o ./media -d ./export --format csv"
            })
    public static final class ExportCommand implements Callable<Integer> {

        @ParentCommand
        private IndexCommand parent;

        @Mixin
        private ConfigOptions config;

        @Option(names = {"-d", "--dir"}, required = true, paramLabel = "DIR", description = "Target directory")
        private Path dir;

        @Option(
                names = "--format",
                paramLabel = "FORMAT",
                defaultValue = "json",
                description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
        private Format format;

        @Override
        public Integer call() {
            return parent.withIndex(config, "EXPORT", index -> {
                IndexExporter exporter = new IndexExporter(index);
                List<Path> written = format == Format.CSV ? exporter.exportCsv(dir) : exporter.exportJson(dir);
                for (Path p : written) {
                    parent.ctx.out().printf("  %s%n", p);
                }
                ConsoleUtils.info(parent.ctx.out(), "[EXPORT] %d file(s) written to %s", written.size(), dir);
                return ExitCodes.OK;
            });
        }
    }

    /** Übernimmt einen Alt-Index ({@code .md5_index.json}) in einen leeren Index. */
    @Command(
            name = "import",
            description = "Import a legacy JSON index into an empty index",
            mixinStandardHelpOptions = true,
            exitCodeOnInvalidInput = ExitCodes.INVALID_INPUT,
            footerHeading = "%nBeispiele:%n",
            footer = {
                "  mediavault index import -o ./media",
                "  mediavault index import -o ./media --from ./old/.md5_index.json"
            })
    public static final class ImportCommand implements Callable<Integer> {

        @ParentCommand
        private IndexCommand parent;

        @Mixin
        private ConfigOptions config;

        @Option(
                names = "--from",
                paramLabel = "FILE",
                description = "Legacy index file (default: <output>/" + IndexImporter.LEGACY_FILE_NAME + ")")
        private Path from;

        @Override
        public Integer call() {
            HarvestConfig cfg = parent.loadConfig(config, "IMPORT");
            if (cfg == null) {
                return ExitCodes.INVALID_INPUT;
            }
            Path file = from != null ? from : cfg.outputDir().resolve(IndexImporter.LEGACY_FILE_NAME);
            if (!Files.isRegularFile(file)) {
                ConsoleUtils.error(parent.ctx.err(), "[IMPORT] No legacy index at %s", file);
                return ExitCodes.ERROR;
            }
            return parent.withIndex(cfg, "IMPORT", true, index -> {
                IndexImporter.ImportSummary s = new IndexImporter(index).importJson(file);
                if (!s.performed()) {
                    ConsoleUtils.info(parent.ctx.out(), "[IMPORT] Index already has entries, nothing imported");
                    return ExitCodes.OK;
                }
                ConsoleUtils.info(
                        parent.ctx.out(),
                        "[IMPORT] %d url(s), %d path(s), %d etag(s) imported, %d skipped",
                        s.urls(), s.paths(), s.etags(), s.skipped());
                return ExitCodes.OK;
            });
        }
    }

    /** Zeigt oder leert die Liste fehlgeschlagener URLs. */
    @Command(
            name = "failed",
            description = "List (or clear) URLs recorded as failed",
            mixinStandardHelpOptions = true,
            exitCodeOnInvalidInput = ExitCodes.INVALID_INPUT,
            footerHeading = "%nBeispiele:%n",
            footer = {
                "  mediavault index failed -o ./media",
                "  mediavault index failed -o ./media --json",
                "  mediavault index failed -o ./media --clear"
            })
    public static final class FailedCommand implements Callable<Integer> {

        @ParentCommand
        private IndexCommand parent;

        @Mixin
        private ConfigOptions config;

        @Option(names = "--clear", defaultValue = "false", description = "Remove all entries")
        private boolean clear;

        @Option(names = "--json", defaultValue = "false", description = "Print entries as JSON")
        private boolean json;

        @Override
        public Integer call() {
            return parent.withIndex(config, "FAILED", index -> {
                PrintWriter out = parent.ctx.out();
                if (clear) {
                    int removed = index.clearAllFailed();
                    ConsoleUtils.info(out, "[FAILED] %d entr%s removed", removed, removed == 1 ? "y" : "ies");
                    return ExitCodes.OK;
                }
                List<FailedUrl> failed = index.failedUrls();
                if (json) {
                    ConsoleUtils.info(out, "%s", JacksonCodec.toPrettyJson(failed));
                    return ExitCodes.OK;
                }
                for (FailedUrl f : failed) {
                    out.printf("%s  attempts=%d  last=%s  %s%n", f.url(), f.attempts(), f.lastFailedAt(), f.reason());
                }
                ConsoleUtils.info(out, "[FAILED] %d URL(s)", failed.size());
                return ExitCodes.OK;
            });
        }
    }
}
