package de.htwsaar.mediavault.cli.command.options;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.mediavault.core.config.HarvestConfig;
import de.htwsaar.mediavault.core.config.HarvestConfigLoader;
import de.htwsaar.mediavault.core.config.HarvestConfigPatch;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

class ConfigOptionsTest {

    @Command(name = "probe")
    static final class Host {
        @Mixin
        ConfigOptions options;
    }

    private static ConfigOptions parse(String... args) {
        Host host = new Host();
        new CommandLine(host).parseArgs(args);
        return host.options;
    }

    @Test
    void toPatch_leavesUnsetOptionsNull() {
        HarvestConfigPatch patch = parse().toPatch();
        assertEquals(HarvestConfigPatch.empty(), patch);
    }

    @Test
    void toPatch_mapsAllOptions() {
        HarvestConfigPatch patch = parse(
                        "-o", "out", "--index", "idx.sqlite", "-w", "8", "--rate", "2.5", "--no-probe",
                        "--fingerprint", "--fingerprint-bytes", "4096", "--retries", "5", "--backoff-ms", "250",
                        "--read-timeout-sec", "30", "--user-agent", "bot/2", "--strip-query-host", "cdn.example",
                        "--strip-query-host", ".img.example", "--force")
                .toPatch();

        assertEquals(Path.of("out"), patch.outputDir());
        assertEquals(Path.of("idx.sqlite"), patch.indexPath());
        assertEquals(8, patch.workers());
        assertEquals(2.5, patch.rate());
        assertEquals(Boolean.FALSE, patch.probe());
        assertEquals(Boolean.TRUE, patch.fingerprint());
        assertEquals(4096, patch.fingerprintBytes());
        assertEquals(5, patch.retryAttempts());
        assertEquals(Duration.ofMillis(250), patch.backoffBase());
        assertEquals(Duration.ofSeconds(30), patch.readTimeout());
        assertEquals("bot/2", patch.userAgent());
        assertEquals(List.of("cdn.example", ".img.example"), patch.stripQueryHosts());
        assertEquals(Boolean.TRUE, patch.force());
    }

    @Test
    void load_optionsOverrideEnvironment() {
        HarvestConfigLoader loader = new HarvestConfigLoader(Map.of(HarvestConfigLoader.ENV_WORKERS, "6", HarvestConfigLoader.ENV_RATE, "9"));

        HarvestConfig cfg = parse("-w", "2").load(loader);

        assertEquals(2, cfg.workers(), "Kommandozeile schlägt Umgebung");
        assertEquals(9.0, cfg.rate());
        assertTrue(cfg.probe(), "Default bleibt erhalten");
    }
}
