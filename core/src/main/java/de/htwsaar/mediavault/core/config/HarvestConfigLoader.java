package de.htwsaar.mediavault.core.config;

import de.htwsaar.mediavault.common.serialization.JacksonCodec;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lädt die Konfiguration in Schichten: Standardwerte ← JSON-Datei ← Umgebung ← Kommandozeile.
 */
public final class HarvestConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(HarvestConfigLoader.class);

    public static final String ENV_WORKERS = "MEDIAVAULT_WORKERS";
    public static final String ENV_RATE = "MEDIAVAULT_RATE";
    public static final String ENV_INDEX = "MEDIAVAULT_INDEX";

    private final Map<String, String> env;

    public HarvestConfigLoader() {
        this(System.getenv());
    }

    public HarvestConfigLoader(Map<String, String> env) {
        this.env = Objects.requireNonNull(env, "env must not be null");
    }

    /**
     * Baut die effektive Konfiguration.
     *
     * @param configFile JSON-Datei oder {@code null}
     * @param cli        Werte der Kommandozeile (höchste Priorität)
     * @return geprüfte Konfiguration
     * @throws IllegalArgumentException bei ungültigen Werten oder fehlender Datei
     * @throws de.htwsaar.mediavault.common.serialization.MediaVaultSerializationException bei ungültigem JSON
     */
    public HarvestConfig load(Path configFile, HarvestConfigPatch cli) {
        HarvestConfig cfg = HarvestConfig.defaults();
        if (configFile != null) {
            if (!Files.isRegularFile(configFile)) {
                throw new IllegalArgumentException("config file not found: " + configFile);
            }
            cfg = cfg.merge(JacksonCodec.readFile(configFile, HarvestConfigPatch.class));
            log.debug("Loaded config file {}", configFile);
        }
        cfg = cfg.merge(fromEnvironment());
        return cfg.merge(cli);
    }

    HarvestConfigPatch fromEnvironment() {
        Integer workers = null;
        Double rate = null;
        Path index = null;

        String w = blankToNull(env.get(ENV_WORKERS));
        if (w != null) {
            try {
                workers = Integer.parseInt(w);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(ENV_WORKERS + " is not a number: " + w, e);
            }
        }
        String r = blankToNull(env.get(ENV_RATE));
        if (r != null) {
            try {
                rate = Double.parseDouble(r);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(ENV_RATE + " is not a number: " + r, e);
            }
        }
        String i = blankToNull(env.get(ENV_INDEX));
        if (i != null) {
            index = Path.of(i);
        }
        return new HarvestConfigPatch(
                null, index, workers, rate, null, null, null, null, null, null, null, null, null, null, null);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
