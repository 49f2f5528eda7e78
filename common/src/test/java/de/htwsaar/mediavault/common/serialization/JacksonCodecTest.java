package de.htwsaar.mediavault.common.serialization;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JacksonCodecTest {

    record Sample(String url, Instant seenAt) {}

    @Test
    void testToJson() {
        Sample sample = new Sample("https://cdn.example/x.jpg", Instant.parse("2026-01-01T00:00:00Z"));
        String json = JacksonCodec.toJson(sample);

        assertNotNull(json);
        assertTrue(json.contains("\"url\":\"https://cdn.example/x.jpg\""));
        assertTrue(json.contains("\"seenAt\":\"2026-01-01T00:00:00Z\""));
    }

    @Test
    void testFromJson_ignoresUnknownProperties() {
        String json = "{\"url\":\"https://cdn.example/y.png\",\"seenAt\":\"2026-01-01T00:00:00Z\",\"extra\":1}";
        Sample sample = JacksonCodec.fromJson(json, Sample.class);

        assertEquals("https://cdn.example/y.png", sample.url());
        assertEquals(Instant.parse("2026-01-01T00:00:00Z"), sample.seenAt());
    }

    @Test
    void testFromJson_InvalidJson_ThrowsException() {
        // Kein gültiges JSON
        String invalidJson = "{url: kaputt}";
        assertThrows(MediaVaultSerializationException.class, () -> {
            JacksonCodec.fromJson(invalidJson, Sample.class);
        });
    }

    @Test
    void writeFileThenReadFile(@TempDir Path tmp) {
        Path file = tmp.resolve("nested/sample.json");
        JacksonCodec.writeFile(file, new Sample("https://cdn.example/z.gif", null));

        Sample back = JacksonCodec.readFile(file, Sample.class);
        assertEquals("https://cdn.example/z.gif", back.url());
        assertNull(back.seenAt());
    }

    @Test
    void readFile_missingFile_throws(@TempDir Path tmp) {
        assertThrows(
                MediaVaultSerializationException.class,
                () -> JacksonCodec.readFile(tmp.resolve("missing.json"), Sample.class));
    }
}
