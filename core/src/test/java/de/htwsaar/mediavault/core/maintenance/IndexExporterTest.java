package de.htwsaar.mediavault.core.maintenance;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.mediavault.common.serialization.JacksonCodec;
import de.htwsaar.mediavault.core.index.IndexRecord;
import de.htwsaar.mediavault.core.index.SqliteDedupIndex;
import de.htwsaar.mediavault.core.testutil.MutableClock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IndexExporterTest {

    @TempDir
    Path tmp;

    private SqliteDedupIndex index;
    private Path file;

    @BeforeEach
    void setUp() throws Exception {
        index = SqliteDedupIndex.open(tmp.resolve("index.sqlite"), new MutableClock(Instant.parse("2024-05-01T10:00:00Z")));
        file = tmp.resolve("media").resolve("a.jpg");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "a");
        index.record(IndexRecord.of("h1", file).withUrl("https://cdn.example/a.jpg").withEtag("\"e,1\""));
        index.markFailed("https://cdn.example/broken.jpg", "HTTP 404");
    }

    @AfterEach
    void tearDown() {
        index.close();
    }

    @Test
    @SuppressWarnings("unchecked")
    void exportJson_writesAllTables() {
        Path out = tmp.resolve("export");

        List<Path> files = new IndexExporter(index).exportJson(out);

        assertEquals(4, files.size());
        Map<String, Object> urls = JacksonCodec.readFile(out.resolve("url_to_hash.json"), Map.class);
        assertEquals(Map.of("https://cdn.example/a.jpg", "h1"), urls);

        Map<String, Object> paths = JacksonCodec.readFile(out.resolve("hash_to_paths.json"), Map.class);
        assertEquals(List.of(file.toAbsolutePath().toString()), paths.get("h1"));

        Map<String, Object> etags = JacksonCodec.readFile(out.resolve("etag_to_hash.json"), Map.class);
        assertEquals("h1", etags.get("\"e,1\""));

        String failed = readString(out.resolve("failed_urls.json"));
        assertTrue(failed.contains("https://cdn.example/broken.jpg"));
        assertTrue(failed.contains("2024-05-01T10:00:00Z"), "Zeitpunkte als ISO-8601");
    }

    @Test
    void exportCsv_quotesAndUsesCrlf() throws Exception {
        Path out = tmp.resolve("csv");

        new IndexExporter(index).exportCsv(out);

        assertEquals("url,hash\r\nhttps://cdn.example/a.jpg,h1\r\n", readString(out.resolve("url_to_hash.csv")));
        assertEquals("etag,hash\r\n\"\"\"e,1\"\"\",h1\r\n", readString(out.resolve("etag_to_hash.csv")));
        assertEquals("url,reason,attempts,last_failed_at\r\nhttps://cdn.example/broken.jpg,HTTP 404,1,2024-05-01T10:00:00Z\r\n",
                readString(out.resolve("failed_urls.csv")));
        assertTrue(readString(out.resolve("hash_to_paths.csv")).startsWith("hash,path\r\nh1,"));
    }

    @Test
    void escape_followsRfc4180() {
        assertEquals("plain", IndexExporter.escape("plain"));
        assertEquals("\"a,b\"", IndexExporter.escape("a,b"));
        assertEquals("\"say \"\"hi\"\"\"", IndexExporter.escape("say \"hi\""));
        assertEquals("\"line\nbreak\"", IndexExporter.escape("line\nbreak"));
    }

    private static String readString(Path p) {
        try {
            return Files.readString(p, StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new AssertionError(e);
        }
    }
}
