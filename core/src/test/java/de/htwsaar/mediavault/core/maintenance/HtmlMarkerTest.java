package de.htwsaar.mediavault.core.maintenance;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HtmlMarkerTest {

    @TempDir
    Path tmp;

    @Test
    void scan_marksHtmlDisguisedAsMedia() throws Exception {
        Path fake = tmp.resolve("sub").resolve("photo.jpg");
        Files.createDirectories(fake.getParent());
        Files.writeString(fake, "<!DOCTYPE html><html><body>Access denied</body></html>");
        Path real = tmp.resolve("real.jpg");
        Files.write(real, new byte[] {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0x00, 0x10});

        List<Path> marked = HtmlMarker.scan(tmp);

        assertEquals(List.of(fake), marked);
        List<String> lines = Files.readAllLines(tmp.resolve("sub").resolve("photo.jpg.failed"), StandardCharsets.UTF_8);
        assertEquals(fake.toString(), lines.get(0));
        assertEquals("Detected HTML content.", lines.get(1));
        assertEquals("---sample---", lines.get(2));
        assertTrue(lines.get(3).contains("Access denied"));
        assertTrue(Files.exists(fake), "die Datei selbst bleibt liegen");
        assertFalse(Files.exists(tmp.resolve("real.jpg.failed")));
    }

    @Test
    void scan_sampleInSidecarIsCapped() throws Exception {
        Path fake = tmp.resolve("big.mp4");
        Files.writeString(fake, "<script>" + "x".repeat(5000));

        HtmlMarker.scan(tmp);

        String sidecar = Files.readString(tmp.resolve("big.mp4.failed"));
        String sample = sidecar.substring(sidecar.indexOf("---sample---\n") + "---sample---\n".length()).trim();
        assertEquals(HtmlMarker.SIDECAR_SAMPLE_CHARS, sample.length());
    }

    @Test
    void scan_ignoresSidecarsPartFilesLogsAndIndex() throws Exception {
        String html = "<html>";
        Files.writeString(tmp.resolve("a.jpg.failed"), html);
        Files.writeString(tmp.resolve("b.jpg12345.part"), html);
        Files.writeString(tmp.resolve("run.log"), html);
        Files.writeString(tmp.resolve(".mediavault-index.sqlite-wal"), html);

        assertTrue(HtmlMarker.scan(tmp).isEmpty());
    }

    @Test
    void looksLikeHtml_isCaseInsensitive() {
        assertTrue(HtmlMarker.looksLikeHtml("  <HTML lang=en>"));
        assertTrue(HtmlMarker.looksLikeHtml("<!doctype html>"));
        assertFalse(HtmlMarker.looksLikeHtml("GIF89a"));
    }
}
