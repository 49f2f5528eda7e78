package de.htwsaar.mediavault.cli.service;

import static org.junit.jupiter.api.Assertions.*;

import de.htwsaar.mediavault.core.dedup.DownloadTask;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TaskFileReaderTest {

    @TempDir
    Path tmp;

    @Test
    void read_skipsBlankAndCommentLines() throws Exception {
        Path file = tmp.resolve("tasks.jsonl");
        Files.write(file, List.of(
                "# reddit r/pics",
                "",
                "{\"url\":\"https://i.redd.it/a.jpg\",\"folder\":\"pics\",\"name\":\"t3_abc\"}",
                "   ",
                "{\"url\":\" https://i.redd.it/b.png \",\"extra\":true}"));

        List<DownloadTask> tasks = new TaskFileReader(tmp.resolve("out")).read(file);

        assertEquals(2, tasks.size());
        assertEquals("https://i.redd.it/a.jpg", tasks.get(0).url());
        assertEquals(tmp.resolve("out").resolve("pics"), tasks.get(0).folder());
        assertEquals("t3_abc", tasks.get(0).name());
        assertEquals("https://i.redd.it/b.png", tasks.get(1).url(), "URL wird getrimmt");
        assertEquals(tmp.resolve("out"), tasks.get(1).folder(), "ohne Ordner gilt das Ausgabeverzeichnis");
        assertNull(tasks.get(1).name());
    }

    @Test
    void parseLine_keepsAbsoluteFolder() {
        Path abs = tmp.resolve("elsewhere").toAbsolutePath();
        String json = "{\"url\":\"https://x/y.jpg\",\"folder\":\"" + abs.toString().replace("\\", "\\\\") + "\"}";

        DownloadTask t = new TaskFileReader(tmp).parseLine(json, 1);

        assertEquals(abs, t.folder());
    }

    @Test
    void parseLine_blankNameBecomesNull() {
        DownloadTask t = new TaskFileReader(tmp).parseLine("{\"url\":\"https://x/y.jpg\",\"name\":\"  \"}", 1);
        assertNull(t.name());
    }

    @Test
    void read_missingUrlNamesTheLine() throws Exception {
        Path file = tmp.resolve("tasks.jsonl");
        Files.write(file, List.of("{\"url\":\"https://x/1.jpg\"}", "# c", "{\"folder\":\"a\"}"));

        IllegalArgumentException e =
                assertThrows(IllegalArgumentException.class, () -> new TaskFileReader(tmp).read(file));
        assertTrue(e.getMessage().startsWith("line 3"), e.getMessage());
    }

    @Test
    void parseLine_rejectsNonObjects() {
        TaskFileReader reader = new TaskFileReader(tmp);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> reader.parseLine("https://x/y.jpg", 7));
        assertTrue(e.getMessage().startsWith("line 7"), e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> reader.parseLine("[1,2]", 1));
        assertThrows(IllegalArgumentException.class, () -> reader.parseLine("null", 1));
    }
}
