package de.htwsaar.mediavault.cli.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ConsoleUtilsTest {

    @Test
    void humanBytes_usesBinaryUnits() {
        assertEquals("0 B", ConsoleUtils.humanBytes(0));
        assertEquals("1023 B", ConsoleUtils.humanBytes(1023));
        assertEquals("1.5 KiB", ConsoleUtils.humanBytes(1536));
        assertEquals("1.0 MiB", ConsoleUtils.humanBytes(1024 * 1024));
        assertEquals("2.0 GiB", ConsoleUtils.humanBytes(2L * 1024 * 1024 * 1024));
    }

    @Test
    void humanDuration_switchesToMinutes() {
        assertEquals("0.0 s", ConsoleUtils.humanDuration(Duration.ZERO));
        assertEquals("1.5 s", ConsoleUtils.humanDuration(Duration.ofMillis(1500)));
        assertEquals("2m 05s", ConsoleUtils.humanDuration(Duration.ofSeconds(125)));
    }

    @Test
    void info_appendsLineSeparatorAndFlushes() {
        StringWriter sink = new StringWriter();
        ConsoleUtils.info(new PrintWriter(sink), "[X] %d item(s)", 3);
        assertEquals("[X] 3 item(s)" + System.lineSeparator(), sink.toString());
    }
}
